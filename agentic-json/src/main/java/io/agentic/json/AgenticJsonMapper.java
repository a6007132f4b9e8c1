/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.agentic.json;

import java.io.IOException;
import java.util.ServiceLoader;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * Abstraction for JSON serialization/deserialization to decouple the agentic schema
 * from any specific JSON library. A default implementation backed by Jackson is
 * provided by the {@code agentic-json-jackson2} module.
 */
public interface AgenticJsonMapper {

	/**
	 * Deserialize JSON bytes into a target type.
	 * @param content JSON as bytes
	 * @param type target class
	 * @return deserialized instance
	 * @param <T> generic type
	 * @throws IOException on parse errors
	 */
	<T> T readValue(byte[] content, Class<T> type) throws IOException;

	/**
	 * Convert a value to a given type, useful for mapping nested JSON structures.
	 * @param fromValue source value
	 * @param type target class
	 * @return converted value
	 * @param <T> generic type
	 * @throws IllegalArgumentException if the value cannot be converted
	 */
	<T> T convertValue(Object fromValue, Class<T> type);

	/**
	 * Convert a value into its JSON tree form made of {@link java.util.Map maps},
	 * {@link java.util.List lists}, strings, numbers, booleans and {@code null}.
	 * @param value value to convert
	 * @return JSON tree of the value
	 * @throws IOException on serialization errors
	 */
	Object toTree(Object value) throws IOException;

	/**
	 * Serialize an object to JSON bytes.
	 * @param value object to serialize
	 * @return JSON as bytes
	 * @throws IOException on serialization errors
	 */
	byte[] writeValueAsBytes(Object value) throws IOException;

	/**
	 * Resolves the default {@link AgenticJsonMapper}.
	 * @return The default {@link AgenticJsonMapper}
	 * @throws IllegalStateException If no {@link AgenticJsonMapper} implementation exists
	 * on the classpath.
	 */
	static AgenticJsonMapper createDefault() {
		AtomicReference<IllegalStateException> ex = new AtomicReference<>();
		return ServiceLoader.load(AgenticJsonMapperSupplier.class).stream().flatMap(p -> {
			try {
				AgenticJsonMapperSupplier supplier = p.get();
				return Stream.ofNullable(supplier);
			}
			catch (Exception e) {
				addException(ex, e);
				return Stream.empty();
			}
		}).flatMap(jsonMapperSupplier -> {
			try {
				return Stream.of(jsonMapperSupplier.get());
			}
			catch (Exception e) {
				addException(ex, e);
				return Stream.empty();
			}
		}).findFirst().orElseThrow(() -> {
			if (ex.get() != null) {
				return ex.get();
			}
			else {
				return new IllegalStateException("No default AgenticJsonMapper implementation found");
			}
		});
	}

	private static void addException(AtomicReference<IllegalStateException> ref, Exception toAdd) {
		ref.updateAndGet(existing -> {
			if (existing == null) {
				return new IllegalStateException("Failed to initialize default AgenticJsonMapper", toAdd);
			}
			else {
				existing.addSuppressed(toAdd);
				return existing;
			}
		});
	}

}
