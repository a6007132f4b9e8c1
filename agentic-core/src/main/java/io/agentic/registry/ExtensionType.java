/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.agentic.registry;

import java.io.IOException;

import io.agentic.json.AgenticJsonMapper;
import io.agentic.util.Assert;

/**
 * Describes how a concrete Java type stored in an {@code extra} map is turned into a
 * JSON payload and back. The {@link #id()} is the stable name written next to every
 * encoded value, so it must not change once payloads have been persisted.
 *
 * @param <T> the Java type of the extension value
 */
public interface ExtensionType<T> {

	String id();

	Class<T> javaType();

	/**
	 * Converts a value into a JSON tree of maps, lists and scalars.
	 * @param value the value to encode, never {@code null}
	 * @param jsonMapper the mapper of the calling codec
	 * @return the payload written to the wire
	 * @throws IOException if the value cannot be serialized
	 */
	Object encode(T value, AgenticJsonMapper jsonMapper) throws IOException;

	/**
	 * Rebuilds a value from the payload produced by {@link #encode}.
	 * @param payload the JSON tree read from the wire
	 * @param jsonMapper the mapper of the calling codec
	 * @return the decoded value
	 * @throws IllegalArgumentException if the payload does not describe a value of this
	 * type
	 */
	T decode(Object payload, AgenticJsonMapper jsonMapper);

	/**
	 * Creates a descriptor that maps values with the codec's JSON mapper. Suitable for
	 * records, beans and enums the mapper can read back without extra type hints.
	 * @param id the stable type id
	 * @param javaType the Java type
	 * @return the descriptor
	 * @param <T> the Java type
	 */
	static <T> ExtensionType<T> of(String id, Class<T> javaType) {
		Assert.hasText(id, "id must not be empty");
		Assert.notNull(javaType, "javaType must not be null");
		return new ExtensionType<>() {

			@Override
			public String id() {
				return id;
			}

			@Override
			public Class<T> javaType() {
				return javaType;
			}

			@Override
			public Object encode(T value, AgenticJsonMapper jsonMapper) throws IOException {
				return jsonMapper.toTree(value);
			}

			@Override
			public T decode(Object payload, AgenticJsonMapper jsonMapper) {
				return jsonMapper.convertValue(payload, javaType);
			}

			@Override
			public String toString() {
				return "ExtensionType[" + id + " -> " + javaType.getName() + "]";
			}

		};
	}

}
