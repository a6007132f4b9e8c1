/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.agentic.json.jackson2;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

import io.agentic.json.AgenticJsonMapper;
import io.agentic.json.AgenticJsonMapperSupplier;

/**
 * A supplier of {@link AgenticJsonMapper} instances that uses the Jackson library for
 * JSON serialization and deserialization.
 * <p>
 * This implementation provides a {@link AgenticJsonMapper} backed by a Jackson
 * {@link ObjectMapper} configured for JPMS (Java Platform Module System) compatibility.
 */
public class JacksonAgenticJsonMapperSupplier implements AgenticJsonMapperSupplier {

	/**
	 * Returns a new instance of {@link AgenticJsonMapper} that uses the Jackson library
	 * for JSON serialization and deserialization.
	 * @return a new {@link AgenticJsonMapper} instance
	 */
	@Override
	public AgenticJsonMapper get() {
		return new JacksonAgenticJsonMapper(createJpmsCompatibleMapper());
	}

	/**
	 * Creates an ObjectMapper configured for JPMS compatibility.
	 * <p>
	 * The mapper is configured to:
	 * <ul>
	 * <li>Not call {@code setAccessible()} on constructors/fields, avoiding the need for
	 * {@code --add-opens} flags</li>
	 * <li>Use the {@link ParameterNamesModule} to discover constructor parameter names
	 * from bytecode (requires the {@code -parameters} compiler flag, configured in the
	 * parent pom.xml)</li>
	 * <li>Skip properties it does not know, so documents written by a newer schema
	 * revision still read</li>
	 * </ul>
	 * @return a JPMS-compatible ObjectMapper
	 */
	private static ObjectMapper createJpmsCompatibleMapper() {
		return JsonMapper.builder()
			.disable(MapperFeature.CAN_OVERRIDE_ACCESS_MODIFIERS)
			.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
			.addModule(new ParameterNamesModule())
			.build();
	}

}
