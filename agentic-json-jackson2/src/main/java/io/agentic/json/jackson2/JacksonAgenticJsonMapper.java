/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.agentic.json.jackson2;

import java.io.IOException;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.agentic.json.AgenticJsonMapper;

/**
 * Jackson-based implementation of {@link AgenticJsonMapper}. Wraps a Jackson
 * {@link ObjectMapper} and delegates every operation to it.
 */
public final class JacksonAgenticJsonMapper implements AgenticJsonMapper {

	private final ObjectMapper objectMapper;

	/**
	 * Constructs a new JacksonAgenticJsonMapper instance with the given ObjectMapper.
	 * @param objectMapper the ObjectMapper to be used for JSON serialization and
	 * deserialization. Must not be null.
	 * @throws IllegalArgumentException if the provided ObjectMapper is null
	 */
	public JacksonAgenticJsonMapper(ObjectMapper objectMapper) {
		if (objectMapper == null) {
			throw new IllegalArgumentException("ObjectMapper must not be null");
		}
		this.objectMapper = objectMapper;
	}

	/**
	 * Returns the underlying Jackson {@link ObjectMapper}.
	 * @return the ObjectMapper instance
	 */
	public ObjectMapper getObjectMapper() {
		return objectMapper;
	}

	@Override
	public <T> T readValue(byte[] content, Class<T> type) throws IOException {
		return objectMapper.readValue(content, type);
	}

	@Override
	public <T> T convertValue(Object fromValue, Class<T> type) {
		return objectMapper.convertValue(fromValue, type);
	}

	@Override
	public Object toTree(Object value) throws IOException {
		return objectMapper.readValue(objectMapper.writeValueAsBytes(value), Object.class);
	}

	@Override
	public byte[] writeValueAsBytes(Object value) throws IOException {
		return objectMapper.writeValueAsBytes(value);
	}

}
