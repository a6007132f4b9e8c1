/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.agentic.schema;

/**
 * Thrown on decode when the byte stream is truncated, fails its checksum or does not
 * parse into a response.
 */
public class CorruptPayloadException extends AgenticSchemaException {

	private static final long serialVersionUID = 1L;

	public CorruptPayloadException(String message) {
		super(ErrorKind.CORRUPT_PAYLOAD, message);
	}

	public CorruptPayloadException(String message, Throwable cause) {
		super(ErrorKind.CORRUPT_PAYLOAD, message, cause);
	}

}
