/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.agentic.schema;

/**
 * Thrown on encode when a registered extension type fails to turn a value into its
 * payload.
 */
public class ExtensionEncodingException extends AgenticSchemaException {

	private static final long serialVersionUID = 1L;

	public ExtensionEncodingException(String typeId, Throwable cause) {
		super(ErrorKind.EXTENSION_ENCODING, "Failed to encode extension value of type '" + typeId + "'", cause);
	}

}
