/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.agentic.schema;

/**
 * Thrown when a tagged entity does not carry exactly one payload matching its tag.
 */
public class VariantMismatchException extends AgenticSchemaException {

	private static final long serialVersionUID = 1L;

	public VariantMismatchException(String message) {
		super(ErrorKind.VARIANT_MISMATCH, message);
	}

}
