/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.agentic.schema;

/**
 * Base class of every failure raised by the agentic schema. Each subclass maps to one
 * {@link ErrorKind}, so callers can either catch the specific type or switch on
 * {@link #getErrorKind()}.
 */
public class AgenticSchemaException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final ErrorKind errorKind;

	public AgenticSchemaException(ErrorKind errorKind, String message) {
		super(message);
		this.errorKind = errorKind;
	}

	public AgenticSchemaException(ErrorKind errorKind, String message, Throwable cause) {
		super(message, cause);
		this.errorKind = errorKind;
	}

	public ErrorKind getErrorKind() {
		return this.errorKind;
	}

}
