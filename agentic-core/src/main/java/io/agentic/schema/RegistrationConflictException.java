/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.agentic.schema;

/**
 * Thrown when a type id or Java type is registered twice with different bindings.
 */
public class RegistrationConflictException extends AgenticSchemaException {

	private static final long serialVersionUID = 1L;

	private final String typeId;

	public RegistrationConflictException(String typeId, String message) {
		super(ErrorKind.REGISTRATION_CONFLICT, message);
		this.typeId = typeId;
	}

	public String getTypeId() {
		return this.typeId;
	}

}
