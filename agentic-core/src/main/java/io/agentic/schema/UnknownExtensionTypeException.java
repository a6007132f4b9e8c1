/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.agentic.schema;

/**
 * Thrown when an extension type id cannot be resolved by the type registry.
 */
public class UnknownExtensionTypeException extends AgenticSchemaException {

	private static final long serialVersionUID = 1L;

	private final String typeId;

	public UnknownExtensionTypeException(String typeId) {
		super(ErrorKind.UNKNOWN_EXTENSION_TYPE, "Unknown extension type: '" + typeId + "'");
		this.typeId = typeId;
	}

	public String getTypeId() {
		return this.typeId;
	}

}
