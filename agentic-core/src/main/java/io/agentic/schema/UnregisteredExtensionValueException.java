/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.agentic.schema;

/**
 * Thrown on encode when an extension map holds a value whose Java type is neither
 * registered nor representable by a built-in encoding, or a key that is not a string.
 */
public class UnregisteredExtensionValueException extends AgenticSchemaException {

	private static final long serialVersionUID = 1L;

	private final Class<?> valueType;

	public UnregisteredExtensionValueException(String key, Class<?> valueType) {
		this(valueType,
				"No extension type registered for " + valueType.getName() + " (extension key '" + key + "')");
	}

	private UnregisteredExtensionValueException(Class<?> valueType, String message) {
		super(ErrorKind.UNREGISTERED_EXTENSION_VALUE, message);
		this.valueType = valueType;
	}

	/**
	 * Creates the exception for an extension map entry without a key.
	 * @param value the value stored under the {@code null} key, may be {@code null}
	 * @return the exception
	 */
	public static UnregisteredExtensionValueException nullKey(Object value) {
		Class<?> valueType = (value != null) ? value.getClass() : Void.class;
		return new UnregisteredExtensionValueException(valueType,
				"Extension map contains a null key (value type " + valueType.getName() + ")");
	}

	public Class<?> getValueType() {
		return this.valueType;
	}

}
