/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.agentic.schema;

/**
 * Categories of failures reported by the agentic schema, its type registry and its
 * codec.
 */
public enum ErrorKind {

	/**
	 * A discriminated union holds no payload, more than one payload, or a payload that
	 * does not match its tag.
	 */
	VARIANT_MISMATCH,

	/**
	 * An extension value has no registered type id and no built-in encoding, or an
	 * extension map key is not a string.
	 */
	UNREGISTERED_EXTENSION_VALUE,

	/**
	 * A decoded extension value names a type id that is not registered.
	 */
	UNKNOWN_EXTENSION_TYPE,

	/**
	 * The encoded bytes are structurally invalid.
	 */
	CORRUPT_PAYLOAD,

	/**
	 * The format version marker is outside the supported range.
	 */
	UNSUPPORTED_VERSION,

	/**
	 * A type id or Java type is already bound to something else.
	 */
	REGISTRATION_CONFLICT,

	/**
	 * A registered extension type, or the serializer of the response body, failed to
	 * produce its payload.
	 */
	EXTENSION_ENCODING

}
