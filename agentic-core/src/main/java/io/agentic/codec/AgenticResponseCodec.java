/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.agentic.codec;

import io.agentic.schema.AgenticSchema;

/**
 * Codec interface for encoding and decoding agentic responses.
 * <p>
 * Implementations are stateless per call: encode and decode may run concurrently on
 * independent values as long as the type registry they use is not being modified.
 */
public interface AgenticResponseCodec {

	/**
	 * Encodes a response, keeping the concrete type of every extension value.
	 * @param response the response to encode
	 * @return the encoded bytes
	 * @throws io.agentic.schema.VariantMismatchException if the response violates a
	 * union invariant
	 * @throws io.agentic.schema.UnregisteredExtensionValueException if an extension value
	 * has no registered or built-in type id
	 */
	byte[] encode(AgenticSchema.AgenticResponse response);

	/**
	 * Decodes bytes produced by {@link #encode}.
	 * @param bytes the encoded response
	 * @return a response equal to the one that was encoded
	 * @throws io.agentic.schema.CorruptPayloadException if the bytes are structurally
	 * invalid
	 * @throws io.agentic.schema.UnsupportedVersionException if the format version is not
	 * supported
	 * @throws io.agentic.schema.UnknownExtensionTypeException if an extension value names
	 * an unregistered type id
	 * @throws io.agentic.schema.VariantMismatchException if the decoded response violates
	 * a union invariant
	 */
	AgenticSchema.AgenticResponse decode(byte[] bytes);

}
