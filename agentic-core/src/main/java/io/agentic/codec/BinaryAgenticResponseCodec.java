/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.agentic.codec;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.agentic.json.AgenticJsonMapper;
import io.agentic.registry.ExtensionTypeRegistry;
import io.agentic.schema.AgenticSchema.AgenticResponse;
import io.agentic.schema.AgenticSchemaException;
import io.agentic.schema.AgenticSchemaValidator;
import io.agentic.schema.CorruptPayloadException;
import io.agentic.schema.ErrorKind;
import io.agentic.util.Assert;

/**
 * Versioned binary {@link AgenticResponseCodec}.
 * <p>
 * The response is written as a JSON body inside a {@link BinaryFrame frame} that starts
 * with a format marker and version and ends with a CRC32 of the body. Every value of an
 * {@code extra} map is written as a {@code (typeId, payload)} envelope and resolved
 * through the {@link ExtensionTypeRegistry} on decode, so values come back with their
 * original Java type or the decode fails. Unknown JSON properties are skipped, which
 * lets newer writers add fields without breaking older readers.
 *
 * <p>
 * Use {@link #builder()} to create instances.
 */
public class BinaryAgenticResponseCodec implements AgenticResponseCodec {

	private static final Logger logger = LoggerFactory.getLogger(BinaryAgenticResponseCodec.class);

	/**
	 * The format version written by this codec.
	 */
	public static final int FORMAT_VERSION = 1;

	public static final int MIN_SUPPORTED_VERSION = 1;

	public static final int MAX_SUPPORTED_VERSION = 1;

	/**
	 * System property holding the default maximum body size, in bytes, accepted on
	 * decode.
	 */
	public static final String MAX_PAYLOAD_SIZE_PROPERTY = "io.agentic.codec.maxPayloadSize";

	public static final int DEFAULT_MAX_PAYLOAD_SIZE = 64 * 1024 * 1024;

	private final AgenticJsonMapper jsonMapper;

	private final ExtensionTypeRegistry registry;

	private final int maxPayloadSize;

	private final ExtraMapRewriter extraEncoder;

	private final ExtraMapRewriter extraDecoder;

	BinaryAgenticResponseCodec(AgenticJsonMapper jsonMapper, ExtensionTypeRegistry registry, int maxPayloadSize) {
		Assert.notNull(jsonMapper, "jsonMapper must not be null");
		Assert.notNull(registry, "registry must not be null");
		Assert.isTrue(maxPayloadSize > 0, "maxPayloadSize must be positive");
		this.jsonMapper = jsonMapper;
		this.registry = registry;
		this.maxPayloadSize = maxPayloadSize;

		ExtensionValueCodec extensionValueCodec = new ExtensionValueCodec(registry, jsonMapper);
		this.extraEncoder = new ExtraMapRewriter(extensionValueCodec::encodeExtra);
		this.extraDecoder = new ExtraMapRewriter(extensionValueCodec::decodeExtra);
	}

	public static Builder builder() {
		return new Builder();
	}

	public ExtensionTypeRegistry getRegistry() {
		return this.registry;
	}

	public int getMaxPayloadSize() {
		return this.maxPayloadSize;
	}

	@Override
	public byte[] encode(AgenticResponse response) {
		Assert.notNull(response, "response must not be null");
		AgenticSchemaValidator.validate(response);

		AgenticResponse wireResponse = this.extraEncoder.rewrite(response);
		byte[] body;
		try {
			body = this.jsonMapper.writeValueAsBytes(wireResponse);
		}
		catch (IOException e) {
			throw new AgenticSchemaException(ErrorKind.EXTENSION_ENCODING,
					"Failed to serialize response '" + response.id() + "'", e);
		}

		byte[] bytes = BinaryFrame.wrap(FORMAT_VERSION, body);
		logger.debug("Encoded response '{}' with {} blocks into {} bytes", response.id(),
				(response.blocks() != null) ? response.blocks().size() : 0, bytes.length);
		return bytes;
	}

	@Override
	public AgenticResponse decode(byte[] bytes) {
		Assert.notNull(bytes, "bytes must not be null");
		try {
			byte[] body = BinaryFrame.unwrap(bytes, MIN_SUPPORTED_VERSION, MAX_SUPPORTED_VERSION,
					this.maxPayloadSize);

			AgenticResponse wireResponse = readBody(body);
			AgenticResponse response = this.extraDecoder.rewrite(wireResponse);
			AgenticSchemaValidator.validate(response);

			logger.debug("Decoded response '{}' from {} bytes", response.id(), bytes.length);
			return response;
		}
		catch (AgenticSchemaException e) {
			logger.warn("Failed to decode {} bytes: {}", bytes.length, e.getMessage());
			throw e;
		}
	}

	private AgenticResponse readBody(byte[] body) {
		AgenticResponse wireResponse;
		try {
			wireResponse = this.jsonMapper.readValue(body, AgenticResponse.class);
		}
		catch (IOException | IllegalArgumentException e) {
			throw new CorruptPayloadException("Malformed response body: " + e.getMessage(), e);
		}
		if (wireResponse == null) {
			throw new CorruptPayloadException("Response body is empty");
		}
		return wireResponse;
	}

	/**
	 * Builder for {@link BinaryAgenticResponseCodec}.
	 */
	public static class Builder {

		private AgenticJsonMapper jsonMapper;

		private ExtensionTypeRegistry registry;

		private Integer maxPayloadSize;

		/**
		 * Sets the JSON mapper used for the body and for registered extension types.
		 * Defaults to {@link AgenticJsonMapper#createDefault()}.
		 * @param jsonMapper the JSON mapper
		 * @return this builder
		 */
		public Builder jsonMapper(AgenticJsonMapper jsonMapper) {
			Assert.notNull(jsonMapper, "jsonMapper must not be null");
			this.jsonMapper = jsonMapper;
			return this;
		}

		/**
		 * Sets the registry resolving extension type ids. Defaults to an empty registry,
		 * which only round-trips built-in values.
		 * @param registry the type registry
		 * @return this builder
		 */
		public Builder registry(ExtensionTypeRegistry registry) {
			Assert.notNull(registry, "registry must not be null");
			this.registry = registry;
			return this;
		}

		/**
		 * Sets the largest body, in bytes, accepted on decode. Defaults to the
		 * {@value BinaryAgenticResponseCodec#MAX_PAYLOAD_SIZE_PROPERTY} system property,
		 * or 64 MiB when it is not set.
		 * @param maxPayloadSize the maximum body size
		 * @return this builder
		 */
		public Builder maxPayloadSize(int maxPayloadSize) {
			Assert.isTrue(maxPayloadSize > 0, "maxPayloadSize must be positive");
			this.maxPayloadSize = maxPayloadSize;
			return this;
		}

		public BinaryAgenticResponseCodec build() {
			AgenticJsonMapper mapper = (this.jsonMapper != null) ? this.jsonMapper : AgenticJsonMapper.createDefault();
			ExtensionTypeRegistry typeRegistry = (this.registry != null) ? this.registry
					: new ExtensionTypeRegistry();
			int maxSize = (this.maxPayloadSize != null) ? this.maxPayloadSize
					: Integer.getInteger(MAX_PAYLOAD_SIZE_PROPERTY, DEFAULT_MAX_PAYLOAD_SIZE);
			return new BinaryAgenticResponseCodec(mapper, typeRegistry, maxSize);
		}

	}

}
