/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.agentic.codec;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.zip.CRC32;

import io.agentic.schema.CorruptPayloadException;
import io.agentic.schema.UnsupportedVersionException;

/**
 * The envelope around an encoded response body. All integers are big-endian.
 *
 * <pre>
 * +-------+---------+-------------+------------+-------------+
 * | magic | version | body length |    body    | body CRC32  |
 * |  4 B  |   1 B   |     4 B     |  variable  |     4 B     |
 * +-------+---------+-------------+------------+-------------+
 * </pre>
 */
final class BinaryFrame {

	static final byte[] MAGIC = { 'A', 'G', 'R', 'S' };

	private static final int VERSION_OFFSET = MAGIC.length;

	private static final int LENGTH_OFFSET = VERSION_OFFSET + 1;

	static final int HEADER_LENGTH = LENGTH_OFFSET + Integer.BYTES;

	static final int TRAILER_LENGTH = Integer.BYTES;

	private BinaryFrame() {
	}

	static byte[] wrap(int version, byte[] body) {
		ByteBuffer buffer = ByteBuffer.allocate(HEADER_LENGTH + body.length + TRAILER_LENGTH);
		buffer.put(MAGIC);
		buffer.put((byte) version);
		buffer.putInt(body.length);
		buffer.put(body);
		buffer.putInt((int) checksum(body, 0, body.length));
		return buffer.array();
	}

	/**
	 * Checks the frame and returns a copy of its body.
	 * @throws CorruptPayloadException if the frame is truncated, oversized, or fails its
	 * checksum
	 * @throws UnsupportedVersionException if the version marker is outside
	 * {@code minVersion..maxVersion}
	 */
	static byte[] unwrap(byte[] bytes, int minVersion, int maxVersion, int maxBodyLength) {
		if (bytes.length < MAGIC.length || !Arrays.equals(bytes, 0, MAGIC.length, MAGIC, 0, MAGIC.length)) {
			throw new CorruptPayloadException("Missing format marker");
		}
		if (bytes.length <= VERSION_OFFSET) {
			throw new CorruptPayloadException("Truncated frame header: " + bytes.length + " bytes");
		}
		int version = Byte.toUnsignedInt(bytes[VERSION_OFFSET]);
		if (version < minVersion || version > maxVersion) {
			throw new UnsupportedVersionException(version, minVersion, maxVersion);
		}
		if (bytes.length < HEADER_LENGTH) {
			throw new CorruptPayloadException("Truncated frame header: " + bytes.length + " bytes");
		}

		ByteBuffer buffer = ByteBuffer.wrap(bytes);
		int bodyLength = buffer.getInt(LENGTH_OFFSET);
		if (bodyLength < 0 || bodyLength > maxBodyLength) {
			throw new CorruptPayloadException(
					"Declared body length " + bodyLength + " is outside 0.." + maxBodyLength + " bytes");
		}
		long expectedLength = (long) HEADER_LENGTH + bodyLength + TRAILER_LENGTH;
		if (bytes.length != expectedLength) {
			throw new CorruptPayloadException(
					"Frame length " + bytes.length + " does not match declared length " + expectedLength);
		}

		int storedChecksum = buffer.getInt(HEADER_LENGTH + bodyLength);
		if (storedChecksum != (int) checksum(bytes, HEADER_LENGTH, bodyLength)) {
			throw new CorruptPayloadException("Body checksum mismatch");
		}
		return Arrays.copyOfRange(bytes, HEADER_LENGTH, HEADER_LENGTH + bodyLength);
	}

	private static long checksum(byte[] bytes, int offset, int length) {
		CRC32 crc = new CRC32();
		crc.update(bytes, offset, length);
		return crc.getValue();
	}

}
