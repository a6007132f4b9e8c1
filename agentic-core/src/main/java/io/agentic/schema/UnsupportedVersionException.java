/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.agentic.schema;

/**
 * Thrown on decode when the format version marker is not one this codec reads.
 */
public class UnsupportedVersionException extends AgenticSchemaException {

	private static final long serialVersionUID = 1L;

	private final int version;

	public UnsupportedVersionException(int version, int minVersion, int maxVersion) {
		super(ErrorKind.UNSUPPORTED_VERSION, "Unsupported format version " + version + " (supported: " + minVersion
				+ ".." + maxVersion + ")");
		this.version = version;
	}

	public int getVersion() {
		return this.version;
	}

}
