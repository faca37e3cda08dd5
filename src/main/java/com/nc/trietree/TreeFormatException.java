package com.nc.trietree;

import java.io.IOException;

/**
 * Thrown by {@link StaticTree#read(java.io.InputStream)} when the byte stream is malformed or
 * truncated.
 */
public class TreeFormatException extends IOException {

	private static final long serialVersionUID = 1L;

	/**
	 * Section of the serialized image that failed to decode.
	 */
	public enum Field {
		NODE_COUNT, NODE_RECORD, DEPTH_TABLE
	}

	private final Field field;

	public TreeFormatException(Field field, String message) {
		super(field + ": " + message);
		this.field = field;
	}

	public TreeFormatException(Field field, String message, Throwable cause) {
		super(field + ": " + message, cause);
		this.field = field;
	}

	public Field field() {
		return field;
	}
}
