package com.nc.trietree;

/**
 * A node count or depth table length that cannot be held in a Java array (or exceeds
 * {@code trietree.maxNodes}).
 */
public class UnrepresentableSizeException extends TreeFormatException {

	private static final long serialVersionUID = 1L;

	private final long size;

	public UnrepresentableSizeException(Field field, long size, long limit) {
		super(field, "size " + size + " exceeds the addressable limit " + limit);
		this.size = size;
	}

	public long size() {
		return size;
	}
}
