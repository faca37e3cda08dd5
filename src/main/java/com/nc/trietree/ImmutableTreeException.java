package com.nc.trietree;

/**
 * Raised when a frozen {@link Trie} is asked to change.
 */
public class ImmutableTreeException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	public ImmutableTreeException(String message) {
		super(message);
	}
}
