package com.nc.trietree;

/**
 * Result of {@link BaseTree#longestPrefix(CharSequence)}.
 *
 * @param prefix
 *            - the longest stored key that is a prefix of the query, or "" if none
 * @param edgeId
 *            - its id, or 0 if none
 */
public record Prefix(String prefix, int edgeId) {

	public static final Prefix NONE = new Prefix("", 0);

	public boolean isPresent() {
		return edgeId > 0;
	}
}
