package com.nc.trietree;

import java.util.List;

/**
 * Report for one character consumed by {@link BaseTree#scan(CharSequence, ScanReporter)}.
 *
 * @param index
 *            - char index of the character in the scanned text
 * @param label
 *            - the character (code point)
 * @param hits
 *            - keys ending at this character, longest first. Empty when nothing matched.
 */
public record ScanEvent(int index, int label, List<Hit> hits) {

	/**
	 * A key that ends at the reported character.
	 *
	 * @param edgeId
	 *            - id returned by {@link DynamicTree#put(CharSequence)} for the key
	 * @param depth
	 *            - number of characters in the key
	 */
	public record Hit(int edgeId, int depth) {
	}

	public boolean matched() {
		return !hits.isEmpty();
	}

	@Override
	public String toString() {
		return "ScanEvent[index=" + index + ", label=" + new String(Character.toChars(label)) + ", hits=" + hits + "]";
	}
}
