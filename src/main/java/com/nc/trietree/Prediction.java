package com.nc.trietree;

/**
 * A key found inside a query.
 *
 * @param start
 *            - char index where the key starts in the query (inclusive)
 * @param end
 *            - char index where the key ends in the query (exclusive)
 * @param edgeId
 *            - id of the key
 */
public record Prediction(int start, int end, int edgeId) {

	/**
	 * @param query
	 *            - the query this prediction was produced for
	 * @return the matched key
	 */
	public String keyIn(CharSequence query) {
		return query.subSequence(start, end).toString();
	}
}
