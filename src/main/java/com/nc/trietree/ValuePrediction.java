package com.nc.trietree;

/**
 * A key found inside a query, with its value.
 *
 * @param start
 *            - char index where key starts in the query
 * @param end
 *            - char index where key ends in the query (exclusive)
 * @param key
 *            - the matched key
 * @param value
 *            - the value stored for key
 */
public record ValuePrediction<V>(int start, int end, String key, V value) {
}
