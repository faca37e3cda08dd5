package com.nc.trietree;

/**
 * Receives one {@link ScanEvent} per scanned character, in text order.
 */
@FunctionalInterface
public interface ScanReporter {

	void report(ScanEvent event);
}
