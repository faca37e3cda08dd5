package com.nc.trietree;

/**
 * How a scan ended. A cancelled scan keeps whatever was reported before the cancellation was
 * observed.
 */
public enum ScanOutcome {
	COMPLETED, CANCELLED;

	public boolean isCancelled() {
		return this == CANCELLED;
	}
}
