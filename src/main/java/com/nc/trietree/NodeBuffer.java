package com.nc.trietree;

import java.util.Arrays;

/**
 * Node records of the dynamic tree: 7 ints each.
 *
 * <pre>
 * | label | child | low | high | edge | depth | failure |
 * </pre>
 *
 * child/low/high/failure hold {@link BaseTree#NONE} when unset.
 */
final class DNodes extends NodeBuffer {

	static final int UNIT = 7;

	static int safeOffset(int ix) {
		return ix * UNIT;
	}

	DNodes(int cap) {
		super(cap, UNIT);
	}

	int child(int ix) {
		return buffer[safeOffset(ix) + 1];
	}

	void child(int ix, int v) {
		buffer[safeOffset(ix) + 1] = v;
	}

	int depth(int ix) {
		return buffer[safeOffset(ix) + 5];
	}

	void depth(int ix, int v) {
		buffer[safeOffset(ix) + 5] = v;
	}

	int edge(int ix) {
		return buffer[safeOffset(ix) + 4];
	}

	void edge(int ix, int v) {
		buffer[safeOffset(ix) + 4] = v;
	}

	int failure(int ix) {
		return buffer[safeOffset(ix) + 6];
	}

	void failure(int ix, int v) {
		buffer[safeOffset(ix) + 6] = v;
	}

	int high(int ix) {
		return buffer[safeOffset(ix) + 3];
	}

	void high(int ix, int v) {
		buffer[safeOffset(ix) + 3] = v;
	}

	int label(int ix) {
		return buffer[safeOffset(ix)];
	}

	int low(int ix) {
		return buffer[safeOffset(ix) + 2];
	}

	void low(int ix, int v) {
		buffer[safeOffset(ix) + 2] = v;
	}

	/**
	 * Appends a detached node.
	 *
	 * @param label
	 *            - code point consumed by the edge leading to the node
	 * @return index of the new node
	 */
	int push(int label) {
		require(1, UNIT);
		var ix = pos;
		var off = safeOffset(ix);
		var buffer = this.buffer;
		buffer[off] = label;
		buffer[off + 1] = BaseTree.NONE;
		buffer[off + 2] = BaseTree.NONE;
		buffer[off + 3] = BaseTree.NONE;
		buffer[off + 4] = 0;
		buffer[off + 5] = 0;
		buffer[off + 6] = BaseTree.NONE;

		pos++;

		return ix;
	}
}

/**
 * Growable array of fixed-width int records. Subclasses hoist a constant unit so record offsets
 * are computed inline.
 *
 * @author cmuramoto
 */
abstract class NodeBuffer {

	static final int MAX_ARRAY = Integer.MAX_VALUE - 8;

	int[] buffer;

	/**
	 * Number of records in use.
	 */
	int pos;

	NodeBuffer(int cap, int unit) {
		this.buffer = new int[Math.max(1, cap) * unit];
	}

	/**
	 * Buffer capacity is derived from it's unit. Capacity is not called often, so there's no need
	 * to hoist it in a field.
	 */
	final int cap(int unit) {
		return buffer.length / unit;
	}

	final void grow(int more, int unit) {
		var curr = buffer.length;
		var min = (long) curr + (long) more * unit;
		var max = (long) MAX_ARRAY / unit * unit;

		if (min > max) {
			throw new IllegalStateException("Node capacity exhausted: " + (min / unit) + " records");
		}

		var newLen = Math.min(max, Math.max(min, 2L * curr));

		this.buffer = Arrays.copyOf(buffer, (int) newLen);
	}

	final void require(int n, int unit) {
		if ((pos + n) > cap(unit)) {
			grow(n, unit);
		}
	}

	final int size() {
		return pos;
	}
}

/**
 * Node records of the static tree: 5 ints each.
 *
 * <pre>
 * | label | start | end | fail | edge |
 * </pre>
 *
 * [start, end) is the children range, start == 0 when the node is a leaf; fail == 0 is the root.
 */
final class SNodes extends NodeBuffer {

	static final int UNIT = 5;

	static int safeOffset(int ix) {
		return ix * UNIT;
	}

	SNodes(int cap) {
		super(cap, UNIT);
	}

	int edge(int ix) {
		return buffer[safeOffset(ix) + 4];
	}

	int end(int ix) {
		return buffer[safeOffset(ix) + 2];
	}

	int fail(int ix) {
		return buffer[safeOffset(ix) + 3];
	}

	void fail(int ix, int v) {
		buffer[safeOffset(ix) + 3] = v;
	}

	int label(int ix) {
		return buffer[safeOffset(ix)];
	}

	void push(int label, int start, int end, int fail, int edge) {
		require(1, UNIT);
		var off = safeOffset(pos);
		var buffer = this.buffer;
		buffer[off] = label;
		buffer[off + 1] = start;
		buffer[off + 2] = end;
		buffer[off + 3] = fail;
		buffer[off + 4] = edge;

		pos++;
	}

	int start(int ix) {
		return buffer[safeOffset(ix) + 1];
	}

	boolean sameAs(SNodes other) {
		var len = safeOffset(pos);
		return pos == other.pos && Arrays.equals(buffer, 0, len, other.buffer, 0, len);
	}

	int contentHash() {
		var h = 1;
		var len = safeOffset(pos);
		var b = buffer;
		for (var i = 0; i < len; i++) {
			h = 31 * h + b[i];
		}
		return h;
	}
}
