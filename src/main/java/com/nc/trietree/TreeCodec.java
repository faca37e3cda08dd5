package com.nc.trietree;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.nc.trietree.TreeFormatException.Field;

/**
 * Binary layout of a {@link StaticTree}. Every integer is a signed varint (zig-zag, then 7 bits
 * per byte, least significant group first, high bit set on all but the last byte):
 *
 * <pre>
 * node count
 * node count * | label | start | end | fail | edge |
 * depth table length
 * depth table length * | depth |
 * </pre>
 *
 * @author cmuramoto
 */
final class TreeCodec {

	static final class Reader {

		final InputStream in;

		Reader(InputStream in) {
			this.in = in;
		}

		int readInt(Field field, String what) throws IOException {
			var v = readLong(field, what);
			if (v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) {
				throw new TreeFormatException(field, what + " does not fit in 32 bits: " + v);
			}
			return (int) v;
		}

		long readLong(Field field, String what) throws IOException {
			var ux = 0L;
			var shift = 0;

			for (var i = 0; i < MAX_VARINT_LEN; i++) {
				var b = in.read();
				if (b < 0) {
					throw new TreeFormatException(field, "truncated while reading " + what, new EOFException());
				}
				if (b < 0x80) {
					if (i == MAX_VARINT_LEN - 1 && b > 1) {
						break;
					}
					ux |= (long) b << shift;
					return (ux >>> 1) ^ -(ux & 1);
				}
				ux |= (long) (b & 0x7F) << shift;
				shift += 7;
			}

			throw new TreeFormatException(field, "varint overflows a 64-bit integer while reading " + what);
		}

		int readSize(Field field) throws IOException {
			var n = readLong(field, "length");
			if (n < 0) {
				throw new TreeFormatException(field, "negative length " + n);
			}
			if (n > MAX_NODES) {
				throw new UnrepresentableSizeException(field, n, MAX_NODES);
			}
			return (int) n;
		}
	}

	static final class Writer {

		final OutputStream out;
		final byte[] buf = new byte[8192];
		int pos;

		Writer(OutputStream out) {
			this.out = out;
		}

		void flush() throws IOException {
			if (pos > 0) {
				out.write(buf, 0, pos);
				pos = 0;
			}
			out.flush();
		}

		void writeLong(long v) throws IOException {
			if (pos + MAX_VARINT_LEN > buf.length) {
				out.write(buf, 0, pos);
				pos = 0;
			}

			var ux = (v << 1) ^ (v >> 63);
			var b = buf;
			var p = pos;

			while ((ux & ~0x7FL) != 0) {
				b[p++] = (byte) ((ux & 0x7F) | 0x80);
				ux >>>= 7;
			}
			b[p++] = (byte) ux;

			pos = p;
		}
	}

	private static final Logger logger = LoggerFactory.getLogger(TreeCodec.class);

	static final int MAX_VARINT_LEN = 10;

	static final int INITIAL_RECORDS = 4096;

	static final int MAX_NODES = Math.min(NodeBuffer.MAX_ARRAY / SNodes.UNIT, Integer.getInteger("trietree.maxNodes", NodeBuffer.MAX_ARRAY));

	static StaticTree read(InputStream in) throws IOException {
		var r = new Reader(in);

		var count = r.readSize(Field.NODE_COUNT);
		if (count == 0) {
			throw new TreeFormatException(Field.NODE_COUNT, "a tree has at least the root node");
		}

		// declared sizes are untrusted until the records arrive
		var nodes = new SNodes(Math.min(count, INITIAL_RECORDS));
		for (var i = 0; i < count; i++) {
			var what = "node #" + i;
			var label = r.readInt(Field.NODE_RECORD, what);
			var start = r.readInt(Field.NODE_RECORD, what);
			var end = r.readInt(Field.NODE_RECORD, what);
			var fail = r.readInt(Field.NODE_RECORD, what);
			var edge = r.readInt(Field.NODE_RECORD, what);

			if (start == 0 ? end != 0 : (start < 0 || start > end || end > count)) {
				throw new TreeFormatException(Field.NODE_RECORD, what + " has an invalid children range [" + start + ", " + end + ")");
			}
			if (fail < 0 || fail >= count) {
				throw new TreeFormatException(Field.NODE_RECORD, what + " has an invalid failure index " + fail);
			}
			if (edge < 0) {
				throw new TreeFormatException(Field.NODE_RECORD, what + " has a negative edge id " + edge);
			}
			nodes.push(label, start, end, fail, edge);
		}

		verifyShape(nodes);

		var len = r.readSize(Field.DEPTH_TABLE);
		var depths = new int[Math.min(len, INITIAL_RECORDS)];
		for (var i = 0; i < len; i++) {
			if (i == depths.length) {
				depths = Arrays.copyOf(depths, (int) Math.min(len, 2L * i));
			}
			var d = r.readInt(Field.DEPTH_TABLE, "depth of edge " + (i + 1));
			if (d < 0) {
				throw new TreeFormatException(Field.DEPTH_TABLE, "negative depth " + d + " for edge " + (i + 1));
			}
			depths[i] = d;
		}

		for (var i = 0; i < count; i++) {
			var edge = nodes.edge(i);
			if (edge > len) {
				throw new TreeFormatException(Field.DEPTH_TABLE, "node #" + i + " has edge id " + edge + " beyond the depth table (" + len + ")");
			}
		}

		logger.debug("Read tree with {} nodes, {} depths", count, len);

		return new StaticTree(nodes, depths);
	}

	/**
	 * Every node must be reached exactly once descending from the root, siblings must be sorted
	 * and failure targets must be strictly shallower, otherwise lookups could loop.
	 */
	static void verifyShape(SNodes nodes) throws TreeFormatException {
		var count = nodes.size();
		var level = new int[count];
		var queue = new int[count];
		var tail = 1;

		Arrays.fill(level, -1);
		level[0] = 0;

		for (var x = 0; x < tail; x++) {
			var p = queue[x];
			var end = nodes.end(p);
			for (var i = nodes.start(p); i < end; i++) {
				if (level[i] >= 0) {
					throw new TreeFormatException(Field.NODE_RECORD, "node #" + i + " is reachable more than once");
				}
				if (i > nodes.start(p) && nodes.label(i - 1) >= nodes.label(i)) {
					throw new TreeFormatException(Field.NODE_RECORD, "children of node #" + p + " are not sorted by label");
				}
				level[i] = level[p] + 1;
				queue[tail++] = i;
			}
		}

		if (tail != count) {
			throw new TreeFormatException(Field.NODE_RECORD, (count - tail) + " nodes are unreachable from the root");
		}

		if (nodes.fail(0) != 0) {
			throw new TreeFormatException(Field.NODE_RECORD, "root has a failure target");
		}

		for (var i = 1; i < count; i++) {
			if (level[nodes.fail(i)] >= level[i]) {
				throw new TreeFormatException(Field.NODE_RECORD, "node #" + i + " fails to a node that is not shallower");
			}
		}
	}

	static void write(StaticTree tree, OutputStream out) throws IOException {
		var w = new Writer(out);
		var nodes = tree.nodes;
		var count = nodes.size();

		w.writeLong(count);
		for (var i = 0; i < count; i++) {
			w.writeLong(nodes.label(i));
			w.writeLong(nodes.start(i));
			w.writeLong(nodes.end(i));
			w.writeLong(nodes.fail(i));
			w.writeLong(nodes.edge(i));
		}

		var depths = tree.depths;
		w.writeLong(depths.length);
		for (var d : depths) {
			w.writeLong(d);
		}

		w.flush();

		logger.debug("Wrote tree with {} nodes, {} depths", count, depths.length);
	}

	private TreeCodec() {
	}
}
