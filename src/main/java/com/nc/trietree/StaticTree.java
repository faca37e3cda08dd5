package com.nc.trietree;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Arrays;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Frozen automaton. Nodes are flat records addressed by index, 0 being the root; the children of
 * a node occupy the contiguous range [start, end), sorted by label, so child lookup is a binary
 * search. Depths live in a side table indexed by edge id - 1, keeping node records fixed-width.
 * <br>
 * Instances are immutable and may be scanned concurrently without synchronization.
 *
 * @author cmuramoto
 */
public final class StaticTree extends BaseTree {

	private static final Logger logger = LoggerFactory.getLogger(StaticTree.class);

	/**
	 * Lays src out breadth first, so that every sibling group lands on a contiguous range in label
	 * order, then recomputes the failure links over indices. src is not modified and need not have
	 * its failure links computed.
	 *
	 * @param src
	 * @return an independent frozen copy
	 */
	public static StaticTree freeze(DynamicTree src) {
		Objects.requireNonNull(src, "src");

		var count = src.countAll();
		var nodes = new SNodes(count);
		var depths = new int[src.size()];

		// queue position == static index
		var queue = new int[count];
		var tail = 1;
		queue[0] = ROOT;

		for (var x = 0; x < tail; x++) {
			var dn = queue[x];
			var start = tail;
			tail = src.children(dn, queue, tail);

			var id = src.edgeId(dn);
			if (tail > start) {
				nodes.push(src.label(dn), start, tail, 0, id);
			} else {
				nodes.push(src.label(dn), 0, 0, 0, id);
			}

			if (id > 0) {
				depths[id - 1] = src.depth(dn);
			}
		}

		var st = new StaticTree(nodes, depths);
		st.fillFailure();

		logger.debug("Froze {} nodes, {} keys", count, depths.length);

		return st;
	}

	/**
	 * Reads a tree written by {@link #write(OutputStream)}. Bytes are consumed one at a time and
	 * nothing past the depth table is read, so data following the tree in the same stream stays
	 * available; wrap unbuffered sources in a {@link java.io.BufferedInputStream}.
	 *
	 * @param in
	 * @return the tree
	 * @throws TreeFormatException
	 *             if the stream is malformed or truncated
	 * @throws UnrepresentableSizeException
	 *             if a declared size cannot be allocated
	 * @throws IOException
	 *             if in fails
	 */
	public static StaticTree read(InputStream in) throws IOException {
		return TreeCodec.read(Objects.requireNonNull(in, "in"));
	}

	final SNodes nodes;

	final int[] depths;

	StaticTree(SNodes nodes, int[] depths) {
		this.nodes = nodes;
		this.depths = depths;
	}

	/**
	 * Number of entries of the depth table, i.e. the greatest edge id. Value tables stored along
	 * with the tree are sized by it.
	 */
	public int depthCount() {
		return depths.length;
	}

	/**
	 * @param edgeId
	 *            - 1 based
	 * @return depth recorded for edgeId
	 */
	public int depth(int edgeId) {
		return depths[edgeId - 1];
	}

	@Override
	int depthAt(int node) {
		var id = nodes.edge(node);
		return id > 0 && id <= depths.length ? depths[id - 1] : -1;
	}

	/**
	 * @return start of node's children range (inclusive), 0 when it has no children.
	 */
	public int start(int node) {
		return nodes.start(node);
	}

	/**
	 * @return end of node's children range (exclusive), 0 when it has no children.
	 */
	public int end(int node) {
		return nodes.end(node);
	}

	/**
	 * @return id of the key ending at node, 0 if none.
	 */
	public int edgeId(int node) {
		return nodes.edge(node);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		return obj instanceof StaticTree o && nodes.sameAs(o.nodes) && Arrays.equals(depths, o.depths);
	}

	/**
	 * @return index of node's failure target, 0 (the root) when it has none.
	 */
	public int fail(int node) {
		return nodes.fail(node);
	}

	@Override
	int failAt(int node) {
		return nodes.fail(node);
	}

	void fillFailure() {
		var n = nodes;
		var size = n.size();

		// breadth first layout: parents are always resolved before their children
		for (var x = 0; x < size; x++) {
			var start = n.start(x);
			if (start == 0) {
				continue;
			}
			var pf = n.fail(x);
			var end = n.end(x);

			for (var i = start; i < end; i++) {
				var f = next(pf, n.label(i));
				n.fail(i, f == i ? ROOT : f);
			}
		}
	}

	@Override
	int find(int node, int c) {
		var n = nodes;
		var lo = n.start(node);
		var hi = n.end(node) - 1;

		while (lo <= hi) {
			var mid = (lo + hi) >>> 1;
			var label = n.label(mid);
			if (label < c) {
				lo = mid + 1;
			} else if (label > c) {
				hi = mid - 1;
			} else {
				return mid;
			}
		}

		return NONE;
	}

	@Override
	public int hashCode() {
		return 31 * nodes.contentHash() + Arrays.hashCode(depths);
	}

	@Override
	int idAt(int node) {
		return nodes.edge(node);
	}

	/**
	 * @return the code point consumed by the edge leading to node.
	 */
	public int label(int node) {
		return nodes.label(node);
	}

	/**
	 * @return number of nodes, root included.
	 */
	public int nodeCount() {
		return nodes.size();
	}

	/**
	 * @return number of keys.
	 */
	public int size() {
		return depths.length;
	}

	@Override
	public String toString() {
		return "StaticTree[nodes=" + nodes.size() + ", keys=" + depths.length + "]";
	}

	/**
	 * Writes the tree in the compact varint layout read by {@link #read(InputStream)}. out is
	 * flushed but not closed.
	 *
	 * @param out
	 * @throws IOException
	 */
	public void write(OutputStream out) throws IOException {
		TreeCodec.write(this, Objects.requireNonNull(out, "out"));
	}
}
