package com.nc.trietree;

import java.util.Arrays;
import java.util.Objects;
import java.util.function.IntConsumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Growable trie. Each node keeps its children in a binary search tree keyed by label (the
 * low/high links of the children), so insertion and lookup cost O(depth * log(branching)). <br>
 * Keys receive dense ids in first insertion order, starting at 1. Failure links are only
 * computed by {@link #fillFailure()}; until then (and again after a {@link #put(CharSequence)}
 * adds nodes) scanning and prediction see only matches reachable by descending from the root,
 * which is reported as a warning. <br>
 * Not thread safe: a single writer followed by {@link #freeze()} is the intended usage when the
 * automaton is to be shared.
 *
 * @author cmuramoto
 */
public final class DynamicTree extends BaseTree {

	private static final Logger logger = LoggerFactory.getLogger(DynamicTree.class);

	static final int INITIAL_CAPACITY = Integer.getInteger("trietree.initialCapacity", 64);

	final DNodes nodes;

	int lastEdgeId;

	boolean linked;

	public DynamicTree() {
		this(INITIAL_CAPACITY);
	}

	public DynamicTree(int capacity) {
		this.nodes = new DNodes(capacity);
		this.nodes.push(0);
	}

	@Override
	void beforeTraversal(String op) {
		if (!linked && nodes.size() > 1) {
			logger.warn("{} over a tree without up to date failure links: only matches reachable from the root are reported. Call fillFailure() first.", op);
		}
	}

	/**
	 * Appends the children of node, in label order, to dst starting at at.
	 *
	 * @return the position after the last appended child
	 */
	int children(int node, int[] dst, int at) {
		var cursor = new int[]{ at };
		forEachChild(node, c -> dst[cursor[0]++] = c);
		return cursor[0];
	}

	/**
	 * @return total number of nodes, root included.
	 */
	public int countAll() {
		return nodes.size();
	}

	/**
	 * @return number of direct children of node.
	 */
	public int countChild(int node) {
		var count = new int[1];
		forEachChild(node, c -> count[0]++);
		return count[0];
	}

	/**
	 * @return number of characters of the key ending at node. Only meaningful when
	 *         {@link #edgeId(int)} is positive.
	 */
	public int depth(int node) {
		return nodes.depth(node);
	}

	@Override
	int depthAt(int node) {
		return nodes.depth(node);
	}

	int dig(int parent, int c) {
		var n = nodes;
		var p = n.child(parent);

		if (p == NONE) {
			var rv = n.push(c);
			n.child(parent, rv);
			return rv;
		}

		for (;;) {
			var label = n.label(p);
			if (c == label) {
				return p;
			}

			if (c < label) {
				var low = n.low(p);
				if (low == NONE) {
					var rv = n.push(c);
					n.low(p, rv);
					return rv;
				}
				p = low;
			} else {
				var high = n.high(p);
				if (high == NONE) {
					var rv = n.push(c);
					n.high(p, rv);
					return rv;
				}
				p = high;
			}
		}
	}

	/**
	 * @return id of the key ending at node, 0 if no key ends there.
	 */
	public int edgeId(int node) {
		return nodes.edge(node);
	}

	/**
	 * Computes Aho-Corasick failure links for every node, breadth first so that a parent's link is
	 * final before any of its children are resolved. The root's link points to itself while the
	 * links are being built and is cleared afterwards.
	 */
	public void fillFailure() {
		var n = nodes;
		var size = n.size();
		var queue = new int[size];
		var head = 0;
		var tail = 1;

		queue[0] = ROOT;
		n.failure(ROOT, ROOT);

		while (head < tail) {
			var parent = queue[head++];
			var from = tail;
			tail = children(parent, queue, tail);

			var pf = n.failure(parent);

			for (var i = from; i < tail; i++) {
				var c = queue[i];
				var f = next(pf, n.label(c));
				if (f == c) {
					f = ROOT;
				}
				n.failure(c, f);
			}
		}

		n.failure(ROOT, NONE);
		linked = true;

		logger.debug("Failure links computed for {} nodes", size);
	}

	/**
	 * Visits the children of node in label order.
	 */
	public void forEachChild(int node, IntConsumer action) {
		var n = nodes;
		var p = n.child(node);
		if (p == NONE) {
			return;
		}
		// iterative in-order walk: sibling trees degenerate into lists for sorted input
		var stack = new int[16];
		var sp = 0;
		while (p != NONE || sp > 0) {
			while (p != NONE) {
				if (sp == stack.length) {
					stack = Arrays.copyOf(stack, sp << 1);
				}
				stack[sp++] = p;
				p = n.low(p);
			}
			p = stack[--sp];
			action.accept(p);
			p = n.high(p);
		}
	}

	@Override
	int failAt(int node) {
		var f = nodes.failure(node);
		return f == NONE ? ROOT : f;
	}

	/**
	 * @return the failure target of node, {@link #NONE} if it has none (always the case for the
	 *         root, and for any node before {@link #fillFailure()}).
	 */
	public int failure(int node) {
		return nodes.failure(node);
	}

	@Override
	int find(int node, int c) {
		var n = nodes;
		var p = n.child(node);
		while (p != NONE) {
			var label = n.label(p);
			if (c == label) {
				return p;
			}
			p = c < label ? n.low(p) : n.high(p);
		}
		return NONE;
	}

	/**
	 * Produces an independent {@link StaticTree} equivalent to this one.
	 *
	 * @see StaticTree#freeze(DynamicTree)
	 */
	public StaticTree freeze() {
		return StaticTree.freeze(this);
	}

	/**
	 * Exact lookup by path descent. No failure links are followed.
	 *
	 * @param key
	 * @return node handle or {@link #NONE}. The root is returned for the empty key.
	 */
	public int get(CharSequence key) {
		Objects.requireNonNull(key, "key");

		var node = ROOT;
		var len = key.length();
		for (var i = 0; i < len;) {
			var c = Character.codePointAt(key, i);
			node = find(node, c);
			if (node == NONE) {
				return NONE;
			}
			i += Character.charCount(c);
		}
		return node;
	}

	/**
	 * @return true if failure links were computed and no node was added since.
	 */
	public boolean hasFailureLinks() {
		return linked;
	}

	@Override
	int idAt(int node) {
		return nodes.edge(node);
	}

	/**
	 * @return the code point consumed by the edge leading to node, 0 for the root.
	 */
	public int label(int node) {
		return nodes.label(node);
	}

	/**
	 * Inserts a key. Re-inserting a key returns its existing id; its recorded depth is refreshed.
	 *
	 * @param key
	 * @return id of the key, greater than zero.
	 */
	public int put(CharSequence key) {
		Objects.requireNonNull(key, "key");

		var before = nodes.size();
		var node = ROOT;
		var depth = 0;
		var len = key.length();

		for (var i = 0; i < len;) {
			var c = Character.codePointAt(key, i);
			node = dig(node, c);
			depth++;
			i += Character.charCount(c);
		}

		var n = nodes;
		if (n.edge(node) <= 0) {
			n.edge(node, ++lastEdgeId);
		}
		n.depth(node, depth);

		if (n.size() != before) {
			linked = false;
		}

		return n.edge(node);
	}

	/**
	 * @return number of distinct keys, which is also the greatest id handed out.
	 */
	public int size() {
		return lastEdgeId;
	}
}
