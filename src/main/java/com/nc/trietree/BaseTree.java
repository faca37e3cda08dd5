package com.nc.trietree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

/**
 * Common structure and algorithms shared by {@link DynamicTree} and {@link StaticTree}. <br>
 * Nodes of both representations are addressed by int handles, {@link #ROOT} being the root. The
 * goto function, scanning, prediction and longest prefix lookup are written once against
 * {@link #find(int, int)}, {@link #idAt(int)}, {@link #depthAt(int)} and {@link #failAt(int)}.
 * <br>
 * Keys and texts are walked by code point; reported positions are char indices.
 *
 * @author cmuramoto
 */
public sealed abstract class BaseTree permits DynamicTree, StaticTree {

	/**
	 * Handle of the root node in both representations.
	 */
	public static final int ROOT = 0;

	/**
	 * Absent node handle.
	 */
	public static final int NONE = -1;

	static final BooleanSupplier NEVER = () -> false;

	/**
	 * Index of the n'th code point counted backwards from end, stopping at 0.
	 */
	static int trailingIndex(CharSequence s, int end, int n) {
		var x = end;
		while (n > 0 && x > 0) {
			x--;
			if (x > 0 && Character.isLowSurrogate(s.charAt(x)) && Character.isHighSurrogate(s.charAt(x - 1))) {
				x--;
			}
			n--;
		}
		return x;
	}

	/**
	 * Hook invoked before a failure-link traversal (scan/predict) starts.
	 */
	void beforeTraversal(String op) {
	}

	/**
	 * Number of characters of the key ending at node. Only meaningful when {@link #idAt(int)} is
	 * positive.
	 */
	abstract int depthAt(int node);

	/**
	 * @return failure target of node, {@link #ROOT} when it has none.
	 */
	abstract int failAt(int node);

	/**
	 * Exact child lookup.
	 *
	 * @return the child of node labeled c or {@link #NONE}
	 */
	abstract int find(int node, int c);

	abstract int idAt(int node);

	/**
	 * Finds the longest stored key which is a prefix of s. Only exact child lookups are performed,
	 * failure links play no role here.
	 *
	 * <pre>
	 * <code>
	 *   tree.put("ab");
	 *   tree.put("abcde");
	 *   tree.longestPrefix("abcdefg"); // Prefix[prefix=abcde, edgeId=2]
	 *   tree.longestPrefix("bbc");     // Prefix.NONE
	 * </code>
	 * </pre>
	 *
	 * @param s
	 *            - query
	 * @return the match or {@link Prefix#NONE}
	 */
	public final Prefix longestPrefix(CharSequence s) {
		Objects.requireNonNull(s, "s");

		var last = NONE;
		var lastEnd = 0;
		var curr = ROOT;
		var len = s.length();

		for (var i = 0; i < len;) {
			var c = Character.codePointAt(s, i);
			var next = find(curr, c);

			if (next == NONE) {
				break;
			}

			i += Character.charCount(c);

			if (idAt(next) > 0) {
				last = next;
				lastEnd = i;
			}
			curr = next;
		}

		return last == NONE ? Prefix.NONE : new Prefix(s.subSequence(0, lastEnd).toString(), idAt(last));
	}

	/**
	 * Goto function: the direct child of node for c, otherwise retries from the failure target
	 * until the root is reached.
	 */
	final int next(int node, int c) {
		for (;;) {
			var n = find(node, c);
			if (n != NONE) {
				return n;
			}
			if (node == ROOT) {
				return ROOT;
			}
			node = failAt(node);
		}
	}

	/**
	 * Lazily enumerates every key that ends inside query, mapped back to its span. For each
	 * character, matches are produced longest first, as in {@link #scan(CharSequence, ScanReporter)}.
	 * <br>
	 * The returned stream pulls one prediction at a time; closing it (or abandoning it) releases the
	 * query.
	 *
	 * <pre>
	 * <code>
	 *   // keys: a, ab, abc, d, de
	 *   tree.predict("azd"); // [Prediction[0, 1, 1], Prediction[2, 3, 4]]
	 * </code>
	 * </pre>
	 *
	 * @param query
	 * @return predictions in query order
	 */
	public final Stream<Prediction> predict(CharSequence query) {
		return new PredictItr(Objects.requireNonNull(query, "query")).stream();
	}

	/**
	 * Iterator form of {@link #predict(CharSequence)}. The iterator is also {@link AutoCloseable}:
	 * closing it stops production.
	 */
	public final Iterator<Prediction> predictIter(CharSequence query) {
		return new PredictItr(Objects.requireNonNull(query, "query"));
	}

	/**
	 * Scans text reporting, for every character, the keys that end there.
	 *
	 * @see #scan(CharSequence, ScanReporter, BooleanSupplier)
	 */
	public final ScanOutcome scan(CharSequence text, ScanReporter reporter) {
		return scan(text, reporter, NEVER);
	}

	/**
	 * Scans text in a single pass. Exactly one {@link ScanEvent} is reported per character, even
	 * when nothing matches, and its hits are ordered longest key first. <br>
	 * cancelled is polled once after each report; when it answers true the scan stops and
	 * {@link ScanOutcome#CANCELLED} is returned. Reports already delivered are not retracted.
	 *
	 * @param text
	 * @param reporter
	 * @param cancelled
	 *            - cooperative cancellation check
	 * @return {@link ScanOutcome#COMPLETED} if the whole text was consumed
	 */
	public final ScanOutcome scan(CharSequence text, ScanReporter reporter, BooleanSupplier cancelled) {
		Objects.requireNonNull(text, "text");
		Objects.requireNonNull(reporter, "reporter");
		Objects.requireNonNull(cancelled, "cancelled");

		beforeTraversal("scan");

		var curr = ROOT;
		var len = text.length();

		for (var i = 0; i < len;) {
			var c = Character.codePointAt(text, i);
			var next = next(curr, c);

			List<ScanEvent.Hit> hits = null;
			for (var n = next; n != ROOT; n = failAt(n)) {
				var id = idAt(n);
				if (id > 0) {
					if (hits == null) {
						hits = new ArrayList<>(2);
					}
					hits.add(new ScanEvent.Hit(id, depthAt(n)));
				}
			}

			reporter.report(new ScanEvent(i, c, hits == null ? List.of() : Collections.unmodifiableList(hits)));

			if (cancelled.getAsBoolean()) {
				return ScanOutcome.CANCELLED;
			}

			curr = next;
			i += Character.charCount(c);
		}

		return ScanOutcome.COMPLETED;
	}

	/**
	 * State machine behind {@link BaseTree#predict(CharSequence)}: index is the next query position
	 * to consume, pivot the automaton state after the last consumed character and node the
	 * position in its failure chain still to be drained.
	 */
	final class PredictItr extends Itr<Prediction> {

		CharSequence query;
		int index;
		int pivot;
		int node;
		int end;

		PredictItr(CharSequence query) {
			this.query = query;
			this.pivot = ROOT;
			this.node = ROOT;
			beforeTraversal("predict");
		}

		@Override
		void advance() {
			var q = query;

			while (q != null) {
				while (node != ROOT) {
					var n = node;
					node = failAt(n);

					var id = idAt(n);
					if (id > 0) {
						curr = new Prediction(trailingIndex(q, end, depthAt(n)), end, id);
						return;
					}
				}

				if (index >= q.length()) {
					close();
					return;
				}

				var c = Character.codePointAt(q, index);
				index += Character.charCount(c);
				end = index;
				// qualified: Itr.next() shadows the goto function here
				pivot = BaseTree.this.next(pivot, c);
				node = pivot;
			}
		}

		@Override
		public void close() {
			super.close();
			query = null;
			node = ROOT;
		}
	}
}
