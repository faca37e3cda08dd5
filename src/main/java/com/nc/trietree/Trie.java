package com.nc.trietree;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keyword set with a grow-then-freeze lifecycle. Keys are added to a {@link DynamicTree} until
 * {@link #freeze()} replaces it with a {@link StaticTree}; from then on the trie is read only.
 * Failure links of the dynamic form are refreshed on demand, so it can be scanned at any time.
 */
public final class Trie {

	private static final Logger logger = LoggerFactory.getLogger(Trie.class);

	/**
	 * Reads a trie written by {@link #marshal(OutputStream)}. The result is frozen.
	 */
	public static Trie unmarshal(InputStream in) throws IOException {
		var rv = new Trie();
		rv.frozen = StaticTree.read(in);
		return rv;
	}

	DynamicTree dynamic;

	StaticTree frozen;

	/**
	 * Compiles the dynamic form into a frozen one. The trie cannot be modified afterwards.
	 *
	 * @throws ImmutableTreeException
	 *             if already frozen
	 */
	public void freeze() {
		if (frozen != null) {
			throw new ImmutableTreeException("Trie is frozen already");
		}
		frozen = StaticTree.freeze(dynamic == null ? new DynamicTree() : dynamic);
		dynamic = null;

		logger.debug("Trie frozen: {}", frozen);
	}

	public boolean isFrozen() {
		return frozen != null;
	}

	public Prefix longestPrefix(CharSequence s) {
		return tree().longestPrefix(s);
	}

	/**
	 * Writes the frozen form. A trie that is not frozen yet is frozen into a snapshot for writing
	 * and stays modifiable.
	 */
	public void marshal(OutputStream out) throws IOException {
		if (frozen != null) {
			frozen.write(out);
		} else {
			StaticTree.freeze(dynamic == null ? new DynamicTree() : dynamic).write(out);
		}
	}

	public Stream<Prediction> predict(CharSequence query) {
		return tree().predict(query);
	}

	/**
	 * @param key
	 * @return edge id of key
	 * @throws ImmutableTreeException
	 *             if frozen
	 */
	public int put(CharSequence key) {
		Objects.requireNonNull(key, "key");
		if (frozen != null) {
			throw new ImmutableTreeException("Trie is frozen, can't put " + key);
		}
		if (dynamic == null) {
			dynamic = new DynamicTree();
		}
		return dynamic.put(key);
	}

	public ScanOutcome scan(CharSequence text, ScanReporter reporter) {
		return tree().scan(text, reporter);
	}

	public ScanOutcome scan(CharSequence text, ScanReporter reporter, BooleanSupplier cancelled) {
		return tree().scan(text, reporter, cancelled);
	}

	BaseTree tree() {
		if (frozen != null) {
			return frozen;
		}
		if (dynamic == null) {
			dynamic = new DynamicTree();
		}
		if (!dynamic.hasFailureLinks()) {
			dynamic.fillFailure();
		}
		return dynamic;
	}
}
