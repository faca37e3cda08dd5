package com.nc.trietree;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.Objects;

/**
 * Read only key/value trie that can be marshaled: the {@link StaticTree} image is followed by the
 * value list, written by a {@link ValueCodec}.
 *
 * @param <V>
 *            - value type
 */
public final class FrozenValueTrie<V> extends BaseValueTrie<V> {

	/**
	 * Reads a trie written by {@link #marshal(OutputStream, ValueCodec)}.
	 *
	 * @param codec
	 *            - reads the values, {@link ValueCodec#serialization()} when null
	 */
	public static <V> FrozenValueTrie<V> unmarshal(InputStream in, ValueCodec<V> codec) throws IOException {
		var tree = StaticTree.read(in);
		var n = tree.depthCount();
		if (n == 0) {
			return new FrozenValueTrie<>(tree, List.of());
		}

		var c = codec != null ? codec : ValueCodec.<V> serialization();
		var values = c.read(in, n);
		if (values == null || values.size() != n) {
			throw new IOException("Expected " + n + " values, got " + (values == null ? 0 : values.size()));
		}

		return new FrozenValueTrie<>(tree, values);
	}

	final StaticTree tree;

	FrozenValueTrie(StaticTree tree, List<V> values) {
		super(values);
		this.tree = tree;
	}

	/**
	 * Writes the tree followed by the values.
	 *
	 * @param codec
	 *            - writes the values, {@link ValueCodec#serialization()} when null
	 * @throws IllegalStateException
	 *             if the number of values and keys differ
	 */
	public void marshal(OutputStream out, ValueCodec<V> codec) throws IOException {
		Objects.requireNonNull(out, "out");

		if (values.size() != tree.depthCount()) {
			throw new IllegalStateException("Number of values and depths unmatched: values=" + values.size() + " depths=" + tree.depthCount());
		}

		tree.write(out);

		if (values.isEmpty()) {
			return;
		}

		var c = codec != null ? codec : ValueCodec.<V> serialization();
		try {
			c.write(out, values);
		} catch (IOException e) {
			throw new IOException("Failed to marshal values", e);
		}
		out.flush();
	}

	@Override
	StaticTree tree() {
		return tree;
	}
}
