package com.nc.trietree;

import java.util.ArrayList;
import java.util.Objects;

/**
 * Growable key/value trie.
 *
 * @param <V>
 *            - value type
 */
public final class ValueTrie<V> extends BaseValueTrie<V> {

	final DynamicTree tree;

	public ValueTrie() {
		super(new ArrayList<>());
		this.tree = new DynamicTree();
	}

	/**
	 * Computes the failure links of the underlying tree, needed before {@link #predict(CharSequence)}
	 * reports matches that do not start at the beginning of the query.
	 */
	public void fillFailure() {
		tree.fillFailure();
	}

	/**
	 * Compiles a frozen copy.
	 *
	 * @param copyValues
	 *            - when false the frozen trie shares the value list with this one, so later
	 *            {@link #put(CharSequence, Object)} replacements are visible through it
	 */
	public FrozenValueTrie<V> freeze(boolean copyValues) {
		return new FrozenValueTrie<>(tree.freeze(), copyValues ? new ArrayList<>(values) : values);
	}

	/**
	 * @return the value stored for key, null if key is absent.
	 */
	public V get(CharSequence key) {
		var node = tree.get(key);
		if (node == BaseTree.NONE) {
			return null;
		}
		var id = tree.edgeId(node);
		return id > 0 ? values.get(id - 1) : null;
	}

	/**
	 * Adds a key, or replaces the value of an existing one.
	 */
	public void put(CharSequence key, V value) {
		Objects.requireNonNull(key, "key");

		var id = tree.put(key);
		if (id - 1 == values.size()) {
			values.add(value);
		} else {
			values.set(id - 1, value);
		}
	}

	@Override
	BaseTree tree() {
		return tree;
	}
}
