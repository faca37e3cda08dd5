package com.nc.trietree;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Pairs every key of a tree with a value: the value of a key lives at values[edgeId - 1].
 *
 * @param <V>
 *            - value type
 */
public sealed abstract class BaseValueTrie<V> permits ValueTrie, FrozenValueTrie {

	/**
	 * Result of {@link BaseValueTrie#longestPrefix(CharSequence)}.
	 */
	public record Match<V>(V value, String prefix) {
	}

	final List<V> values;

	BaseValueTrie(List<V> values) {
		this.values = values;
	}

	/**
	 * Longest stored key which is a prefix of s, together with its value.
	 *
	 * @return the match or null if no key is a prefix of s
	 */
	public final Match<V> longestPrefix(CharSequence s) {
		var p = tree().longestPrefix(s);
		if (!p.isPresent()) {
			return null;
		}
		return new Match<>(values.get(p.edgeId() - 1), p.prefix());
	}

	/**
	 * Every key ending inside query, with its span and value.
	 *
	 * @see BaseTree#predict(CharSequence)
	 */
	public final Stream<ValuePrediction<V>> predict(CharSequence query) {
		Objects.requireNonNull(query, "query");
		return tree().predict(query).map(p -> new ValuePrediction<>(p.start(), p.end(), p.keyIn(query), values.get(p.edgeId() - 1)));
	}

	/**
	 * @return number of keys.
	 */
	public final int size() {
		return values.size();
	}

	abstract BaseTree tree();
}
