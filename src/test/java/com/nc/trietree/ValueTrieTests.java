package com.nc.trietree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.FixMethodOrder;
import org.junit.Test;
import org.junit.runners.MethodSorters;

import com.nc.trietree.BaseValueTrie.Match;

@FixMethodOrder(MethodSorters.NAME_ASCENDING)
public class ValueTrieTests {

	static final ValueCodec<Integer> INTS = new ValueCodec<>() {

		@Override
		public List<Integer> read(InputStream in, int count) throws IOException {
			var din = new DataInputStream(in);
			var rv = new ArrayList<Integer>(count);
			for (var i = 0; i < count; i++) {
				rv.add(din.readInt());
			}
			return rv;
		}

		@Override
		public void write(OutputStream out, List<Integer> values) throws IOException {
			var dout = new DataOutputStream(out);
			for (var v : values) {
				dout.writeInt(v);
			}
			dout.flush();
		}
	};

	static ValueTrie<String> sample() {
		var trie = new ValueTrie<String>();
		trie.put("ab", "AB");
		trie.put("bc", "BC");
		trie.put("bab", "BAB");
		trie.put("d", "D");
		trie.put("abcde", "ABCDE");
		trie.fillFailure();
		return trie;
	}

	@Test
	public void test_count_mismatch() throws IOException {
		var trie = new ValueTrie<String>();
		trie.put("a", "A");
		var frozen = trie.freeze(false);

		// shared list grows past the frozen key set
		trie.put("b", "B");

		try {
			frozen.marshal(new ByteArrayOutputStream(), null);
			fail("marshaled mismatched values");
		} catch (IllegalStateException expected) {
			// ok
		}
	}

	@Test
	public void test_custom_codec() throws IOException {
		var trie = new ValueTrie<Integer>();
		for (var i = 0; i < 100; i++) {
			trie.put("k" + i, i * i);
		}
		var frozen = trie.freeze(true);

		var bos = new ByteArrayOutputStream();
		frozen.marshal(bos, INTS);
		bos.write(7);

		var in = new ByteArrayInputStream(bos.toByteArray());
		var read = FrozenValueTrie.unmarshal(in, INTS);

		assertEquals(100, read.size());
		assertEquals(new Match<>(81 * 81, "k81"), read.longestPrefix("k81x"));
		assertEquals(new Match<>(8 * 8, "k8"), read.longestPrefix("k8x"));
		assertEquals(7, in.read());
	}

	@Test
	public void test_default_codec_round_trip() throws IOException {
		var frozen = sample().freeze(true);

		var bos = new ByteArrayOutputStream();
		frozen.marshal(bos, null);

		var read = FrozenValueTrie.<String> unmarshal(new ByteArrayInputStream(bos.toByteArray()), null);

		assertEquals(5, read.size());
		assertEquals(frozen.predict("xxbabcde").toList(), read.predict("xxbabcde").toList());
		assertEquals(new Match<>("ABCDE", "abcde"), read.longestPrefix("abcdefg"));
	}

	@Test
	public void test_empty() throws IOException {
		var trie = new ValueTrie<String>();
		var frozen = trie.freeze(true);

		assertEquals(0, frozen.size());
		assertNull(frozen.longestPrefix("abc"));

		var bos = new ByteArrayOutputStream();
		frozen.marshal(bos, null);

		var read = FrozenValueTrie.<String> unmarshal(new ByteArrayInputStream(bos.toByteArray()), null);
		assertEquals(0, read.size());
		assertEquals(List.of(), read.predict("abc").toList());
	}

	@Test
	public void test_freeze_copies_or_shares_values() {
		var trie = new ValueTrie<String>();
		trie.put("a", "1");

		var copied = trie.freeze(true);
		var shared = trie.freeze(false);

		trie.put("a", "2");

		assertEquals("1", copied.longestPrefix("a").value());
		assertEquals("2", shared.longestPrefix("a").value());
	}

	@Test
	public void test_get() {
		var trie = sample();

		assertEquals("BAB", trie.get("bab"));
		assertEquals("D", trie.get("d"));
		// path exists, key does not
		assertNull(trie.get("abc"));
		assertNull(trie.get("zz"));
	}

	@Test
	public void test_longest_prefix() {
		var trie = sample();

		assertEquals(new Match<>("ABCDE", "abcde"), trie.longestPrefix("abcdefg"));
		assertEquals(new Match<>("AB", "ab"), trie.longestPrefix("abcd"));
		assertNull(trie.longestPrefix("bbc"));
	}

	@Test
	public void test_predict() {
		var trie = sample();

		var found = trie.predict("xxbabcde").map(p -> p.key() + "=" + p.value()).collect(Collectors.toList());

		assertEquals(List.of("bab=BAB", "ab=AB", "bc=BC", "d=D", "abcde=ABCDE"), found);

		var first = trie.predict("xxbabcde").findFirst().orElseThrow();
		assertEquals(new ValuePrediction<>(2, 5, "bab", "BAB"), first);
	}

	@Test
	public void test_replace_value() {
		var trie = new ValueTrie<String>();
		trie.put("a", "1");
		trie.put("b", "2");
		trie.put("a", "3");

		assertEquals(2, trie.size());
		assertEquals("3", trie.get("a"));
		assertEquals(new Match<>("3", "a"), trie.longestPrefix("ab"));
	}
}
