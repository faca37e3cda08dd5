package com.nc.trietree;

import static com.nc.trietree.TrieTreeTestSupport.ev;
import static com.nc.trietree.TrieTreeTestSupport.hit;
import static com.nc.trietree.TrieTreeTestSupport.p;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.junit.FixMethodOrder;
import org.junit.Test;
import org.junit.runners.MethodSorters;

@FixMethodOrder(MethodSorters.NAME_ASCENDING)
public class TrieTests {

	static List<ScanEvent> scan(Trie trie, String text) {
		var rv = new ArrayList<ScanEvent>();
		assertEquals(ScanOutcome.COMPLETED, trie.scan(text, rv::add));
		return rv;
	}

	@Test
	public void test_empty() {
		var trie = new Trie();

		assertEquals(Prefix.NONE, trie.longestPrefix("abc"));
		assertEquals(List.of(ev(0, 'a')), scan(trie, "a"));

		trie.freeze();
		assertEquals(List.of(), trie.predict("abc").toList());
	}

	@Test
	public void test_freeze_twice() {
		var trie = new Trie();
		trie.put("a");
		trie.freeze();

		try {
			trie.freeze();
			fail("second freeze succeeded");
		} catch (ImmutableTreeException expected) {
			// ok
		}
	}

	@Test
	public void test_lifecycle() {
		var trie = new Trie();
		assertEquals(1, trie.put("ab"));
		assertEquals(2, trie.put("b"));
		assertFalse(trie.isFrozen());

		assertEquals(List.of(ev(0, 'a'), ev(1, 'b', hit(1, 2), hit(2, 1))), scan(trie, "ab"));

		trie.freeze();
		assertTrue(trie.isFrozen());

		assertEquals(List.of(ev(0, 'a'), ev(1, 'b', hit(1, 2), hit(2, 1))), scan(trie, "ab"));
		assertEquals(new Prefix("ab", 1), trie.longestPrefix("abc"));
		assertEquals(List.of(p(0, 1, 2), p(1, 3, 1), p(2, 3, 2)), trie.predict("babx").toList());
	}

	@Test
	public void test_links_refreshed_after_put() {
		var trie = new Trie();
		trie.put("ab");
		assertEquals(List.of(ev(0, 'a'), ev(1, 'b', hit(1, 2))), scan(trie, "ab"));

		trie.put("b");
		assertEquals(List.of(ev(0, 'a'), ev(1, 'b', hit(1, 2), hit(2, 1))), scan(trie, "ab"));
	}

	@Test
	public void test_marshal_before_freeze() throws IOException {
		var trie = new Trie();
		trie.put("ab");

		var bos = new ByteArrayOutputStream();
		trie.marshal(bos);

		// still modifiable
		assertFalse(trie.isFrozen());
		assertEquals(2, trie.put("cd"));

		var read = Trie.unmarshal(new ByteArrayInputStream(bos.toByteArray()));
		assertTrue(read.isFrozen());
		assertEquals(new Prefix("ab", 1), read.longestPrefix("abcd"));
		assertEquals(Prefix.NONE, read.longestPrefix("cd"));
	}

	@Test
	public void test_marshal_round_trip() throws IOException {
		var trie = new Trie();
		for (var k : List.of("ab", "bc", "bab", "d", "abcde")) {
			trie.put(k);
		}
		trie.freeze();

		var bos = new ByteArrayOutputStream();
		trie.marshal(bos);
		var read = Trie.unmarshal(new ByteArrayInputStream(bos.toByteArray()));

		assertEquals(scan(trie, "xxbabcde"), scan(read, "xxbabcde"));
		assertEquals(trie.predict("xxbabcde").toList(), read.predict("xxbabcde").toList());

		try {
			read.put("e");
			fail("unmarshaled trie accepted a key");
		} catch (ImmutableTreeException expected) {
			// ok
		}
	}

	@Test
	public void test_put_after_freeze() {
		var trie = new Trie();
		trie.put("a");
		trie.freeze();

		try {
			trie.put("b");
			fail("frozen trie accepted a key");
		} catch (ImmutableTreeException expected) {
			assertTrue(expected instanceof IllegalStateException);
		}

		assertEquals(Prefix.NONE, trie.longestPrefix("b"));
	}

	@Test
	public void test_scan_cancel() {
		var trie = new Trie();
		trie.put("a");
		var seen = new ArrayList<ScanEvent>();

		assertEquals(ScanOutcome.CANCELLED, trie.scan("aaa", seen::add, () -> true));
		assertEquals(1, seen.size());
	}
}
