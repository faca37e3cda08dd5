package com.nc.trietree;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Pull-based iterator: {@link #advance()} either fills {@link #curr} or leaves it null, which
 * marks the end of the sequence. Once {@link #close()} is called no further values are produced.
 */
abstract class Itr<T> implements Iterator<T>, AutoCloseable {

	T curr;

	boolean closed;

	abstract void advance();

	/**
	 * Releases the state held by the producer. Subclasses must call super.
	 */
	@Override
	public void close() {
		closed = true;
		curr = null;
	}

	@Override
	public final boolean hasNext() {
		if (curr == null && !closed) {
			advance();
		}
		return curr != null;
	}

	@Override
	public final T next() {
		if (!hasNext()) {
			throw new NoSuchElementException();
		}
		var rv = curr;
		curr = null;

		return rv;
	}

	final Stream<T> stream() {
		return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, Spliterator.NONNULL | Spliterator.ORDERED), false).onClose(this::close);
	}
}
