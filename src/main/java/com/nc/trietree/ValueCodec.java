package com.nc.trietree;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes and reads the value list of a {@link FrozenValueTrie}, positioned right after the tree
 * image in the same stream.
 *
 * @param <V>
 *            - value type
 */
public interface ValueCodec<V> {

	/**
	 * Default codec: Java object serialization of the value list. Values must be
	 * {@link java.io.Serializable}.
	 */
	@SuppressWarnings("unchecked")
	static <V> ValueCodec<V> serialization() {
		return (ValueCodec<V>) Serialization.INSTANCE;
	}

	/**
	 * @param count
	 *            - number of values expected, one per edge id
	 */
	List<V> read(InputStream in, int count) throws IOException;

	void write(OutputStream out, List<V> values) throws IOException;

	final class Serialization implements ValueCodec<Object> {

		static final Serialization INSTANCE = new Serialization();

		private Serialization() {
		}

		@Override
		public List<Object> read(InputStream in, int count) throws IOException {
			// not closed: the caller owns in
			var ois = new ObjectInputStream(in);
			try {
				var o = ois.readObject();
				if (!(o instanceof List<?> l)) {
					throw new IOException("Expected a value list, got " + (o == null ? "null" : o.getClass().getName()));
				}
				return new ArrayList<Object>(l);
			} catch (ClassNotFoundException e) {
				throw new IOException("Unknown value class", e);
			}
		}

		@Override
		public void write(OutputStream out, List<Object> values) throws IOException {
			// closing oos must leave out open
			var oos = new ObjectOutputStream(new FilterOutputStream(out) {
				@Override
				public void close() throws IOException {
					flush();
				}

				@Override
				public void write(byte[] b, int off, int len) throws IOException {
					out.write(b, off, len);
				}
			});
			try (oos) {
				oos.writeObject(new ArrayList<>(values));
			}
		}
	}
}
