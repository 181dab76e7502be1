/**
 * Forward-only record cursor
 */
package tabula.csv;

/**
 * A finite, lazily evaluated, non-restartable sequence.
 * Every stage of the record pipeline (raw rows, normalization, filtering,
 * windowing, projection) is a cursor pulling from the stage before it.
 *
 * <pre>{@code
 * try (Cursor<Record> cursor = reader.records()) {
 *     for (Record r; (r = cursor.next()) != null;) {
 *         System.out.println(r.get("name"));
 *     }
 * }
 * }</pre>
 *
 * @param <T> the element type
 */
public interface Cursor<T> extends AutoCloseable {
	/**
	 * Advances the cursor and returns the next element.
	 *
	 * @return the next element, or null once the cursor is exhausted
	 */
	T next();

	/**
	 * Releases the resources held by this cursor and the cursors it pulls from.
	 */
	@Override
	default void close() {
	}

	/**
	 * Cursor over an in-memory list
	 */
	static <T> Cursor<T> of(final java.util.List<T> list) {
		final java.util.Iterator<T> it = list.iterator();
		return () -> it.hasNext() ? it.next() : null;
	}

	/**
	 * Cursor that yields nothing
	 */
	static <T> Cursor<T> empty() {
		return () -> null;
	}
}
