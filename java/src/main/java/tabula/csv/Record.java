/**
 * Record.java
 */
package tabula.csv;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalized CSV record.
 *
 * <p>A record is keyed by the names of its header, in header order, or by
 * ascending position when the header is empty. When a header is present the
 * key set always equals the header: {@link #reshape(String[], int, String)} pads
 * short rows and truncates long ones before a record is built.</p>
 *
 * <p>Values are text or {@code null}; no typing takes place.</p>
 */
public final class Record {

	/** Record returned when a lookup runs past the end of a result */
	public static final Record EMPTY = new Record(Header.EMPTY, new String[0], -1L);

	private final Header header;
	private final String[] values;
	private final long id;

	Record(final Header header, final String[] values, final long id) {
		this.header = header;
		this.values = values;
		this.id = id;
	}

	/**
	 * Creates a record keyed by the given header.
	 * Values are padded with {@code null} or truncated to the header width.
	 *
	 * @param header record keys, empty for a positional record
	 * @param values field values in key order
	 * @return new record
	 */
	public static Record of(final Header header, final String... values) {
		final String[] a = values == null ? new String[0] : values.clone();
		if (header.isEmpty())
			return new Record(header, a, -1L);
		return new Record(header, reshape(a, header.size(), null), -1L);
	}

	/**
	 * Creates a positional record
	 */
	public static Record positional(final String... values) {
		return of(Header.EMPTY, values);
	}

	/**
	 * Pads or truncates a row to the given width.
	 *
	 * @param row     raw fields
	 * @param width   target width
	 * @param padding value appended to short rows
	 * @return the row itself when it already has the width, otherwise a new array
	 */
	static String[] reshape(final String[] row, final int width, final String padding) {
		if (row.length == width)
			return row;
		final String[] a = Arrays.copyOf(row, width);
		for (int i = row.length; i < width; i++)
			a[i] = padding;
		return a;
	}

	/**
	 * Re-keys this record against another header, positionally.
	 *
	 * @param h       new keys
	 * @param padding value for keys past the end of this record
	 * @return new record sharing this record's id
	 */
	Record rekey(final Header h, final String padding) {
		if (h.isEmpty())
			return new Record(h, values, id);
		return new Record(h, reshape(values, h.size(), padding), id);
	}

	/**
	 * Position of the source row this record was read from, -1 if not read from a source
	 */
	public long id() {
		return id;
	}

	public Header header() {
		return header;
	}

	/**
	 * @return true when addressed by name, false when addressed by position
	 */
	public boolean isKeyed() {
		return !header.isEmpty();
	}

	public int size() {
		return values.length;
	}

	public boolean isEmpty() {
		return values.length == 0;
	}

	/**
	 * Value at an index into {@link #values()}, for keyed and positional records
	 * alike. This is index access, not key lookup: on a keyed record a position is
	 * not a key, see {@link #get(Key)}.
	 *
	 * @param i zero-based index
	 * @return the value, or null if out of range
	 */
	public String get(final int i) {
		return (i < 0 || i >= values.length) ? null : values[i];
	}

	/**
	 * Value of a named field
	 *
	 * @param name header name
	 * @return the value, or null if the record has no such key
	 */
	public String get(final String name) {
		final int i = header.indexOf(name);
		return i < 0 ? null : values[i];
	}

	/**
	 * Value of a key of this record's key set. A keyed record has name keys
	 * only, so a position key yields null on it, the way {@link #contains(Key)}
	 * is false for it.
	 *
	 * @return the value, or null if the key does not belong to the record
	 */
	public String get(final Key key) {
		if (key.isName())
			return get(key.name());
		return isKeyed() ? null : get(key.position());
	}

	/**
	 * Tells whether the key belongs to this record's key set
	 */
	public boolean contains(final Key key) {
		if (key.isName())
			return header.contains(key.name());
		return !isKeyed() && key.position() < values.length;
	}

	public boolean contains(final String name) {
		return header.contains(name);
	}

	public List<Key> keys() {
		final List<Key> keys = new ArrayList<>(values.length);
		for (int i = 0; i < values.length; i++)
			keys.add(isKeyed() ? Key.name(header.name(i)) : Key.position(i));
		return keys;
	}

	public List<String> values() {
		return Collections.unmodifiableList(Arrays.asList(values));
	}

	/**
	 * Field map in key order; positional keys are rendered as decimal strings
	 */
	public Map<String, String> map() {
		final Map<String, String> m = new LinkedHashMap<>();
		for (int i = 0; i < values.length; i++)
			m.put(isKeyed() ? header.name(i) : Integer.toString(i), values[i]);
		return m;
	}

	/**
	 * Plain structure for export: a map for keyed records, a list for positional ones
	 */
	public Object plain() {
		return isKeyed() ? map() : new ArrayList<>(Arrays.asList(values));
	}

	String[] array() {
		return values;
	}

	@Override
	public boolean equals(final Object o) {
		if (!(o instanceof Record))
			return false;
		final Record r = (Record) o;
		return header.equals(r.header) && Arrays.equals(values, r.values);
	}

	@Override
	public int hashCode() {
		return 31 * header.hashCode() + Arrays.hashCode(values);
	}

	@Override
	public String toString() {
		return isKeyed() ? map().toString() : Arrays.toString(values);
	}
}
