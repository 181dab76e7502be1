/**
 * Header.java
 */
package tabula.csv;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered list of field names framing every record of a result.
 * An empty header means records are addressed by position.
 *
 * <p>Instances are immutable. A header read from a document is not validated on
 * construction, {@link #isFlatUnique()} tells whether it may be used as record keys.</p>
 */
public final class Header {

	public static final Header EMPTY = new Header(new String[0]);

	private final String[] names;
	private final Map<String, Integer> positions;

	private Header(final String[] names) {
		this.names = names;
		final Map<String, Integer> m = new HashMap<>(names.length * 2);
		for (int i = names.length - 1; i >= 0; i--) {
			if (names[i] != null)
				m.put(names[i], i);
		}
		this.positions = m;
	}

	/**
	 * Header from raw names, no validation
	 */
	public static Header of(final String... names) {
		if (names == null || names.length == 0)
			return EMPTY;
		return new Header(names.clone());
	}

	/**
	 * Header from raw names, no validation
	 */
	public static Header of(final List<String> names) {
		if (names == null || names.isEmpty())
			return EMPTY;
		return new Header(names.toArray(new String[0]));
	}

	/**
	 * Header whose names must be unique and non-empty
	 *
	 * @param names header names
	 * @return the header
	 * @throws CsvException INVALID_HEADER if the names cannot be used as record keys
	 */
	public static Header checked(final List<String> names) {
		if (names == null)
			throw new CsvException(ErrorCode.INVALID_HEADER, "null");
		final Header h = of(names);
		if (!h.isFlatUnique())
			throw new CsvException(ErrorCode.INVALID_HEADER, (Object) names);
		return h;
	}

	/**
	 * Empty, or made of unique non-empty names
	 */
	public boolean isFlatUnique() {
		for (final String name : names) {
			if (name == null || name.isEmpty())
				return false;
		}
		return positions.size() == names.length;
	}

	public boolean isEmpty() {
		return names.length == 0;
	}

	public int size() {
		return names.length;
	}

	public String name(final int i) {
		return names[i];
	}

	/**
	 * @return position of the name, or -1
	 */
	public int indexOf(final String name) {
		final Integer i = name == null ? null : positions.get(name);
		return i == null ? -1 : i;
	}

	public boolean contains(final String name) {
		return indexOf(name) > -1;
	}

	public List<String> names() {
		return Collections.unmodifiableList(Arrays.asList(names));
	}

	String[] array() {
		return names;
	}

	@Override
	public boolean equals(final Object o) {
		return (o instanceof Header) && Arrays.equals(names, ((Header) o).names);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(names);
	}

	@Override
	public String toString() {
		return Arrays.toString(names);
	}
}
