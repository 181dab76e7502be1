package tabula.csv;

/**
 * Record key: a header name or a zero-based position.
 * Resolved once against the effective header when a query is built,
 * see {@link RecordSet#column(Object)}.
 */
public final class Key {
	private final String name;
	private final int position;

	private Key(final String name, final int position) {
		this.name = name;
		this.position = position;
	}

	public static Key name(final String name) {
		if (name == null)
			throw new CsvException(ErrorCode.INVALID_COLUMN, "null");
		return new Key(name, -1);
	}

	public static Key position(final int position) {
		if (position < 0)
			throw new CsvException(ErrorCode.INVALID_COLUMN, (Object) position);
		return new Key(null, position);
	}

	public boolean isName() {
		return name != null;
	}

	public String name() {
		return name;
	}

	public int position() {
		return position;
	}

	@Override
	public boolean equals(final Object o) {
		if (!(o instanceof Key))
			return false;
		final Key k = (Key) o;
		return position == k.position && (name == null ? k.name == null : name.equals(k.name));
	}

	@Override
	public int hashCode() {
		return name != null ? name.hashCode() : position;
	}

	@Override
	public String toString() {
		return name != null ? name : Integer.toString(position);
	}
}
