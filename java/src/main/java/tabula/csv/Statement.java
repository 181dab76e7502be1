package tabula.csv;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Immutable query over the records of a {@link CsvReader}.
 *
 * <p>Every setter returns a new statement and leaves the receiver unchanged;
 * a setter that does not change anything returns the receiver itself.</p>
 *
 * <pre>
 * RecordSet rs = Statement.create()
 *     .where(r -&gt; !"2".equals(r.get(1)))
 *     .orderBy(Filter.column("name", Filter.ASCENDING))
 *     .offset(10)
 *     .limit(20)
 *     .process(reader);
 * </pre>
 */
public final class Statement {
    private static final Statement EMPTY = new Statement(List.of(), List.of(), 0, -1, null, Collections.emptyMap());

    private final List<Predicate<Record>> where;
    private final List<Comparator<Record>> orderBy;
    private final int offset;
    private final int limit;
    private final Header header;
    private final Map<String, String> columns;

    private Statement(final List<Predicate<Record>> where, final List<Comparator<Record>> orderBy, final int offset,
            final int limit, final Header header, final Map<String, String> columns) {
        this.where = where;
        this.orderBy = orderBy;
        this.offset = offset;
        this.limit = limit;
        this.header = header;
        this.columns = columns;
    }

    public static Statement create() {
        return EMPTY;
    }

    /**
     * Adds a filter. All filters must accept a record for it to be kept.
     */
    public Statement where(final Predicate<Record> predicate) {
        if (predicate == null)
            throw new CsvException(ErrorCode.INVALID_ARGUMENT, "predicate is null");
        return new Statement(append(where, predicate), orderBy, offset, limit, header, columns);
    }

    /**
     * Adds a comparator, consulted when the previous ones find two records equal
     */
    public Statement orderBy(final Comparator<Record> comparator) {
        if (comparator == null)
            throw new CsvException(ErrorCode.INVALID_ARGUMENT, "comparator is null");
        return new Statement(where, append(orderBy, comparator), offset, limit, header, columns);
    }

    /**
     * @param offset number of records to skip, 0 or more
     * @throws CsvException INVALID_OFFSET if negative
     */
    public Statement offset(final int offset) {
        if (offset < 0)
            throw new CsvException(ErrorCode.INVALID_OFFSET, (Object) offset);
        if (offset == this.offset)
            return this;
        return new Statement(where, orderBy, offset, limit, header, columns);
    }

    /**
     * @param limit maximum number of records, -1 for all
     * @throws CsvException INVALID_LIMIT if lower than -1
     */
    public Statement limit(final int limit) {
        if (limit < -1)
            throw new CsvException(ErrorCode.INVALID_LIMIT, (Object) limit);
        if (limit == this.limit)
            return this;
        return new Statement(where, orderBy, offset, limit, header, columns);
    }

    public Statement header(final String... names) {
        return header(names == null ? null : Arrays.asList(names));
    }

    /**
     * Re-keys every record with the given names instead of the source header.
     * The override applies before filters and comparators see the records. An
     * empty list removes the override.
     *
     * @throws CsvException INVALID_HEADER if a name is null, empty or repeated
     */
    public Statement header(final List<String> names) {
        final Header h = Header.checked(names);
        final Header override = h.isEmpty() ? null : h;
        if (override == null ? header == null : override.equals(header))
            return this;
        return new Statement(where, orderBy, offset, limit, override, columns);
    }

    /**
     * Selects columns, keeping their names
     */
    public Statement columns(final String... names) {
        final Map<String, String> m = new LinkedHashMap<>();
        for (final String name : names) {
            if (name == null || name.isEmpty())
                throw new CsvException(ErrorCode.INVALID_ARGUMENT, "column name must be a non-empty string");
            if (m.put(name, name) != null)
                throw new CsvException(ErrorCode.INVALID_ARGUMENT, "duplicate column " + name);
        }
        return columns(m);
    }

    /**
     * Selects and renames columns.
     *
     * @param aliases source column to result name, in result order. Without a
     *                header the source columns are positions ("0", "1", ...)
     * @throws CsvException INVALID_ARGUMENT for empty names or repeated aliases
     */
    public Statement columns(final Map<String, String> aliases) {
        final Map<String, String> m = new LinkedHashMap<>();
        final Set<String> seen = new HashSet<>();
        for (final Map.Entry<String, String> e : aliases.entrySet()) {
            final String source = e.getKey();
            final String alias = e.getValue();
            if (source == null || source.isEmpty() || alias == null || alias.isEmpty())
                throw new CsvException(ErrorCode.INVALID_ARGUMENT, "column name must be a non-empty string");
            if (!seen.add(alias))
                throw new CsvException(ErrorCode.INVALID_ARGUMENT, "duplicate column alias " + alias);
            m.put(source, alias);
        }
        if (new ArrayList<>(m.entrySet()).equals(new ArrayList<>(columns.entrySet())))
            return this;
        return new Statement(where, orderBy, offset, limit, header, Collections.unmodifiableMap(m));
    }

    /**
     * Runs this statement over the reader's records
     *
     * @return single-pass result
     */
    public RecordSet process(final CsvReader reader) {
        return Pipeline.compile(this, reader);
    }

    public List<Predicate<Record>> where() {
        return where;
    }

    public List<Comparator<Record>> orderBy() {
        return orderBy;
    }

    public int offset() {
        return offset;
    }

    public int limit() {
        return limit;
    }

    /**
     * Header override, null if none
     */
    public Header header() {
        return header;
    }

    public Map<String, String> columns() {
        return columns;
    }

    private static <T> List<T> append(final List<T> list, final T v) {
        final List<T> a = new ArrayList<>(list.size() + 1);
        a.addAll(list);
        a.add(v);
        return Collections.unmodifiableList(a);
    }

    @Override
    public String toString() {
        return String.format("Statement{where=%d, orderBy=%d, offset=%d, limit=%d, header=%s, columns=%s}", //
                where.size(), orderBy.size(), offset, limit, header, columns);
    }
}
