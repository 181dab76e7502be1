/**
 * CsvReader.java
 */
package tabula.csv;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads the records of a delimited document.
 *
 * <pre>
 * try (CsvReader reader = CsvReader.open(new File("users.csv")).headerOffset(0)) {
 *     for (Record r : reader) {
 *         System.out.println(r.get("name"));
 *     }
 * }
 * </pre>
 *
 * A reader is not safe for use by several threads.
 */
public final class CsvReader implements Iterable<Record>, AutoCloseable {
    private final RawSource source;
    private Logger logger;
    private HeaderResolver resolver;
    private Integer headerOffset = null;
    private String paddingValue = null;
    private long count = -1;
    // lazy results handed out by iterator(), fetchColumn() and fetchPairs()
    private final List<RecordSet> pending = new ArrayList<>();

    private CsvReader(final RawSource source, final Logger logger) {
        this.source = source;
        this.logger = logger;
        this.resolver = new HeaderResolver(source, logger);
    }

    public static CsvReader open(final RawSource source) {
        return new CsvReader(source, new Logger.NullLogger());
    }

    public static CsvReader open(final File file) throws IOException {
        return open(TextSource.open(file));
    }

    public static CsvReader fromString(final String text) {
        return open(TextSource.fromString(text));
    }

    public RawSource source() {
        return source;
    }

    public CsvReader logger(final Logger logger) {
        this.logger = logger != null ? logger : new Logger.NullLogger();
        this.resolver = new HeaderResolver(source, this.logger);
        if (source instanceof TextSource)
            ((TextSource) source).logger(this.logger);
        reset();
        return this;
    }

    Logger logger() {
        return logger;
    }

    /**
     * Sets the position of the header row; any cached header and count is dropped
     * when the position changes.
     *
     * @param offset zero-based row position, null for a document without header
     * @throws CsvException INVALID_HEADER_OFFSET if negative
     */
    public CsvReader headerOffset(final Integer offset) {
        if (offset != null && offset < 0)
            throw new CsvException(ErrorCode.INVALID_HEADER_OFFSET, (Object) offset);
        if (offset == null ? headerOffset != null : !offset.equals(headerOffset)) {
            logger.log("header offset %s -> %s", headerOffset, offset);
            headerOffset = offset;
            reset();
        }
        return this;
    }

    public Integer headerOffset() {
        return headerOffset;
    }

    /**
     * Value appended to records shorter than the header, null by default
     */
    public CsvReader paddingValue(final String paddingValue) {
        this.paddingValue = paddingValue;
        return this;
    }

    public String paddingValue() {
        return paddingValue;
    }

    private void reset() {
        resolver.invalidate();
        count = -1;
    }

    /**
     * @return the header, empty when no header offset is set
     * @throws CsvException HEADER_NOT_FOUND if the header row is missing or empty
     */
    public Header header() {
        try {
            return resolver.resolve(headerOffset);
        } catch (IOException ex) {
            throw new CsvException(ErrorCode.SOURCE_READ_ERROR, source.toString(), ex);
        }
    }

    /**
     * Tells whether the header can key records: empty, or unique non-empty names
     */
    public boolean supportsHeaderAsRecordKeys() {
        return header().isFlatUnique();
    }

    /**
     * Opens a new cursor over the normalized records
     *
     * @throws CsvException HEADER_NOT_UNIQUE if the header cannot key records
     */
    public Cursor<Record> records() {
        final Header header = header();
        if (!header.isFlatUnique())
            throw new CsvException(ErrorCode.HEADER_NOT_UNIQUE, header);
        try {
            return new RecordNormalizer(source.rows(), header, headerOffset, source.bom(), source.enclosure(), paddingValue);
        } catch (IOException ex) {
            throw new CsvException(ErrorCode.SOURCE_READ_ERROR, source.toString(), ex);
        }
    }

    /**
     * Iterates the records; a loop left early keeps its cursor open until the
     * reader is closed
     */
    @Override
    public Iterator<Record> iterator() {
        return lazy().iterator();
    }

    private RecordSet all() {
        return new RecordSet(records(), header());
    }

    private RecordSet lazy() {
        pending.removeIf(rs -> rs.state() == RecordSet.State.EXHAUSTED);
        final RecordSet rs = all();
        pending.add(rs);
        return rs;
    }

    /**
     * Number of records, cached until the header offset changes
     */
    public long count() {
        if (count < 0) {
            try (RecordSet rs = all()) {
                count = rs.count();
            }
        }
        return count;
    }

    public List<Record> fetchAll() {
        try (RecordSet rs = all()) {
            return rs.all();
        }
    }

    public Record fetchOne(final int offset) {
        try (RecordSet rs = all()) {
            return rs.one(offset);
        }
    }

    /**
     * Lazy column values; the cursor is released once the values are exhausted
     * or the reader is closed
     */
    public Iterator<String> fetchColumn(final Object column) {
        final RecordSet rs = lazy();
        try {
            return rs.column(column);
        } catch (CsvException ex) {
            rs.close();
            throw ex;
        }
    }

    public Iterator<Map.Entry<String, String>> fetchPairs(final Object keyColumn, final Object valueColumn) {
        final RecordSet rs = lazy();
        try {
            return rs.pairs(keyColumn, valueColumn);
        } catch (CsvException ex) {
            rs.close();
            throw ex;
        }
    }

    /**
     * Candidate delimiters ranked by the number of cells they produce in the first rows
     *
     * @throws CsvException INVALID_ARGUMENT if the source is not a text source
     */
    public Map<Character, Integer> delimiterOccurrences(final List<Character> delimiters, final int rows) throws IOException {
        if (!(source instanceof TextSource))
            throw new CsvException(ErrorCode.INVALID_ARGUMENT, "delimiter detection needs a text source");
        return ((TextSource) source).delimiterOccurrences(delimiters, rows);
    }

    /**
     * Closes the cursors of iterations and lazy fetches left unfinished, then the source
     */
    @Override
    public void close() throws IOException {
        for (final RecordSet rs : pending)
            rs.close();
        pending.clear();
        source.close();
    }

    @Override
    public String toString() {
        return "CsvReader{" + source + ", headerOffset=" + headerOffset + "}";
    }
}
