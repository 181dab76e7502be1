/**
 * RecordSet.java
 */
package tabula.csv;

import java.io.StringWriter;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.Function;
import java.util.function.Predicate;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;

import org.w3c.dom.DOMException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Result of a processed {@link Statement}.
 *
 * <p>A record set reads its records once. Every consuming method
 * ({@link #all()}, {@link #one(int)}, {@link #column(Object)}, iteration,
 * conversions) continues from where the previous one stopped; once the records
 * are exhausted they all return empty results. Run the statement again for a
 * new pass.</p>
 */
public final class RecordSet implements Iterable<Record>, AutoCloseable {

    /** Consumption state of the underlying cursor */
    public enum State {
        FRESH, DRAINING, EXHAUSTED
    }

    private final Cursor<Record> cursor;
    private final Header header;
    private State state = State.FRESH;
    private String inputEncoding = "UTF-8";
    private Charset charset = StandardCharsets.UTF_8;
    private Transcoder transcoder = Transcoder.DEFAULT;
    private boolean includeHeader = true;

    RecordSet(final Cursor<Record> cursor, final Header header) {
        this.cursor = cursor;
        this.header = header;
    }

    /**
     * Header framing the records, empty when records are positional
     */
    public Header header() {
        return header;
    }

    public State state() {
        return state;
    }

    /**
     * Charset the field text was written in, used by the conversion methods
     *
     * @param label charset name, e.g. "iso-8859-15" or "windows_1252"
     * @throws CsvException INVALID_CHARSET if the label is empty or unknown
     */
    public RecordSet inputEncoding(final String label) {
        final String s = Transcoder.label(label);
        this.charset = s.contains("UTF-8") ? StandardCharsets.UTF_8 : Transcoder.charset(s);
        this.inputEncoding = s;
        return this;
    }

    public String inputEncoding() {
        return inputEncoding;
    }

    public RecordSet transcoder(final Transcoder transcoder) {
        this.transcoder = transcoder;
        return this;
    }

    /**
     * Whether {@link #toXml()} and {@link #toHtml()} emit the header as a first row, true by default
     */
    public RecordSet includeHeader(final boolean includeHeader) {
        this.includeHeader = includeHeader;
        return this;
    }

    private Record pull() {
        if (state == State.EXHAUSTED)
            return null;
        state = State.DRAINING;
        final Record r;
        try {
            r = cursor.next();
        } catch (RuntimeException ex) {
            close();
            throw ex;
        }
        if (r == null)
            close();
        return r;
    }

    private <T> Iterator<T> iterate(final Predicate<Record> filter, final Function<Record, T> map) {
        return new Iterator<T>() {
            private Record next;

            @Override
            public boolean hasNext() {
                while (next == null) {
                    final Record r = pull();
                    if (r == null)
                        return false;
                    if (filter.test(r))
                        next = r;
                }
                return true;
            }

            @Override
            public T next() {
                if (!hasNext())
                    throw new NoSuchElementException();
                final Record r = next;
                next = null;
                return map.apply(r);
            }
        };
    }

    @Override
    public Iterator<Record> iterator() {
        return iterate(r -> true, r -> r);
    }

    /**
     * Reads all remaining records
     */
    public List<Record> all() {
        final List<Record> list = new ArrayList<>();
        Record r;
        while ((r = pull()) != null)
            list.add(r);
        return list;
    }

    public Record one() {
        return one(0);
    }

    /**
     * Reads up to the offset-th remaining record
     *
     * @param offset zero-based position among the remaining records
     * @return the record, {@link Record#EMPTY} if there are fewer records
     * @throws CsvException INVALID_OFFSET if negative
     */
    public Record one(final int offset) {
        if (offset < 0)
            throw new CsvException(ErrorCode.INVALID_OFFSET, (Object) offset);
        Record r;
        for (int i = 0; (r = pull()) != null; i++) {
            if (i == offset)
                return r;
        }
        return Record.EMPTY;
    }

    public Iterator<String> column() {
        return column(0);
    }

    /**
     * Values of one column, skipping records that lack it
     *
     * @param column header name, or position as an Integer or a numeric string
     * @throws CsvException INVALID_COLUMN if the column cannot be resolved
     */
    public Iterator<String> column(final Object column) {
        final Key key = fieldIndex(column);
        return iterate(r -> r.contains(key), r -> r.get(key));
    }

    public Iterator<Map.Entry<String, String>> pairs() {
        return pairs(0, 1);
    }

    /**
     * Key/value pairs built from two columns. Records lacking the key column are
     * skipped, a missing value column yields null.
     */
    public Iterator<Map.Entry<String, String>> pairs(final Object keyColumn, final Object valueColumn) {
        final Key k = fieldIndex(keyColumn);
        final Key v = fieldIndex(valueColumn);
        return iterate(r -> r.contains(k),
                r -> new AbstractMap.SimpleImmutableEntry<>(r.get(k), r.contains(v) ? r.get(v) : null));
    }

    /**
     * Resolves a caller supplied column.
     * A header name or a non-numeric string is taken as a name; otherwise the
     * value must be a non-negative position, translated to the header name at
     * that position when there is a header.
     */
    Key fieldIndex(final Object field) {
        if (field instanceof String) {
            final String s = (String) field;
            if (header.contains(s) || !isInteger(s))
                return Key.name(s);
            return position(Integer.parseInt(s), field);
        }
        if (field instanceof Integer || field instanceof Long || field instanceof Short || field instanceof Byte)
            return position(((Number) field).longValue(), field);
        throw new CsvException(ErrorCode.INVALID_COLUMN, field);
    }

    private Key position(final long i, final Object field) {
        if (i < 0 || i > Integer.MAX_VALUE)
            throw new CsvException(ErrorCode.INVALID_COLUMN, field);
        if (header.isEmpty())
            return Key.position((int) i);
        if (i < header.size())
            return Key.name(header.name((int) i));
        throw new CsvException(ErrorCode.INVALID_COLUMN, field);
    }

    private static boolean isInteger(final String s) {
        if (s.isEmpty() || s.length() > 10)
            return false;
        final int start = s.charAt(0) == '-' ? 1 : 0;
        if (start == s.length())
            return false;
        for (int i = start; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i)))
                return false;
        }
        return true;
    }

    /**
     * Number of remaining records; reads them all
     */
    public long count() {
        long n = 0;
        while (pull() != null)
            n++;
        return n;
    }

    private String convert(final String s) {
        return s == null || charset == StandardCharsets.UTF_8 ? s : transcoder.convert(s, charset);
    }

    private Object convert(final Record r) {
        if (r.isKeyed()) {
            final Map<String, String> m = new LinkedHashMap<>();
            for (int i = 0; i < r.size(); i++)
                m.put(convert(r.header().name(i)), convert(r.get(i)));
            return m;
        }
        final List<String> list = new ArrayList<>(r.size());
        for (int i = 0; i < r.size(); i++)
            list.add(convert(r.get(i)));
        return list;
    }

    /**
     * Remaining records as plain structures with text converted from the input
     * encoding: a map per keyed record, a list per positional record
     */
    public List<Object> toMapping() {
        final List<Object> list = new ArrayList<>();
        Record r;
        while ((r = pull()) != null)
            list.add(convert(r));
        return list;
    }

    /**
     * {@link #toMapping()} as JSON text, nulls included
     */
    public String toJson() {
        final Gson g = new GsonBuilder() //
                .serializeNulls() //
                .disableHtmlEscaping() //
                .create();
        return g.toJson(toMapping());
    }

    public Document toXml() {
        return toXml("csv", "row", "cell");
    }

    /**
     * Builds a document with one row element per remaining record
     *
     * @param rootName root element name
     * @param rowName  row element name
     * @param cellName cell element name
     * @throws CsvException INVALID_ARGUMENT for an invalid element name
     */
    public Document toXml(final String rootName, final String rowName, final String cellName) {
        final Document doc;
        try {
            doc = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
        } catch (ParserConfigurationException ex) {
            throw new CsvException(ErrorCode.CONVERSION_FAILED, "document builder", ex);
        }
        try {
            final Element root = doc.createElement(rootName);
            // validates the names before reading any record
            doc.createElement(rowName);
            doc.createElement(cellName);

            if (!header.isEmpty() && includeHeader)
                root.appendChild(row(doc, header.names(), rowName, cellName));
            Record r;
            while ((r = pull()) != null) {
                final List<String> values = new ArrayList<>(r.size());
                for (int i = 0; i < r.size(); i++)
                    values.add(convert(r.get(i)));
                root.appendChild(row(doc, values, rowName, cellName));
            }
            doc.appendChild(root);
            return doc;
        } catch (DOMException ex) {
            throw new CsvException(ErrorCode.INVALID_ARGUMENT, ex.getMessage(), ex);
        }
    }

    private static Element row(final Document doc, final List<String> values, final String rowName, final String cellName) {
        final Element row = doc.createElement(rowName);
        for (final String value : values) {
            final Element cell = doc.createElement(cellName);
            cell.appendChild(doc.createTextNode(value == null ? "" : value));
            row.appendChild(cell);
        }
        return row;
    }

    public String toHtml() {
        return toHtml("table-csv-data");
    }

    /**
     * Renders the remaining records as an HTML table fragment
     *
     * @param cssClass value of the table's class attribute
     */
    public String toHtml(final String cssClass) {
        final Document doc = toXml("table", "tr", "td");
        final Element table = doc.getDocumentElement();
        table.setAttribute("class", cssClass);
        try {
            final Transformer t = TransformerFactory.newInstance().newTransformer();
            t.setOutputProperty(OutputKeys.METHOD, "html");
            t.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            t.setOutputProperty(OutputKeys.INDENT, "no");
            t.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            final StringWriter w = new StringWriter();
            t.transform(new DOMSource(table), new StreamResult(w));
            return w.toString().trim();
        } catch (TransformerException ex) {
            throw new CsvException(ErrorCode.CONVERSION_FAILED, "html", ex);
        }
    }

    /**
     * Stops reading and releases the source
     */
    @Override
    public void close() {
        if (state == State.EXHAUSTED)
            return;
        state = State.EXHAUSTED;
        cursor.close();
    }

    @Override
    public String toString() {
        return "RecordSet{header=" + header + ", state=" + state + "}";
    }
}
