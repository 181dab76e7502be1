/**
 * Delimited text source
 *
 * Reads CSV/TSV text from files (plain, gzip, zip), strings or byte arrays and
 * delivers it as raw rows.
 */
package tabula.csv;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Raw source over delimited text.
 *
 * Supports:
 * - CSV and TSV presets with customizable delimiter, enclosure, escape and null token
 * - Quoted fields spanning several physical lines
 * - Compressed files (gzip, zip)
 * - Byte order mark detection; the detected mark selects the decoding charset
 */
public final class TextSource implements RawSource {

    static final int READ_BUFSZ = Integer.parseInt(System.getProperty("TABULA_READ_BUFSZ", String.valueOf(1 << 16)));
    static final int GZIP_BUFSZ = 8192;

    /**
     * Format configuration for delimited text
     *
     * Defines the delimiter, enclosure, escape character and null token.
     */
    public static final class Format {
        private String NULL = null;
        private char delimiter = ',';
        private char quote = '"';
        private char escape = 0;
        private String name = "";

        public static final Format CSV = new Format() //
                .setDelimiter(',') //
                .setQuote('"') //
                .setName("CSV");

        public static final Format TSV = new Format() //
                .setDelimiter('\t') //
                .setQuote((char) 0) //
                .setEscape('\\') //
                .setNull("\\N") //
                .setName("TSV");

        public Format copy() {
            return new Format() //
                    .setDelimiter(delimiter) //
                    .setQuote(quote) //
                    .setEscape(escape) //
                    .setNull(NULL) //
                    .setName(name);
        }

        public Format setName(final String name) {
            this.name = name;
            return this;
        }

        /**
         * Set the unquoted token read as {@code null}, or null to read every field as text
         */
        public Format setNull(final String NULL) {
            this.NULL = NULL;
            return this;
        }

        public Format setDelimiter(final char delimiter) {
            this.delimiter = delimiter;
            return this;
        }

        /**
         * Set the enclosure character, 0 to disable quoting
         */
        public Format setQuote(final char quote) {
            this.quote = quote;
            return this;
        }

        /**
         * Set the escape character, 0 to disable escapes. Recognized sequences are
         * escape followed by the delimiter, the escape itself, n, r or t.
         */
        public Format setEscape(final char escape) {
            this.escape = escape;
            return this;
        }

        String Null() {
            return NULL;
        }

        char delimiter() {
            return delimiter;
        }

        char quote() {
            return quote;
        }

        char escape() {
            return escape;
        }

        @Override
        public String toString() {
            return (name != null && !"".equals(name)) ? name : super.toString();
        }
    }

    /**
     * Splits text lines into fields
     */
    static final class RowParser {
        private final String NULL;
        private final char DELIM;
        private final char QUOTE;
        private final char ESCAPE;

        RowParser(final Format format) {
            this.NULL = format.Null();
            this.DELIM = format.delimiter();
            this.QUOTE = format.quote();
            this.ESCAPE = format.escape();
        }

        String[] split(final CharSequence raw) {
            final ArrayList<String> array = new ArrayList<>();
            final int L = raw.length();
            final char[] s = new char[L + 1];
            int n = 0;
            int qoute = 0;
            int q = 0;

            for (int i = 0; i < L; i++) {
                final char ch = raw.charAt(i);
                final char next = ((i + 1) < L) ? raw.charAt(i + 1) : '\0';

                if (qoute == 0 && (ch == '\n' || ch == '\r')) {
                    break; // trailing line break
                }

                if (qoute > 0 && QUOTE == ch && QUOTE == next) {
                    s[n++] = ch;
                    i++;
                } else if (qoute > 0 && QUOTE == ch) {
                    qoute = 0;
                } else if (QUOTE != 0 && QUOTE == ch) {
                    qoute = 1;
                    q = 1;
                } else if (qoute > 0) {
                    s[n++] = ch;
                } else if (ESCAPE != 0 && ESCAPE == ch) {
                    if (DELIM == next) {
                        s[n++] = DELIM;
                        i++;
                    } else if (ESCAPE == next) {
                        s[n++] = ESCAPE;
                        i++;
                    } else if ('n' == next) {
                        s[n++] = '\n';
                        i++;
                    } else if ('r' == next) {
                        s[n++] = '\r';
                        i++;
                    } else if ('t' == next) {
                        s[n++] = '\t';
                        i++;
                    } else {
                        // unrecognized escape, keep it literal
                        s[n++] = ch;
                    }
                } else if (DELIM == ch) {
                    array.add(field(s, n, q));
                    n = 0;
                    q = 0;
                } else {
                    s[n++] = ch;
                }
            }
            array.add(field(s, n, q));
            return array.toArray(String[]::new);
        }

        private String field(final char[] s, final int n, final int quoted) {
            final String v = new String(s, 0, n);
            return (quoted == 0 && NULL != null && NULL.equals(v)) ? null : v;
        }

        /**
         * Check if the buffered text ends outside of a quoted section
         *
         * @param raw text read so far, possibly several physical lines
         * @return true when the record is complete
         */
        boolean completed(final CharSequence raw) {
            if (QUOTE == 0)
                return true;
            int qoute = 0;
            final int len = raw.length();
            for (int i = 0; i < len; i++) {
                final char ch = raw.charAt(i);
                final char next = (i + 1) < len ? raw.charAt(i + 1) : '\0';
                if (qoute > 0 && QUOTE == ch && QUOTE == next) {
                    i++;
                } else if (qoute > 0 && QUOTE == ch) {
                    qoute = 0;
                } else if (QUOTE == ch) {
                    qoute = 1;
                }
            }
            return qoute == 0;
        }
    }

    private final File file;
    private final byte[] bytes;
    private final Format format;
    private final RowParser parser;
    private Charset charset = StandardCharsets.UTF_8;
    private Logger logger = new Logger.NullLogger();
    private Bom bom;
    // cursors handed out by rows() and not closed yet
    private final Set<Cursor<String[]>> cursors = new LinkedHashSet<>();

    private TextSource(final File file, final byte[] bytes, final Format format) {
        this.file = file;
        this.bytes = bytes;
        this.format = format;
        this.parser = new RowParser(format);
    }

    /**
     * Opens a file; the format is chosen from the file name (.tsv, .tsv.gz, .tsv.zip are TSV, anything else CSV)
     */
    public static TextSource open(final File file) throws IOException {
        final String name = file.getName().toLowerCase();
        final Format format = (name.endsWith(".tsv") || name.endsWith(".tsv.gz") || name.endsWith(".tsv.zip")) //
                ? Format.TSV
                : Format.CSV;
        return open(file, format);
    }

    public static TextSource open(final File file, final Format format) throws IOException {
        if (!file.exists())
            throw new java.io.FileNotFoundException(file.toString());
        return new TextSource(file, null, format);
    }

    public static TextSource fromString(final String text) {
        return fromString(text, Format.CSV);
    }

    /**
     * Source over a string, encoded as UTF-8
     */
    public static TextSource fromString(final String text, final Format format) {
        return new TextSource(null, text.getBytes(StandardCharsets.UTF_8), format);
    }

    public static TextSource fromBytes(final byte[] bytes, final Format format) {
        return new TextSource(null, bytes.clone(), format);
    }

    /**
     * Charset used when the document carries no byte order mark
     */
    public TextSource charset(final Charset charset) {
        this.charset = charset;
        return this;
    }

    public TextSource logger(final Logger logger) {
        this.logger = logger != null ? logger : new Logger.NullLogger();
        return this;
    }

    public Format format() {
        return format;
    }

    @Override
    public char enclosure() {
        return format.quote();
    }

    @Override
    public Bom bom() throws IOException {
        if (bom == null) {
            try (InputStream istream = stream()) {
                final byte[] head = new byte[4];
                final int n = istream.readNBytes(head, 0, head.length);
                bom = Bom.detect(head, n);
            }
        }
        return bom;
    }

    /**
     * Create input stream with decompression support
     */
    private InputStream stream() throws IOException {
        if (file == null)
            return new ByteArrayInputStream(bytes);
        final String name = file.getName();
        try {
            if (name.endsWith(".gz")) {
                return new java.util.zip.GZIPInputStream(new java.io.FileInputStream(file), GZIP_BUFSZ);
            } else if (name.endsWith(".zip")) {
                final java.util.zip.ZipInputStream instream = new java.util.zip.ZipInputStream(
                        new java.io.FileInputStream(file));
                if (instream.getNextEntry() == null) {
                    instream.close();
                    throw new IOException("empty zip archive " + file);
                }
                return instream;
            }
            return new java.io.FileInputStream(file);
        } catch (java.io.EOFException ex) {
            throw new java.io.EOFException("EOF " + file.getCanonicalPath());
        }
    }

    private java.io.BufferedReader reader() throws IOException {
        final Bom mark = bom();
        final Charset cs = mark == Bom.NONE ? charset : mark.charset();
        final InputStream istream = new BufferedInputStream(stream(), READ_BUFSZ);
        logger.log("open %s, format : %s, charset : %s, bom : %s", this, format, cs, mark);
        return new java.io.BufferedReader(new java.io.InputStreamReader(istream, cs), READ_BUFSZ);
    }

    @Override
    public Cursor<String[]> rows() throws IOException {
        final java.io.BufferedReader reader = reader();
        final Cursor<String[]> cursor = new Cursor<String[]>() {
            private final StringBuilder sb = new StringBuilder();
            private boolean finished = false;

            @Override
            public String[] next() {
                if (finished)
                    return null;
                try {
                    String l;
                    while ((l = reader.readLine()) != null) {
                        if (sb.length() == 0 && l.isEmpty())
                            return new String[] { null }; // blank line
                        sb.append(l);
                        if (!parser.completed(sb)) {
                            sb.append('\n');
                            continue;
                        }
                        final String[] row = parser.split(sb);
                        sb.setLength(0);
                        return row;
                    }
                    // unterminated quoted field at end of input
                    finished = true;
                    if (sb.length() > 0) {
                        sb.setLength(sb.length() - 1);
                        final String[] row = parser.split(sb);
                        sb.setLength(0);
                        return row;
                    }
                    close();
                    return null;
                } catch (IOException e) {
                    finished = true;
                    close();
                    throw new CsvException(ErrorCode.SOURCE_READ_ERROR, TextSource.this.toString(), e);
                }
            }

            @Override
            public void close() {
                finished = true;
                cursors.remove(this);
                try {
                    reader.close();
                } catch (IOException e) {
                    logger.error("close failed %s : %s", TextSource.this, e.getMessage());
                }
            }
        };
        cursors.add(cursor);
        return cursor;
    }

    /**
     * Number of cursors opened by {@link #rows()} that are still open
     */
    int openCursors() {
        return cursors.size();
    }

    /**
     * Closes every cursor still open; the source itself can be read again
     */
    @Override
    public void close() {
        if (!cursors.isEmpty())
            logger.log("close %s, %d open cursor(s)", this, cursors.size());
        for (final Cursor<String[]> cursor : new ArrayList<>(cursors))
            cursor.close();
    }

    /**
     * Counts, for each candidate delimiter, the cells of the first rows that
     * split into more than one cell.
     *
     * @param delimiters candidate delimiters
     * @param rows       number of rows to inspect, at least 1
     * @return candidate to cell count, highest count first
     * @throws IOException if the document cannot be read
     */
    public Map<Character, Integer> delimiterOccurrences(final List<Character> delimiters, final int rows) throws IOException {
        if (rows < 1)
            throw new CsvException(ErrorCode.INVALID_ARGUMENT, "rows must be a positive integer, " + rows + " given");
        final Map<Character, Integer> counts = new LinkedHashMap<>();
        for (final Character delimiter : delimiters) {
            if (delimiter == null || counts.containsKey(delimiter))
                continue;
            final TextSource probe = new TextSource(file, bytes, format.copy().setDelimiter(delimiter)).charset(charset);
            int cells = 0;
            try (Cursor<String[]> cursor = probe.rows()) {
                String[] row;
                for (int i = 0; i < rows && (row = cursor.next()) != null;) {
                    if (row.length == 1 && row[0] == null)
                        continue; // blank lines are not records
                    if (row.length > 1)
                        cells += row.length;
                    i++;
                }
            }
            counts.put(delimiter, cells);
        }
        final List<Map.Entry<Character, Integer>> entries = new ArrayList<>(counts.entrySet());
        entries.sort((a, b) -> Integer.compare(b.getValue(), a.getValue()));
        final Map<Character, Integer> sorted = new LinkedHashMap<>();
        for (final Map.Entry<Character, Integer> e : entries)
            sorted.put(e.getKey(), e.getValue());
        return sorted;
    }

    @Override
    public String toString() {
        return file != null ? file.toString() : "TextSource(" + bytes.length + " bytes)";
    }
}
