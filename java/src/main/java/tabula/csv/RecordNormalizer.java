package tabula.csv;

/**
 * Turns raw rows into records.
 *
 * <p>For each raw row, in order:</p>
 * <ol>
 * <li>empty rows and blank lines ({@code [null]}) are skipped</li>
 * <li>at position 0 the byte order mark is removed from the first field</li>
 * <li>the header row is dropped</li>
 * <li>with a header, the row is padded or truncated to the header width</li>
 * <li>the row is keyed by the header, or by position without one</li>
 * </ol>
 *
 * Only one raw row is held at a time.
 */
final class RecordNormalizer implements Cursor<Record> {
    private final Cursor<String[]> rows;
    private final Header header;
    private final Integer headerOffset;
    private final Bom bom;
    private final char enclosure;
    private final String padding;
    private long position = -1;

    RecordNormalizer(final Cursor<String[]> rows, final Header header, final Integer headerOffset, final Bom bom,
            final char enclosure, final String padding) {
        this.rows = rows;
        this.header = header;
        this.headerOffset = headerOffset;
        this.bom = bom;
        this.enclosure = enclosure;
        this.padding = padding;
    }

    @Override
    public Record next() {
        String[] row;
        while ((row = rows.next()) != null) {
            position++;
            if (row.length == 0 || (row.length == 1 && row[0] == null))
                continue;
            if (position == 0)
                row = stripBom(row, bom, enclosure);
            if (headerOffset != null && position == headerOffset)
                continue;
            if (header.isEmpty())
                return new Record(header, row, position);
            return new Record(header, Record.reshape(row, header.size(), padding), position);
        }
        return null;
    }

    @Override
    public void close() {
        rows.close();
    }

    /**
     * Removes a byte order mark from the first field, then an enclosure wrapping
     * the rest of that field.
     *
     * @return the row itself if the mark is absent, otherwise a copy
     */
    static String[] stripBom(final String[] row, final Bom bom, final char enclosure) {
        final String sequence = bom == null ? "" : bom.sequence();
        if (sequence.isEmpty() || row.length == 0 || row[0] == null || !row[0].startsWith(sequence))
            return row;
        String first = row[0].substring(sequence.length());
        if (enclosure != 0 && first.length() >= 2 && first.charAt(0) == enclosure
                && first.charAt(first.length() - 1) == enclosure)
            first = first.substring(1, first.length() - 1);
        final String[] a = row.clone();
        a[0] = first;
        return a;
    }
}
