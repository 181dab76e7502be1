package tabula.csv;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * In-memory raw source.
 * A {@code null} element stands for a row that is not a proper row structure.
 */
public final class ListSource implements RawSource {
    private final List<String[]> rows;
    private Bom bom = Bom.NONE;
    private char enclosure = '"';

    private ListSource(final List<String[]> rows) {
        this.rows = rows;
    }

    public static ListSource of(final List<String[]> rows) {
        return new ListSource(new ArrayList<>(rows));
    }

    public static ListSource of(final String[]... rows) {
        return new ListSource(new ArrayList<>(Arrays.asList(rows)));
    }

    /**
     * Declares a byte order mark; the first field of row 0 is expected to start
     * with its decoded {@link Bom#sequence() sequence}
     */
    public ListSource bom(final Bom bom) {
        this.bom = bom;
        return this;
    }

    public ListSource enclosure(final char enclosure) {
        this.enclosure = enclosure;
        return this;
    }

    @Override
    public Bom bom() {
        return bom;
    }

    @Override
    public char enclosure() {
        return enclosure;
    }

    @Override
    public Cursor<String[]> rows() {
        return new Cursor<String[]>() {
            private int i = 0;

            @Override
            public String[] next() {
                if (i >= rows.size())
                    return null;
                final String[] row = rows.get(i++);
                return row == null ? new String[0] : row.clone();
            }
        };
    }

    @Override
    public String toString() {
        return "ListSource(" + rows.size() + " rows)";
    }
}
