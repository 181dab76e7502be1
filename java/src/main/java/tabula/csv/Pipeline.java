package tabula.csv;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Compiles a {@link Statement} against a reader.
 *
 * <p>Stages always run in this order:</p>
 * <ol>
 * <li>re-keying by the header override</li>
 * <li>filters</li>
 * <li>ordering, which reads every remaining record before returning any</li>
 * <li>offset and limit</li>
 * <li>column selection</li>
 * </ol>
 * Every stage but ordering pulls one record at a time.
 */
final class Pipeline {

    private Pipeline() {
    }

    static RecordSet compile(final Statement statement, final CsvReader reader) {
        final Logger logger = reader.logger();
        final Header source = reader.header();
        final Header header = statement.header() != null ? statement.header() : source;
        final Select select = statement.columns().isEmpty() ? null : new Select(header, statement.columns());

        Cursor<Record> cursor = reader.records();
        try {
            if (statement.header() != null)
                cursor = new Rekey(cursor, header, reader.paddingValue());
            if (!statement.where().isEmpty())
                cursor = new Where(cursor, Filter.and(statement.where()));
            if (!statement.orderBy().isEmpty())
                cursor = Sorted.sort(cursor, Filter.chain(statement.orderBy()));
            if (statement.offset() > 0 || statement.limit() != -1)
                cursor = new Window(cursor, statement.offset(), statement.limit());
            if (select != null)
                cursor = select.apply(cursor);
        } catch (RuntimeException ex) {
            cursor.close();
            throw ex;
        }

        logger.log("compiled %s over %s, header : %s", statement, reader, header);
        return new RecordSet(cursor, select != null ? select.header : header);
    }

    /**
     * Re-keys records positionally against a header override
     */
    static final class Rekey implements Cursor<Record> {
        private final Cursor<Record> cursor;
        private final Header header;
        private final String padding;

        Rekey(final Cursor<Record> cursor, final Header header, final String padding) {
            this.cursor = cursor;
            this.header = header;
            this.padding = padding;
        }

        @Override
        public Record next() {
            final Record r = cursor.next();
            return r == null ? null : r.rekey(header, padding);
        }

        @Override
        public void close() {
            cursor.close();
        }
    }

    static final class Where implements Cursor<Record> {
        private final Cursor<Record> cursor;
        private final Predicate<Record> filter;

        Where(final Cursor<Record> cursor, final Predicate<Record> filter) {
            this.cursor = cursor;
            this.filter = filter;
        }

        @Override
        public Record next() {
            Record r;
            while ((r = cursor.next()) != null) {
                if (filter.test(r))
                    return r;
            }
            return null;
        }

        @Override
        public void close() {
            cursor.close();
        }
    }

    /**
     * Materializes the upstream records and sorts them
     */
    static final class Sorted {
        private Sorted() {
        }

        static Cursor<Record> sort(final Cursor<Record> cursor, final Comparator<Record> comparator) {
            final List<Record> list = new ArrayList<>();
            try (cursor) {
                Record r;
                while ((r = cursor.next()) != null)
                    list.add(r);
            }
            Sortable.sort(list, comparator);
            return Cursor.of(list);
        }
    }

    /**
     * Skips the first records, then passes at most limit records, -1 meaning all
     */
    static final class Window implements Cursor<Record> {
        private final Cursor<Record> cursor;
        private int skip;
        private int remaining;

        Window(final Cursor<Record> cursor, final int offset, final int limit) {
            this.cursor = cursor;
            this.skip = offset;
            this.remaining = limit;
        }

        @Override
        public Record next() {
            // a full window pulls nothing more from upstream
            if (remaining == 0)
                return null;
            for (; skip > 0; skip--) {
                if (cursor.next() == null) {
                    skip = 0;
                    remaining = 0;
                    return null;
                }
            }
            final Record r = cursor.next();
            if (r == null)
                remaining = 0;
            else if (remaining > 0)
                remaining--;
            return r;
        }

        @Override
        public void close() {
            cursor.close();
        }
    }

    /**
     * Column selection and renaming
     */
    static final class Select {
        private final Key[] keys;
        private final Header header;

        Select(final Header source, final Map<String, String> columns) {
            this.keys = new Key[columns.size()];
            final List<String> aliases = new ArrayList<>(columns.size());
            int i = 0;
            for (final Map.Entry<String, String> e : columns.entrySet()) {
                keys[i++] = key(source, e.getKey());
                aliases.add(e.getValue());
            }
            this.header = Header.of(aliases);
        }

        private static Key key(final Header source, final String column) {
            if (!source.isEmpty()) {
                if (!source.contains(column))
                    throw new CsvException(ErrorCode.UNKNOWN_COLUMN, column);
                return Key.name(column);
            }
            try {
                return Key.position(Integer.parseInt(column));
            } catch (NumberFormatException ex) {
                throw new CsvException(ErrorCode.INVALID_COLUMN, column, ex);
            }
        }

        Cursor<Record> apply(final Cursor<Record> cursor) {
            return new Cursor<Record>() {
                @Override
                public Record next() {
                    final Record r = cursor.next();
                    if (r == null)
                        return null;
                    final String[] values = new String[keys.length];
                    for (int i = 0; i < keys.length; i++)
                        values[i] = r.get(keys[i]);
                    return new Record(header, values, r.id());
                }

                @Override
                public void close() {
                    cursor.close();
                }
            };
        }
    }
}
