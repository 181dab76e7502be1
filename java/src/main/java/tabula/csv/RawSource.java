/**
 *
 */
package tabula.csv;

import java.io.IOException;

/**
 * Supplier of raw delimited rows.
 *
 * <p>Rows are addressed by a zero-based position that counts every row the
 * source delivers, blank ones included. A blank physical line is delivered as
 * the synthetic row {@code [null]}; a row that is not a proper row structure is
 * delivered as an empty array.</p>
 */
public interface RawSource extends AutoCloseable {

    /**
     * Byte order mark detected at the start of the document
     *
     * @return the mark, {@link Bom#NONE} if there is none
     * @throws IOException if the document cannot be read
     */
    Bom bom() throws IOException;

    /**
     * Enclosure (quote) character of the document
     */
    char enclosure();

    /**
     * Opens a forward cursor positioned before row 0.
     * Each call starts over from the beginning of the document.
     *
     * @return cursor over raw rows, {@code null} once exhausted
     * @throws IOException if the document cannot be opened
     */
    Cursor<String[]> rows() throws IOException;

    /**
     * Reads the row at a position
     *
     * @param position zero-based row position
     * @return the row, or null if the document has fewer rows
     * @throws IOException if the document cannot be read
     */
    default String[] seek(final long position) throws IOException {
        try (Cursor<String[]> cursor = rows()) {
            String[] row;
            long i = 0;
            while ((row = cursor.next()) != null) {
                if (i++ == position)
                    return row;
            }
            return null;
        } catch (CsvException ex) {
            if (ex.getCause() instanceof IOException)
                throw (IOException) ex.getCause();
            throw ex;
        }
    }

    @Override
    default void close() throws IOException {
    }
}
