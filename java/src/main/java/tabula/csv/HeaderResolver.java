package tabula.csv;

import java.io.IOException;

/**
 * Reads the header record of a source once per header offset.
 *
 * <p>Name uniqueness is not checked here, reading the header has no side
 * effect. {@link CsvReader#records()} refuses to iterate over a header that is
 * not a flat list of unique names.</p>
 */
final class HeaderResolver {
    private final RawSource source;
    private final Logger logger;
    private Integer resolvedOffset;
    private Header header;

    HeaderResolver(final RawSource source, final Logger logger) {
        this.source = source;
        this.logger = logger;
    }

    /**
     * @param offset zero-based row position of the header, null for none
     * @return the header, {@link Header#EMPTY} when offset is null
     * @throws CsvException HEADER_NOT_FOUND if the row is missing or empty
     */
    Header resolve(final Integer offset) throws IOException {
        if (offset == null)
            return Header.EMPTY;
        if (header != null && offset.equals(resolvedOffset))
            return header;

        final String[] row = source.seek(offset);
        if (row == null || row.length == 0 || (row.length == 1 && row[0] == null))
            throw new CsvException(ErrorCode.HEADER_NOT_FOUND, (Object) offset);

        final String[] names = offset == 0 ? RecordNormalizer.stripBom(row, source.bom(), source.enclosure()) : row;
        header = Header.of(names);
        resolvedOffset = offset;
        logger.log("header at %d : %s", offset, header);
        return header;
    }

    void invalidate() {
        header = null;
        resolvedOffset = null;
    }
}
