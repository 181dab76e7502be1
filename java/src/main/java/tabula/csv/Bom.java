package tabula.csv;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Byte order marks recognized at the start of a document
 */
public enum Bom {
    NONE(new byte[0], null),
    UTF_8(new byte[] { (byte) 0xEF, (byte) 0xBB, (byte) 0xBF }, StandardCharsets.UTF_8),
    UTF_16BE(new byte[] { (byte) 0xFE, (byte) 0xFF }, StandardCharsets.UTF_16BE),
    UTF_16LE(new byte[] { (byte) 0xFF, (byte) 0xFE }, StandardCharsets.UTF_16LE),
    UTF_32BE(new byte[] { 0, 0, (byte) 0xFE, (byte) 0xFF }, "UTF-32BE"),
    UTF_32LE(new byte[] { (byte) 0xFF, (byte) 0xFE, 0, 0 }, "UTF-32LE");

    /** The BOM once decoded with its own charset */
    static final String ZWNBSP = "\uFEFF";

    private final byte[] bytes;
    private final Object charset; // Charset or lazily resolved name

    Bom(final byte[] bytes, final Object charset) {
        this.bytes = bytes;
        this.charset = charset;
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    /**
     * Charset implied by the mark, null for {@link #NONE}
     */
    public Charset charset() {
        if (charset == null || charset instanceof Charset)
            return (Charset) charset;
        return Charset.forName((String) charset);
    }

    /**
     * The mark as it appears at the start of the first field once decoded: empty
     * for {@link #NONE}, a single U+FEFF character otherwise
     */
    public String sequence() {
        return this == NONE ? "" : ZWNBSP;
    }

    /**
     * Detects the mark at the start of a buffer. Four byte marks are tested first
     * because UTF-32LE begins with the UTF-16LE mark.
     *
     * @param head first bytes of the document
     * @param n    number of valid bytes in head
     * @return the detected mark, {@link #NONE} if there is none
     */
    public static Bom detect(final byte[] head, final int n) {
        for (final Bom bom : new Bom[] { UTF_32BE, UTF_32LE, UTF_8, UTF_16BE, UTF_16LE }) {
            if (startsWith(head, n, bom.bytes))
                return bom;
        }
        return NONE;
    }

    private static boolean startsWith(final byte[] head, final int n, final byte[] prefix) {
        if (n < prefix.length)
            return false;
        for (int i = 0; i < prefix.length; i++) {
            if (head[i] != prefix[i])
                return false;
        }
        return true;
    }
}
