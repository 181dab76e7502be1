package tabula.csv;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Converts field text read in a foreign charset to proper Unicode text
 */
@FunctionalInterface
public interface Transcoder {

    /**
     * @param text text whose characters carry the bytes of the source charset
     * @param from charset the bytes were written in
     * @return converted text
     */
    String convert(String text, Charset from);

    /**
     * Reinterprets each character as one byte (ISO-8859-1) and decodes the
     * bytes with the source charset. This only holds for text decoded as
     * ISO-8859-1: text holding a character above U+00FF was not, and is
     * returned as is, like UTF-8 input.
     */
    Transcoder DEFAULT = (text, from) -> {
        if (text == null || StandardCharsets.UTF_8.equals(from) || !isByteText(text))
            return text;
        return new String(text.getBytes(StandardCharsets.ISO_8859_1), from);
    };

    /**
     * Tells whether every character fits in one byte
     */
    static boolean isByteText(final String text) {
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) > 0xFF)
                return false;
        }
        return true;
    }

    /**
     * Normalizes a charset label: '_' becomes '-', control and non-ASCII
     * characters are removed, the rest is trimmed and upper-cased.
     *
     * @throws CsvException INVALID_CHARSET if nothing is left
     */
    static String label(final String label) {
        if (label == null)
            throw new CsvException(ErrorCode.INVALID_CHARSET, "null");
        final StringBuilder sb = new StringBuilder(label.length());
        for (int i = 0; i < label.length(); i++) {
            final char ch = label.charAt(i) == '_' ? '-' : label.charAt(i);
            if (ch >= 32 && ch < 127)
                sb.append(ch);
        }
        final String s = sb.toString().trim().toUpperCase(java.util.Locale.ROOT);
        if (s.isEmpty())
            throw new CsvException(ErrorCode.INVALID_CHARSET, label);
        return s;
    }

    /**
     * @throws CsvException INVALID_CHARSET if the label is empty or unknown
     */
    static Charset charset(final String label) {
        final String s = label(label);
        try {
            return Charset.forName(s);
        } catch (IllegalArgumentException ex) {
            throw new CsvException(ErrorCode.INVALID_CHARSET, s, ex);
        }
    }
}
