/**
 *
 */
package tabula.csv;

/**
 * Error codes for reading and querying CSV documents
 */
public enum ErrorCode {
    // Caller supplied values (-1000 to -1999)
    INVALID_OFFSET(-1000, "Offset must be a positive integer or 0"),
    INVALID_LIMIT(-1001, "Limit must be an integer greater than or equal to -1"),
    INVALID_HEADER(-1002, "Header must be empty or a flat list of unique non-empty names"),
    INVALID_COLUMN(-1003, "Column index is invalid"),
    UNKNOWN_COLUMN(-1004, "Column does not exist in the CSV document"),
    INVALID_HEADER_OFFSET(-1005, "Header offset must be a positive integer or 0"),
    INVALID_CHARSET(-1006, "Invalid charset"),
    INVALID_ARGUMENT(-1099, "Invalid argument"),

    // Document structure (-2000 to -2999)
    HEADER_NOT_FOUND(-2000, "Header record absent or empty at the configured offset"),
    HEADER_NOT_UNIQUE(-2001, "Header is not a flat array of unique strings"),

    // Caller supplied callbacks (-3000 to -3999)
    CALLBACK_FAILED(-3000, "Filter or comparator failed"),

    // Source and conversion (-4000 to -4999)
    SOURCE_READ_ERROR(-4000, "Source read error"),
    CONVERSION_FAILED(-4001, "Document conversion failed");

    /**
     * Error families, one per numeric range
     */
    public enum Category {
        VALIDATION, STRUCTURE, CALLBACK, SOURCE
    }

    private final int code;
    private final String message;

    ErrorCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public Category category() {
        if (code > -2000)
            return Category.VALIDATION;
        if (code > -3000)
            return Category.STRUCTURE;
        if (code > -4000)
            return Category.CALLBACK;
        return Category.SOURCE;
    }
}
