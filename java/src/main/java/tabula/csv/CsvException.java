/**
 *
 */
package tabula.csv;

/**
 * CSV exception with error code classification.
 * Callers distinguish validation, structural, callback and source failures
 * through {@link #getErrorCode()} and {@link #category()}.
 *
 * <p>Unchecked, because it has to travel through {@link java.util.Iterator},
 * {@link java.util.function.Predicate} and {@link java.util.Comparator} call sites.</p>
 */
public class CsvException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCode errorCode;
    private final transient Object context;

    public CsvException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
        this.context = null;
    }

    public CsvException(ErrorCode errorCode, String additionalMessage) {
        super(errorCode.getMessage() + " - " + additionalMessage);
        this.errorCode = errorCode;
        this.context = null;
    }

    public CsvException(ErrorCode errorCode, Object context) {
        super(errorCode.getMessage() + " - " + context);
        this.errorCode = errorCode;
        this.context = context;
    }

    public CsvException(ErrorCode errorCode, String additionalMessage, Throwable cause) {
        super(errorCode.getMessage() + " - " + additionalMessage, cause);
        this.errorCode = errorCode;
        this.context = null;
    }

    public CsvException(ErrorCode errorCode, Object context, Throwable cause) {
        super(errorCode.getMessage() + " - " + context, cause);
        this.errorCode = errorCode;
        this.context = context;
    }

    /**
     * Get the error code for this exception
     * @return the error code
     */
    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Get the offending value, when one was recorded
     * @return the context object, or null if not available
     */
    public Object getContext() {
        return context;
    }

    /**
     * Check if this exception has a specific error code
     * @param code the error code to check
     * @return true if the error code matches
     */
    public boolean isErrorCode(ErrorCode code) {
        return this.errorCode == code;
    }

    public ErrorCode.Category category() {
        return errorCode.category();
    }

    @Override
    public String toString() {
        return "CsvException{" +
                "errorCode=" + errorCode +
                ", context=" + context +
                ", message=" + getMessage() +
                '}';
    }
}
