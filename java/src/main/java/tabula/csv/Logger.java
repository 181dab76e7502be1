package tabula.csv;

/**
 * Logger for reader, source and pipeline activity
 */
public interface Logger {
    /**
     * Log a diagnostic message (source opened, header resolved, plan compiled)
     *
     * @param fmt  format string
     * @param args format arguments
     */
    void log(String fmt, Object... args);

    /**
     * Log an error message
     *
     * @param fmt  format string
     * @param args format arguments
     */
    void error(String fmt, Object... args);

    /**
     * Discards diagnostics, prints errors to stderr
     */
    public static final class NullLogger implements Logger {
        @Override
        public void log(String fmt, Object... args) {
        }

        @Override
        public void error(String fmt, Object... args) {
            System.err.printf(fmt, args);
            System.err.println();
        }
    }

    /**
     * java.util.logging backed logger, diagnostics at FINE and errors at SEVERE
     */
    public static final class DefaultLogger implements Logger {
        private final java.util.logging.Logger LOGGER;

        public DefaultLogger(String name) {
            LOGGER = java.util.logging.Logger.getLogger(name);
        }

        public DefaultLogger(Class<?> type) {
            this(type.getName());
        }

        @Override
        public void log(String fmt, Object... args) {
            if (LOGGER.isLoggable(java.util.logging.Level.FINE))
                LOGGER.log(java.util.logging.Level.FINE, String.format(fmt, args));
        }

        @Override
        public void error(String fmt, Object... args) {
            LOGGER.log(java.util.logging.Level.SEVERE, String.format(fmt, args));
        }
    }
}
