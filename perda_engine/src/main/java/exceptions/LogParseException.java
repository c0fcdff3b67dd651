package exceptions;

/**
 * Thrown when a telemetry log cannot be parsed at all: the file is unreadable
 * or the number of bad lines exceeded the configured error budget.
 */
public class LogParseException extends Exception {

    private final int errorCount;

    public LogParseException(String message, int errorCount) {
        super(message);
        this.errorCount = errorCount;
    }

    public LogParseException(String message, Throwable cause) {
        super(message, cause);
        this.errorCount = 0;
    }

    /**
     * @return number of row-level errors counted before the parse was aborted
     */
    public int getErrorCount() {
        return errorCount;
    }
}
