package util.sources;

import result_classes.ParseReport;

/**
 * Receives progress callbacks while a log is parsed.
 */
public interface ParseProgressListener {

    ParseProgressListener NONE = (linesRead, dataRows, errors) -> { };

    /** Called with the first line of the file, which carries no data. */
    default void onHeader(String headerLine) {
    }

    /** Called every {@code progressInterval} lines. */
    void onProgress(long linesRead, long dataRows, int errors);

    default void onComplete(ParseReport report) {
    }

    static ParseProgressListener logging() {
        return new LoggingProgressListener();
    }
}
