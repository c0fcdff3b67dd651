package result_classes;

/**
 * Counters collected while a log was read.
 */
public final class ParseReport {

    public final long lineCount;
    public final long headerPairs;
    public final long dataRows;
    public final int errorCount;
    public final int duplicateIds;

    public ParseReport(long lineCount, long headerPairs, long dataRows, int errorCount, int duplicateIds) {
        this.lineCount = lineCount;
        this.headerPairs = headerPairs;
        this.dataRows = dataRows;
        this.errorCount = errorCount;
        this.duplicateIds = duplicateIds;
    }

    public static ParseReport empty() {
        return new ParseReport(0, 0, 0, 0, 0);
    }

    @Override
    public String toString() {
        return "ParseReport[lines=" + lineCount + ", headerPairs=" + headerPairs + ", dataRows=" + dataRows
                + ", errors=" + errorCount + ", duplicateIds=" + duplicateIds + "]";
    }
}
