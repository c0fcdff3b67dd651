package util.sources;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import result_classes.ParseReport;

class LoggingProgressListener implements ParseProgressListener {

    private static final Logger LOG = LoggerFactory.getLogger(LogFileParser.class);

    @Override
    public void onHeader(String headerLine) {
        LOG.info("Header: {}", headerLine);
    }

    @Override
    public void onProgress(long linesRead, long dataRows, int errors) {
        LOG.info("Read {} lines ({} data rows, {} errors)", linesRead, dataRows, errors);
    }

    @Override
    public void onComplete(ParseReport report) {
        LOG.info("Parsing complete with {} parsing errors: {}", report.errorCount, report);
    }
}
