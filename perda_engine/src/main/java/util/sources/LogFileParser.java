package util.sources;

import exceptions.LogParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import result_classes.ParseReport;
import result_classes.Series;
import result_classes.SeriesStore;
import util.AnalyzerSettings;
import util.TimeSeriesSource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Reads a telemetry log into a {@link SeriesStore}.
 * <p>
 * Format:
 * <pre>
 * &lt;informational first line&gt;
 * Value 1: "Pack Voltage (ams.pack.voltage)"
 * Value 2: Pack Current (ams.pack.current)
 * 1000,1,400.0
 * 1000,2,-12.5
 * </pre>
 * Header pairs may also appear between data rows, and the older
 * {@code Value <name>: <id>} order is accepted. A data row may only refer to an
 * id whose header pair came before it.
 * <p>
 * Malformed lines are counted and skipped. The parse is aborted once the
 * count exceeds {@code maxErrors}; {@code maxErrors <= 0} never aborts.
 */
public class LogFileParser implements TimeSeriesSource {

    private static final Logger LOG = LoggerFactory.getLogger(LogFileParser.class);

    private static final String HEADER_PREFIX = "Value ";
    private static final String HEADER_SEPARATOR = ": ";

    private final int maxErrors;
    private final int progressInterval;
    private final ParseProgressListener listener;

    public LogFileParser() {
        this(AnalyzerSettings.defaults());
    }

    public LogFileParser(AnalyzerSettings settings) {
        this(settings.maxErrors, settings.progressInterval, ParseProgressListener.logging());
    }

    public LogFileParser(int maxErrors, int progressInterval, ParseProgressListener listener) {
        if (progressInterval <= 0) {
            throw new IllegalArgumentException("progressInterval must be > 0, got " + progressInterval + ".");
        }
        this.maxErrors = maxErrors;
        this.progressInterval = progressInterval;
        this.listener = Objects.requireNonNull(listener, "listener must not be null.");
    }

    public static SeriesStore parse(Path path) throws LogParseException {
        return new LogFileParser().load(path);
    }

    public static SeriesStore parse(Path path, int maxErrors) throws LogParseException {
        AnalyzerSettings defaults = AnalyzerSettings.defaults();
        return new LogFileParser(maxErrors, defaults.progressInterval, ParseProgressListener.logging()).load(path);
    }

    @Override
    public SeriesStore load(Path path) throws LogParseException {
        Objects.requireNonNull(path, "path must not be null.");
        LOG.debug("Parsing {} (maxErrors={})", path, maxErrors);

        ParseState state = new ParseState();
        try (BufferedReader reader = openLenient(path)) {
            String first = reader.readLine();
            if (first != null) {
                state.lineCount++;
                listener.onHeader(first.trim());
            }

            String line;
            while ((line = reader.readLine()) != null) {
                state.lineCount++;
                readLine(line, state);

                if (state.lineCount % progressInterval == 0) {
                    listener.onProgress(state.lineCount, state.dataRows, state.errors);
                }
            }
        } catch (IOException e) {
            throw new LogParseException("Cannot read log file " + path + ": " + e.getMessage(), e);
        }

        SeriesStore store = state.build();
        listener.onComplete(store.getReport());
        return store;
    }

    /** Undecodable bytes become U+FFFD, so the line they sit on fails as an ordinary bad row. */
    private static BufferedReader openLenient(Path path) throws IOException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        return new BufferedReader(new InputStreamReader(Files.newInputStream(path), decoder));
    }

    private void readLine(String rawLine, ParseState state) throws LogParseException {
        String line = rawLine.trim();
        if (line.isEmpty()) {
            return;
        }

        String problem = line.startsWith(HEADER_PREFIX) ? readHeader(line, state) : readData(line, state);
        if (problem == null) {
            return;
        }

        state.errors++;
        LOG.warn("Line {}: {}", state.lineCount, problem);
        if (maxErrors > 0 && state.errors > maxErrors) {
            throw new LogParseException("Too many parsing errors (" + state.errors + " > " + maxErrors
                    + "), last at line " + state.lineCount + ".", state.errors);
        }
    }

    /** @return an error description, or null if the line was accepted */
    private String readHeader(String line, ParseState state) {
        String body = line.substring(HEADER_PREFIX.length());
        int sep = body.indexOf(HEADER_SEPARATOR);
        if (sep < 0) {
            return "malformed header pair '" + line + "'";
        }
        String left = body.substring(0, sep).trim();
        String right = body.substring(sep + HEADER_SEPARATOR.length()).trim();

        Integer id = parseId(left);
        String name = right;
        if (id == null) {
            // older logs: "Value <name>: <id>"
            id = parseId(right);
            name = left;
        }
        if (id == null) {
            return "header pair without a numeric id '" + line + "'";
        }

        name = unquote(name);
        if (name.isEmpty()) {
            return "header pair with empty name '" + line + "'";
        }

        state.header(id, name, this);
        return null;
    }

    /** @return an error description, or null if the line was accepted */
    private String readData(String line, ParseState state) {
        String[] parts = line.split(",", -1);
        if (parts.length != 3) {
            return "expected 'timestamp,id,value' but got '" + line + "'";
        }

        long timestamp;
        int id;
        double value;
        try {
            timestamp = Long.parseLong(parts[0].trim());
            id = Integer.parseInt(parts[1].trim());
            value = Double.parseDouble(parts[2].trim());
        } catch (NumberFormatException e) {
            return "cannot parse data row '" + line + "' (" + e.getMessage() + ")";
        }

        if (timestamp < 0) {
            return "negative timestamp " + timestamp;
        }
        Bucket bucket = state.buckets.get(id);
        if (bucket == null) {
            return "data row for unknown variable id " + id;
        }

        bucket.add(timestamp, value);
        if (state.dataRows == 0) {
            state.startTime = timestamp;
        }
        state.endTime = timestamp;
        state.dataRows++;
        return null;
    }

    private static Integer parseId(String token) {
        try {
            return Integer.valueOf(token);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String unquote(String name) {
        String trimmed = name.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return trimmed.substring(1, trimmed.length() - 1).trim();
        }
        return trimmed;
    }

    private void duplicateId(int id, String oldName, String newName, long line) {
        LOG.warn("Duplicate variable ID {} at line {}: '{}' replaces '{}'", id, line, newName, oldName);
    }

    /** Mutable state of a single {@link #load(Path)} call. */
    private static final class ParseState {
        final Map<Integer, String> nameOf = new LinkedHashMap<>();
        final Map<String, Integer> idOf = new LinkedHashMap<>();
        final Map<Integer, Bucket> buckets = new LinkedHashMap<>();

        long lineCount;
        long headerPairs;
        long dataRows;
        int errors;
        int duplicateIds;
        long startTime;
        long endTime;

        void header(int id, String name, LogFileParser parser) {
            headerPairs++;
            String previous = nameOf.put(id, name);
            if (previous != null) {
                duplicateIds++;
                parser.duplicateId(id, previous, name, lineCount);
                if (!previous.equals(name) && Integer.valueOf(id).equals(idOf.get(previous))) {
                    idOf.remove(previous);
                }
            }
            idOf.put(name, id);
            buckets.computeIfAbsent(id, k -> new Bucket());
        }

        SeriesStore build() {
            Map<Integer, Series> byId = new LinkedHashMap<>();
            for (Map.Entry<Integer, String> entry : nameOf.entrySet()) {
                Bucket bucket = buckets.get(entry.getKey());
                byId.put(entry.getKey(), bucket.toSeries(entry.getValue(), entry.getKey()));
            }
            ParseReport report = new ParseReport(lineCount, headerPairs, dataRows, errors, duplicateIds);
            return new SeriesStore(byId, nameOf, idOf, dataRows, startTime, endTime, report);
        }
    }

    /** Samples of one id in file order. */
    private static final class Bucket {
        long[] timestamps = new long[16];
        double[] values = new double[16];
        int size;
        boolean sorted = true;

        void add(long timestamp, double value) {
            if (size == timestamps.length) {
                timestamps = Arrays.copyOf(timestamps, size * 2);
                values = Arrays.copyOf(values, size * 2);
            }
            if (size > 0 && timestamp < timestamps[size - 1]) {
                sorted = false;
            }
            timestamps[size] = timestamp;
            values[size] = value;
            size++;
        }

        Series toSeries(String name, int id) {
            long[] ts = Arrays.copyOf(timestamps, size);
            double[] vs = Arrays.copyOf(values, size);
            if (!sorted) {
                // stable: samples with equal timestamps keep their file order
                Integer[] order = new Integer[size];
                for (int i = 0; i < size; i++) order[i] = i;
                Arrays.sort(order, Comparator.comparingLong(i -> timestamps[i]));
                for (int i = 0; i < size; i++) {
                    ts[i] = timestamps[order[i]];
                    vs[i] = values[order[i]];
                }
            }
            return new Series(ts, vs, name, id);
        }
    }
}
