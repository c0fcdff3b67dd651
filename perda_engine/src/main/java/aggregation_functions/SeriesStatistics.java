package aggregation_functions;

import result_classes.Series;
import util.AnalyzerSettings;
import util.StatisticUtil;
import util.TimeWindow;
import util.Timescale;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Descriptive statistics of one series inside a time range.
 * Timestamps are reported in the requested {@link Timescale}.
 */
public final class SeriesStatistics {

    public final String label;
    public final int id;
    public final int count;
    public final Timescale unit;
    public final double firstTime;
    public final double lastTime;
    public final double min;
    public final double minTime;
    public final double max;
    public final double maxTime;
    public final double mean;
    public final double median;
    public final double stddev;
    /** Integral over the range divided by its duration. */
    public final double timeWeightedAverage;

    private SeriesStatistics(Series slice, Timescale unit) {
        this.label = slice.getLabel();
        this.id = slice.getId();
        this.count = slice.size();
        this.unit = unit;

        double[] values = slice.getValues();
        if (values.length == 0) {
            this.firstTime = Double.NaN;
            this.lastTime = Double.NaN;
            this.min = Double.NaN;
            this.minTime = Double.NaN;
            this.max = Double.NaN;
            this.maxTime = Double.NaN;
            this.mean = Double.NaN;
            this.median = Double.NaN;
            this.stddev = Double.NaN;
            this.timeWeightedAverage = 0.0;
            return;
        }

        int minIdx = 0;
        int maxIdx = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] < values[minIdx]) minIdx = i;
            if (values[i] > values[maxIdx]) maxIdx = i;
        }

        this.firstTime = unit.fromMillis(slice.firstTimestamp());
        this.lastTime = unit.fromMillis(slice.lastTimestamp());
        this.min = values[minIdx];
        this.minTime = unit.fromMillis(slice.timestampAt(minIdx));
        this.max = values[maxIdx];
        this.maxTime = unit.fromMillis(slice.timestampAt(maxIdx));
        this.mean = StatisticUtil.mean(values);
        this.median = StatisticUtil.median(values);
        this.stddev = StatisticUtil.stddev(values);
        this.timeWeightedAverage = Integral.average(slice, unit);
    }

    /** Statistics in the configured {@link AnalyzerSettings#timescale}. */
    public static SeriesStatistics of(Series series) {
        return of(series, AnalyzerSettings.defaults().timescale);
    }

    public static SeriesStatistics of(Series series, long start, long end) {
        return of(series, start, end, AnalyzerSettings.defaults().timescale);
    }

    public static SeriesStatistics of(Series series, Timescale unit) {
        return new SeriesStatistics(series, unit);
    }

    /** Statistics over {@code [start, end)}; {@code end = -1} is unbounded. */
    public static SeriesStatistics of(Series series, long start, long end, Timescale unit) {
        return new SeriesStatistics(TimeSlice.slice(series, new TimeWindow(start, end)), unit);
    }

    public boolean isEmpty() {
        return count == 0;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("label", label);
        stats.put("id", id);
        stats.put("count", count);
        stats.put("unit", unit.symbol());
        stats.put("first", firstTime);
        stats.put("last", lastTime);
        stats.put("min", min);
        stats.put("minTime", minTime);
        stats.put("max", max);
        stats.put("maxTime", maxTime);
        stats.put("mean", mean);
        stats.put("median", median);
        stats.put("stddev", stddev);
        stats.put("timeWeightedAverage", timeWeightedAverage);
        return stats;
    }

    @Override
    public String toString() {
        if (count == 0) {
            return label + " | ID: " + id + " | empty";
        }
        return String.format("%s | ID: %d | count=%d, %.4f to %.4f (%s), min=%.4f at %.4f, max=%.4f at %.4f, avg=%.4f",
                label, id, count, firstTime, lastTime, unit.symbol(), min, minTime, max, maxTime, timeWeightedAverage);
    }
}
