package aggregation_functions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import result_classes.Series;
import util.AnalyzerSettings;
import util.TimeWindow;
import util.Timescale;

/**
 * Trapezoidal integral and time-weighted average of a series.
 * <p>
 * The series is treated as the piecewise-linear curve through its samples.
 * Bounds are milliseconds, {@code end = -1} is unbounded, and the range is
 * clipped to {@code [max(start, first), min(end, last)]}. Values at the
 * clipped bounds are interpolated, so for any split point m
 * {@code integrate(a, m) + integrate(m, b) == integrate(a, b)}.
 * A jump between samples that share a timestamp has zero width: the lower
 * bound takes the value after the jump, the upper bound the value before it.
 */
public final class Integral {

    private static final Logger LOG = LoggerFactory.getLogger(Integral.class);

    private Integral() {}

    /** Whole-series integral in the configured {@link AnalyzerSettings#timescale}. */
    public static double integrate(Series series) {
        return integrate(series, AnalyzerSettings.defaults().timescale);
    }

    public static double integrate(Series series, long start, long end) {
        return integrate(series, start, end, AnalyzerSettings.defaults().timescale);
    }

    public static double integrate(Series series, Timescale unit) {
        return integrate(series, 0L, TimeWindow.OPEN_END, unit);
    }

    /**
     * @return the area in value x {@code unit}; 0 for fewer than two samples or an empty range
     */
    public static double integrate(Series series, long start, long end, Timescale unit) {
        long[] bounds = clippedRange(series, start, end);
        if (bounds == null) {
            return 0.0;
        }
        return unit.fromMillis(areaMillis(series, bounds[0], bounds[1]));
    }

    public static double average(Series series) {
        return average(series, AnalyzerSettings.defaults().timescale);
    }

    public static double average(Series series, long start, long end) {
        return average(series, start, end, AnalyzerSettings.defaults().timescale);
    }

    public static double average(Series series, Timescale unit) {
        return average(series, 0L, TimeWindow.OPEN_END, unit);
    }

    /**
     * Time-weighted average: integral divided by the elapsed time, both in {@code unit}.
     *
     * @return the average, or 0 if no time elapses inside the range
     */
    public static double average(Series series, long start, long end, Timescale unit) {
        long[] bounds = clippedRange(series, start, end);
        if (bounds == null) {
            LOG.debug("Zero elapsed time for '{}' in [{}, {}], average is 0", series.getLabel(), start, end);
            return 0.0;
        }
        double elapsed = unit.fromMillis(bounds[1] - bounds[0]);
        double integral = unit.fromMillis(areaMillis(series, bounds[0], bounds[1]));
        return integral / elapsed;
    }

    /**
     * Running integral: element i is the area from the first sample up to sample i + 1.
     * The result starts at the second timestamp.
     */
    public static Series cumulative(Series series) {
        return cumulative(series, AnalyzerSettings.defaults().timescale);
    }

    public static Series cumulative(Series series, Timescale unit) {
        int n = series.size();
        if (n < 2) {
            return Series.empty(series.getLabel(), series.getId());
        }
        long[] ts = series.getTimestamps();
        double[] vs = series.getValues();

        long[] outTs = new long[n - 1];
        double[] outVs = new double[n - 1];
        double area = 0.0;
        for (int i = 1; i < n; i++) {
            area += (ts[i] - ts[i - 1]) * (vs[i - 1] + vs[i]) / 2.0;
            outTs[i - 1] = ts[i];
            outVs[i - 1] = unit.fromMillis(area);
        }
        return new Series(outTs, outVs, series.getLabel(), series.getId());
    }

    /** Running sum of the sample values. */
    public static Series cumulativeSum(Series series) {
        double[] vs = series.getValues();
        double sum = 0.0;
        for (int i = 0; i < vs.length; i++) {
            sum += vs[i];
            vs[i] = sum;
        }
        return series.withValues(vs);
    }

    /** @return {lo, hi} with lo < hi, or null if nothing can be integrated */
    private static long[] clippedRange(Series series, long start, long end) {
        if (series.size() < 2) {
            return null;
        }
        long[] bounds = new TimeWindow(start, end).clip(series.firstTimestamp(), series.lastTimestamp());
        return bounds[0] < bounds[1] ? bounds : null;
    }

    private static double areaMillis(Series series, long lo, long hi) {
        long[] ts = series.getTimestamps();
        double[] vs = series.getValues();

        // last sample at or before lo
        int i = 0;
        while (i + 1 < ts.length && ts[i + 1] <= lo) i++;
        double prevValue = ts[i] == lo ? vs[i] : lerp(ts, vs, i, lo);
        long prevTime = lo;
        i++;

        double area = 0.0;
        for (; i < ts.length && ts[i] < hi; i++) {
            area += (ts[i] - prevTime) * (prevValue + vs[i]) / 2.0;
            prevTime = ts[i];
            prevValue = vs[i];
        }

        // i is now the first sample at or after hi
        double hiValue = ts[i] == hi ? vs[i] : lerp(ts, vs, i - 1, hi);
        area += (hi - prevTime) * (prevValue + hiValue) / 2.0;
        return area;
    }

    /** Value at t on the segment between samples {@code left} and {@code left + 1}. */
    private static double lerp(long[] ts, double[] vs, int left, long t) {
        long t0 = ts[left];
        long t1 = ts[left + 1];
        double ratio = (double) (t - t0) / (double) (t1 - t0);
        return vs[left] + ratio * (vs[left + 1] - vs[left]);
    }
}
