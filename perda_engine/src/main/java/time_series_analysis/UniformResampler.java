package time_series_analysis;

import result_classes.Series;
import temporal_joins.FillPolicy;
import temporal_joins.TimeSeriesConverter;
import util.StatisticUtil;

import java.util.Arrays;
import java.util.Objects;

/**
 * Puts a series on an evenly spaced grid, which the spectral filters need.
 */
public final class UniformResampler {

    private UniformResampler() {}

    /**
     * Sample rate in Hz from the median spacing of distinct timestamps.
     *
     * @throws IllegalArgumentException if the series has fewer than two distinct timestamps
     */
    public static double estimateSampleRate(Series series) {
        long[] ts = series.getTimestamps();
        long[] diffs = new long[Math.max(0, ts.length - 1)];
        int k = 0;
        for (int i = 1; i < ts.length; i++) {
            long d = ts[i] - ts[i - 1];
            if (d > 0) diffs[k++] = d;
        }
        if (k == 0) {
            throw new IllegalArgumentException("Cannot estimate the sample rate of '" + series.getLabel()
                    + "': fewer than two distinct timestamps.");
        }
        return 1000.0 / StatisticUtil.median(Arrays.copyOf(diffs, k));
    }

    /**
     * Grid {@code t_i = first + round(i * 1000 / fs)} for
     * {@code i = 0 .. floor((last - first) * fs / 1000)}, values from {@code policy}.
     */
    public static Series resample(Series series, double sampleRate, FillPolicy policy) {
        Objects.requireNonNull(policy, "policy must not be null.");
        if (!(sampleRate > 0) || Double.isInfinite(sampleRate)) {
            throw new IllegalArgumentException("sampleRate must be a positive number, got " + sampleRate + ".");
        }
        TimeSeriesConverter.Knots knots = TimeSeriesConverter.knots(series);

        long first = knots.first();
        long last = knots.last();
        int n = (int) Math.floor((last - first) * sampleRate / 1000.0) + 1;
        double stepMillis = 1000.0 / sampleRate;

        long[] grid = new long[n];
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            grid[i] = first + Math.round(i * stepMillis);
            values[i] = policy.valueAt(knots, grid[i]);
        }
        return new Series(grid, values, series.getLabel(), series.getId());
    }
}
