package time_series_analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import result_classes.Series;
import util.AnalyzerSettings;
import util.StatisticUtil;

import java.util.Arrays;
import java.util.Objects;

/**
 * Sliding-window IQR outlier rejection.
 * <p>
 * Every sample is tested against the window of {@code w} samples centred on
 * it; samples too close to either end use the first or last full window.
 * A sample outside {@code [Q1 - k*IQR, Q3 + k*IQR]} of its window is an outlier.
 */
public final class OutlierDetection {

    private static final Logger LOG = LoggerFactory.getLogger(OutlierDetection.class);

    public enum Mode {
        /** Outliers get the median of their window. */
        REPLACE,
        /** Outliers are removed. */
        DROP
    }

    private OutlierDetection() {}

    public static Series filter(Series series, Mode mode) {
        AnalyzerSettings settings = AnalyzerSettings.defaults();
        return filter(series, mode, settings.outlierWindow, settings.iqrMultiplier);
    }

    public static Series filter(Series series, Mode mode, int windowSize) {
        return filter(series, mode, windowSize, AnalyzerSettings.defaults().iqrMultiplier);
    }

    /**
     * @param windowSize window width, {@code 0} for {@code max(5, round(sqrt(N)))};
     *                   even widths are widened by one and the width is capped at N
     * @param multiplier IQR multiplier k, usually 1.5
     */
    public static Series filter(Series series, Mode mode, int windowSize, double multiplier) {
        Objects.requireNonNull(series, "series must not be null.");
        Objects.requireNonNull(mode, "mode must not be null.");
        if (windowSize < 0) {
            throw new IllegalArgumentException("windowSize must be >= 0, got " + windowSize + ".");
        }
        if (!(multiplier >= 0)) {
            throw new IllegalArgumentException("multiplier must be >= 0, got " + multiplier + ".");
        }

        if (mode == Mode.DROP && series.isOutlierFiltered()) {
            return series;
        }

        int n = series.size();
        if (n == 0) {
            return mode == Mode.DROP
                    ? new Series(new long[0], new double[0], series.getLabel(), series.getId(), true)
                    : series;
        }

        int w = effectiveWindow(n, windowSize);
        int half = w / 2;
        double[] y = series.getValues();
        long[] ts = series.getTimestamps();

        boolean[] outlier = new boolean[n];
        double[] replacement = new double[n];
        int outliers = 0;

        for (int i = 0; i < n; i++) {
            int center = Math.max(half, Math.min(i, n - 1 - half));
            double[] window = Arrays.copyOfRange(y, center - half, center + half + 1);

            double q1 = StatisticUtil.percentile(window, 25.0);
            double q3 = StatisticUtil.percentile(window, 75.0);
            double iqr = q3 - q1;
            double lower = q1 - multiplier * iqr;
            double upper = q3 + multiplier * iqr;

            if (y[i] < lower || y[i] > upper) {
                outlier[i] = true;
                replacement[i] = StatisticUtil.median(window);
                outliers++;
            }
        }

        LOG.debug("{} outlier(s) in '{}' (n={}, window={}, mode={})", outliers, series.getLabel(), n, w, mode);

        if (mode == Mode.REPLACE) {
            double[] cleaned = y.clone();
            for (int i = 0; i < n; i++) {
                if (outlier[i]) cleaned[i] = replacement[i];
            }
            return new Series(ts, cleaned, series.getLabel(), series.getId(), series.isOutlierFiltered());
        }

        long[] keptTs = new long[n - outliers];
        double[] keptValues = new double[n - outliers];
        int k = 0;
        for (int i = 0; i < n; i++) {
            if (!outlier[i]) {
                keptTs[k] = ts[i];
                keptValues[k] = y[i];
                k++;
            }
        }
        return new Series(keptTs, keptValues, series.getLabel(), series.getId(), true);
    }

    /** Odd window width for a series of n samples, never wider than n. */
    static int effectiveWindow(int n, int requested) {
        int w = requested > 0 ? requested : Math.max(5, (int) Math.round(Math.sqrt(n)));
        if (w % 2 == 0) w++;
        if (w > n) {
            w = n % 2 == 0 ? n - 1 : n;
        }
        return w;
    }
}
