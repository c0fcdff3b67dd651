package util;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

import java.util.Arrays;

public final class StatisticUtil {

    private StatisticUtil() {
        // utility class
    }

    /**
     * Percentile with linear interpolation between closest ranks (R-7, the
     * definition most numeric libraries default to).
     *
     * @param values     sample, not modified
     * @param percentile in (0, 100]
     */
    public static double percentile(double[] values, double percentile) {
        if (values.length == 0) return Double.NaN;
        return new Percentile(percentile)
                .withEstimationType(EstimationType.R_7)
                .evaluate(values);
    }

    public static double median(double[] values) {
        return percentile(values, 50.0);
    }

    public static double median(long[] values) {
        return median(Arrays.stream(values).asDoubleStream().toArray());
    }

    public static double mean(double[] values) {
        if (values.length == 0) return Double.NaN;
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    /** Population standard deviation. */
    public static double stddev(double[] values) {
        if (values.length == 0) return Double.NaN;
        double mean = mean(values);
        double sumSquares = 0.0;
        for (double v : values) {
            double diff = v - mean;
            sumSquares += diff * diff;
        }
        return Math.sqrt(sumSquares / values.length);
    }
}
