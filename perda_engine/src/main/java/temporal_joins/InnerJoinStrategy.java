package temporal_joins;

import result_classes.Series;

import java.util.Arrays;

/**
 * Inner join with a matching tolerance.
 * <p>
 * For every A timestamp the nearest B sample is looked up. If its distance is
 * at most {@code tolerance} milliseconds the row is kept and B's value is the
 * mean of the B samples at that timestamp. Of two equally distant B
 * timestamps the earlier one wins. A timestamps without such a match are
 * dropped, so the result never has more rows than A.
 */
public class InnerJoinStrategy implements TemporalJoinStrategy {

    private final double tolerance;

    public InnerJoinStrategy(double tolerance) {
        if (Double.isNaN(tolerance) || tolerance < 0) {
            throw new IllegalArgumentException("tolerance must be >= 0, got " + tolerance + ".");
        }
        this.tolerance = tolerance;
    }

    public double getTolerance() {
        return tolerance;
    }

    @Override
    public AlignedData align(Series a, Series b) {
        TimeSeriesConverter.knots(a);
        TimeSeriesConverter.Knots knotsB = TimeSeriesConverter.knots(b);

        long[] tsA = a.getTimestamps();
        double[] valuesA = a.getValues();

        long[] ts = new long[tsA.length];
        double[] outA = new double[tsA.length];
        double[] outB = new double[tsA.length];
        int k = 0;

        for (int i = 0; i < tsA.length; i++) {
            long t = tsA[i];
            int before = knotsB.indexAtOrBefore(t);
            int after = knotsB.indexAtOrAfter(t);

            long distBefore = before >= 0 ? t - knotsB.rawTime(before) : Long.MAX_VALUE;
            long distAfter = after < knotsB.size() ? knotsB.rawTime(after) - t : Long.MAX_VALUE;
            long best = Math.min(distBefore, distAfter);

            if (best > tolerance) {
                continue;
            }

            double sum = 0.0;
            int count = 0;
            if (distBefore <= distAfter) {
                long matchTime = knotsB.rawTime(before);
                for (int j = before; j >= 0 && knotsB.rawTime(j) == matchTime; j--) {
                    sum += knotsB.rawValue(j);
                    count++;
                }
            } else {
                long matchTime = knotsB.rawTime(after);
                for (int j = after; j < knotsB.size() && knotsB.rawTime(j) == matchTime; j++) {
                    sum += knotsB.rawValue(j);
                    count++;
                }
            }

            ts[k] = t;
            outA[k] = valuesA[i];
            outB[k] = sum / count;
            k++;
        }

        return new AlignedData(Arrays.copyOf(ts, k), Arrays.copyOf(outA, k), Arrays.copyOf(outB, k));
    }
}
