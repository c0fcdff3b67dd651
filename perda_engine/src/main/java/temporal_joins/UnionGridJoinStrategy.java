package temporal_joins;

import result_classes.Series;

import java.util.Arrays;
import java.util.Objects;

/**
 * Base for the outer joins: the shared axis is the sorted union of both
 * series' timestamps and each side is sampled onto it by the subclass.
 * Where a side has no value the {@link MissingPolicy} decides between dropping
 * the row and filling it.
 */
public abstract class UnionGridJoinStrategy implements TemporalJoinStrategy {

    private final MissingPolicy missingPolicy;

    protected UnionGridJoinStrategy(MissingPolicy missingPolicy) {
        this.missingPolicy = Objects.requireNonNull(missingPolicy, "missingPolicy must not be null.");
    }

    /**
     * Value of the series at grid point t, or NaN where it has none.
     */
    protected abstract double sample(TimeSeriesConverter.Knots knots, long t);

    @Override
    public AlignedData align(Series a, Series b) {
        TimeSeriesConverter.Knots knotsA = TimeSeriesConverter.knots(a);
        TimeSeriesConverter.Knots knotsB = TimeSeriesConverter.knots(b);

        long[] grid = TimeSeriesConverter.unionGrid(knotsA.distinctTimes(), knotsB.distinctTimes());

        long[] ts = new long[grid.length];
        double[] va = new double[grid.length];
        double[] vb = new double[grid.length];
        int k = 0;

        for (long t : grid) {
            double x = sample(knotsA, t);
            double y = sample(knotsB, t);

            if (Double.isNaN(x) || Double.isNaN(y)) {
                if (missingPolicy.isDrop()) {
                    continue;
                }
                if (Double.isNaN(x)) x = missingPolicy.fillValue();
                if (Double.isNaN(y)) y = missingPolicy.fillValue();
            }
            ts[k] = t;
            va[k] = x;
            vb[k] = y;
            k++;
        }

        if (k == grid.length) {
            return new AlignedData(ts, va, vb);
        }
        return new AlignedData(
                Arrays.copyOf(ts, k),
                Arrays.copyOf(va, k),
                Arrays.copyOf(vb, k));
    }
}
