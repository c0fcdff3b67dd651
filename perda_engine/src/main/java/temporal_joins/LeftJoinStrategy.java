package temporal_joins;

import result_classes.Series;

/**
 * Left join: the shared axis is exactly the timestamps of series A.
 * <p>
 * Every sample of B is assigned to the A timestamp nearest to it; when it sits
 * exactly halfway between two A timestamps the earlier one wins. Several B
 * samples landing on the same A timestamp are averaged. A timestamps that
 * received nothing are linearly interpolated from the ones that did, holding
 * the first/last assigned value beyond either end.
 * <p>
 * The result always has as many rows as A.
 */
public class LeftJoinStrategy implements TemporalJoinStrategy {

    @Override
    public AlignedData align(Series a, Series b) {
        TimeSeriesConverter.Knots knotsA = TimeSeriesConverter.knots(a);
        TimeSeriesConverter.Knots knotsB = TimeSeriesConverter.knots(b);

        // 1. Distinct A timestamps are the buckets B samples fall into
        long[] buckets = knotsA.distinctTimes();
        double[] sums = new double[buckets.length];
        int[] counts = new int[buckets.length];

        for (int j = 0; j < knotsB.size(); j++) {
            int target = nearestBucket(buckets, knotsB.rawTime(j));
            sums[target] += knotsB.rawValue(j);
            counts[target]++;
        }

        // 2. Assigned buckets become the knots for filling the rest
        int assigned = 0;
        for (int count : counts) {
            if (count > 0) assigned++;
        }
        long[] assignedTimes = new long[assigned];
        double[] assignedValues = new double[assigned];
        int k = 0;
        for (int i = 0; i < buckets.length; i++) {
            if (counts[i] > 0) {
                assignedTimes[k] = buckets[i];
                assignedValues[k] = sums[i] / counts[i];
                k++;
            }
        }
        TimeSeriesConverter.Knots assignedKnots = new TimeSeriesConverter.Knots(assignedTimes, assignedValues);

        // 3. One output row per A sample, duplicates included
        long[] ts = a.getTimestamps();
        double[] valuesB = new double[ts.length];
        for (int i = 0; i < ts.length; i++) {
            valuesB[i] = assignedKnots.interpolateClamped(ts[i]);
        }
        return new AlignedData(ts, a.getValues(), valuesB);
    }

    /**
     * Index of the bucket nearest to t; on a tie the earlier bucket.
     */
    static int nearestBucket(long[] buckets, long t) {
        int right = TimeSeriesConverter.lowerBound(buckets, t);
        if (right == 0) return 0;
        if (right == buckets.length) return buckets.length - 1;

        int left = right - 1;
        long distLeft = t - buckets[left];
        long distRight = buckets[right] - t;
        return distLeft <= distRight ? left : right;
    }
}
