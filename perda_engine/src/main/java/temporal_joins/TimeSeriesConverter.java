package temporal_joins;

import exceptions.EmptySeriesException;
import result_classes.Series;

import java.util.Arrays;

/**
 * Converts series into the lookup structures the join algorithms work on.
 */
public final class TimeSeriesConverter {

    private TimeSeriesConverter() {}

    /**
     * Builds the lookup structure for one series.
     *
     * @throws EmptySeriesException if the series has no samples
     */
    public static Knots knots(Series series) {
        if (series.isEmpty()) {
            throw new EmptySeriesException("Cannot align empty series '" + series.getLabel()
                    + "' (id " + series.getId() + ").");
        }
        return new Knots(series.getTimestamps(), series.getValues());
    }

    /**
     * Sorted union of two timestamp arrays without duplicates.
     */
    public static long[] unionGrid(long[] a, long[] b) {
        long[] merged = new long[a.length + b.length];
        int i = 0, j = 0, k = 0;
        while (i < a.length || j < b.length) {
            long next;
            if (j >= b.length || (i < a.length && a[i] <= b[j])) {
                next = a[i++];
            } else {
                next = b[j++];
            }
            if (k == 0 || merged[k - 1] != next) {
                merged[k++] = next;
            }
        }
        return Arrays.copyOf(merged, k);
    }

    /** Index of the first element {@code >= key}, or {@code xs.length}. */
    static int lowerBound(long[] xs, long key) {
        int lo = 0, hi = xs.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (xs[mid] < key) lo = mid + 1;
            else hi = mid;
        }
        return lo;
    }

    /** Index of the first element {@code > key}, or {@code xs.length}. */
    static int upperBound(long[] xs, long key) {
        int lo = 0, hi = xs.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (xs[mid] <= key) lo = mid + 1;
            else hi = mid;
        }
        return lo;
    }

    /**
     * A series prepared for point lookups.
     * <p>
     * Keeps the raw samples for step lookups and a copy in which samples sharing
     * a timestamp are averaged into one knot, so that linear interpolation is
     * well defined.
     */
    public static final class Knots {

        private final long[] rawTimes;
        private final double[] rawValues;
        private final long[] xs;
        private final double[] ys;

        Knots(long[] timestamps, double[] values) {
            this.rawTimes = timestamps;
            this.rawValues = values;

            long[] x = new long[timestamps.length];
            double[] y = new double[timestamps.length];
            int k = 0;
            int i = 0;
            while (i < timestamps.length) {
                int j = i;
                double sum = 0.0;
                while (j < timestamps.length && timestamps[j] == timestamps[i]) {
                    sum += values[j];
                    j++;
                }
                x[k] = timestamps[i];
                y[k] = sum / (j - i);
                k++;
                i = j;
            }
            this.xs = Arrays.copyOf(x, k);
            this.ys = Arrays.copyOf(y, k);
        }

        public long first() {
            return xs[0];
        }

        public long last() {
            return xs[xs.length - 1];
        }

        /** Distinct timestamps, ascending. */
        public long[] distinctTimes() {
            return xs.clone();
        }

        /**
         * Linear interpolation at {@code t}.
         *
         * @return the interpolated value, or NaN if t lies outside the sampled range
         */
        public double interpolate(long t) {
            if (t < xs[0] || t > xs[xs.length - 1]) {
                return Double.NaN;
            }
            return interpolateClamped(t);
        }

        /**
         * Linear interpolation at {@code t}; beyond either end the boundary value is held.
         */
        public double interpolateClamped(long t) {
            if (t <= xs[0]) return ys[0];
            if (t >= xs[xs.length - 1]) return ys[ys.length - 1];

            int idx = Arrays.binarySearch(xs, t);
            if (idx >= 0) {
                return ys[idx];
            }
            int right = -idx - 1;
            int left = right - 1;

            long x0 = xs[left];
            long x1 = xs[right];
            double y0 = ys[left];
            double y1 = ys[right];

            double ratio = (double) (t - x0) / (double) (x1 - x0);
            return y0 + ratio * (y1 - y0);
        }

        /** Index of the last raw sample at or before t, or -1. */
        public int indexAtOrBefore(long t) {
            return upperBound(rawTimes, t) - 1;
        }

        /** Index of the first raw sample at or after t, or {@link #size()}. */
        public int indexAtOrAfter(long t) {
            return lowerBound(rawTimes, t);
        }

        /**
         * Value of the last sample at or before t ("last observation carried forward").
         *
         * @return the value, or NaN if no sample precedes t
         */
        public double previous(long t) {
            int idx = indexAtOrBefore(t);
            return idx < 0 ? Double.NaN : rawValues[idx];
        }

        /**
         * Value of the first sample at or after t.
         *
         * @return the value, or NaN if no sample follows t
         */
        public double next(long t) {
            int idx = indexAtOrAfter(t);
            return idx >= rawTimes.length ? Double.NaN : rawValues[idx];
        }

        public double rawValue(int index) {
            return rawValues[index];
        }

        public long rawTime(int index) {
            return rawTimes[index];
        }

        public int size() {
            return rawTimes.length;
        }
    }
}
