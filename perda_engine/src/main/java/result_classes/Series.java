package result_classes;

import exceptions.EmptySeriesException;
import temporal_joins.SeriesCombiner;

import java.util.Arrays;
import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

/**
 * One signal from a telemetry log: timestamps in milliseconds with one value each.
 * <p>
 * Timestamps are non-decreasing (duplicates allowed) and non-negative. Both
 * arrays are copied on the way in and on the way out, so an instance never
 * changes after construction; every transformation builds a new one.
 */
public final class Series {

    private final long[] timestamps;
    private final double[] values;
    private final String label;
    private final int id;
    private final boolean outlierFiltered;

    public Series(long[] timestamps, double[] values, String label, int id) {
        this(timestamps, values, label, id, false);
    }

    public Series(long[] timestamps, double[] values, String label, int id, boolean outlierFiltered) {
        Objects.requireNonNull(timestamps, "timestamps must not be null.");
        Objects.requireNonNull(values, "values must not be null.");
        if (timestamps.length != values.length) {
            throw new IllegalArgumentException("timestamps and values must have the same length ("
                    + timestamps.length + " != " + values.length + ").");
        }
        if (timestamps.length > 0 && timestamps[0] < 0) {
            throw new IllegalArgumentException("timestamps must be non-negative, got " + timestamps[0] + ".");
        }
        for (int i = 1; i < timestamps.length; i++) {
            if (timestamps[i] < timestamps[i - 1]) {
                throw new IllegalArgumentException("timestamps cannot be decreasing (index " + i + ": "
                        + timestamps[i - 1] + " -> " + timestamps[i] + ").");
            }
        }
        this.timestamps = timestamps.clone();
        this.values = values.clone();
        this.label = label == null ? "" : label;
        this.id = id;
        this.outlierFiltered = outlierFiltered;
    }

    public static Series empty(String label, int id) {
        return new Series(new long[0], new double[0], label, id);
    }

    public long[] getTimestamps() {
        return timestamps.clone();
    }

    public double[] getValues() {
        return values.clone();
    }

    public long timestampAt(int index) {
        return timestamps[index];
    }

    public double valueAt(int index) {
        return values[index];
    }

    public String getLabel() {
        return label;
    }

    public int getId() {
        return id;
    }

    /** True for the output of a drop-mode outlier pass. */
    public boolean isOutlierFiltered() {
        return outlierFiltered;
    }

    public int size() {
        return timestamps.length;
    }

    public boolean isEmpty() {
        return timestamps.length == 0;
    }

    public long firstTimestamp() {
        requireNonEmpty();
        return timestamps[0];
    }

    public long lastTimestamp() {
        requireNonEmpty();
        return timestamps[timestamps.length - 1];
    }

    public Series withValues(double[] newValues) {
        return new Series(timestamps, newValues, label, id);
    }

    public Series withLabel(String newLabel) {
        return new Series(timestamps, values, newLabel, id, outlierFiltered);
    }

    // ---------- arithmetic against another series (outer join, interpolated) ----------

    public Series add(Series other) {
        return SeriesCombiner.combine(this, other, Double::sum);
    }

    public Series subtract(Series other) {
        return SeriesCombiner.combine(this, other, (a, b) -> a - b);
    }

    public Series multiply(Series other) {
        return SeriesCombiner.combine(this, other, (a, b) -> a * b);
    }

    /**
     * Divides by another series. Aligned zero divisors are not evaluated; those
     * rows are left out of the result and counted in the returned {@link Quotient}.
     */
    public Quotient divide(Series other) {
        return SeriesCombiner.divide(this, other);
    }

    public Series pow(Series other) {
        return SeriesCombiner.combine(this, other, Math::pow);
    }

    // ---------- arithmetic against a scalar ----------

    public Series add(double scalar) {
        return mapValues(v -> v + scalar);
    }

    public Series subtract(double scalar) {
        return mapValues(v -> v - scalar);
    }

    public Series multiply(double scalar) {
        return mapValues(v -> v * scalar);
    }

    public Series divide(double scalar) {
        return mapValues(v -> v / scalar);
    }

    public Series pow(double exponent) {
        return mapValues(v -> Math.pow(v, exponent));
    }

    public Series negate() {
        return mapValues(v -> -v);
    }

    private Series mapValues(DoubleUnaryOperator op) {
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = op.applyAsDouble(values[i]);
        }
        return new Series(timestamps, result, label, id);
    }

    private void requireNonEmpty() {
        if (timestamps.length == 0) {
            throw new EmptySeriesException("Series '" + label + "' (id " + id + ") is empty.");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Series)) return false;
        Series other = (Series) o;
        return id == other.id
                && outlierFiltered == other.outlierFiltered
                && label.equals(other.label)
                && Arrays.equals(timestamps, other.timestamps)
                && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(label, id, outlierFiltered);
        result = 31 * result + Arrays.hashCode(timestamps);
        result = 31 * result + Arrays.hashCode(values);
        return result;
    }

    @Override
    public String toString() {
        if (timestamps.length == 0) {
            return "Series[" + label + " | id " + id + " | empty]";
        }
        return "Series[" + label + " | id " + id + " | " + timestamps.length + " points, "
                + timestamps[0] + " -> " + timestamps[timestamps.length - 1] + " ms]";
    }
}
