package temporal_joins;

import result_classes.Series;

import java.util.Objects;

/**
 * Result of a temporal join: one shared time axis and, for each of the two
 * input series, its value at every point of that axis.
 */
public final class AlignedData {

    public final long[] timestamps;
    public final double[] valuesA;
    public final double[] valuesB;

    /**
     * @param timestamps the shared time axis, non-decreasing
     * @param valuesA    aligned values of series A
     * @param valuesB    aligned values of series B
     */
    public AlignedData(long[] timestamps, double[] valuesA, double[] valuesB) {
        this.timestamps = Objects.requireNonNull(timestamps, "timestamps must not be null.");
        this.valuesA = Objects.requireNonNull(valuesA, "valuesA must not be null.");
        this.valuesB = Objects.requireNonNull(valuesB, "valuesB must not be null.");

        if (valuesA.length != valuesB.length || valuesA.length != timestamps.length) {
            throw new IllegalArgumentException("timestamps and both value arrays must have the same length.");
        }
    }

    public int size() {
        return timestamps.length;
    }

    public boolean isEmpty() {
        return timestamps.length == 0;
    }

    /** Series A on the shared axis, keeping A's label and id. */
    public Series seriesA(Series a) {
        return new Series(timestamps, valuesA, a.getLabel(), a.getId());
    }

    /** Series B on the shared axis, keeping B's label and id. */
    public Series seriesB(Series b) {
        return new Series(timestamps, valuesB, b.getLabel(), b.getId());
    }
}
