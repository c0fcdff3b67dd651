package temporal_joins;

import result_classes.Series;

/**
 * Strategy interface for temporal joins.
 * <p>
 * Each implementation is one way of bringing two series, sampled at different
 * and irregular instants, onto a common time axis.
 */
public interface TemporalJoinStrategy {

    /**
     * Aligns two series in time.
     *
     * @param a the first (left) series
     * @param b the second (right) series
     * @return the shared axis with the aligned values of both series
     * @throws exceptions.EmptySeriesException if either series has no samples
     */
    AlignedData align(Series a, Series b);
}
