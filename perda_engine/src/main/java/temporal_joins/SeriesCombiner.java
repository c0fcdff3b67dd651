package temporal_joins;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import result_classes.Quotient;
import result_classes.Series;

import java.util.Arrays;
import java.util.Objects;
import java.util.function.DoubleBinaryOperator;

/**
 * Applies an element-wise binary operation to two series after aligning them
 * with a {@link TemporalJoinStrategy}. The result keeps the left operand's
 * label and id.
 */
public final class SeriesCombiner {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesCombiner.class);

    private static final TemporalJoinStrategy DEFAULT_ALIGNMENT = new LinearInterpolationJoinStrategy();

    private SeriesCombiner() {}

    public static Series combine(Series a, Series b, DoubleBinaryOperator op) {
        return combine(a, b, op, DEFAULT_ALIGNMENT);
    }

    public static Series combine(Series a, Series b, DoubleBinaryOperator op, TemporalJoinStrategy alignment) {
        Objects.requireNonNull(op, "op must not be null.");
        Objects.requireNonNull(alignment, "alignment must not be null.");

        AlignedData aligned = alignment.align(a, b);
        double[] result = new double[aligned.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = op.applyAsDouble(aligned.valuesA[i], aligned.valuesB[i]);
        }
        return new Series(aligned.timestamps, result, a.getLabel(), a.getId());
    }

    public static Quotient divide(Series a, Series b) {
        return divide(a, b, DEFAULT_ALIGNMENT);
    }

    /**
     * Divides a by b. Rows whose aligned divisor is exactly zero are marked NaN
     * instead of being divided, then removed; their number is reported.
     */
    public static Quotient divide(Series a, Series b, TemporalJoinStrategy alignment) {
        AlignedData aligned = alignment.align(a, b);

        double[] quotient = new double[aligned.size()];
        int zeroCount = 0;
        for (int i = 0; i < quotient.length; i++) {
            double divisor = aligned.valuesB[i];
            if (divisor == 0.0) {
                quotient[i] = Double.NaN;
                zeroCount++;
            } else {
                quotient[i] = aligned.valuesA[i] / divisor;
            }
        }

        if (zeroCount == 0) {
            return new Quotient(new Series(aligned.timestamps, quotient, a.getLabel(), a.getId()), 0);
        }

        LOG.warn("{} divide-by-zero occurrence(s) dividing '{}' by '{}' (excluded from result)",
                zeroCount, a.getLabel(), b.getLabel());

        long[] ts = new long[quotient.length - zeroCount];
        double[] values = new double[ts.length];
        int k = 0;
        for (int i = 0; i < quotient.length; i++) {
            if (aligned.valuesB[i] != 0.0) {
                ts[k] = aligned.timestamps[i];
                values[k] = quotient[i];
                k++;
            }
        }
        return new Quotient(new Series(Arrays.copyOf(ts, k), Arrays.copyOf(values, k), a.getLabel(), a.getId()),
                zeroCount);
    }
}
