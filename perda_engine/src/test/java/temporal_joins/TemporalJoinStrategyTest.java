package temporal_joins;

import exceptions.EmptySeriesException;
import org.junit.jupiter.api.Test;
import result_classes.Series;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TemporalJoinStrategyTest {

    private static Series series(String label, long[] ts, double... vs) {
        return new Series(ts, vs, label, label.hashCode());
    }

    // ---------- outer ----------

    @Test
    void outerSelfJoinIsIdentity() {
        Series a = series("a", new long[]{0, 7, 10, 31}, 1.0, -2.0, 3.5, 8.0);

        AlignedData aligned = new LinearInterpolationJoinStrategy().align(a, a);

        assertThat(aligned.timestamps).containsExactly(a.getTimestamps());
        assertThat(aligned.valuesA).containsExactly(a.getValues());
        assertThat(aligned.valuesB).containsExactly(a.getValues());
    }

    @Test
    void outerJoinDropsRowsOutsideEitherRange() {
        Series a = series("a", new long[]{0, 10, 20}, 0, 10, 20);
        Series b = series("b", new long[]{5, 15, 25}, 1, 2, 3);

        AlignedData aligned = new LinearInterpolationJoinStrategy().align(a, b);

        assertThat(aligned.timestamps).containsExactly(5L, 10L, 15L, 20L);
        assertThat(aligned.valuesA).containsExactly(new double[]{5, 10, 15, 20}, within(1e-12));
        assertThat(aligned.valuesB).containsExactly(new double[]{1, 1.5, 2, 2.5}, within(1e-12));
    }

    @Test
    void alignedSidesKeepTheirIdentity() {
        Series a = series("a", new long[]{0, 10}, 1, 2);
        Series b = series("b", new long[]{0, 10}, 3, 4);

        AlignedData aligned = new LinearInterpolationJoinStrategy().align(a, b);

        assertThat(aligned.seriesA(a)).isEqualTo(a);
        assertThat(aligned.seriesB(b).getLabel()).isEqualTo("b");
        assertThat(aligned.seriesB(b).getValues()).containsExactly(3.0, 4.0);
    }

    @Test
    void outerJoinCanFillMissingRows() {
        Series a = series("a", new long[]{0, 10, 20}, 0, 10, 20);
        Series b = series("b", new long[]{5, 15, 25}, 1, 2, 3);

        AlignedData aligned = new LinearInterpolationJoinStrategy(MissingPolicy.fill(-1)).align(a, b);

        assertThat(aligned.timestamps).containsExactly(0L, 5L, 10L, 15L, 20L, 25L);
        assertThat(aligned.valuesA[5]).isEqualTo(-1.0);
        assertThat(aligned.valuesB[0]).isEqualTo(-1.0);
    }

    @Test
    void outerJoinAveragesDuplicateTimestamps() {
        Series a = series("a", new long[]{0, 10, 10, 20}, 0, 8, 12, 20);

        AlignedData aligned = new LinearInterpolationJoinStrategy().align(a, a);

        assertThat(aligned.timestamps).containsExactly(0L, 10L, 20L);
        assertThat(aligned.valuesA[1]).isEqualTo(10.0);
    }

    @Test
    void forwardFillCarriesThePreviousSample() {
        Series a = series("a", new long[]{0, 10, 20}, 1, 2, 3);
        Series b = series("b", new long[]{5, 15}, 10, 20);

        AlignedData aligned = new ForwardFillJoinStrategy().align(a, b);

        assertThat(aligned.timestamps).containsExactly(5L, 10L, 15L, 20L);
        assertThat(aligned.valuesA).containsExactly(1.0, 2.0, 2.0, 3.0);
        assertThat(aligned.valuesB).containsExactly(10.0, 10.0, 20.0, 20.0);
    }

    @Test
    void backwardFillTakesTheNextSample() {
        Series a = series("a", new long[]{0, 10, 20}, 1, 2, 3);
        Series b = series("b", new long[]{5, 15}, 10, 20);

        AlignedData aligned = new BackwardFillJoinStrategy().align(a, b);

        assertThat(aligned.timestamps).containsExactly(0L, 5L, 10L, 15L);
        assertThat(aligned.valuesA).containsExactly(1.0, 2.0, 2.0, 3.0);
        assertThat(aligned.valuesB).containsExactly(10.0, 10.0, 20.0, 20.0);
    }

    // ---------- left ----------

    @Test
    void leftJoinKeepsTheShapeOfA() {
        Series a = series("a", new long[]{0, 10, 20, 30}, 1, 2, 3, 4);
        Series b = series("b", new long[]{4, 6, 26}, 1, 3, 5);

        AlignedData aligned = new LeftJoinStrategy().align(a, b);

        assertThat(aligned.timestamps).containsExactly(a.getTimestamps());
        assertThat(aligned.valuesA).containsExactly(a.getValues());
        assertThat(aligned.valuesB).containsExactly(new double[]{1, 3, 4, 5}, within(1e-12));
    }

    @Test
    void leftJoinAveragesSamplesSharingATarget() {
        Series a = series("a", new long[]{0, 10}, 0, 0);
        Series b = series("b", new long[]{1, 2}, 2, 4);

        AlignedData aligned = new LeftJoinStrategy().align(a, b);

        assertThat(aligned.valuesB).containsExactly(3.0, 3.0);
    }

    @Test
    void leftJoinOutputLengthMatchesAWithDuplicates() {
        Series a = series("a", new long[]{0, 0, 10}, 1, 2, 3);
        Series b = series("b", new long[]{0, 10}, 5, 7);

        AlignedData aligned = new LeftJoinStrategy().align(a, b);

        assertThat(aligned.size()).isEqualTo(3);
        assertThat(aligned.valuesB).containsExactly(5.0, 5.0, 7.0);
    }

    @Test
    void equidistantSampleGoesToTheEarlierTimestamp() {
        assertThat(LeftJoinStrategy.nearestBucket(new long[]{0, 10}, 5)).isZero();
        assertThat(LeftJoinStrategy.nearestBucket(new long[]{0, 10}, 6)).isEqualTo(1);
        assertThat(LeftJoinStrategy.nearestBucket(new long[]{0, 10}, -3)).isZero();
        assertThat(LeftJoinStrategy.nearestBucket(new long[]{0, 10}, 50)).isEqualTo(1);

        Series a = series("a", new long[]{0, 10, 20}, 0, 0, 0);
        Series b = series("b", new long[]{5, 20}, 1, 9);
        assertThat(new LeftJoinStrategy().align(a, b).valuesB).containsExactly(new double[]{1, 5, 9}, within(1e-12));
    }

    // ---------- inner ----------

    @Test
    void innerJoinToleranceIsInclusive() {
        Series a = series("a", new long[]{0, 10, 20}, 1, 2, 3);
        Series b = series("b", new long[]{1, 9, 22}, 10, 20, 30);

        AlignedData loose = new InnerJoinStrategy(2).align(a, b);
        AlignedData tight = new InnerJoinStrategy(1).align(a, b);

        // t=20 is exactly 2 ms from its nearest B sample
        assertThat(loose.timestamps).containsExactly(0L, 10L, 20L);
        assertThat(loose.valuesB).containsExactly(10.0, 20.0, 30.0);
        assertThat(tight.timestamps).containsExactly(0L, 10L);
        assertThat(tight.valuesA).containsExactly(1.0, 2.0);
        assertThat(tight.valuesB).containsExactly(10.0, 20.0);
    }

    @Test
    void innerJoinPrefersTheEarlierOfTwoEquidistantMatches() {
        Series a = series("a", new long[]{10}, 1);
        Series b = series("b", new long[]{8, 12}, 1, 3);

        AlignedData aligned = new InnerJoinStrategy(2).align(a, b);

        assertThat(aligned.valuesB).containsExactly(1.0);
    }

    @Test
    void innerJoinAveragesDuplicatesAtTheMatchedTimestamp() {
        Series a = series("a", new long[]{10, 20}, 1, 2);
        Series b = series("b", new long[]{8, 8, 12, 19, 21, 21}, 1, 5, 100, 4, 6, 8);

        AlignedData aligned = new InnerJoinStrategy(2).align(a, b);

        assertThat(aligned.timestamps).containsExactly(10L, 20L);
        assertThat(aligned.valuesB).containsExactly(3.0, 4.0);
    }

    @Test
    void innerJoinNeverGrowsBeyondA() {
        Series a = series("a", new long[]{0, 100, 200}, 1, 2, 3);
        Series b = series("b", new long[]{0, 1, 2, 3, 4, 100, 199, 200, 201}, 1, 1, 1, 1, 1, 1, 1, 1, 1);

        AlignedData aligned = new InnerJoinStrategy(0).align(a, b);

        assertThat(aligned.size()).isEqualTo(3);
    }

    @Test
    void innerJoinRejectsNegativeTolerance() {
        assertThatThrownBy(() -> new InnerJoinStrategy(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void emptyInputIsAnError() {
        Series a = series("a", new long[]{0}, 1);
        Series empty = Series.empty("empty", 3);

        assertThatThrownBy(() -> new LeftJoinStrategy().align(a, empty)).isInstanceOf(EmptySeriesException.class);
        assertThatThrownBy(() -> new LinearInterpolationJoinStrategy().align(empty, a))
                .isInstanceOf(EmptySeriesException.class);
        assertThatThrownBy(() -> new InnerJoinStrategy(1).align(a, empty)).isInstanceOf(EmptySeriesException.class);
    }
}
