package time_series_analysis;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import result_classes.Series;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutlierDetectionTest {

    private static Series withSpikeAt(int n, int spikeIndex, double spike) {
        long[] ts = new long[n];
        double[] vs = new double[n];
        for (int i = 0; i < n; i++) {
            ts[i] = i * 100L;
            vs[i] = 1.0;
        }
        vs[spikeIndex] = spike;
        return new Series(ts, vs, "Cell Temp", 5);
    }

    @Test
    void replaceSubstitutesTheWindowMedian() {
        Series input = withSpikeAt(21, 10, 100.0);

        Series cleaned = OutlierDetection.filter(input, OutlierDetection.Mode.REPLACE);

        double[] expected = new double[21];
        Arrays.fill(expected, 1.0);
        assertThat(cleaned.getValues()).containsExactly(expected);
        assertThat(cleaned.getTimestamps()).containsExactly(input.getTimestamps());
        assertThat(cleaned.isOutlierFiltered()).isFalse();
    }

    @Test
    void dropRemovesTheSpikeAndMarksTheResult() {
        Series input = withSpikeAt(21, 10, 100.0);

        Series dropped = OutlierDetection.filter(input, OutlierDetection.Mode.DROP);

        assertThat(dropped.size()).isEqualTo(20);
        assertThat(dropped.getTimestamps()).doesNotContain(1000L);
        assertThat(dropped.isOutlierFiltered()).isTrue();
    }

    @Test
    void dropOnFilteredDataReturnsItUnchanged() {
        Series once = OutlierDetection.filter(withSpikeAt(21, 10, 100.0), OutlierDetection.Mode.DROP);

        assertThat(OutlierDetection.filter(once, OutlierDetection.Mode.DROP)).isSameAs(once);
    }

    @Test
    void neverAddsSamples() {
        double[] noisy = {3, 4, 2, 50, 3, 5, 4, -40, 3, 4, 3, 2, 5, 4, 3};
        long[] ts = new long[noisy.length];
        for (int i = 0; i < ts.length; i++) ts[i] = i;
        Series input = new Series(ts, noisy, "noisy", 1);

        Series dropped = OutlierDetection.filter(input, OutlierDetection.Mode.DROP);

        assertThat(dropped.size()).isLessThanOrEqualTo(input.size());
        assertThat(dropped.getValues()).doesNotContain(50.0, -40.0);
    }

    @Test
    void edgeSamplesUseTheFirstAndLastWindow() {
        Series leading = withSpikeAt(7, 0, 100.0);
        Series trailing = withSpikeAt(7, 6, -100.0);

        assertThat(OutlierDetection.filter(leading, OutlierDetection.Mode.DROP).getTimestamps()).doesNotContain(0L);
        assertThat(OutlierDetection.filter(trailing, OutlierDetection.Mode.DROP).getTimestamps()).doesNotContain(600L);
    }

    @Test
    void cleanDataIsUntouched() {
        Series ramp = new Series(new long[]{0, 1, 2, 3, 4, 5, 6}, new double[]{0, 1, 2, 3, 4, 5, 6}, "ramp", 1);

        assertThat(OutlierDetection.filter(ramp, OutlierDetection.Mode.DROP).size()).isEqualTo(7);
    }

    @ParameterizedTest
    @CsvSource({
            "21, 0, 5",
            "100, 0, 11",
            "4, 0, 3",
            "3, 0, 3",
            "50, 6, 7",
            "5, 9, 5"
    })
    void windowIsOddAndCapped(int n, int requested, int expected) {
        assertThat(OutlierDetection.effectiveWindow(n, requested)).isEqualTo(expected);
    }

    @Test
    void rejectsNegativeWindow() {
        assertThatThrownBy(() -> OutlierDetection.filter(withSpikeAt(5, 0, 1), OutlierDetection.Mode.DROP, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
