package aggregation_functions;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import result_classes.Series;
import util.AnalyzerSettings;
import util.Timescale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class IntegralTest {

    private final Series ramp = new Series(new long[]{1000, 2000}, new double[]{400.0, 401.5}, "Pack Voltage", 1);

    /** Triangle, a jump at 1000 ms and a plateau. */
    private final Series shape = new Series(
            new long[]{0, 1000, 1000, 3000, 4000},
            new double[]{0, 10, 20, 20, 0}, "shape", 2);

    @Test
    void trapezoidOverALinearRamp() {
        assertThat(Integral.integrate(ramp, 1000, 2000, Timescale.SECONDS)).isCloseTo(400.75, within(1e-9));
        assertThat(Integral.integrate(ramp, 1000, 2000, Timescale.MILLISECONDS)).isCloseTo(400750.0, within(1e-6));
    }

    @Test
    void unitDefaultsToTheConfiguredTimescale() {
        Timescale configured = AnalyzerSettings.defaults().timescale;

        assertThat(Integral.integrate(ramp, 1000, 2000))
                .isEqualTo(Integral.integrate(ramp, 1000, 2000, configured))
                .isCloseTo(400.75, within(1e-9));
        assertThat(Integral.integrate(shape)).isCloseTo(55.0, within(1e-9));
        assertThat(Integral.average(shape, 0, 1000)).isEqualTo(Integral.average(shape, 0, 1000, configured));
        assertThat(Integral.cumulative(shape).getValues())
                .containsExactly(Integral.cumulative(shape, configured).getValues());
    }

    @Test
    void boundsAreClippedToTheData() {
        assertThat(Integral.integrate(ramp, 0, -1, Timescale.SECONDS))
                .isCloseTo(Integral.integrate(ramp, 1000, 2000, Timescale.SECONDS), within(1e-12));
        assertThat(Integral.integrate(ramp, 0, 99_999, Timescale.SECONDS)).isCloseTo(400.75, within(1e-9));
    }

    @Test
    void wholeShape() {
        assertThat(Integral.integrate(shape, Timescale.SECONDS)).isCloseTo(55.0, within(1e-9));
    }

    @ParameterizedTest
    @ValueSource(longs = {1, 500, 999, 1000, 1001, 2500, 3000, 3999})
    void isAdditiveAtAnySplit(long split) {
        double whole = Integral.integrate(shape, 0, 4000, Timescale.SECONDS);
        double left = Integral.integrate(shape, 0, split, Timescale.SECONDS);
        double right = Integral.integrate(shape, split, 4000, Timescale.SECONDS);

        assertThat(left + right).isCloseTo(whole, within(1e-9));
    }

    @Test
    void fewerThanTwoSamplesIntegrateToZero() {
        Series single = new Series(new long[]{5}, new double[]{3}, "single", 3);

        assertThat(Integral.integrate(single, 0, -1, Timescale.SECONDS)).isZero();
        assertThat(Integral.integrate(Series.empty("e", 4), 0, -1, Timescale.SECONDS)).isZero();
    }

    @Test
    void emptyRangeIntegratesToZero() {
        assertThat(Integral.integrate(ramp, 5000, 6000, Timescale.SECONDS)).isZero();
        assertThat(Integral.integrate(ramp, 1500, 1500, Timescale.SECONDS)).isZero();
    }

    @Test
    void averageIsTimeWeighted() {
        // two seconds at 20, one second at 0 -> weighted by duration, not by sample count
        Series s = new Series(new long[]{0, 2000, 2000, 3000}, new double[]{20, 20, 0, 0}, "s", 1);

        assertThat(Integral.average(s, Timescale.SECONDS)).isCloseTo(40.0 / 3.0, within(1e-9));
        assertThat(Integral.average(s, Timescale.MILLISECONDS)).isCloseTo(40.0 / 3.0, within(1e-9));
    }

    @Test
    void averageOverAConstantIsTheConstant() {
        Series constant = new Series(new long[]{0, 700, 2000}, new double[]{4, 4, 4}, "c", 1);

        assertThat(Integral.average(constant, 100, 1900, Timescale.SECONDS)).isCloseTo(4.0, within(1e-12));
    }

    @Test
    void zeroElapsedTimeAveragesToZero() {
        assertThat(Integral.average(ramp, 1500, 1500, Timescale.SECONDS)).isZero();
    }

    @Test
    void cumulativeIntegralStartsAtTheSecondSample() {
        Series running = Integral.cumulative(shape, Timescale.SECONDS);

        assertThat(running.getTimestamps()).containsExactly(1000L, 1000L, 3000L, 4000L);
        assertThat(running.getValues()).containsExactly(new double[]{5, 5, 45, 55}, within(1e-9));
    }

    @Test
    void cumulativeSum() {
        assertThat(Integral.cumulativeSum(shape).getValues()).containsExactly(0.0, 10.0, 30.0, 50.0, 50.0);
    }
}
