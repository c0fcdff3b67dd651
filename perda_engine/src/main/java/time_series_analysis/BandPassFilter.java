package time_series_analysis;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import result_classes.Series;
import temporal_joins.FillPolicy;

import java.util.Arrays;
import java.util.Objects;

/**
 * FFT band-pass (or band-stop) filter.
 * <p>
 * The series is resampled onto a uniform grid, transformed at its own length, every bin outside
 * {@code [lower, upper]} Hz is zeroed and the result is transformed back. The
 * returned series lives on the resampled grid.
 * <pre>
 * Series smooth = new BandPassFilter().upper(5.0).lower(0.0).apply(current);
 * </pre>
 */
public class BandPassFilter {

    private static final Logger LOG = LoggerFactory.getLogger(BandPassFilter.class);

    /** Marks an open upper edge. */
    public static final double NO_UPPER = -1.0;

    private double lower = Double.NaN;
    private double upper = NO_UPPER;
    private double sampleRate = Double.NaN;
    private FillPolicy fillPolicy = FillPolicy.CONNECT;
    private boolean stopBand;

    /** Lower edge in Hz. Defaults to a third of the sample rate. */
    public BandPassFilter lower(double hz) {
        if (!(hz >= 0)) {
            throw new IllegalArgumentException("lower must be >= 0, got " + hz + ".");
        }
        this.lower = hz;
        return this;
    }

    /** Upper edge in Hz, {@link #NO_UPPER} for none. */
    public BandPassFilter upper(double hz) {
        if (hz != NO_UPPER && !(hz >= 0)) {
            throw new IllegalArgumentException("upper must be >= 0 or -1, got " + hz + ".");
        }
        this.upper = hz;
        return this;
    }

    /** Resampling rate in Hz. Estimated from the data when not set. */
    public BandPassFilter sampleRate(double hz) {
        if (!(hz > 0) || Double.isInfinite(hz)) {
            throw new IllegalArgumentException("sampleRate must be a positive number, got " + hz + ".");
        }
        this.sampleRate = hz;
        return this;
    }

    public BandPassFilter fillPolicy(FillPolicy policy) {
        this.fillPolicy = Objects.requireNonNull(policy, "policy must not be null.");
        return this;
    }

    /** Removes the band instead of keeping it. */
    public BandPassFilter stopBand(boolean stop) {
        this.stopBand = stop;
        return this;
    }

    /**
     * One-shot variant. {@code lower < 0} and {@code sampleRate <= 0} select the defaults.
     */
    public static Series apply(Series series, double lower, double upper, double sampleRate, FillPolicy policy) {
        BandPassFilter filter = new BandPassFilter().upper(upper < 0 ? NO_UPPER : upper).fillPolicy(policy);
        if (lower >= 0) filter.lower(lower);
        if (sampleRate > 0) filter.sampleRate(sampleRate);
        return filter.apply(series);
    }

    public Series apply(Series series) {
        double fs = Double.isNaN(sampleRate) ? UniformResampler.estimateSampleRate(series) : sampleRate;
        double lo = Double.isNaN(lower) ? fs / 3.0 : lower;

        Series uniform = UniformResampler.resample(series, fs, fillPolicy);
        double[] signal = uniform.getValues();
        int n = signal.length;

        Complex[] spectrum = dft(toComplex(signal), false);

        int zeroed = 0;
        for (int k = 0; k < n; k++) {
            double freq = Math.min(k, n - k) * fs / n;
            boolean inBand = freq >= lo && (upper == NO_UPPER || freq <= upper);
            if (inBand == stopBand) {
                spectrum[k] = Complex.ZERO;
                zeroed++;
            }
        }
        LOG.debug("Filtered '{}': fs={} Hz, band [{}, {}] Hz{}, {} of {} bins zeroed", series.getLabel(), fs, lo,
                upper == NO_UPPER ? "inf" : upper, stopBand ? " (stop)" : "", zeroed, n);

        Complex[] restored = dft(spectrum, true);
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = restored[i].getReal();
        }
        return uniform.withValues(out);
    }

    private static Complex[] toComplex(double[] values) {
        Complex[] out = new Complex[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = new Complex(values[i], 0.0);
        }
        return out;
    }

    /**
     * Discrete Fourier transform of any length. Powers of two go straight to the
     * radix-2 FFT, every other length through Bluestein's chirp-z convolution.
     * The inverse is scaled by {@code 1/n}.
     */
    static Complex[] dft(Complex[] x, boolean inverse) {
        int n = x.length;
        if (n == 0) {
            return new Complex[0];
        }
        FastFourierTransformer fft = new FastFourierTransformer(DftNormalization.STANDARD);
        if (Integer.bitCount(n) == 1) {
            return fft.transform(x, inverse ? TransformType.INVERSE : TransformType.FORWARD);
        }
        if (inverse) {
            // x = conj(DFT(conj(X))) / n
            Complex[] conj = new Complex[n];
            for (int i = 0; i < n; i++) conj[i] = x[i].conjugate();
            Complex[] forward = dft(conj, false);
            for (int i = 0; i < n; i++) forward[i] = forward[i].conjugate().divide(n);
            return forward;
        }

        int m = Integer.highestOneBit(2 * n - 1);
        if (m < 2 * n - 1) m <<= 1;

        // chirp[j] = exp(-i*pi*j^2/n), j^2 taken mod 2n to keep the angle small
        Complex[] chirp = new Complex[n];
        for (int j = 0; j < n; j++) {
            long sq = ((long) j * j) % (2L * n);
            double angle = -Math.PI * sq / n;
            chirp[j] = new Complex(Math.cos(angle), Math.sin(angle));
        }

        Complex[] a = new Complex[m];
        Complex[] b = new Complex[m];
        Arrays.fill(a, Complex.ZERO);
        Arrays.fill(b, Complex.ZERO);
        for (int j = 0; j < n; j++) {
            a[j] = x[j].multiply(chirp[j]);
        }
        b[0] = chirp[0].conjugate();
        for (int j = 1; j < n; j++) {
            b[j] = chirp[j].conjugate();
            b[m - j] = chirp[j].conjugate();
        }

        Complex[] fa = fft.transform(a, TransformType.FORWARD);
        Complex[] fb = fft.transform(b, TransformType.FORWARD);
        for (int j = 0; j < m; j++) {
            fa[j] = fa[j].multiply(fb[j]);
        }
        Complex[] conv = fft.transform(fa, TransformType.INVERSE);

        Complex[] out = new Complex[n];
        for (int k = 0; k < n; k++) {
            out[k] = conv[k].multiply(chirp[k]);
        }
        return out;
    }
}
