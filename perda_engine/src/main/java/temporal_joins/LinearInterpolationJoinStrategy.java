package temporal_joins;

/**
 * Outer join with linear interpolation.
 * <p>
 * The shared axis holds every distinct timestamp of either series; each series
 * is linearly interpolated onto it. Grid points outside a series' own time
 * range have no value there (NaN) and are handled by the {@link MissingPolicy},
 * which by default drops them.
 * <p>
 * This is the alignment behind series arithmetic and suits continuous signals
 * such as voltages or temperatures.
 */
public class LinearInterpolationJoinStrategy extends UnionGridJoinStrategy {

    public LinearInterpolationJoinStrategy() {
        this(MissingPolicy.drop());
    }

    public LinearInterpolationJoinStrategy(MissingPolicy missingPolicy) {
        super(missingPolicy);
    }

    @Override
    protected double sample(TimeSeriesConverter.Knots knots, long t) {
        return knots.interpolate(t);
    }
}
