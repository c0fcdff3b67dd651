package temporal_joins;

/**
 * Outer join that takes, for every grid point, the next sample at or after it.
 * Grid points after a series' last sample have no value there.
 */
public class BackwardFillJoinStrategy extends UnionGridJoinStrategy {

    public BackwardFillJoinStrategy() {
        this(MissingPolicy.drop());
    }

    public BackwardFillJoinStrategy(MissingPolicy missingPolicy) {
        super(missingPolicy);
    }

    @Override
    protected double sample(TimeSeriesConverter.Knots knots, long t) {
        return knots.next(t);
    }
}
