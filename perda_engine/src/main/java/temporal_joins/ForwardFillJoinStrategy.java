package temporal_joins;

/**
 * Outer join with "last observation carried forward".
 * <p>
 * Produces a step function: a value holds until the series has a new sample.
 * Grid points before a series' first sample have no value there.
 * <p>
 * Suits discrete, state-like signals (contactor states, fault flags).
 */
public class ForwardFillJoinStrategy extends UnionGridJoinStrategy {

    public ForwardFillJoinStrategy() {
        this(MissingPolicy.drop());
    }

    public ForwardFillJoinStrategy(MissingPolicy missingPolicy) {
        super(missingPolicy);
    }

    @Override
    protected double sample(TimeSeriesConverter.Knots knots, long t) {
        return knots.previous(t);
    }
}
