package temporal_joins;

/**
 * What a union-grid join does with grid points where one side has no value
 * (outside its native time range): drop the row, or put a constant there.
 */
public final class MissingPolicy {

    private static final MissingPolicy DROP = new MissingPolicy(true, Double.NaN);

    private final boolean drop;
    private final double fillValue;

    private MissingPolicy(boolean drop, double fillValue) {
        this.drop = drop;
        this.fillValue = fillValue;
    }

    public static MissingPolicy drop() {
        return DROP;
    }

    public static MissingPolicy fill(double fillValue) {
        return new MissingPolicy(false, fillValue);
    }

    public boolean isDrop() {
        return drop;
    }

    public double fillValue() {
        return fillValue;
    }

    @Override
    public String toString() {
        return drop ? "MissingPolicy[drop]" : "MissingPolicy[fill=" + fillValue + "]";
    }
}
