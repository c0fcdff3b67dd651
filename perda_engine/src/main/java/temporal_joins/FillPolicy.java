package temporal_joins;

import java.util.Locale;

/**
 * How a value is produced at an instant where a series has no sample of its own.
 * A policy that needs a neighbour on one side falls back to the other side when
 * there is none.
 */
public enum FillPolicy {

    /** Linear interpolation between the nearest samples before and after. */
    CONNECT("connect") {
        @Override
        public double valueAt(TimeSeriesConverter.Knots knots, long t) {
            return knots.interpolateClamped(t);
        }
    },

    /** Value of the previous sample. */
    EXTEND_FORWARD("extend_forward") {
        @Override
        public double valueAt(TimeSeriesConverter.Knots knots, long t) {
            int idx = knots.indexAtOrBefore(t);
            if (idx < 0) {
                idx = knots.indexAtOrAfter(t);
            }
            return knots.rawValue(idx);
        }
    },

    /** Value of the next sample. */
    EXTEND_BACK("extend_back") {
        @Override
        public double valueAt(TimeSeriesConverter.Knots knots, long t) {
            int idx = knots.indexAtOrAfter(t);
            if (idx >= knots.size()) {
                idx = knots.indexAtOrBefore(t);
            }
            return knots.rawValue(idx);
        }
    };

    private final String key;

    FillPolicy(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public abstract double valueAt(TimeSeriesConverter.Knots knots, long t);

    public static FillPolicy parse(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Fill policy must not be null.");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (FillPolicy policy : values()) {
            if (policy.key.equals(normalized)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown fill policy: " + name
                + " (expected connect, extend_forward or extend_back)");
    }
}
