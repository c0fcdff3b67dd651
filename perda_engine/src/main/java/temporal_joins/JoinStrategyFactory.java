package temporal_joins;

import util.AnalyzerSettings;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;

/**
 * Factory for {@link TemporalJoinStrategy} instances by name.
 * <p>
 * Keeps client code (query handlers, notebooks) independent of the concrete
 * strategy classes.
 */
public final class JoinStrategyFactory {

    private JoinStrategyFactory() {}

    public static TemporalJoinStrategy getStrategy(String strategyName) {
        return getStrategy(strategyName, Collections.emptyMap());
    }

    /**
     * Returns the join strategy for a name (case-insensitive).
     *
     * @param strategyName e.g. "left", "outer", "inner", "forward_fill", "backward_fill"
     * @param params       optional parameters: {@code tolerance} (inner join, ms),
     *                     {@code dropMissing} and {@code fill} (outer joins)
     * @throws IllegalArgumentException if the name is unknown
     */
    public static TemporalJoinStrategy getStrategy(String strategyName, Map<String, Object> params) {
        if (strategyName == null || strategyName.trim().isEmpty()) {
            throw new IllegalArgumentException("Strategy name must not be null or empty.");
        }
        if (params == null) params = Collections.emptyMap();

        AnalyzerSettings defaults = AnalyzerSettings.defaults();

        switch (strategyName.toLowerCase(Locale.ROOT).trim()) {
            case "left":
                return new LeftJoinStrategy();

            case "outer":
            case "linear":
            case "interpolate":
                return new LinearInterpolationJoinStrategy(missingPolicy(params, defaults));

            case "inner":
                return new InnerJoinStrategy(number(params, "tolerance", defaults.innerJoinTolerance));

            case "forward_fill":
            case "locf":
            case "prev":
                return new ForwardFillJoinStrategy(missingPolicy(params, defaults));

            case "backward_fill":
            case "next":
                return new BackwardFillJoinStrategy(missingPolicy(params, defaults));

            default:
                throw new IllegalArgumentException("Unknown temporal join strategy: " + strategyName);
        }
    }

    private static MissingPolicy missingPolicy(Map<String, Object> params, AnalyzerSettings defaults) {
        if (flag(params, "dropMissing", true)) {
            return MissingPolicy.drop();
        }
        return MissingPolicy.fill(number(params, "fill", defaults.outerFill));
    }

    private static double number(Map<String, Object> params, String key, double fallback) {
        Object value = params.get(key);
        if (value == null) {
            return fallback;
        }
        if (!(value instanceof Number)) {
            throw new IllegalArgumentException("Parameter '" + key + "' must be a number, got "
                    + value.getClass().getSimpleName() + " '" + value + "'.");
        }
        return ((Number) value).doubleValue();
    }

    private static boolean flag(Map<String, Object> params, String key, boolean fallback) {
        Object value = params.get(key);
        if (value == null) {
            return fallback;
        }
        if (!(value instanceof Boolean)) {
            throw new IllegalArgumentException("Parameter '" + key + "' must be a boolean, got "
                    + value.getClass().getSimpleName() + " '" + value + "'.");
        }
        return (Boolean) value;
    }
}
