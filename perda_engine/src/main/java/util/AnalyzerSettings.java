package util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tunables of the analyzer.
 * <p>
 * The defaults come from {@code analyzer-settings.json} on the classpath. A
 * settings file or a {@code params} map can override single keys; keys that
 * are not given keep their current value.
 */
public final class AnalyzerSettings {

    public static final String RESOURCE = "analyzer-settings.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final AnalyzerSettings DEFAULTS = loadDefaults();

    /** Parse aborts once more than this many malformed lines were seen; {@code <= 0} is unlimited. */
    @JsonProperty("maxErrors")
    public final int maxErrors;

    /** Lines between two progress callbacks of the parser. */
    @JsonProperty("progressInterval")
    public final int progressInterval;

    @JsonProperty("timescale")
    public final Timescale timescale;

    /** Sliding-window width of the outlier filter; {@code 0} picks it from the series length. */
    @JsonProperty("outlierWindow")
    public final int outlierWindow;

    @JsonProperty("iqrMultiplier")
    public final double iqrMultiplier;

    /** Inner join tolerance in milliseconds. */
    @JsonProperty("innerJoinTolerance")
    public final double innerJoinTolerance;

    /** Fill value of outer joins that keep missing rows. */
    @JsonProperty("outerFill")
    public final double outerFill;

    @JsonCreator
    public AnalyzerSettings(@JsonProperty("maxErrors") Integer maxErrors,
                            @JsonProperty("progressInterval") Integer progressInterval,
                            @JsonProperty("timescale") Timescale timescale,
                            @JsonProperty("outlierWindow") Integer outlierWindow,
                            @JsonProperty("iqrMultiplier") Double iqrMultiplier,
                            @JsonProperty("innerJoinTolerance") Double innerJoinTolerance,
                            @JsonProperty("outerFill") Double outerFill) {
        this.maxErrors = maxErrors != null ? maxErrors : 100;
        this.progressInterval = progressInterval != null ? progressInterval : 100_000;
        this.timescale = timescale != null ? timescale : Timescale.SECONDS;
        this.outlierWindow = outlierWindow != null ? outlierWindow : 0;
        this.iqrMultiplier = iqrMultiplier != null ? iqrMultiplier : 1.5;
        this.innerJoinTolerance = innerJoinTolerance != null ? innerJoinTolerance : 0.0;
        this.outerFill = outerFill != null ? outerFill : 0.0;

        if (this.progressInterval <= 0) {
            throw new IllegalArgumentException("progressInterval must be > 0, got " + this.progressInterval + ".");
        }
        if (this.outlierWindow < 0) {
            throw new IllegalArgumentException("outlierWindow must be >= 0, got " + this.outlierWindow + ".");
        }
        if (!(this.iqrMultiplier >= 0)) {
            throw new IllegalArgumentException("iqrMultiplier must be >= 0, got " + this.iqrMultiplier + ".");
        }
        if (!(this.innerJoinTolerance >= 0)) {
            throw new IllegalArgumentException("innerJoinTolerance must be >= 0, got " + this.innerJoinTolerance + ".");
        }
    }

    /** Settings from the classpath resource, or the built-in values if it is absent. */
    public static AnalyzerSettings defaults() {
        return DEFAULTS;
    }

    /** Reads a settings file; missing keys fall back to {@link #defaults()}. */
    public static AnalyzerSettings load(Path path) throws IOException {
        Map<String, Object> overrides = MAPPER.readValue(path.toFile(), new TypeReference<Map<String, Object>>() {});
        return DEFAULTS.withOverrides(overrides);
    }

    /**
     * Copy with the given keys replaced.
     *
     * @throws IllegalArgumentException for unknown keys or values of the wrong type
     */
    public AnalyzerSettings withOverrides(Map<String, Object> params) {
        if (params == null || params.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = toMap();
        merged.putAll(params);
        return MAPPER.convertValue(merged, AnalyzerSettings.class);
    }

    public Map<String, Object> toMap() {
        return MAPPER.convertValue(this, new TypeReference<LinkedHashMap<String, Object>>() {});
    }

    private static AnalyzerSettings loadDefaults() {
        try (InputStream in = AnalyzerSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                return new AnalyzerSettings(null, null, null, null, null, null, null);
            }
            return MAPPER.readValue(in, AnalyzerSettings.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
    }

    @Override
    public String toString() {
        return "AnalyzerSettings" + toMap();
    }
}
