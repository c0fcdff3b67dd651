package util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Unit in which time is reported at the analytics boundary. Timestamps are
 * always stored in milliseconds; this is the only place they get rescaled.
 */
public enum Timescale {

    MILLISECONDS("ms", 1.0),
    SECONDS("s", 1000.0);

    private final String symbol;
    private final double millisPerUnit;

    Timescale(String symbol, double millisPerUnit) {
        this.symbol = symbol;
        this.millisPerUnit = millisPerUnit;
    }

    @JsonValue
    public String symbol() {
        return symbol;
    }

    /** Converts a duration or instant given in milliseconds into this unit. */
    public double fromMillis(double millis) {
        return millis / millisPerUnit;
    }

    public double toMillis(double amount) {
        return amount * millisPerUnit;
    }

    @JsonCreator
    public static Timescale parse(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("Time unit must not be null or empty.");
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "ms":
            case "millis":
            case "milliseconds":
                return MILLISECONDS;
            case "s":
            case "sec":
            case "seconds":
                return SECONDS;
            default:
                throw new IllegalArgumentException("Unknown time unit: " + value);
        }
    }
}
