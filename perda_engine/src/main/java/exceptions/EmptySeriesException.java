package exceptions;

/**
 * A join or reduction needs at least one sample but got an empty series.
 */
public class EmptySeriesException extends IllegalArgumentException {

    public EmptySeriesException(String message) {
        super(message);
    }
}
