package exceptions;

import java.util.NoSuchElementException;

/**
 * Lookup of a variable by id or name found nothing in the store.
 */
public class SeriesNotFoundException extends NoSuchElementException {

    public SeriesNotFoundException(String message) {
        super(message);
    }
}
