package util;

import exceptions.LogParseException;
import result_classes.SeriesStore;

import java.nio.file.Path;

/**
 * Interface for time series sources.
 * Implementations read one recording and return all of its signals.
 */
public interface TimeSeriesSource {

    SeriesStore load(Path path) throws LogParseException;
}
