package aggregation_functions;

import result_classes.Series;
import util.TimeWindow;

import java.util.Arrays;

/**
 * Restricts a series to a half-open time range {@code [start, end)}.
 */
public final class TimeSlice {

    private TimeSlice() {}

    /**
     * @param start inclusive lower bound in ms
     * @param end   exclusive upper bound in ms, {@code -1} for no upper bound
     */
    public static Series slice(Series series, long start, long end) {
        return slice(series, new TimeWindow(start, end));
    }

    public static Series slice(Series series, TimeWindow window) {
        long[] ts = series.getTimestamps();

        int from = 0;
        while (from < ts.length && ts[from] < window.startTime) from++;
        int to = from;
        while (to < ts.length && window.contains(ts[to])) to++;

        if (from == 0 && to == ts.length) {
            return series;
        }
        return new Series(Arrays.copyOfRange(ts, from, to),
                Arrays.copyOfRange(series.getValues(), from, to),
                series.getLabel(), series.getId(), series.isOutlierFiltered());
    }
}
