package util;

/**
 * Half-open time range {@code [startTime, endTime)} in milliseconds.
 * A negative end ({@code -1} by convention) leaves the window open to the right.
 */
public final class TimeWindow {

    public static final long OPEN_END = -1L;

    public final long startTime;
    public final long endTime;

    public TimeWindow(long startTime, long endTime) {
        this.startTime = startTime;
        this.endTime = endTime < 0 ? OPEN_END : endTime;
    }

    public static TimeWindow all() {
        return new TimeWindow(0L, OPEN_END);
    }

    public boolean isOpenEnded() {
        return endTime == OPEN_END;
    }

    public boolean contains(long t) {
        return t >= startTime && (isOpenEnded() || t < endTime);
    }

    /**
     * Clips the window to the closed range {@code [first, last]} of a series.
     * Used by reductions that integrate up to and including the last sample.
     *
     * @return {start, end}; start >= end means the overlap is empty
     */
    public long[] clip(long first, long last) {
        long start = Math.max(startTime, first);
        long end = isOpenEnded() ? last : Math.min(endTime, last);
        return new long[]{start, end};
    }

    @Override
    public String toString() {
        return "TimeWindow[" + startTime + " ms -> " + (isOpenEnded() ? "end" : endTime + " ms") + "]";
    }
}
