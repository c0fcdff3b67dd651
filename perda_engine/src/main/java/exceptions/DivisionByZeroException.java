package exceptions;

/**
 * Raised by the multi-series computation when an aligned divisor is exactly zero.
 */
public class DivisionByZeroException extends ArithmeticException {

    private final int zeroCount;
    private final long firstTimestamp;

    public DivisionByZeroException(int zeroCount, long firstTimestamp) {
        super("Cannot divide by 0: " + zeroCount + " aligned divisor(s) are zero, first at t=" + firstTimestamp + " ms");
        this.zeroCount = zeroCount;
        this.firstTimestamp = firstTimestamp;
    }

    public int getZeroCount() {
        return zeroCount;
    }

    public long getFirstTimestamp() {
        return firstTimestamp;
    }
}
