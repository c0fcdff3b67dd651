package result_classes;

/**
 * Result of dividing one series by another: the quotient without the rows whose
 * aligned divisor was zero, plus how many rows that were.
 */
public final class Quotient {

    private final Series series;
    private final int divideByZeroCount;

    public Quotient(Series series, int divideByZeroCount) {
        this.series = series;
        this.divideByZeroCount = divideByZeroCount;
    }

    public Series series() {
        return series;
    }

    public int divideByZeroCount() {
        return divideByZeroCount;
    }

    public boolean hadDivideByZero() {
        return divideByZeroCount > 0;
    }
}
