package temporal_joins;

/**
 * Operators of the N-way arithmetic path, applied left to right.
 */
public enum ArithmeticOperator {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/");

    private final String symbol;

    ArithmeticOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public double apply(double left, double right) {
        switch (this) {
            case ADD:
                return left + right;
            case SUBTRACT:
                return left - right;
            case MULTIPLY:
                return left * right;
            case DIVIDE:
                return left / right;
            default:
                throw new IllegalStateException("Unhandled operator " + this);
        }
    }

    public static ArithmeticOperator fromSymbol(String symbol) {
        if (symbol != null) {
            String trimmed = symbol.trim();
            for (ArithmeticOperator op : values()) {
                if (op.symbol.equals(trimmed)) {
                    return op;
                }
            }
        }
        throw new IllegalArgumentException("Unknown operator: " + symbol + " (expected + - * /)");
    }
}
