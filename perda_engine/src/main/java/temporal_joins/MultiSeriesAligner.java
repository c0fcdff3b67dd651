package temporal_joins;

import exceptions.DivisionByZeroException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import result_classes.Series;
import result_classes.SeriesKey;
import result_classes.SeriesStore;
import util.TimeWindow;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Aligns N series on one timestamp grid and evaluates {@code s0 op1 s1 op2 s2 ...}
 * strictly left to right.
 * <p>
 * All series are restricted to their common window
 * {@code [max(start, first_i), min(end, last_i)]}; the grid is the union of
 * their timestamps inside it and each column is filled according to a
 * {@link FillPolicy}.
 */
public final class MultiSeriesAligner {

    private static final Logger LOG = LoggerFactory.getLogger(MultiSeriesAligner.class);

    private MultiSeriesAligner() {}

    public static AlignedTable alignArrays(List<Series> seriesList, FillPolicy policy, TimeWindow window) {
        Objects.requireNonNull(seriesList, "seriesList must not be null.");
        Objects.requireNonNull(policy, "policy must not be null.");
        if (window == null) window = TimeWindow.all();
        if (seriesList.isEmpty()) {
            throw new IllegalArgumentException("At least one series is required.");
        }

        // 1. common window
        long lo = window.startTime;
        long hi = Long.MAX_VALUE;
        for (Series series : seriesList) {
            TimeSeriesConverter.Knots full = TimeSeriesConverter.knots(series);
            lo = Math.max(lo, full.first());
            hi = Math.min(hi, full.last());
        }
        if (!window.isOpenEnded()) {
            hi = Math.min(hi, window.endTime);
        }

        if (lo > hi) {
            LOG.debug("No common time range for {} series in {}", seriesList.size(), window);
            return new AlignedTable(new long[0], new double[seriesList.size()][0]);
        }

        // 2. union grid inside the window
        long[] grid = new long[0];
        List<TimeSeriesConverter.Knots> knots = new ArrayList<>(seriesList.size());
        for (Series series : seriesList) {
            long[] ts = series.getTimestamps();
            int from = TimeSeriesConverter.lowerBound(ts, lo);
            int to = TimeSeriesConverter.upperBound(ts, hi);
            if (from < to) {
                long[] inWindow = Arrays.copyOfRange(ts, from, to);
                grid = TimeSeriesConverter.unionGrid(grid, inWindow);
                knots.add(new TimeSeriesConverter.Knots(inWindow, Arrays.copyOfRange(series.getValues(), from, to)));
            } else {
                knots.add(TimeSeriesConverter.knots(series));
            }
        }

        // 3. fill every column
        double[][] columns = new double[seriesList.size()][grid.length];
        for (int c = 0; c < columns.length; c++) {
            TimeSeriesConverter.Knots k = knots.get(c);
            for (int r = 0; r < grid.length; r++) {
                columns[c][r] = policy.valueAt(k, grid[r]);
            }
        }
        return new AlignedTable(grid, columns);
    }

    /**
     * Evaluates the expression over the aligned columns.
     *
     * @param operators one operator fewer than there are series
     * @throws DivisionByZeroException if an aligned divisor is zero
     */
    public static Series computeArrays(List<Series> seriesList, List<ArithmeticOperator> operators,
                                       FillPolicy policy, TimeWindow window) {
        Objects.requireNonNull(operators, "operators must not be null.");
        if (seriesList == null || operators.size() != seriesList.size() - 1) {
            throw new IllegalArgumentException("Expected " + (seriesList == null ? 0 : seriesList.size() - 1)
                    + " operator(s) for " + (seriesList == null ? 0 : seriesList.size()) + " series, got "
                    + operators.size() + ".");
        }

        AlignedTable table = alignArrays(seriesList, policy, window);
        double[] acc = table.columns[0].clone();

        StringBuilder label = new StringBuilder(seriesList.get(0).getLabel());
        for (int step = 0; step < operators.size(); step++) {
            ArithmeticOperator op = operators.get(step);
            double[] rhs = table.columns[step + 1];

            if (op == ArithmeticOperator.DIVIDE) {
                int zeros = 0;
                long firstZero = -1L;
                for (int r = 0; r < rhs.length; r++) {
                    if (rhs[r] == 0.0) {
                        if (zeros == 0) firstZero = table.timestamps[r];
                        zeros++;
                    }
                }
                if (zeros > 0) {
                    throw new DivisionByZeroException(zeros, firstZero);
                }
            }

            for (int r = 0; r < acc.length; r++) {
                acc[r] = op.apply(acc[r], rhs[r]);
            }
            label.append(' ').append(op.symbol()).append(' ').append(seriesList.get(step + 1).getLabel());
        }

        return new Series(table.timestamps, acc, label.toString(), seriesList.get(0).getId());
    }

    /**
     * Resolves an alternating token list such as {@code ["1", "+", "pack.current", "/", "3"]}
     * against a store and evaluates it. Numeric tokens are variable ids, all others names.
     */
    public static Series computeArrays(SeriesStore store, List<String> tokens, FillPolicy policy, TimeWindow window) {
        Objects.requireNonNull(store, "store must not be null.");
        if (tokens == null || tokens.isEmpty() || tokens.size() % 2 == 0) {
            throw new IllegalArgumentException("Expected an odd number of tokens (series op series ...), got "
                    + (tokens == null ? 0 : tokens.size()) + ".");
        }

        List<Series> seriesList = new ArrayList<>();
        List<ArithmeticOperator> operators = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            if (i % 2 == 0) {
                seriesList.add(store.get(keyOf(tokens.get(i))));
            } else {
                operators.add(ArithmeticOperator.fromSymbol(tokens.get(i)));
            }
        }
        return computeArrays(seriesList, operators, policy, window);
    }

    private static SeriesKey keyOf(String token) {
        String trimmed = token.trim();
        try {
            return SeriesKey.byId(Integer.parseInt(trimmed));
        } catch (NumberFormatException e) {
            return SeriesKey.byName(trimmed);
        }
    }
}
