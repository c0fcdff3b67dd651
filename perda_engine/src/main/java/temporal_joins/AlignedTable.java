package temporal_joins;

/**
 * N series aligned on one shared timestamp grid; {@code columns[i][j]} is the
 * value of input i at {@code timestamps[j]}.
 */
public class AlignedTable {

    public final long[] timestamps;
    public final double[][] columns;

    public AlignedTable(long[] timestamps, double[][] columns) {
        for (double[] column : columns) {
            if (column.length != timestamps.length) {
                throw new IllegalArgumentException("Every column must have " + timestamps.length
                        + " rows, got " + column.length + ".");
            }
        }
        this.timestamps = timestamps;
        this.columns = columns;
    }

    public int rowCount() {
        return timestamps.length;
    }

    public int columnCount() {
        return columns.length;
    }

    public boolean isEmpty() {
        return timestamps.length == 0;
    }
}
