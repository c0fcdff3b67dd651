package result_classes;

import java.util.Objects;

/**
 * What a caller uses to pick a variable out of a {@link SeriesStore}: a numeric
 * id, a (short or full) name, or a series that is already resolved.
 */
public abstract class SeriesKey {

    private SeriesKey() {
    }

    public static SeriesKey byId(int id) {
        return new ById(id);
    }

    public static SeriesKey byName(String name) {
        return new ByName(name);
    }

    public static SeriesKey resolved(Series series) {
        return new Resolved(series);
    }

    abstract Series resolve(SeriesStore store);

    public static final class ById extends SeriesKey {
        private final int id;

        private ById(int id) {
            this.id = id;
        }

        public int id() {
            return id;
        }

        @Override
        Series resolve(SeriesStore store) {
            return store.lookupId(id);
        }

        @Override
        public String toString() {
            return "id " + id;
        }
    }

    public static final class ByName extends SeriesKey {
        private final String name;

        private ByName(String name) {
            Objects.requireNonNull(name, "name must not be null.");
            if (name.trim().isEmpty()) {
                throw new IllegalArgumentException("Variable name must not be empty.");
            }
            this.name = name.trim();
        }

        public String name() {
            return name;
        }

        @Override
        Series resolve(SeriesStore store) {
            return store.lookupName(name);
        }

        @Override
        public String toString() {
            return "name '" + name + "'";
        }
    }

    public static final class Resolved extends SeriesKey {
        private final Series series;

        private Resolved(Series series) {
            this.series = Objects.requireNonNull(series, "series must not be null.");
        }

        public Series series() {
            return series;
        }

        @Override
        Series resolve(SeriesStore store) {
            return series;
        }

        @Override
        public String toString() {
            return "resolved " + series;
        }
    }
}
