package util;

import result_classes.SeriesStore;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Keyword search over the variables of a {@link SeriesStore}.
 * <p>
 * Header names usually read {@code "Pack Voltage (ams.pack.voltage)"}: a
 * description followed by the short name in parentheses. A query is split at
 * whitespace and every term is matched case-insensitively against both parts.
 */
public final class VariableSearch {

    public enum Match { ANY, ALL }

    public enum SortBy { ID, NAME }

    private VariableSearch() {}

    public static final class Hit {
        public final int id;
        public final String fullName;
        public final String description;
        public final String shortName;

        Hit(int id, String fullName) {
            this.id = id;
            this.fullName = fullName;

            int open = fullName.lastIndexOf('(');
            if (open >= 0 && fullName.endsWith(")") && open < fullName.length() - 1) {
                this.description = fullName.substring(0, open).trim();
                this.shortName = fullName.substring(open + 1, fullName.length() - 1).trim();
            } else {
                this.description = fullName;
                this.shortName = fullName;
            }
        }

        @Override
        public String toString() {
            return id + ": " + fullName;
        }
    }

    public static List<Hit> search(SeriesStore store, String query) {
        return search(store, query, Match.ANY, SortBy.ID);
    }

    public static List<Hit> search(SeriesStore store, String query, Match match, SortBy sortBy) {
        Objects.requireNonNull(store, "store must not be null.");
        if (query == null || query.trim().isEmpty()) {
            throw new IllegalArgumentException("Search query cannot be empty.");
        }
        List<String> terms = Arrays.stream(query.trim().toLowerCase(Locale.ROOT).split("\\s+"))
                .collect(Collectors.toList());

        List<Hit> hits = new ArrayList<>();
        for (Map.Entry<Integer, String> entry : store.getNames().entrySet()) {
            Hit hit = new Hit(entry.getKey(), entry.getValue());
            String haystack = (hit.description + " " + hit.shortName).toLowerCase(Locale.ROOT);

            boolean matched = match == Match.ALL
                    ? terms.stream().allMatch(haystack::contains)
                    : terms.stream().anyMatch(haystack::contains);
            if (matched) {
                hits.add(hit);
            }
        }

        hits.sort(order(sortBy));
        return hits;
    }

    /** All variables, sorted. */
    public static List<Hit> list(SeriesStore store, SortBy sortBy) {
        List<Hit> all = new ArrayList<>();
        for (Map.Entry<Integer, String> entry : store.getNames().entrySet()) {
            all.add(new Hit(entry.getKey(), entry.getValue()));
        }
        all.sort(order(sortBy));
        return all;
    }

    private static Comparator<Hit> order(SortBy sortBy) {
        if (sortBy == SortBy.NAME) {
            return Comparator.comparing((Hit h) -> h.shortName.toLowerCase(Locale.ROOT)).thenComparingInt(h -> h.id);
        }
        return Comparator.comparingInt(h -> h.id);
    }
}
