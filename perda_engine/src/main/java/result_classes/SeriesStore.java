package result_classes;

import exceptions.SeriesNotFoundException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Everything parsed from one telemetry log: one {@link Series} per variable id,
 * the id/name indices from the header block and dataset-wide metadata.
 * <p>
 * Read-only once built. A new log means a new store.
 */
public final class SeriesStore {

    private final Map<Integer, Series> byId;
    private final Map<Integer, String> nameOf;
    private final Map<String, Integer> idOf;
    private final long totalPoints;
    private final long startTime;
    private final long endTime;
    private final ParseReport report;

    public SeriesStore(Map<Integer, Series> byId,
                       Map<Integer, String> nameOf,
                       Map<String, Integer> idOf,
                       long totalPoints,
                       long startTime,
                       long endTime,
                       ParseReport report) {
        this.byId = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(byId)));
        this.nameOf = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(nameOf)));
        this.idOf = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(idOf)));
        this.totalPoints = totalPoints;
        this.startTime = startTime;
        this.endTime = endTime;
        this.report = report == null ? ParseReport.empty() : report;
    }

    public Series get(SeriesKey key) {
        Objects.requireNonNull(key, "key must not be null.");
        return key.resolve(this);
    }

    public Series get(int id) {
        return get(SeriesKey.byId(id));
    }

    public Series get(String name) {
        return get(SeriesKey.byName(name));
    }

    /** Pass-through, so call sites can treat resolved and unresolved inputs alike. */
    public Series get(Series series) {
        return get(SeriesKey.resolved(series));
    }

    public boolean contains(SeriesKey key) {
        try {
            get(key);
            return true;
        } catch (SeriesNotFoundException e) {
            return false;
        }
    }

    public boolean contains(int id) {
        return byId.containsKey(id);
    }

    public boolean contains(String name) {
        return findId(name).isPresent();
    }

    /**
     * Resolves a name to its id. A query matches a full variable name if the
     * name contains {@code "(query)"} or the query itself; the first match in
     * header order wins.
     */
    public Optional<Integer> findId(String query) {
        if (query == null) return Optional.empty();
        for (Map.Entry<String, Integer> entry : idOf.entrySet()) {
            if (nameMatches(query, entry.getKey())) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    public static boolean nameMatches(String query, String fullName) {
        return fullName.contains("(" + query + ")") || fullName.contains(query);
    }

    Series lookupId(int id) {
        Series series = byId.get(id);
        if (series == null) {
            throw new SeriesNotFoundException("Cannot find variable ID: " + id);
        }
        return series;
    }

    Series lookupName(String name) {
        Integer id = findId(name)
                .orElseThrow(() -> new SeriesNotFoundException("Cannot find variable name: " + name));
        return lookupId(id);
    }

    public Optional<String> getNameOf(int id) {
        return Optional.ofNullable(nameOf.get(id));
    }

    public Map<Integer, String> getNames() {
        return nameOf;
    }

    public Set<Integer> ids() {
        return byId.keySet();
    }

    public int size() {
        return byId.size();
    }

    public long getTotalPoints() {
        return totalPoints;
    }

    public long getStartTime() {
        return startTime;
    }

    public long getEndTime() {
        return endTime;
    }

    public ParseReport getReport() {
        return report;
    }

    public DatasetSummary summary() {
        return DatasetSummary.of(this);
    }

    @Override
    public String toString() {
        return "SeriesStore[" + byId.size() + " variables, " + totalPoints + " points, "
                + startTime + " -> " + endTime + " ms]";
    }
}
