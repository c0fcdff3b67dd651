package core;

import exceptions.LogParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import result_classes.SeriesStore;
import util.TimeSeriesSource;
import util.sources.LogFileParser;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps the store of the most recently requested log.
 * <p>
 * Asking for the same path again returns the cached store; asking for a
 * different path parses that file and replaces the entry. Not thread-safe;
 * share one instance per request handler.
 */
public class SeriesStoreCache {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesStoreCache.class);

    private final TimeSeriesSource source;

    private Path activePath;
    private SeriesStore activeStore;

    public SeriesStoreCache() {
        this(new LogFileParser());
    }

    public SeriesStoreCache(TimeSeriesSource source) {
        this.source = Objects.requireNonNull(source, "source must not be null.");
    }

    public SeriesStore get(Path path) throws LogParseException {
        Path key = Objects.requireNonNull(path, "path must not be null.").toAbsolutePath().normalize();
        if (activeStore != null && key.equals(activePath)) {
            LOG.debug("Cache hit for {}", key);
            return activeStore;
        }

        LOG.info("Loading {}", key);
        SeriesStore store = source.load(key);
        activePath = key;
        activeStore = store;
        return store;
    }

    public Optional<Path> activePath() {
        return Optional.ofNullable(activePath);
    }

    public boolean isCached(Path path) {
        return activeStore != null && path.toAbsolutePath().normalize().equals(activePath);
    }

    /** Drops the cached store; the next {@link #get(Path)} parses again. */
    public void invalidate() {
        if (activePath != null) {
            LOG.debug("Invalidating cached store for {}", activePath);
        }
        activePath = null;
        activeStore = null;
    }
}
