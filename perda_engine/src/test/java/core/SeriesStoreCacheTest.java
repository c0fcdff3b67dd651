package core;

import exceptions.LogParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import result_classes.ParseReport;
import result_classes.SeriesStore;
import util.TimeSeriesSource;
import util.sources.LogFileParser;
import util.sources.ParseProgressListener;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeriesStoreCacheTest {

    private final AtomicInteger loads = new AtomicInteger();

    private final TimeSeriesSource countingSource = path -> {
        loads.incrementAndGet();
        return new SeriesStore(Collections.emptyMap(), Collections.emptyMap(), Collections.emptyMap(),
                0, 0, 0, ParseReport.empty());
    };

    @Test
    void samePathIsParsedOnce() throws Exception {
        SeriesStoreCache cache = new SeriesStoreCache(countingSource);
        Path path = Path.of("runs", "a.log");

        SeriesStore first = cache.get(path);
        SeriesStore second = cache.get(Path.of("runs", ".", "a.log"));

        assertThat(second).isSameAs(first);
        assertThat(loads.get()).isEqualTo(1);
        assertThat(cache.isCached(path)).isTrue();
    }

    @Test
    void newPathReplacesTheEntry() throws Exception {
        SeriesStoreCache cache = new SeriesStoreCache(countingSource);

        cache.get(Path.of("a.log"));
        cache.get(Path.of("b.log"));
        cache.get(Path.of("a.log"));

        assertThat(loads.get()).isEqualTo(3);
        assertThat(cache.activePath()).contains(Path.of("a.log").toAbsolutePath().normalize());
    }

    @Test
    void invalidateForcesAReparse() throws Exception {
        SeriesStoreCache cache = new SeriesStoreCache(countingSource);

        cache.get(Path.of("a.log"));
        cache.invalidate();

        assertThat(cache.activePath()).isEmpty();
        cache.get(Path.of("a.log"));
        assertThat(loads.get()).isEqualTo(2);
    }

    @Test
    void failedLoadKeepsThePreviousEntry(@TempDir Path dir) throws Exception {
        Path good = dir.resolve("good.log");
        Files.write(good, List.of("header", "Value 1: a (x.a)", "1,1,1.0"), StandardCharsets.UTF_8);
        SeriesStoreCache cache = new SeriesStoreCache(new LogFileParser(100, 1000, ParseProgressListener.NONE));

        SeriesStore store = cache.get(good);

        assertThatThrownBy(() -> cache.get(dir.resolve("missing.log"))).isInstanceOf(LogParseException.class);
        assertThat(cache.isCached(good)).isTrue();
        assertThat(cache.get(good)).isSameAs(store);
    }
}
