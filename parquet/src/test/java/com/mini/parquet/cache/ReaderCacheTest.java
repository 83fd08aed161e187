package com.mini.parquet.cache;

import com.google.common.base.Ticker;
import com.mini.parquet.data.DynamicValue;
import com.mini.parquet.data.RowRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ReaderCache 测试
 */
public class ReaderCacheTest {

    private FakeTicker ticker;
    private ReaderCache cache;

    @BeforeEach
    public void setup() {
        ticker = new FakeTicker();
        cache = new ReaderCache(Duration.ofMinutes(5), ticker);
    }

    @Test
    public void testGetUnsetKey() {
        assertNull(cache.get("missing.parquet"));
    }

    @Test
    public void testSetThenGet() {
        List<RowRecord> rows = rows(3);
        cache.set("a.parquet", rows);

        assertEquals(rows, cache.get("a.parquet"));
        assertEquals(1, cache.size());
    }

    @Test
    public void testSetOverwritesAndRefreshesTimestamp() {
        cache.set("a.parquet", rows(1));
        ticker.advance(Duration.ofMinutes(4));
        cache.set("a.parquet", rows(2));
        ticker.advance(Duration.ofMinutes(4));

        assertEquals(2, cache.get("a.parquet").size());
    }

    @Test
    public void testEntryExpiresWithoutRemoval() {
        cache.set("a.parquet", rows(1));
        ticker.advance(Duration.ofMinutes(5));
        assertNotNull(cache.get("a.parquet"), "entry is valid while age equals TTL");

        ticker.advance(Duration.ofNanos(1));
        assertNull(cache.get("a.parquet"));
        assertEquals(1, cache.size(), "expiry is logical, the entry is still stored");
    }

    @Test
    public void testExpiryWithRealClock() throws InterruptedException {
        ReaderCache realCache = new ReaderCache(Duration.ofMillis(50));
        realCache.set("a.parquet", rows(1));
        assertNotNull(realCache.get("a.parquet"));

        Thread.sleep(100);

        assertNull(realCache.get("a.parquet"));
    }

    @Test
    public void testSetTtlAppliesToStoredEntries() {
        cache.set("a.parquet", rows(1));
        ticker.advance(Duration.ofSeconds(10));

        cache.setTtl(Duration.ofSeconds(5));
        assertNull(cache.get("a.parquet"));

        cache.setTtl(Duration.ofMinutes(1));
        assertNotNull(cache.get("a.parquet"));
        assertEquals(Duration.ofMinutes(1), cache.getTtl());
    }

    @Test
    public void testNegativeTtlRejected() {
        assertThrows(IllegalArgumentException.class, () -> cache.setTtl(Duration.ofSeconds(-1)));
    }

    @Test
    public void testRemoveDeletesOnlyThatKey() {
        cache.set("a.parquet", rows(1));
        cache.set("b.parquet", rows(2));

        cache.remove("a.parquet");

        assertNull(cache.get("a.parquet"));
        assertNotNull(cache.get("b.parquet"));
    }

    @Test
    public void testClear() {
        cache.set("a.parquet", rows(1));
        cache.set("b.parquet", rows(2));

        cache.clear();

        assertNull(cache.get("a.parquet"));
        assertNull(cache.get("b.parquet"));
        assertEquals(0, cache.size());
    }

    @Test
    public void testCachedRowsAreImmutable() {
        List<RowRecord> rows = new ArrayList<>(rows(2));
        cache.set("a.parquet", rows);
        rows.clear();

        List<RowRecord> cached = cache.get("a.parquet");
        assertEquals(2, cached.size());
        assertThrows(UnsupportedOperationException.class, () -> cached.add(row(9)));
    }

    @Test
    public void testConcurrentReadersAndWriters() throws Exception {
        ReaderCache shared = new ReaderCache();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Void>> tasks = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                String key = "file-" + (t % 4) + ".parquet";
                int size = t % 4 + 1;
                tasks.add(() -> {
                    for (int i = 0; i < 500; i++) {
                        shared.set(key, rows(size));
                        List<RowRecord> cached = shared.get(key);
                        // 同一个键总是写入相同大小的结果
                        if (cached != null) {
                            assertEquals(size, cached.size());
                        }
                    }
                    return null;
                });
            }
            for (Future<Void> future : executor.invokeAll(tasks)) {
                future.get();
            }
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        }
        assertEquals(4, shared.size());
    }

    private static List<RowRecord> rows(int count) {
        List<RowRecord> rows = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            rows.add(row(i));
        }
        return rows;
    }

    private static RowRecord row(long id) {
        return RowRecord.builder().put("id", DynamicValue.ofInt64(id)).build();
    }

    private static class FakeTicker extends Ticker {
        private final AtomicLong nanos = new AtomicLong(1_000_000L);

        @Override
        public long read() {
            return nanos.get();
        }

        void advance(Duration duration) {
            nanos.addAndGet(duration.toNanos());
        }
    }
}
