package com.mini.parquet.cache;

import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import com.mini.parquet.data.RowRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Reader Cache
 * 文件路径到全量读取结果的缓存
 *
 * 特性:
 * 1. 基于 TTL 的惰性失效：只在查找时比较时间戳，没有后台清理线程
 * 2. 读写锁：并发的 get 互不阻塞，set/remove/clear 独占
 * 3. 使用单调时钟，修改 TTL 对已有条目立即生效
 */
public class ReaderCache {
    private static final Logger logger = LoggerFactory.getLogger(ReaderCache.class);

    /** 默认过期时间: 5 分钟 */
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private final Map<String, CacheEntry> entries = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Ticker ticker;

    /** 过期时间（纳秒），在写锁下修改 */
    private long ttlNanos;

    public ReaderCache() {
        this(DEFAULT_TTL);
    }

    public ReaderCache(Duration ttl) {
        this(ttl, Ticker.systemTicker());
    }

    public ReaderCache(Duration ttl, Ticker ticker) {
        this.ttlNanos = toNanos(ttl);
        this.ticker = Preconditions.checkNotNull(ticker, "ticker");
    }

    /**
     * 获取缓存的行
     *
     * @return 缓存的行，不存在或已过期时返回 null
     */
    @Nullable
    public List<RowRecord> get(String key) {
        lock.readLock().lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                return null;
            }
            if (ticker.read() - entry.createdNanos > ttlNanos) {
                logger.trace("Cache entry expired: {}", key);
                return null;
            }
            return entry.rows;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 写入或覆盖缓存条目，创建时间为当前时间
     */
    public void set(String key, List<RowRecord> rows) {
        Preconditions.checkNotNull(key, "key");
        CacheEntry entry = new CacheEntry(ImmutableList.copyOf(rows), ticker.read());
        lock.writeLock().lock();
        try {
            entries.put(key, entry);
        } finally {
            lock.writeLock().unlock();
        }
        logger.debug("Cached {} rows for {}", rows.size(), key);
    }

    public void remove(String key) {
        lock.writeLock().lock();
        try {
            entries.remove(key);
        } finally {
            lock.writeLock().unlock();
        }
        logger.debug("Invalidated cache for file: {}", key);
    }

    public void clear() {
        int removed;
        lock.writeLock().lock();
        try {
            removed = entries.size();
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("Reader cache cleared ({} entries)", removed);
    }

    /**
     * 修改过期时间，对已缓存的条目同样生效
     */
    public void setTtl(Duration ttl) {
        long nanos = toNanos(ttl);
        lock.writeLock().lock();
        try {
            this.ttlNanos = nanos;
        } finally {
            lock.writeLock().unlock();
        }
        logger.debug("Reader cache TTL set to {}", ttl);
    }

    public Duration getTtl() {
        lock.readLock().lock();
        try {
            return Duration.ofNanos(ttlNanos);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 已保存的条目数量，包括逻辑上已过期但尚未被覆盖或删除的条目
     */
    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private static long toNanos(Duration ttl) {
        Preconditions.checkNotNull(ttl, "ttl");
        Preconditions.checkArgument(!ttl.isNegative(), "TTL must not be negative: %s", ttl);
        return ttl.toNanos();
    }

    /**
     * 缓存条目
     */
    private static final class CacheEntry {
        final List<RowRecord> rows;
        final long createdNanos;

        CacheEntry(List<RowRecord> rows, long createdNanos) {
            this.rows = rows;
            this.createdNanos = createdNanos;
        }
    }
}
