package io.github.cyfko.taskql.core.cache;

import java.time.Duration;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A bounded LRU cache whose entries expire after a fixed time to live.
 * <p>
 * Expiry does not rely on one timer per entry. Each entry records the {@link Ticker}
 * reading and the cache <em>epoch</em> at which it was written; a read treats the entry as
 * absent once its age reaches the TTL or once the epoch has moved on. Expired entries are
 * dropped lazily by the read that finds them, or in bulk by {@link #sweep()}.
 * </p>
 *
 * <h2>Implementation Strategy</h2>
 * <ul>
 *   <li><strong>Deque for ordering</strong>: tracks access order for LRU eviction</li>
 *   <li><strong>Map for storage</strong>: O(1) lookups of stamped entries</li>
 *   <li><strong>Epoch</strong>: {@link #invalidateAll()} bumps it, so entries written before
 *       the bump can never be served even by a reader that raced with the clear</li>
 *   <li><strong>ReadWriteLock</strong>: concurrent reads, exclusive writes</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ExpiringCache<String, Set<String>> cache =
 *     new ExpiringCache<>(1000, Duration.ofSeconds(30), Ticker.system());
 *
 * cache.put("status:is:open", paths);
 * Set<String> cached = cache.get("status:is:open"); // null after 30 s
 *
 * cache.invalidateAll(); // on any index event
 * }</pre>
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ExpiringCache<K, V> {

    private record Entry<V>(V value, long writtenAt, long epoch) {
    }

    private final int maxSize;
    private final long ttlNanos;
    private final Ticker ticker;
    private final Map<K, Entry<V>> cache;
    private final Deque<K> accessOrder;
    private final ReadWriteLock lock;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong invalidations = new AtomicLong();
    private long epoch;

    /**
     * @param maxSize maximum number of entries
     * @param ttl     time to live of an entry; zero disables caching
     * @param ticker  time source
     * @throws IllegalArgumentException if maxSize is not positive or ttl is negative
     */
    public ExpiringCache(int maxSize, Duration ttl, Ticker ticker) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive, got: " + maxSize);
        }
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be negative, got: " + ttl);
        }

        this.maxSize = maxSize;
        this.ttlNanos = ttl.toNanos();
        this.ticker = Objects.requireNonNull(ticker, "ticker");
        this.cache = new LinkedHashMap<>();
        this.accessOrder = new ConcurrentLinkedDeque<>();
        this.lock = new ReentrantReadWriteLock();
    }

    /**
     * Retrieves a live value.
     *
     * @param key the key to look up
     * @return the cached value, or null if absent or expired
     */
    public V get(K key) {
        lock.readLock().lock();
        try {
            Entry<V> entry = cache.get(key);
            if (entry == null) {
                misses.incrementAndGet();
                return null;
            }
            if (isLive(entry)) {
                // best-effort LRU update under the read lock, as the deque is concurrent
                accessOrder.remove(key);
                accessOrder.addFirst(key);
                hits.incrementAndGet();
                return entry.value();
            }
        } finally {
            lock.readLock().unlock();
        }

        misses.incrementAndGet();
        lock.writeLock().lock();
        try {
            Entry<V> entry = cache.get(key);
            if (entry != null && !isLive(entry)) {
                cache.remove(key);
                accessOrder.remove(key);
            }
        } finally {
            lock.writeLock().unlock();
        }
        return null;
    }

    /**
     * Stores a value stamped with the current time and epoch, evicting the least recently
     * used entries beyond capacity.
     *
     * @param key the key to store
     * @param value the value to store, not null
     */
    public void put(K key, V value) {
        Objects.requireNonNull(value, "value");
        if (ttlNanos == 0) return;

        lock.writeLock().lock();
        try {
            if (cache.containsKey(key)) {
                accessOrder.remove(key);
            }

            cache.put(key, new Entry<>(value, ticker.read(), epoch));
            accessOrder.addFirst(key);

            while (accessOrder.size() > maxSize) {
                K oldest = accessOrder.removeLast();
                cache.remove(oldest);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Drops every entry and moves to a new epoch.
     */
    public void invalidateAll() {
        lock.writeLock().lock();
        try {
            epoch++;
            cache.clear();
            accessOrder.clear();
            invalidations.incrementAndGet();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes every expired entry.
     *
     * @return the number of entries removed
     */
    public int sweep() {
        lock.writeLock().lock();
        try {
            int removed = 0;
            Iterator<Map.Entry<K, Entry<V>>> it = cache.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<K, Entry<V>> e = it.next();
                if (!isLive(e.getValue())) {
                    it.remove();
                    accessOrder.remove(e.getKey());
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the number of stored entries, expired ones included until swept.
     *
     * @return the cache size
     */
    public int size() {
        lock.readLock().lock();
        try {
            return cache.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getMaxSize() {
        return maxSize;
    }

    public CacheStats stats() {
        return new CacheStats(hits.get(), misses.get(), invalidations.get());
    }

    private boolean isLive(Entry<V> entry) {
        return entry.epoch() == epoch && ticker.read() - entry.writtenAt() < ttlNanos;
    }

    /**
     * Returns cache statistics as a formatted string.
     *
     * @return statistics string
     */
    public String getStats() {
        lock.readLock().lock();
        try {
            return String.format("ExpiringCache[size=%d, maxSize=%d, ttl=%dms, epoch=%d, %s]",
                    cache.size(), maxSize, ttlNanos / 1_000_000, epoch, stats());
        } finally {
            lock.readLock().unlock();
        }
    }
}
