package io.github.cyfko.taskql.core.cache;

import io.github.cyfko.taskql.core.config.CachePolicy;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Single-value cache for data that only feeds pickers and menus.
 * <p>
 * Index events do not clear the value; they only mark it stale. A stale value keeps being
 * served until it is older than the freshness window, so a burst of edits costs at most one
 * recomputation per window. Independently of events, a value older than the maximum age is
 * always recomputed.
 * </p>
 *
 * <pre>{@code
 * FilterOptionsCache<SelectableValues> cache = new FilterOptionsCache<>(CachePolicy.defaults(), Ticker.system());
 * SelectableValues values = cache.get(this::computeSelectableValues);
 * index.subscribe(IndexEventType.RECORD_UPDATED, (type, path) -> cache.markStale());
 * }</pre>
 *
 * @param <V> the cached value type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FilterOptionsCache<V> {

    private static final Logger log = Logger.getLogger(FilterOptionsCache.class.getName());

    private final long freshnessNanos;
    private final long maxAgeNanos;
    private final Ticker ticker;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong computations = new AtomicLong();
    private final AtomicLong invalidations = new AtomicLong();

    private V value;
    private long computedAt;
    private boolean stale;

    public FilterOptionsCache(CachePolicy policy, Ticker ticker) {
        this.freshnessNanos = policy.optionsFreshnessWindow().toNanos();
        this.maxAgeNanos = policy.optionsMaxAge().toNanos();
        this.ticker = Objects.requireNonNull(ticker, "ticker");
    }

    /**
     * Returns the cached value, computing it first when absent or outdated.
     *
     * @param loader computes a fresh value
     * @return the current value
     */
    public V get(Supplier<V> loader) {
        lock.readLock().lock();
        try {
            if (value != null && !needsRefresh(ticker.read())) {
                hits.incrementAndGet();
                return value;
            }
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            long now = ticker.read();
            if (value != null && !needsRefresh(now)) {
                hits.incrementAndGet();
                return value;
            }
            boolean wasStale = stale;
            value = Objects.requireNonNull(loader.get(), "loader returned null");
            computedAt = ticker.read();
            stale = false;
            computations.incrementAndGet();
            log.fine(() -> String.format("Filter options recomputed (stale=%s)", wasStale));
            return value;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private boolean needsRefresh(long now) {
        long age = now - computedAt;
        if (age >= maxAgeNanos) return true;
        return stale && age >= freshnessNanos;
    }

    /**
     * Records that the underlying data changed.
     */
    public void markStale() {
        lock.writeLock().lock();
        try {
            stale = true;
            invalidations.incrementAndGet();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Forgets the value so that the next read recomputes it.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            value = null;
            stale = false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isStale() {
        lock.readLock().lock();
        try {
            return stale;
        } finally {
            lock.readLock().unlock();
        }
    }

    public CacheStats stats() {
        return new CacheStats(hits.get(), computations.get(), invalidations.get());
    }
}
