package io.github.cyfko.taskql.core.cache;

/**
 * Counters of a cache since its creation.
 *
 * @param hits          reads answered from the cache
 * @param computations  reads that had to compute the value
 * @param invalidations invalidation signals received
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CacheStats(long hits, long computations, long invalidations) {

    /**
     * @return hits divided by reads, {@code 0.0} before the first read
     */
    public double hitRate() {
        long reads = hits + computations;
        return reads == 0 ? 0.0 : (double) hits / reads;
    }

    @Override
    public String toString() {
        return String.format("CacheStats[hits=%d, computations=%d, invalidations=%d, hitRate=%.1f%%]",
                hits, computations, invalidations, hitRate() * 100);
    }
}
