package io.github.cyfko.taskql.core.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of the engine's result caches.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>lookupTtl</strong>: lifetime of a memoized index lookup (default: 30 s)</li>
 *   <li><strong>optionsFreshnessWindow</strong>: index changes younger than this do not
 *       invalidate the selectable-values cache (default: 30 s)</li>
 *   <li><strong>optionsMaxAge</strong>: selectable values are recomputed after this age
 *       whatever happened (default: 5 min)</li>
 *   <li><strong>maxEntries</strong>: bound of the lookup cache (default: 1000)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (balanced for interactive use)
 * CachePolicy policy = CachePolicy.defaults();
 *
 * // None (every call recomputes)
 * CachePolicy policy = CachePolicy.none();
 *
 * // Custom
 * CachePolicy policy = CachePolicy.custom(Duration.ofSeconds(10), 500);
 * }</pre>
 *
 * @param lookupTtl              lifetime of index lookup entries
 * @param optionsFreshnessWindow grace period of the selectable-values cache
 * @param optionsMaxAge          hard age limit of the selectable-values cache
 * @param maxEntries             maximum number of lookup entries
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CachePolicy(
        Duration lookupTtl,
        Duration optionsFreshnessWindow,
        Duration optionsMaxAge,
        int maxEntries
) {

    /**
     * Canonical constructor with validation.
     */
    public CachePolicy {
        Objects.requireNonNull(lookupTtl, "lookupTtl");
        Objects.requireNonNull(optionsFreshnessWindow, "optionsFreshnessWindow");
        Objects.requireNonNull(optionsMaxAge, "optionsMaxAge");
        if (lookupTtl.isNegative() || optionsFreshnessWindow.isNegative() || optionsMaxAge.isNegative()) {
            throw new IllegalArgumentException("durations must not be negative");
        }
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive, got: " + maxEntries);
        }
    }

    /**
     * Default configuration for interactive use.
     * <ul>
     *   <li>Lookup TTL: 30 seconds</li>
     *   <li>Options freshness window: 30 seconds</li>
     *   <li>Options max age: 5 minutes</li>
     *   <li>Max entries: 1000</li>
     * </ul>
     *
     * @return default configuration
     */
    public static CachePolicy defaults() {
        return new CachePolicy(
                Duration.ofSeconds(30),  // lookupTtl
                Duration.ofSeconds(30),  // optionsFreshnessWindow
                Duration.ofMinutes(5),   // optionsMaxAge
                1000                     // maxEntries
        );
    }

    /**
     * No caching: entries expire as soon as they are written.
     *
     * @return a policy with zero lifetimes
     */
    public static CachePolicy none() {
        return new CachePolicy(Duration.ZERO, Duration.ZERO, Duration.ZERO, 1);
    }

    public static CachePolicy custom(Duration lookupTtl, int maxEntries) {
        return new CachePolicy(lookupTtl, Duration.ofSeconds(30), Duration.ofMinutes(5), maxEntries);
    }

    public boolean isEnabled() {
        return !lookupTtl.isZero();
    }
}
