package io.github.cyfko.taskql.core.cache;

import io.github.cyfko.taskql.core.utils.ValueCoercion;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Memo of index lookups performed by the optimizer.
 * <p>
 * Keys have the form {@code property:operator:=value} for a single value and
 * {@code property:operator:[len:item,len:item]} for a list, so a list never collides with
 * a string holding the same commas. Sets are copied on the way in and on
 * the way out, so a caller mutating a returned set never affects later hits.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class IndexLookupCache {

    private final ExpiringCache<String, Set<String>> delegate;

    public IndexLookupCache(int maxEntries, Duration ttl, Ticker ticker) {
        this.delegate = new ExpiringCache<>(maxEntries, ttl, ticker);
    }

    /**
     * Builds the memo key of a lookup. List items are length-prefixed inside brackets.
     *
     * @param property property key
     * @param operator operator code
     * @param value    condition value
     * @return the memo key
     */
    public static String key(String property, String operator, Object value) {
        String text;
        if (value instanceof Collection<?> items) {
            text = items.stream()
                    .map(ValueCoercion::text)
                    .map(item -> item.length() + ":" + item)
                    .collect(Collectors.joining(",", "[", "]"));
        } else {
            text = "=" + ValueCoercion.text(value);
        }
        return property + ":" + operator + ":" + text;
    }

    public Optional<Set<String>> get(String key) {
        Set<String> cached = delegate.get(key);
        return cached == null ? Optional.empty() : Optional.of(new LinkedHashSet<>(cached));
    }

    public void put(String key, Set<String> paths) {
        delegate.put(key, Set.copyOf(paths));
    }

    public void invalidateAll() {
        delegate.invalidateAll();
    }

    public int sweep() {
        return delegate.sweep();
    }

    public int size() {
        return delegate.size();
    }

    public CacheStats stats() {
        return delegate.stats();
    }
}
