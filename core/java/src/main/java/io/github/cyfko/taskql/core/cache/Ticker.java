package io.github.cyfko.taskql.core.cache;

/**
 * Monotonic time source of the caches, in nanoseconds.
 * <p>
 * Only differences between two readings are meaningful. Tests substitute a manual ticker
 * to move time forward without sleeping.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface Ticker {

    long read();

    /**
     * @return a ticker backed by {@link System#nanoTime()}
     */
    static Ticker system() {
        return System::nanoTime;
    }
}
