package io.github.cyfko.taskql.core.utils;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates identities for filter nodes, of the form {@code filter_<epochMillis>_<counter>}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FilterIds {

    private static final AtomicLong COUNTER = new AtomicLong();

    private FilterIds() {
    }

    /**
     * @return an id unique within this JVM
     */
    public static String next() {
        return "filter_" + System.currentTimeMillis() + "_" + COUNTER.incrementAndGet();
    }
}
