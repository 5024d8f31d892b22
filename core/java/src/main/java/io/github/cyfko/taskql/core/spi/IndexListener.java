package io.github.cyfko.taskql.core.spi;

/**
 * Callback invoked by a {@link TaskIndex} after a mutation.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface IndexListener {

    /**
     * @param type kind of mutation
     * @param path affected path, null for {@link IndexEventType#INDEX_REBUILT}
     */
    void onEvent(IndexEventType type, String path);
}
