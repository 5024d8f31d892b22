package io.github.cyfko.taskql.core.spi;

/**
 * Kinds of mutation a {@link TaskIndex} publishes.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum IndexEventType {
    RECORD_ADDED,
    RECORD_UPDATED,
    RECORD_DELETED,
    RECORD_RENAMED,
    INDEX_REBUILT
}
