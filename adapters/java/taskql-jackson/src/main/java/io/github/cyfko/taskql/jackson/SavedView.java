package io.github.cyfko.taskql.jackson;

import io.github.cyfko.taskql.core.api.FilterQuery;
import io.github.cyfko.taskql.core.utils.FilterIds;

import java.util.Objects;

/**
 * A named query the user stored to reload later.
 * <p>
 * The stored query is a deep copy, so editing the live query afterwards never changes
 * the view.
 * </p>
 *
 * @param id    view identity
 * @param name  display name
 * @param query stored query
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record SavedView(String id, String name, FilterQuery query) {

    public SavedView {
        if (id == null || id.isBlank()) id = FilterIds.next();
        name = name == null ? "" : name.trim();
        Objects.requireNonNull(query, "query");
    }

    /**
     * Stores a snapshot of {@code query} under a fresh id.
     *
     * @param name  display name
     * @param query query to snapshot
     * @return the new view
     */
    public static SavedView of(String name, FilterQuery query) {
        Objects.requireNonNull(query, "query");
        return new SavedView(FilterIds.next(), name, query.deepCopy());
    }

    public SavedView rename(String newName) {
        return new SavedView(id, newName, query);
    }
}
