package io.github.cyfko.taskql.core.model;

import java.util.Objects;

/**
 * Declaration of a user-defined task field.
 * <p>
 * Queries address the field as {@code user:<id>}; task snapshots store its value under
 * {@code key} in {@link TaskEntity#userFields()}.
 * </p>
 *
 * @param id          stable identifier used in selectors
 * @param key         frontmatter key holding the value
 * @param displayName label shown to users
 * @param type        declared kind
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record UserFieldDefinition(String id, String key, String displayName, UserFieldType type) {

    public UserFieldDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        if (key == null || key.isBlank()) key = id;
        if (displayName == null || displayName.isBlank()) displayName = key;
    }

    public static UserFieldDefinition of(String id, UserFieldType type) {
        return new UserFieldDefinition(id, id, id, type);
    }
}
