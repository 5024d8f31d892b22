package io.github.cyfko.taskql.core.api;

import java.util.Optional;

/**
 * Identifies what a condition reads from a task: a built-in {@link FilterProperty}
 * or a user-defined field addressed as {@code user:<field-id>}.
 * <p>
 * A selector with an empty key is a <em>placeholder</em>: the property has not been picked
 * yet in the query builder, so the owning condition is incomplete and ignored during
 * evaluation. {@link #parse(String)} never throws; keys that match neither form are kept
 * verbatim and reported later by validation.
 * </p>
 *
 * <pre>{@code
 * PropertySelector status = PropertySelector.of(FilterProperty.STATUS);
 * PropertySelector effort = PropertySelector.parse("user:effort");
 * effort.isUserField();   // true
 * effort.userFieldId();   // "effort"
 * }</pre>
 *
 * @param key the wire form of the selector, never null
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record PropertySelector(String key) {

    /** Prefix of selectors addressing user-defined fields. */
    public static final String USER_PREFIX = "user:";

    private static final PropertySelector PLACEHOLDER = new PropertySelector("");

    public PropertySelector {
        key = key == null ? "" : key.trim();
    }

    public static PropertySelector of(FilterProperty property) {
        return new PropertySelector(property.getKey());
    }

    public static PropertySelector user(String fieldId) {
        return new PropertySelector(USER_PREFIX + fieldId);
    }

    /**
     * Returns the selector of a condition whose property has not been chosen yet.
     *
     * @return the shared placeholder selector
     */
    public static PropertySelector placeholder() {
        return PLACEHOLDER;
    }

    /**
     * Reads a selector from its wire form.
     *
     * @param raw wire key; null or blank yields the placeholder
     * @return a selector, never null
     */
    public static PropertySelector parse(String raw) {
        if (raw == null || raw.isBlank()) return PLACEHOLDER;
        return new PropertySelector(raw);
    }

    public boolean isPlaceholder() {
        return key.isEmpty();
    }

    public boolean isUserField() {
        return key.startsWith(USER_PREFIX) && key.length() > USER_PREFIX.length();
    }

    /**
     * @return the field id of a {@code user:} selector, or null for other selectors
     */
    public String userFieldId() {
        return isUserField() ? key.substring(USER_PREFIX.length()) : null;
    }

    /**
     * @return the built-in property this selector names, if any
     */
    public Optional<FilterProperty> builtIn() {
        return FilterProperty.fromKey(key);
    }

    @Override
    public String toString() {
        return key;
    }
}
