package io.github.cyfko.taskql.core.api;

import java.util.Optional;
import java.util.Set;

/**
 * Key used to partition sorted tasks into buckets: {@code none}, one of the built-in
 * keys, or {@code user:<field-id>}.
 *
 * @param key wire form of the key
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TaskGroupKey(String key) {

    private static final Set<String> BUILT_IN = Set.of(
            "none", "status", "priority", "context", "project", "due", "scheduled");

    public static final TaskGroupKey NONE = new TaskGroupKey("none");
    public static final TaskGroupKey STATUS = new TaskGroupKey("status");
    public static final TaskGroupKey PRIORITY = new TaskGroupKey("priority");
    public static final TaskGroupKey CONTEXT = new TaskGroupKey("context");
    public static final TaskGroupKey PROJECT = new TaskGroupKey("project");
    public static final TaskGroupKey DUE = new TaskGroupKey("due");
    public static final TaskGroupKey SCHEDULED = new TaskGroupKey("scheduled");

    /**
     * @throws IllegalArgumentException if {@code key} is neither built-in nor a {@code user:} key
     */
    public TaskGroupKey {
        if (!isValid(key)) {
            throw new IllegalArgumentException("Unknown group key: " + key);
        }
    }

    public static TaskGroupKey user(String fieldId) {
        return new TaskGroupKey(PropertySelector.USER_PREFIX + fieldId);
    }

    public static Optional<TaskGroupKey> parse(String raw) {
        return isValid(raw) ? Optional.of(new TaskGroupKey(raw)) : Optional.empty();
    }

    private static boolean isValid(String key) {
        if (key == null) return false;
        return BUILT_IN.contains(key)
                || (key.startsWith(PropertySelector.USER_PREFIX) && key.length() > PropertySelector.USER_PREFIX.length());
    }

    public boolean isUserField() {
        return key.startsWith(PropertySelector.USER_PREFIX);
    }

    public String userFieldId() {
        return isUserField() ? key.substring(PropertySelector.USER_PREFIX.length()) : null;
    }

    /**
     * Tells whether buckets of this key correspond to the given sort key, in which case
     * bucket order follows the sort direction.
     *
     * @param sortKey active sort key, may be null
     * @return true when both keys address the same value
     */
    public boolean matches(TaskSortKey sortKey) {
        if (sortKey == null) return false;
        if (isUserField()) return key.equals(sortKey.key());
        return ("priority".equals(key) || "due".equals(key) || "scheduled".equals(key)) && key.equals(sortKey.key());
    }

    @Override
    public String toString() {
        return key;
    }
}
