package io.github.cyfko.taskql.core.api;

import java.util.Optional;
import java.util.Set;

/**
 * Primary key of a task sort: one of the built-in keys or {@code user:<field-id>}.
 *
 * <pre>{@code
 * TaskSortKey byDue = TaskSortKey.DUE;
 * TaskSortKey byEffort = TaskSortKey.user("effort");
 * TaskSortKey parsed = TaskSortKey.parse("priority").orElse(TaskSortKey.DUE);
 * }</pre>
 *
 * @param key wire form of the key
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TaskSortKey(String key) {

    private static final Set<String> BUILT_IN = Set.of(
            "due", "scheduled", "priority", "title", "dateCreated", "dateModified",
            "completedDate", "manualOrder", "storyPoints", "timeEstimate");

    public static final TaskSortKey DUE = new TaskSortKey("due");
    public static final TaskSortKey SCHEDULED = new TaskSortKey("scheduled");
    public static final TaskSortKey PRIORITY = new TaskSortKey("priority");
    public static final TaskSortKey TITLE = new TaskSortKey("title");
    public static final TaskSortKey DATE_CREATED = new TaskSortKey("dateCreated");
    public static final TaskSortKey DATE_MODIFIED = new TaskSortKey("dateModified");
    public static final TaskSortKey COMPLETED_DATE = new TaskSortKey("completedDate");
    public static final TaskSortKey MANUAL_ORDER = new TaskSortKey("manualOrder");
    public static final TaskSortKey STORY_POINTS = new TaskSortKey("storyPoints");
    public static final TaskSortKey TIME_ESTIMATE = new TaskSortKey("timeEstimate");

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if {@code key} is neither built-in nor a {@code user:} key
     */
    public TaskSortKey {
        if (!isValid(key)) {
            throw new IllegalArgumentException("Unknown sort key: " + key);
        }
    }

    public static TaskSortKey user(String fieldId) {
        return new TaskSortKey(PropertySelector.USER_PREFIX + fieldId);
    }

    /**
     * Reads a key from its wire form without throwing.
     *
     * @param raw wire key
     * @return the key, or empty if {@code raw} is null or unknown
     */
    public static Optional<TaskSortKey> parse(String raw) {
        return isValid(raw) ? Optional.of(new TaskSortKey(raw)) : Optional.empty();
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

    @Override
    public String toString() {
        return key;
    }
}
