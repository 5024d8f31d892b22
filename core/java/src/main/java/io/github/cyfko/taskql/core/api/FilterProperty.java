package io.github.cyfko.taskql.core.api;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

import static io.github.cyfko.taskql.core.api.FilterOperator.*;

/**
 * Built-in task properties a {@link FilterCondition} can test.
 * <p>
 * Every property declares its wire key (the string persisted in saved views) and the set
 * of operators that make sense for it. User-defined fields are not listed here; they are
 * addressed through {@link PropertySelector#user(String)} and typed by their
 * {@link io.github.cyfko.taskql.core.model.UserFieldType}.
 * </p>
 *
 * <table border="1">
 *   <caption>Property families</caption>
 *   <tr><th>Family</th><th>Properties</th></tr>
 *   <tr><td>Text</td><td>{@code title}</td></tr>
 *   <tr><td>Select</td><td>{@code status}, {@code priority}</td></tr>
 *   <tr><td>List</td><td>{@code tags}, {@code contexts}, {@code projects}</td></tr>
 *   <tr><td>Date</td><td>{@code due}, {@code scheduled}, {@code completedDate}, {@code file.ctime}, {@code file.mtime}</td></tr>
 *   <tr><td>Boolean</td><td>{@code archived}, {@code status.isCompleted}</td></tr>
 *   <tr><td>Numeric</td><td>{@code timeEstimate}, {@code storyPoints}</td></tr>
 *   <tr><td>Special</td><td>{@code recurrence}</td></tr>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum FilterProperty {

    TITLE("title", EnumSet.of(IS, IS_NOT, CONTAINS, DOES_NOT_CONTAIN, IS_EMPTY, IS_NOT_EMPTY)),
    STATUS("status", EnumSet.of(IS, IS_NOT, IS_EMPTY, IS_NOT_EMPTY)),
    PRIORITY("priority", EnumSet.of(IS, IS_NOT, IS_EMPTY, IS_NOT_EMPTY)),
    TAGS("tags", EnumSet.of(CONTAINS, DOES_NOT_CONTAIN, IS_EMPTY, IS_NOT_EMPTY)),
    CONTEXTS("contexts", EnumSet.of(CONTAINS, DOES_NOT_CONTAIN, IS_EMPTY, IS_NOT_EMPTY)),
    PROJECTS("projects", EnumSet.of(CONTAINS, DOES_NOT_CONTAIN, IS_EMPTY, IS_NOT_EMPTY)),
    DUE("due", dateOperators()),
    SCHEDULED("scheduled", dateOperators()),
    COMPLETED_DATE("completedDate", dateOperators()),
    FILE_CTIME("file.ctime", dateOperators()),
    FILE_MTIME("file.mtime", dateOperators()),
    ARCHIVED("archived", EnumSet.of(IS_CHECKED, IS_NOT_CHECKED)),
    TIME_ESTIMATE("timeEstimate", EnumSet.of(IS, IS_NOT, IS_GREATER_THAN, IS_LESS_THAN)),
    STORY_POINTS("storyPoints", EnumSet.of(IS, IS_NOT, IS_GREATER_THAN, IS_LESS_THAN, IS_EMPTY, IS_NOT_EMPTY)),
    RECURRENCE("recurrence", EnumSet.of(IS_EMPTY, IS_NOT_EMPTY)),
    STATUS_IS_COMPLETED("status.isCompleted", EnumSet.of(IS_CHECKED, IS_NOT_CHECKED));

    private final String key;
    private final Set<FilterOperator> operators;

    FilterProperty(String key, EnumSet<FilterOperator> operators) {
        this.key = key;
        this.operators = Collections.unmodifiableSet(operators);
    }

    private static EnumSet<FilterOperator> dateOperators() {
        return EnumSet.of(IS, IS_NOT, IS_BEFORE, IS_AFTER, IS_ON_OR_BEFORE, IS_ON_OR_AFTER, IS_EMPTY, IS_NOT_EMPTY);
    }

    /**
     * @return the wire key of this property, e.g. {@code "file.ctime"}
     */
    public String getKey() {
        return key;
    }

    /**
     * @return the unmodifiable set of operators this property accepts
     */
    public Set<FilterOperator> getOperators() {
        return operators;
    }

    public boolean supports(FilterOperator operator) {
        return operator != null && operators.contains(operator);
    }

    /**
     * Tells whether values of this property are calendar dates or timestamps.
     *
     * @return {@code true} for due, scheduled, completion and file dates
     */
    public boolean isDate() {
        return this == DUE || this == SCHEDULED || this == COMPLETED_DATE || this == FILE_CTIME || this == FILE_MTIME;
    }

    /**
     * Resolves a property from its wire key (exact match, case-sensitive as persisted).
     *
     * @param key wire key such as {@code "status.isCompleted"}
     * @return the property, or empty if {@code key} is not a built-in property
     */
    public static Optional<FilterProperty> fromKey(String key) {
        if (key == null) return Optional.empty();
        for (FilterProperty property : values()) {
            if (property.key.equals(key)) return Optional.of(property);
        }
        return Optional.empty();
    }
}
