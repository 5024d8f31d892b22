package io.github.cyfko.taskql.core.api;

/**
 * Shortcuts that show or hide a whole category of tasks by adding or removing one
 * well-known condition at the root of a query.
 * <p>
 * Disabling a shortcut hides its category: the engine appends the hiding condition to the
 * root group. Enabling it shows the category again by removing that condition.
 * </p>
 *
 * <table border="1">
 *   <caption>Hiding conditions</caption>
 *   <tr><th>Shortcut</th><th>Condition added when disabled</th></tr>
 *   <tr><td>{@link #SHOW_COMPLETED}</td><td>{@code status.isCompleted is-not-checked}</td></tr>
 *   <tr><td>{@link #SHOW_ARCHIVED}</td><td>{@code archived is-not-checked}</td></tr>
 *   <tr><td>{@link #SHOW_RECURRING}</td><td>{@code recurrence is-empty}</td></tr>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum QuickFilter {

    SHOW_COMPLETED(FilterProperty.STATUS_IS_COMPLETED, FilterOperator.IS_NOT_CHECKED),
    SHOW_ARCHIVED(FilterProperty.ARCHIVED, FilterOperator.IS_NOT_CHECKED),
    SHOW_RECURRING(FilterProperty.RECURRENCE, FilterOperator.IS_EMPTY);

    private final FilterProperty property;
    private final FilterOperator operator;

    QuickFilter(FilterProperty property, FilterOperator operator) {
        this.property = property;
        this.operator = operator;
    }

    public FilterProperty getProperty() {
        return property;
    }

    public FilterOperator getOperator() {
        return operator;
    }

    /**
     * @return a new hiding condition with a fresh id
     */
    public FilterCondition hidingCondition() {
        return FilterCondition.of(property, operator, null);
    }

    /**
     * Tells whether {@code node} is the hiding condition of this shortcut.
     *
     * @param node any root-level child
     * @return true for a condition with this shortcut's property and operator
     */
    public boolean isHidingCondition(FilterNode node) {
        if (!(node instanceof FilterCondition condition)) return false;
        return condition.operator() == operator && condition.property().key().equals(property.getKey());
    }
}
