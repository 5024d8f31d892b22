package io.github.cyfko.taskql.core.api;

import io.github.cyfko.taskql.core.utils.FilterIds;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;

/**
 * Leaf of a filter tree: tests one property of a task with one operator.
 * <p>
 * The comparison value may be a {@link String}, a {@link Number}, a {@link Boolean} or a
 * list of those. Collections are copied into an unmodifiable list on construction.
 * </p>
 *
 * <h2>Completeness</h2>
 * <p>
 * A condition is complete when it names a property, an operator and, for operators that
 * {@linkplain FilterOperator#requiresValue() require one}, a value that is neither null,
 * an empty string nor an empty list. Incomplete conditions are skipped by the evaluator,
 * which lets a query be edited one field at a time without changing its results midway.
 * </p>
 *
 * <pre>{@code
 * FilterCondition open = FilterCondition.of(
 *     PropertySelector.of(FilterProperty.STATUS), FilterOperator.IS, "open");
 * open.isComplete(); // true
 *
 * FilterCondition draft = FilterCondition.of(PropertySelector.placeholder(), null, null);
 * draft.isComplete(); // false
 * }</pre>
 *
 * @param id       node identity
 * @param property selector of the tested property, never null
 * @param operator operator, null while the condition is being built
 * @param value    comparison value, may be null
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FilterCondition(String id, PropertySelector property, FilterOperator operator, Object value)
        implements FilterNode {

    public FilterCondition {
        if (id == null || id.isBlank()) id = FilterIds.next();
        if (property == null) property = PropertySelector.placeholder();
        if (value instanceof Collection<?> collection) {
            value = Collections.unmodifiableList(new ArrayList<>(collection));
        }
    }

    /**
     * Creates a condition with a freshly generated id.
     */
    public static FilterCondition of(PropertySelector property, FilterOperator operator, Object value) {
        return new FilterCondition(FilterIds.next(), property, operator, value);
    }

    /**
     * Shortcut for conditions on built-in properties.
     */
    public static FilterCondition of(FilterProperty property, FilterOperator operator, Object value) {
        return of(PropertySelector.of(property), operator, value);
    }

    public boolean isComplete() {
        if (property.isPlaceholder() || operator == null) return false;
        if (!operator.requiresValue()) return true;
        if (value == null) return false;
        if (value instanceof String s) return !s.isBlank();
        if (value instanceof Collection<?> c) return !c.isEmpty();
        return true;
    }

    public FilterCondition withValue(Object newValue) {
        return new FilterCondition(id, property, operator, newValue);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitCondition(this);
    }
}
