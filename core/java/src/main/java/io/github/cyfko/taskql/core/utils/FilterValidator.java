package io.github.cyfko.taskql.core.utils;

import io.github.cyfko.taskql.core.api.FilterCondition;
import io.github.cyfko.taskql.core.api.FilterGroup;
import io.github.cyfko.taskql.core.api.FilterNode;
import io.github.cyfko.taskql.core.api.FilterOperator;
import io.github.cyfko.taskql.core.api.FilterProperty;
import io.github.cyfko.taskql.core.exception.FilterValidationException;
import io.github.cyfko.taskql.core.model.UserFieldDefinition;

import java.util.Map;
import java.util.Optional;

/**
 * Structural validation of filter trees.
 * <p>
 * Two modes are offered:
 * </p>
 * <ul>
 *   <li><strong>Lenient</strong> (while a query is being edited): incomplete conditions
 *       pass, only combinations that can never be evaluated are rejected.</li>
 *   <li><strong>Strict</strong> (when a query is committed): every condition must name a
 *       property, an operator and the value that operator needs.</li>
 * </ul>
 * <p>
 * Conditions on user fields are checked against the field's declared type when the field
 * is known. A field that is not declared is reported at evaluation time.
 * </p>
 *
 * <pre>{@code
 * ValidationResult result = FilterValidator.check(query.root(), config.getUserFieldsById(), true);
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FilterValidator {

    private FilterValidator() {
    }

    /**
     * Validates {@code node} and its subtree.
     *
     * @param node       root of the subtree
     * @param userFields declared user fields by id
     * @param strict     true for the commit-time rules
     * @throws FilterValidationException on the first invalid node, depth first
     */
    public static void validate(FilterNode node, Map<String, UserFieldDefinition> userFields, boolean strict) {
        if (node == null) {
            throw new FilterValidationException("Filter node must not be null");
        }
        node.accept(new FilterNode.Visitor<Void>() {
            @Override
            public Void visitCondition(FilterCondition condition) {
                validateCondition(condition, userFields, strict);
                return null;
            }

            @Override
            public Void visitGroup(FilterGroup group) {
                if (group.conjunction() == null) {
                    throw new FilterValidationException("Group must have a valid conjunction (and/or)",
                            group.id(), "conjunction");
                }
                int index = 0;
                for (FilterNode child : group.children()) {
                    try {
                        child.accept(this);
                    } catch (FilterValidationException e) {
                        throw new FilterValidationException("Child " + index + ": " + e.getMessage(),
                                e.getNodeId(), e.getField());
                    }
                    index++;
                }
                return null;
            }
        });
    }

    /**
     * Same as {@link #validate(FilterNode, Map, boolean)} but reports the outcome instead of throwing.
     */
    public static ValidationResult check(FilterNode node, Map<String, UserFieldDefinition> userFields, boolean strict) {
        try {
            validate(node, userFields, strict);
            return ValidationResult.success();
        } catch (FilterValidationException e) {
            return ValidationResult.failure(e.getMessage(), e.getNodeId(), e.getField());
        }
    }

    private static void validateCondition(FilterCondition condition, Map<String, UserFieldDefinition> userFields,
                                          boolean strict) {
        String id = condition.id();
        String key = condition.property().key();

        if (condition.property().isPlaceholder()) {
            if (strict) throw new FilterValidationException("Property must be selected", id, "property");
            return;
        }

        FilterOperator operator = condition.operator();
        if (operator == null) {
            if (strict) throw new FilterValidationException("Condition must have a valid operator", id, key);
            return;
        }
        // drafts are checked once they carry a value
        if (!strict && !condition.isComplete()) return;

        if (condition.property().isUserField()) {
            UserFieldDefinition definition = userFields.get(condition.property().userFieldId());
            if (definition != null && !definition.type().supports(operator)) {
                throw new FilterValidationException(String.format(
                        "Operator '%s' is not valid for %s field '%s'",
                        operator.getCode(), definition.type().getCode(), key), id, key);
            }
        } else {
            Optional<FilterProperty> property = condition.property().builtIn();
            if (property.isEmpty()) {
                throw new FilterValidationException("Unknown property '" + key + "'", id, key);
            }
            if (!property.get().supports(operator)) {
                throw new FilterValidationException(String.format(
                        "Operator '%s' is not valid for property '%s'", operator.getCode(), key), id, key);
            }
        }

        if (strict && !condition.isComplete()) {
            throw new FilterValidationException(
                    "Operator '" + operator.getCode() + "' requires a value", id, key);
        }
    }
}
