package io.github.cyfko.taskql.core.model;

import io.github.cyfko.taskql.core.api.FilterOperator;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

import static io.github.cyfko.taskql.core.api.FilterOperator.*;

/**
 * Declared kind of a user-defined field. The kind decides which operators a condition on
 * the field accepts and how its values sort and bucket.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum UserFieldType {

    TEXT("text", EnumSet.of(IS, IS_NOT, CONTAINS, DOES_NOT_CONTAIN, IS_EMPTY, IS_NOT_EMPTY)),
    NUMBER("number", EnumSet.of(IS, IS_NOT, IS_GREATER_THAN, IS_LESS_THAN, IS_EMPTY, IS_NOT_EMPTY)),
    DATE("date", EnumSet.of(IS, IS_NOT, IS_BEFORE, IS_AFTER, IS_ON_OR_BEFORE, IS_ON_OR_AFTER, IS_EMPTY, IS_NOT_EMPTY)),
    BOOLEAN("boolean", EnumSet.of(IS_CHECKED, IS_NOT_CHECKED)),
    LIST("list", EnumSet.of(CONTAINS, DOES_NOT_CONTAIN, IS_EMPTY, IS_NOT_EMPTY));

    private final String code;
    private final Set<FilterOperator> operators;

    UserFieldType(String code, EnumSet<FilterOperator> operators) {
        this.code = code;
        this.operators = Collections.unmodifiableSet(operators);
    }

    public String getCode() {
        return code;
    }

    public Set<FilterOperator> getOperators() {
        return operators;
    }

    public boolean supports(FilterOperator operator) {
        return operator != null && operators.contains(operator);
    }

    public static Optional<UserFieldType> fromCode(String code) {
        if (code == null) return Optional.empty();
        for (UserFieldType type : values()) {
            if (type.code.equalsIgnoreCase(code.trim())) return Optional.of(type);
        }
        return Optional.empty();
    }
}
