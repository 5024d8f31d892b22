package io.github.cyfko.taskql.core.api;

import java.util.Locale;
import java.util.Optional;

/**
 * Enumeration of supported filter operators.
 * <p>
 * Each operator carries the short, hyphenated code used in persisted queries
 * (for example {@code "is-on-or-before"}) and knows whether it needs an operand.
 * </p>
 *
 * <p><strong>Example usage:</strong></p>
 * <pre>{@code
 * FilterOperator op = FilterOperator.fromCode("is-before").orElseThrow();
 * if (op.requiresValue()) {
 *     // the condition is incomplete until a value is supplied
 * }
 *
 * FilterCondition dueSoon = FilterCondition.of(
 *     PropertySelector.of(FilterProperty.DUE), FilterOperator.IS_BEFORE, "next week");
 * FilterCondition notArchived = FilterCondition.of(
 *     PropertySelector.of(FilterProperty.ARCHIVED), FilterOperator.IS_NOT_CHECKED, null);
 * }</pre>
 *
 * <p><strong>Operator Categories:</strong></p>
 * <ul>
 *     <li>Equality: {@code is} / {@code is-not}</li>
 *     <li>Text and list membership: {@code contains} / {@code does-not-contain}</li>
 *     <li>Dates: {@code is-before}, {@code is-after}, {@code is-on-or-before}, {@code is-on-or-after}</li>
 *     <li>Presence: {@code is-empty} / {@code is-not-empty}</li>
 *     <li>Booleans: {@code is-checked} / {@code is-not-checked}</li>
 *     <li>Numbers: {@code is-greater-than} / {@code is-less-than}</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum FilterOperator {

    /** Equality: "is" */
    IS("is"),

    /** Negated equality: "is-not" */
    IS_NOT("is-not"),

    /** Case-insensitive substring or list membership: "contains" */
    CONTAINS("contains"),

    /** Negated containment: "does-not-contain" */
    DOES_NOT_CONTAIN("does-not-contain"),

    /** Strictly earlier date: "is-before" */
    IS_BEFORE("is-before"),

    /** Strictly later date: "is-after" */
    IS_AFTER("is-after"),

    /** Earlier date or same calendar day: "is-on-or-before" */
    IS_ON_OR_BEFORE("is-on-or-before"),

    /** Later date or same calendar day: "is-on-or-after" */
    IS_ON_OR_AFTER("is-on-or-after"),

    /** Null, blank text or empty list: "is-empty" */
    IS_EMPTY("is-empty"),

    /** Negated emptiness: "is-not-empty" */
    IS_NOT_EMPTY("is-not-empty"),

    /** Boolean true: "is-checked" */
    IS_CHECKED("is-checked"),

    /** Anything but boolean true: "is-not-checked" */
    IS_NOT_CHECKED("is-not-checked"),

    /** Numeric comparison: "is-greater-than" */
    IS_GREATER_THAN("is-greater-than"),

    /** Numeric comparison: "is-less-than" */
    IS_LESS_THAN("is-less-than");

    private final String code;

    FilterOperator(String code) {
        this.code = code;
    }

    /**
     * Returns the persisted code of the operator, e.g. {@code "is-not-empty"}.
     *
     * @return the operator code
     */
    public String getCode() {
        return code;
    }

    /**
     * Finds an operator by its code or enum name, ignoring case.
     *
     * @param value code such as {@code "is-before"} or name such as {@code "IS_BEFORE"}
     * @return the matching operator, or empty when {@code value} is null, blank or unknown
     */
    public static Optional<FilterOperator> fromCode(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String trimmed = value.trim();

        for (FilterOperator op : values()) {
            if (op.code.equalsIgnoreCase(trimmed)) return Optional.of(op);
            if (op.name().equalsIgnoreCase(trimmed.replace('-', '_').toUpperCase(Locale.ROOT))) return Optional.of(op);
        }

        return Optional.empty();
    }

    /**
     * Indicates whether this operator requires a comparison value.
     * <p>
     * The presence and boolean operators ({@code is-empty}, {@code is-not-empty},
     * {@code is-checked}, {@code is-not-checked}) are unary.
     * </p>
     *
     * @return {@code true} if a condition using this operator needs a value
     */
    public boolean requiresValue() {
        return this != IS_EMPTY && this != IS_NOT_EMPTY && this != IS_CHECKED && this != IS_NOT_CHECKED;
    }

    /**
     * Checks whether the operator compares calendar dates.
     *
     * @return {@code true} for the four before/after operators
     */
    public boolean isDateComparison() {
        return this == IS_BEFORE || this == IS_AFTER || this == IS_ON_OR_BEFORE || this == IS_ON_OR_AFTER;
    }
}
