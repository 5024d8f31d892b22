package io.github.cyfko.taskql.core.api;

import java.util.Optional;

/**
 * Logical combinator of a {@link FilterGroup}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Conjunction {
    AND("and"),
    OR("or");

    private final String code;

    Conjunction(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<Conjunction> fromCode(String value) {
        if (value == null) return Optional.empty();
        for (Conjunction c : values()) {
            if (c.code.equalsIgnoreCase(value.trim())) return Optional.of(c);
        }
        return Optional.empty();
    }
}
