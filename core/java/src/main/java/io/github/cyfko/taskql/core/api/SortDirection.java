package io.github.cyfko.taskql.core.api;

import java.util.Optional;

/**
 * Direction applied to the final comparison of a sort.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum SortDirection {
    ASC("asc"),
    DESC("desc");

    private final String code;

    SortDirection(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<SortDirection> fromCode(String value) {
        if (value == null) return Optional.empty();
        for (SortDirection d : values()) {
            if (d.code.equalsIgnoreCase(value.trim())) return Optional.of(d);
        }
        return Optional.empty();
    }
}
