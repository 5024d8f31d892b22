package io.github.cyfko.taskql.core.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The priorities a workspace declares. A higher weight means more urgent; unknown or
 * missing priorities weigh {@code 0}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class PriorityCatalog {

    /**
     * @param value  value stored in task metadata
     * @param label  display label
     * @param weight urgency, higher first
     */
    public record Priority(String value, String label, int weight) {
        public Priority {
            Objects.requireNonNull(value, "value");
            if (label == null) label = value;
        }
    }

    private final Map<String, Priority> byValue;

    private PriorityCatalog(List<Priority> priorities) {
        Map<String, Priority> map = new LinkedHashMap<>();
        for (Priority priority : priorities) {
            map.put(priority.value(), priority);
        }
        this.byValue = map;
    }

    public static PriorityCatalog of(List<Priority> priorities) {
        return new PriorityCatalog(List.copyOf(priorities));
    }

    /**
     * Catalog with {@code none} (0), {@code low} (1), {@code normal} (2) and {@code high} (3).
     *
     * @return the default catalog
     */
    public static PriorityCatalog defaults() {
        return of(List.of(
                new Priority("none", "None", 0),
                new Priority("low", "Low", 1),
                new Priority("normal", "Normal", 2),
                new Priority("high", "High", 3)));
    }

    public int weightOf(String value) {
        Priority priority = value == null ? null : byValue.get(value);
        return priority == null ? 0 : priority.weight();
    }

    public List<Priority> priorities() {
        return List.copyOf(byValue.values());
    }
}
