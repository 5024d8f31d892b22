package io.github.cyfko.taskql.core.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The statuses a workspace declares, with their display order and completion flag.
 * <p>
 * Unknown status values are tolerated everywhere: they have order {@code 0} and are not
 * completed.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class StatusCatalog {

    /**
     * One declared status.
     *
     * @param value     value stored in task metadata
     * @param label     display label
     * @param order     display order, smaller first
     * @param completed whether tasks in this status count as done
     */
    public record Status(String value, String label, int order, boolean completed) {
        public Status {
            Objects.requireNonNull(value, "value");
            if (label == null) label = value;
        }
    }

    private final Map<String, Status> byValue;

    private StatusCatalog(List<Status> statuses) {
        Map<String, Status> map = new LinkedHashMap<>();
        for (Status status : statuses) {
            map.put(status.value(), status);
        }
        this.byValue = map;
    }

    public static StatusCatalog of(List<Status> statuses) {
        return new StatusCatalog(List.copyOf(statuses));
    }

    /**
     * Catalog with {@code open}, {@code in-progress} and {@code done} (completed).
     *
     * @return the default catalog
     */
    public static StatusCatalog defaults() {
        return of(List.of(
                new Status("open", "Open", 1, false),
                new Status("in-progress", "In progress", 2, false),
                new Status("done", "Done", 3, true)));
    }

    public int orderOf(String value) {
        Status status = value == null ? null : byValue.get(value);
        return status == null ? 0 : status.order();
    }

    public boolean isCompleted(String value) {
        Status status = value == null ? null : byValue.get(value);
        return status != null && status.completed();
    }

    public List<Status> statuses() {
        return List.copyOf(byValue.values());
    }
}
