package io.github.cyfko.taskql.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Read-only snapshot of a task as materialized by the task index.
 * <p>
 * Date fields hold the strings found in the task metadata: a calendar date
 * ({@code 2025-06-10}) or a timestamp ({@code 2025-06-10T14:30}, optionally with an offset).
 * They are interpreted by {@link io.github.cyfko.taskql.core.utils.DateAnchors}. Collections
 * are copied into unmodifiable views; the engine never alters a snapshot.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * TaskEntity task = TaskEntity.builder("tasks/write-report.md")
 *     .title("Write report")
 *     .status("open")
 *     .priority("high")
 *     .due("2025-01-10")
 *     .tags(List.of("work"))
 *     .userField("effort", 3)
 *     .build();
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TaskEntity(
        String path,
        String title,
        String status,
        String priority,
        String due,
        String scheduled,
        Recurrence recurrence,
        Set<String> completeInstances,
        List<String> tags,
        List<String> contexts,
        List<String> projects,
        boolean archived,
        Map<String, Object> userFields,
        String dateCreated,
        String dateModified,
        String completedDate,
        Double manualOrder,
        Double storyPoints,
        Integer timeEstimate
) {

    public TaskEntity {
        Objects.requireNonNull(path, "path");
        title = title == null ? "" : title;
        completeInstances = Collections.unmodifiableSet(new LinkedHashSet<>(nonNull(completeInstances)));
        tags = Collections.unmodifiableList(new ArrayList<>(nonNull(tags)));
        contexts = Collections.unmodifiableList(new ArrayList<>(nonNull(contexts)));
        projects = Collections.unmodifiableList(new ArrayList<>(nonNull(projects)));
        userFields = Collections.unmodifiableMap(userFields == null ? Map.of() : new LinkedHashMap<>(userFields));
    }

    private static <T> Collection<T> nonNull(Collection<T> values) {
        return values == null ? List.of() : values;
    }

    public static Builder builder(String path) {
        return new Builder(path);
    }

    public boolean isRecurring() {
        return recurrence != null;
    }

    /**
     * Reads a user-defined field by its frontmatter key.
     *
     * @param key field key
     * @return the raw value, or null when absent
     */
    public Object userField(String key) {
        return userFields.get(key);
    }

    public Builder toBuilder() {
        Builder b = new Builder(path);
        b.title = title;
        b.status = status;
        b.priority = priority;
        b.due = due;
        b.scheduled = scheduled;
        b.recurrence = recurrence;
        b.completeInstances = new LinkedHashSet<>(completeInstances);
        b.tags = tags;
        b.contexts = contexts;
        b.projects = projects;
        b.archived = archived;
        b.userFields = new LinkedHashMap<>(userFields);
        b.dateCreated = dateCreated;
        b.dateModified = dateModified;
        b.completedDate = completedDate;
        b.manualOrder = manualOrder;
        b.storyPoints = storyPoints;
        b.timeEstimate = timeEstimate;
        return b;
    }

    /**
     * Builder for {@link TaskEntity}.
     */
    public static final class Builder {
        private final String path;
        private String title = "";
        private String status;
        private String priority;
        private String due;
        private String scheduled;
        private Recurrence recurrence;
        private Set<String> completeInstances = new LinkedHashSet<>();
        private List<String> tags = List.of();
        private List<String> contexts = List.of();
        private List<String> projects = List.of();
        private boolean archived;
        private Map<String, Object> userFields = new LinkedHashMap<>();
        private String dateCreated;
        private String dateModified;
        private String completedDate;
        private Double manualOrder;
        private Double storyPoints;
        private Integer timeEstimate;

        private Builder(String path) {
            this.path = Objects.requireNonNull(path, "path");
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder priority(String priority) {
            this.priority = priority;
            return this;
        }

        public Builder due(String due) {
            this.due = due;
            return this;
        }

        public Builder scheduled(String scheduled) {
            this.scheduled = scheduled;
            return this;
        }

        public Builder recurrence(Recurrence recurrence) {
            this.recurrence = recurrence;
            return this;
        }

        public Builder recurrence(String rule) {
            this.recurrence = rule == null ? null : new Recurrence.RuleString(rule);
            return this;
        }

        public Builder completeInstances(Collection<String> instances) {
            this.completeInstances = new LinkedHashSet<>(nonNull(instances));
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder contexts(List<String> contexts) {
            this.contexts = contexts;
            return this;
        }

        public Builder projects(List<String> projects) {
            this.projects = projects;
            return this;
        }

        public Builder archived(boolean archived) {
            this.archived = archived;
            return this;
        }

        public Builder userField(String key, Object value) {
            this.userFields.put(key, value);
            return this;
        }

        public Builder userFields(Map<String, Object> fields) {
            this.userFields = new LinkedHashMap<>(fields == null ? Map.of() : fields);
            return this;
        }

        public Builder dateCreated(String dateCreated) {
            this.dateCreated = dateCreated;
            return this;
        }

        public Builder dateModified(String dateModified) {
            this.dateModified = dateModified;
            return this;
        }

        public Builder completedDate(String completedDate) {
            this.completedDate = completedDate;
            return this;
        }

        public Builder manualOrder(Double manualOrder) {
            this.manualOrder = manualOrder;
            return this;
        }

        public Builder storyPoints(Double storyPoints) {
            this.storyPoints = storyPoints;
            return this;
        }

        public Builder timeEstimate(Integer timeEstimate) {
            this.timeEstimate = timeEstimate;
            return this;
        }

        public TaskEntity build() {
            return new TaskEntity(path, title, status, priority, due, scheduled, recurrence, completeInstances,
                    tags, contexts, projects, archived, userFields, dateCreated, dateModified, completedDate,
                    manualOrder, storyPoints, timeEstimate);
        }
    }
}
