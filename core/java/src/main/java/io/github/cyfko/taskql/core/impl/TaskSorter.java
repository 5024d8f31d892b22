package io.github.cyfko.taskql.core.impl;

import io.github.cyfko.taskql.core.api.SortDirection;
import io.github.cyfko.taskql.core.api.TaskSortKey;
import io.github.cyfko.taskql.core.config.EngineConfig;
import io.github.cyfko.taskql.core.model.PriorityCatalog;
import io.github.cyfko.taskql.core.model.TaskEntity;
import io.github.cyfko.taskql.core.utils.DateAnchors;

import java.text.Collator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Orders tasks by a primary key with a fixed fallback chain.
 * <p>
 * When the primary comparator ties, the chain {@code scheduled -> due -> priority -> title}
 * decides, skipping the key already used as primary. The direction is applied last by
 * negating the complete comparison, so {@code desc} is the exact reverse of {@code asc}.
 * </p>
 *
 * <h2>Comparators</h2>
 * <ul>
 *   <li><strong>Dates</strong>: time-aware via {@link DateAnchors#compareNullsLast(String, String)}</li>
 *   <li><strong>Priority</strong>: descending weight, so ascending order lists the most
 *       urgent tasks first</li>
 *   <li><strong>Numbers</strong> (manual order, story points, time estimate): missing last</li>
 *   <li><strong>Title</strong>: {@link Collator} of the configured locale</li>
 *   <li><strong>User fields</strong>: typed per field, see {@link UserFieldAccessor}</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TaskSorter {

    private final PriorityCatalog priorities;
    private final Collator collator;
    private final UserFieldAccessor userFields;

    public TaskSorter(EngineConfig config, UserFieldAccessor userFields) {
        this.priorities = config.getPriorityCatalog();
        this.collator = Collator.getInstance(config.getCollationLocale());
        this.userFields = Objects.requireNonNull(userFields, "userFields");
    }

    /**
     * Sorts a copy of the given tasks.
     *
     * @param tasks     tasks to order
     * @param key       primary key
     * @param direction sort direction
     * @return a new list in the requested order
     */
    public List<TaskEntity> sort(List<TaskEntity> tasks, TaskSortKey key, SortDirection direction) {
        List<TaskEntity> sorted = new ArrayList<>(tasks);
        sorted.sort(comparator(key, direction));
        return sorted;
    }

    /**
     * @param key       primary key
     * @param direction sort direction
     * @return the primary comparator followed by the fallback chain, reversed for {@code desc}
     */
    public Comparator<TaskEntity> comparator(TaskSortKey key, SortDirection direction) {
        Comparator<TaskEntity> chain = primary(key);
        for (TaskSortKey fallback : List.of(TaskSortKey.SCHEDULED, TaskSortKey.DUE, TaskSortKey.PRIORITY,
                TaskSortKey.TITLE)) {
            if (!fallback.equals(key)) {
                chain = chain.thenComparing(primary(fallback));
            }
        }
        return direction == SortDirection.DESC ? chain.reversed() : chain;
    }

    Comparator<TaskEntity> primary(TaskSortKey key) {
        if (key.isUserField()) {
            return userFields.comparator(key.userFieldId());
        }
        switch (key.key()) {
            case "due":
                return dates(TaskEntity::due);
            case "scheduled":
                return dates(TaskEntity::scheduled);
            case "dateCreated":
                return dates(TaskEntity::dateCreated);
            case "dateModified":
                return dates(TaskEntity::dateModified);
            case "completedDate":
                return dates(TaskEntity::completedDate);
            case "priority":
                return (a, b) -> Integer.compare(priorities.weightOf(b.priority()), priorities.weightOf(a.priority()));
            case "title":
                return (a, b) -> collator.compare(a.title(), b.title());
            case "manualOrder":
                return numbers(TaskEntity::manualOrder);
            case "storyPoints":
                return numbers(TaskEntity::storyPoints);
            case "timeEstimate":
                return numbers(t -> t.timeEstimate() == null ? null : t.timeEstimate().doubleValue());
            default:
                throw new IllegalArgumentException("Unsupported sort key: " + key);
        }
    }

    private static Comparator<TaskEntity> dates(Function<TaskEntity, String> getter) {
        return (a, b) -> DateAnchors.compareNullsLast(getter.apply(a), getter.apply(b));
    }

    private static Comparator<TaskEntity> numbers(Function<TaskEntity, Double> getter) {
        return Comparator.comparing(getter, Comparator.nullsLast(Comparator.naturalOrder()));
    }
}
