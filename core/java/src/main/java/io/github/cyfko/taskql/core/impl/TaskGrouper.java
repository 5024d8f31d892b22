package io.github.cyfko.taskql.core.impl;

import io.github.cyfko.taskql.core.api.SortDirection;
import io.github.cyfko.taskql.core.api.TaskGroupKey;
import io.github.cyfko.taskql.core.api.TaskSortKey;
import io.github.cyfko.taskql.core.config.EngineConfig;
import io.github.cyfko.taskql.core.model.PriorityCatalog;
import io.github.cyfko.taskql.core.model.StatusCatalog;
import io.github.cyfko.taskql.core.model.TaskEntity;
import io.github.cyfko.taskql.core.spi.ProjectResolver;

import java.text.Collator;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Partitions sorted tasks into named, ordered buckets.
 * <p>
 * Every key assigns exactly one bucket per task, except {@code project}: a task lands in the
 * bucket of each distinct project it references, or in {@value #NO_PROJECT}. Tasks keep their
 * input order inside each bucket.
 * </p>
 *
 * <h2>Bucket names</h2>
 * <ul>
 *   <li>{@code none}: {@value #ALL}</li>
 *   <li>{@code status}: the status, or {@value #NO_STATUS}</li>
 *   <li>{@code priority}: the priority, or {@value #UNKNOWN_PRIORITY}</li>
 *   <li>{@code context}: the first context, or {@value #NO_CONTEXT}</li>
 *   <li>{@code due}, {@code scheduled}: see {@link DateBuckets}</li>
 *   <li>{@code user:<id>}: see {@link UserFieldAccessor}</li>
 * </ul>
 *
 * <h2>Bucket order</h2>
 * <ul>
 *   <li>Priority by descending weight, status by catalog order</li>
 *   <li>Date buckets in their fixed sequence, from past to "no date"</li>
 *   <li>Projects alphabetically with {@value #NO_PROJECT} last; contexts alphabetically</li>
 *   <li>User fields per type</li>
 * </ul>
 * <p>
 * When the group key is also the sort key, buckets follow the sort direction and are
 * reversed for {@code desc}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TaskGrouper {

    public static final String ALL = "all";
    public static final String NO_STATUS = "no-status";
    public static final String UNKNOWN_PRIORITY = "unknown";
    public static final String NO_CONTEXT = "none";
    public static final String NO_PROJECT = "No Project";

    private final StatusCatalog statuses;
    private final PriorityCatalog priorities;
    private final ProjectResolver projectResolver;
    private final Collator collator;
    private final DateBuckets dateBuckets;
    private final UserFieldAccessor userFields;

    public TaskGrouper(EngineConfig config, DateBuckets dateBuckets, UserFieldAccessor userFields) {
        this.statuses = config.getStatusCatalog();
        this.priorities = config.getPriorityCatalog();
        this.projectResolver = config.getProjectResolver();
        this.collator = Collator.getInstance(config.getCollationLocale());
        this.dateBuckets = Objects.requireNonNull(dateBuckets, "dateBuckets");
        this.userFields = Objects.requireNonNull(userFields, "userFields");
    }

    /**
     * Groups tasks already in sort order.
     *
     * @param sortedTasks   tasks in sort order
     * @param key           group key
     * @param sortKey       active sort key
     * @param direction     active sort direction
     * @param referenceDate day date buckets are relative to
     * @return ordered map of bucket name to tasks
     */
    public LinkedHashMap<String, List<TaskEntity>> group(List<TaskEntity> sortedTasks, TaskGroupKey key,
                                                         TaskSortKey sortKey, SortDirection direction,
                                                         LocalDate referenceDate) {
        LinkedHashMap<String, List<TaskEntity>> result = new LinkedHashMap<>();
        if (TaskGroupKey.NONE.equals(key)) {
            result.put(ALL, new ArrayList<>(sortedTasks));
            return result;
        }

        Map<String, List<TaskEntity>> buckets = new LinkedHashMap<>();
        for (TaskEntity task : sortedTasks) {
            for (String bucket : bucketsOf(task, key, referenceDate)) {
                buckets.computeIfAbsent(bucket, b -> new ArrayList<>()).add(task);
            }
        }

        List<String> names = new ArrayList<>(buckets.keySet());
        names.sort(bucketOrder(key, sortKey, direction));
        for (String name : names) {
            result.put(name, buckets.get(name));
        }
        return result;
    }

    /**
     * @return the buckets of a task, a single one except for project grouping
     */
    Set<String> bucketsOf(TaskEntity task, TaskGroupKey key, LocalDate referenceDate) {
        if (key.isUserField()) {
            return Set.of(userFields.bucket(task, key.userFieldId()));
        }
        switch (key.key()) {
            case "status":
                return Set.of(isBlank(task.status()) ? NO_STATUS : task.status());
            case "priority":
                return Set.of(isBlank(task.priority()) ? UNKNOWN_PRIORITY : task.priority());
            case "context":
                return Set.of(firstContext(task));
            case "due":
                return Set.of(dateBuckets.dueBucket(task, referenceDate));
            case "scheduled":
                return Set.of(dateBuckets.scheduledBucket(task, referenceDate));
            case "project":
                return projectsOf(task);
            default:
                return Set.of(ALL);
        }
    }

    private static String firstContext(TaskEntity task) {
        for (String context : task.contexts()) {
            if (!isBlank(context)) return context.trim();
        }
        return NO_CONTEXT;
    }

    private Set<String> projectsOf(TaskEntity task) {
        Set<String> projects = new LinkedHashSet<>();
        for (String reference : task.projects()) {
            String name = projectResolver.canonicalize(reference, task.path());
            if (!isBlank(name)) projects.add(name);
        }
        if (projects.isEmpty()) projects.add(NO_PROJECT);
        return projects;
    }

    private Comparator<String> bucketOrder(TaskGroupKey key, TaskSortKey sortKey, SortDirection direction) {
        boolean aligned = sortKey != null && key.matches(sortKey);
        boolean reverse = aligned && direction == SortDirection.DESC;

        Comparator<String> order;
        if (key.isUserField()) {
            order = aligned
                    ? userFields.sortAlignedBucketOrder(key.userFieldId())
                    : userFields.bucketOrder(key.userFieldId());
        } else {
            switch (key.key()) {
                case "priority":
                    order = (a, b) -> Integer.compare(priorities.weightOf(b), priorities.weightOf(a));
                    break;
                case "status":
                    order = Comparator.comparingInt(statuses::orderOf);
                    break;
                case "due":
                    order = Comparator.comparingInt(DateBuckets.DUE_ORDER::indexOf);
                    break;
                case "scheduled":
                    order = Comparator.comparingInt(DateBuckets.SCHEDULED_ORDER::indexOf);
                    break;
                case "project":
                    order = (a, b) -> {
                        if (a.equals(b)) return 0;
                        if (NO_PROJECT.equals(a)) return 1;
                        if (NO_PROJECT.equals(b)) return -1;
                        return collator.compare(a, b);
                    };
                    break;
                default:
                    order = collator::compare;
            }
        }
        return reverse ? order.reversed() : order;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
