package io.github.cyfko.taskql.core.api;

import io.github.cyfko.taskql.core.cache.CacheStats;
import io.github.cyfko.taskql.core.model.AgendaDay;
import io.github.cyfko.taskql.core.model.GroupStats;
import io.github.cyfko.taskql.core.model.SelectableValues;
import io.github.cyfko.taskql.core.model.TaskEntity;
import io.github.cyfko.taskql.core.utils.ValidationResult;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Answers "which tasks match this query, in what order, grouped how" over a task index.
 * <p>
 * An engine subscribes to the mutation events of its index when created and keeps its
 * caches consistent with them. {@link #close()} releases the subscriptions.
 * </p>
 *
 * <h2>Evaluation pipeline</h2>
 * <ol>
 *   <li><strong>Optimize:</strong> narrow the candidate paths through the index</li>
 *   <li><strong>Materialize:</strong> look the candidates up in fixed-size batches</li>
 *   <li><strong>Filter:</strong> evaluate the filter tree on each task</li>
 *   <li><strong>Sort:</strong> primary key, then the fallback chain</li>
 *   <li><strong>Group:</strong> partition into ordered buckets</li>
 * </ol>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * try (TaskQueryEngine engine = TaskQueryFactory.of(index, EngineConfig.defaults())) {
 *     FilterQuery query = engine.defaultQuery()
 *         .withRoot(FilterGroup.and(FilterCondition.of(FilterProperty.STATUS, FilterOperator.IS, "open")))
 *         .withGroupKey(TaskGroupKey.PRIORITY);
 *
 *     LinkedHashMap<String, List<TaskEntity>> groups = engine.evaluate(query);
 *     groups.forEach((bucket, tasks) -> render(bucket, tasks));
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface TaskQueryEngine extends AutoCloseable {

    /**
     * Evaluates a query relative to today.
     *
     * @param query the query, normalized first
     * @return ordered map of bucket name to tasks; empty when the query fails
     */
    LinkedHashMap<String, List<TaskEntity>> evaluate(FilterQuery query);

    /**
     * Evaluates a query relative to the given day.
     * <p>
     * Failures of validation or evaluation are logged and answered with an empty map; they
     * never reach the caller.
     * </p>
     *
     * @param query         the query, normalized first
     * @param referenceDate day natural-language dates, date buckets and recurring completion refer to
     * @return ordered map of bucket name to tasks
     */
    LinkedHashMap<String, List<TaskEntity>> evaluate(FilterQuery query, LocalDate referenceDate);

    /**
     * @return an empty {@code and} root, sorted by due date ascending, not grouped
     */
    FilterQuery defaultQuery();

    /**
     * Fills every missing part of a query with its default. Never throws and is idempotent.
     *
     * @param query a partial query, may be null
     * @return a complete query
     */
    FilterQuery normalize(FilterQuery query);

    /**
     * Shows or hides a category of tasks through its well-known root-level condition.
     * <p>
     * The previous hiding condition of the shortcut is always removed first; when
     * {@code enabled} is false a fresh one is appended to the root group.
     * </p>
     *
     * @param query   current query
     * @param filter  the shortcut
     * @param enabled true to show the category
     * @return a new query
     */
    FilterQuery toggleQuickFilter(FilterQuery query, QuickFilter filter, boolean enabled);

    /**
     * @return the values pickers offer, served from a cache
     */
    SelectableValues selectableValues();

    CacheStats filterOptionsStats();

    /**
     * Validates a filter tree.
     *
     * @param query  the query
     * @param strict true at commit time: incomplete conditions are errors
     * @return the outcome
     */
    ValidationResult validate(FilterQuery query, boolean strict);

    /**
     * Tasks of the agenda of one day: recurring tasks due that day, tasks due or scheduled
     * that day, and, when the day is today and {@code includeOverdue} is set, overdue tasks.
     *
     * @param date           the day
     * @param baseQuery      filter and sort applied to the day's tasks
     * @param includeOverdue add overdue tasks on today
     * @return tasks in the base query's sort order
     */
    List<TaskEntity> tasksForDate(LocalDate date, FilterQuery baseQuery, boolean includeOverdue);

    /**
     * @param dates              days to cover
     * @param baseQuery          filter and sort applied to every day
     * @param showOverdueOnToday add overdue tasks on today
     * @return one entry per day, in the given order
     */
    List<AgendaDay> agenda(List<LocalDate> dates, FilterQuery baseQuery, boolean showOverdueOnToday);

    /**
     * Completion statistics of evaluated buckets.
     *
     * @param groups result of {@link #evaluate(FilterQuery)}
     * @return completed and total counts per bucket, in bucket order
     */
    Map<String, GroupStats> groupStats(Map<String, List<TaskEntity>> groups);

    /**
     * Unsubscribes from the index.
     */
    @Override
    void close();
}
