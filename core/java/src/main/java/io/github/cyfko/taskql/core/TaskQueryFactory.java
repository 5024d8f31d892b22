package io.github.cyfko.taskql.core;

import io.github.cyfko.taskql.core.api.TaskQueryEngine;
import io.github.cyfko.taskql.core.cache.Ticker;
import io.github.cyfko.taskql.core.config.EngineConfig;
import io.github.cyfko.taskql.core.impl.DefaultTaskQueryEngine;
import io.github.cyfko.taskql.core.spi.TaskIndex;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * High-level facade creating query engines over a task index.
 * <p>
 * The returned engine is subscribed to the index events as soon as it is created; close it
 * when the view it serves goes away.
 * </p>
 *
 * <p><strong>Complete Usage Example:</strong></p>
 * <pre>{@code
 * // 1. Describe the workspace
 * EngineConfig config = EngineConfig.builder()
 *     .userFields(List.of(UserFieldDefinition.of("effort", UserFieldType.NUMBER)))
 *     .recurrenceEvaluator(rules::isDueOn)
 *     .build();
 *
 * // 2. Create the engine
 * TaskQueryEngine engine = TaskQueryFactory.of(index, config);
 *
 * // 3. Build and evaluate a query
 * FilterQuery query = engine.defaultQuery()
 *     .withRoot(FilterGroup.and(
 *         FilterCondition.of(FilterProperty.STATUS, FilterOperator.IS, "open"),
 *         FilterCondition.of(PropertySelector.user("effort"), FilterOperator.IS_GREATER_THAN, 3)))
 *     .withSort(TaskSortKey.user("effort"), SortDirection.DESC)
 *     .withGroupKey(TaskGroupKey.PROJECT);
 *
 * LinkedHashMap<String, List<TaskEntity>> groups = engine.evaluate(query);
 *
 * // 4. Hide completed tasks with a single call
 * query = engine.toggleQuickFilter(query, QuickFilter.SHOW_COMPLETED, false);
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TaskQueryFactory {

    private static final Logger log = Logger.getLogger(TaskQueryFactory.class.getName());

    private TaskQueryFactory() {
    }

    /**
     * Creates an engine with the default configuration.
     *
     * @param index task index
     * @return a new engine
     */
    public static TaskQueryEngine of(TaskIndex index) {
        return of(index, EngineConfig.defaults());
    }

    /**
     * Creates an engine.
     *
     * @param index  task index
     * @param config engine configuration
     * @return a new engine
     * @throws NullPointerException if an argument is null
     */
    public static TaskQueryEngine of(TaskIndex index, EngineConfig config) {
        return of(index, config, Ticker.system());
    }

    /**
     * Creates an engine whose caches read time from the given ticker.
     *
     * @param index  task index
     * @param config engine configuration
     * @param ticker monotonic time source
     * @return a new engine
     */
    public static TaskQueryEngine of(TaskIndex index, EngineConfig config, Ticker ticker) {
        Objects.requireNonNull(index, "TaskIndex cannot be null");
        Objects.requireNonNull(config, "EngineConfig cannot be null");
        Objects.requireNonNull(ticker, "Ticker cannot be null");

        log.fine(() -> String.format(
                "Creating task query engine: %d user fields, batch size %d, cache %s",
                config.getUserFields().size(),
                config.getBatchSize(),
                config.getCachePolicy()));
        return new DefaultTaskQueryEngine(index, config, ticker);
    }
}
