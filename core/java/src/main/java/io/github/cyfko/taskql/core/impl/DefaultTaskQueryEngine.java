package io.github.cyfko.taskql.core.impl;

import io.github.cyfko.taskql.core.api.Conjunction;
import io.github.cyfko.taskql.core.api.FilterCondition;
import io.github.cyfko.taskql.core.api.FilterGroup;
import io.github.cyfko.taskql.core.api.FilterNode;
import io.github.cyfko.taskql.core.api.FilterQuery;
import io.github.cyfko.taskql.core.api.QuickFilter;
import io.github.cyfko.taskql.core.api.SortDirection;
import io.github.cyfko.taskql.core.api.TaskGroupKey;
import io.github.cyfko.taskql.core.api.TaskQueryEngine;
import io.github.cyfko.taskql.core.api.TaskSortKey;
import io.github.cyfko.taskql.core.cache.CacheStats;
import io.github.cyfko.taskql.core.cache.FilterOptionsCache;
import io.github.cyfko.taskql.core.cache.IndexLookupCache;
import io.github.cyfko.taskql.core.cache.Ticker;
import io.github.cyfko.taskql.core.config.CachePolicy;
import io.github.cyfko.taskql.core.config.EngineConfig;
import io.github.cyfko.taskql.core.exception.FilterEvaluationException;
import io.github.cyfko.taskql.core.exception.FilterValidationException;
import io.github.cyfko.taskql.core.model.AgendaDay;
import io.github.cyfko.taskql.core.model.GroupStats;
import io.github.cyfko.taskql.core.model.SelectableValues;
import io.github.cyfko.taskql.core.model.TaskEntity;
import io.github.cyfko.taskql.core.spi.IndexEventType;
import io.github.cyfko.taskql.core.spi.TaskIndex;
import io.github.cyfko.taskql.core.utils.DateAnchors;
import io.github.cyfko.taskql.core.utils.FilterIds;
import io.github.cyfko.taskql.core.utils.FilterValidator;
import io.github.cyfko.taskql.core.utils.ValidationResult;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link TaskQueryEngine} wiring the optimizer, materializer, evaluator, sorter and
 * grouper over a {@link TaskIndex}.
 * <p>
 * Every index event clears the optimizer memo and marks the selectable values stale. The
 * engine holds no other state, so concurrent evaluations only share the caches, which are
 * guarded by their own locks.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class DefaultTaskQueryEngine implements TaskQueryEngine {

    private static final Logger log = Logger.getLogger(DefaultTaskQueryEngine.class.getName());

    private final TaskIndex index;
    private final EngineConfig config;
    private final TaskCompletion completion;
    private final QueryEvaluator evaluator;
    private final IndexOptimizer optimizer;
    private final TaskMaterializer materializer;
    private final TaskSorter sorter;
    private final DateBuckets dateBuckets;
    private final TaskGrouper grouper;
    private final FilterOptionsCache<SelectableValues> optionsCache;
    private final List<TaskIndex.Subscription> subscriptions = new ArrayList<>();

    public DefaultTaskQueryEngine(TaskIndex index, EngineConfig config) {
        this(index, config, Ticker.system());
    }

    /**
     * @param index  task index
     * @param config engine configuration
     * @param ticker time source of the caches
     */
    public DefaultTaskQueryEngine(TaskIndex index, EngineConfig config, Ticker ticker) {
        this.index = Objects.requireNonNull(index, "index");
        this.config = Objects.requireNonNull(config, "config");
        Objects.requireNonNull(ticker, "ticker");

        CachePolicy policy = config.getCachePolicy();
        UserFieldAccessor userFields = new UserFieldAccessor(config);
        this.completion = new TaskCompletion(config.getStatusCatalog());
        this.evaluator = new QueryEvaluator(config, userFields);
        this.optimizer = new IndexOptimizer(index,
                new IndexLookupCache(policy.maxEntries(), policy.lookupTtl(), ticker));
        this.materializer = new TaskMaterializer(index, config.getBatchSize());
        this.sorter = new TaskSorter(config, userFields);
        this.dateBuckets = new DateBuckets(config, completion);
        this.grouper = new TaskGrouper(config, dateBuckets, userFields);
        this.optionsCache = new FilterOptionsCache<>(policy, ticker);

        for (IndexEventType type : IndexEventType.values()) {
            TaskIndex.Subscription subscription = index.subscribe(type, this::onIndexEvent);
            if (subscription != null) {
                subscriptions.add(subscription);
            }
        }
    }

    private void onIndexEvent(IndexEventType type, String path) {
        optimizer.invalidate();
        optionsCache.markStale();
        log.fine(() -> String.format("Index event %s on '%s': caches invalidated", type, path));
    }

    @Override
    public LinkedHashMap<String, List<TaskEntity>> evaluate(FilterQuery query) {
        return evaluate(query, config.today());
    }

    @Override
    public LinkedHashMap<String, List<TaskEntity>> evaluate(FilterQuery query, LocalDate referenceDate) {
        long start = System.nanoTime();
        FilterQuery normalized = normalize(query);
        LocalDate day = referenceDate != null ? referenceDate : config.today();

        try {
            List<TaskEntity> matching = matchingTasks(normalized.root(), day);
            List<TaskEntity> sorted = sorter.sort(matching, normalized.sortKey(), normalized.sortDirection());
            LinkedHashMap<String, List<TaskEntity>> groups = grouper.group(sorted, normalized.groupKey(),
                    normalized.sortKey(), normalized.sortDirection(), day);

            long durationMs = (System.nanoTime() - start) / 1_000_000;
            log.fine(() -> String.format("Query evaluated in %d ms: %d tasks in %d groups",
                    durationMs, sorted.size(), groups.size()));
            return groups;
        } catch (FilterValidationException e) {
            log.warning(() -> String.format("Query rejected (validation error) at node '%s', field '%s': %s",
                    e.getNodeId(), e.getField(), e.getMessage()));
        } catch (FilterEvaluationException e) {
            log.warning(() -> String.format("Query failed (evaluation error) at node '%s', property '%s': %s",
                    e.getNodeId(), e.getProperty(), e.getMessage()));
        } catch (RuntimeException e) {
            log.log(Level.WARNING, e, () -> "Query failed (unexpected error)");
        }
        return new LinkedHashMap<>();
    }

    /**
     * Validates leniently, narrows, materializes and filters.
     */
    private List<TaskEntity> matchingTasks(FilterGroup root, LocalDate day) {
        FilterValidator.validate(root, config.getUserFieldsById(), false);

        Set<String> candidates = optimizer.candidatePaths(root, day);
        List<TaskEntity> tasks = materializer.materialize(candidates);

        List<TaskEntity> matching = new ArrayList<>();
        for (TaskEntity task : tasks) {
            if (evaluator.evaluate(root, task, day)) {
                matching.add(task);
            }
        }
        log.fine(() -> String.format("%d of %d candidates matched", matching.size(), tasks.size()));
        return matching;
    }

    @Override
    public FilterQuery defaultQuery() {
        return new FilterQuery(new FilterGroup(FilterIds.next(), Conjunction.AND, List.of()),
                TaskSortKey.DUE, SortDirection.ASC, TaskGroupKey.NONE);
    }

    @Override
    public FilterQuery normalize(FilterQuery query) {
        if (query == null) {
            return defaultQuery();
        }
        FilterGroup root = query.root() == null
                ? new FilterGroup(FilterIds.next(), Conjunction.AND, List.of())
                : normalizeGroup(query.root());
        return new FilterQuery(
                root,
                query.sortKey() != null ? query.sortKey() : TaskSortKey.DUE,
                query.sortDirection() != null ? query.sortDirection() : SortDirection.ASC,
                query.groupKey() != null ? query.groupKey() : TaskGroupKey.NONE);
    }

    private static FilterGroup normalizeGroup(FilterGroup group) {
        List<FilterNode> children = new ArrayList<>(group.children().size());
        for (FilterNode child : group.children()) {
            children.add(child instanceof FilterGroup nested ? normalizeGroup(nested) : child);
        }
        Conjunction conjunction = group.conjunction() != null ? group.conjunction() : Conjunction.AND;
        return new FilterGroup(group.id(), conjunction, children);
    }

    @Override
    public FilterQuery toggleQuickFilter(FilterQuery query, QuickFilter filter, boolean enabled) {
        Objects.requireNonNull(filter, "filter");
        FilterQuery base = normalize(query).deepCopy();
        FilterGroup root = base.root().removeChildren(filter::isHidingCondition);
        if (!enabled) {
            root = root.append(filter.hidingCondition());
        }
        return base.withRoot(root);
    }

    @Override
    public SelectableValues selectableValues() {
        return optionsCache.get(this::computeSelectableValues);
    }

    private SelectableValues computeSelectableValues() {
        Set<String> folders = new TreeSet<>();
        for (String path : index.allPaths()) {
            int slash = path.lastIndexOf('/');
            if (slash > 0) {
                folders.add(path.substring(0, slash));
            }
        }
        return new SelectableValues(
                distinct(index.allStatuses()),
                distinct(index.allPriorities()),
                distinct(index.allContexts()),
                distinct(index.allProjects()),
                distinct(index.allTags()),
                new ArrayList<>(folders),
                config.getUserFields());
    }

    private static List<String> distinct(Collection<String> values) {
        Set<String> kept = new LinkedHashSet<>();
        if (values != null) {
            for (String value : values) {
                if (value != null && !value.isBlank()) kept.add(value);
            }
        }
        return new ArrayList<>(kept);
    }

    @Override
    public CacheStats filterOptionsStats() {
        return optionsCache.stats();
    }

    @Override
    public ValidationResult validate(FilterQuery query, boolean strict) {
        if (query == null || query.root() == null) {
            return ValidationResult.success();
        }
        return FilterValidator.check(query.root(), config.getUserFieldsById(), strict);
    }

    @Override
    public List<TaskEntity> tasksForDate(LocalDate date, FilterQuery baseQuery, boolean includeOverdue) {
        Objects.requireNonNull(date, "date");
        FilterQuery normalized = normalize(baseQuery);
        boolean withOverdue = includeOverdue && date.equals(config.today());

        try {
            List<TaskEntity> onDay = new ArrayList<>();
            for (TaskEntity task : matchingTasks(normalized.root(), date)) {
                if (isOnDay(task, date) || withOverdue && isOverdue(task, date)) {
                    onDay.add(task);
                }
            }
            return sorter.sort(onDay, normalized.sortKey(), normalized.sortDirection());
        } catch (FilterValidationException | FilterEvaluationException e) {
            log.warning(() -> String.format("Agenda query for %s failed: %s", date, e.getMessage()));
        } catch (RuntimeException e) {
            log.log(Level.WARNING, e, () -> "Agenda query for " + date + " failed (unexpected error)");
        }
        return new ArrayList<>();
    }

    private boolean isOnDay(TaskEntity task, LocalDate date) {
        if (task.isRecurring()) {
            return config.getRecurrenceEvaluator().isDueOn(task, date);
        }
        return DateAnchors.anchorDay(task.due()).filter(date::equals).isPresent()
                || DateAnchors.anchorDay(task.scheduled()).filter(date::equals).isPresent();
    }

    private boolean isOverdue(TaskEntity task, LocalDate today) {
        if (task.isRecurring()) return false;
        if (config.isHideCompletedFromOverdue() && completion.isCompleted(task, today)) return false;
        return isPast(task.due(), today) || isPast(task.scheduled(), today);
    }

    private boolean isPast(String raw, LocalDate today) {
        Optional<DateAnchors.Anchored> date = DateAnchors.parse(raw);
        return date.isPresent() && dateBuckets.isPast(date.get(), today);
    }

    @Override
    public List<AgendaDay> agenda(List<LocalDate> dates, FilterQuery baseQuery, boolean showOverdueOnToday) {
        List<AgendaDay> days = new ArrayList<>(dates.size());
        for (LocalDate date : dates) {
            days.add(new AgendaDay(date, tasksForDate(date, baseQuery, showOverdueOnToday)));
        }
        return days;
    }

    @Override
    public Map<String, GroupStats> groupStats(Map<String, List<TaskEntity>> groups) {
        LocalDate today = config.today();
        Map<String, GroupStats> stats = new LinkedHashMap<>();
        groups.forEach((name, tasks) -> {
            int completed = (int) tasks.stream().filter(task -> completion.isCompleted(task, today)).count();
            stats.put(name, new GroupStats(completed, tasks.size()));
        });
        return stats;
    }

    @Override
    public void close() {
        for (TaskIndex.Subscription subscription : subscriptions) {
            subscription.close();
        }
        subscriptions.clear();
    }
}
