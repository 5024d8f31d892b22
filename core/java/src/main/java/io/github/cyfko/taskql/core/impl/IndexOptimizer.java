package io.github.cyfko.taskql.core.impl;

import io.github.cyfko.taskql.core.api.Conjunction;
import io.github.cyfko.taskql.core.api.FilterCondition;
import io.github.cyfko.taskql.core.api.FilterGroup;
import io.github.cyfko.taskql.core.api.FilterNode;
import io.github.cyfko.taskql.core.api.FilterOperator;
import io.github.cyfko.taskql.core.api.FilterProperty;
import io.github.cyfko.taskql.core.cache.IndexLookupCache;
import io.github.cyfko.taskql.core.spi.TaskIndex;
import io.github.cyfko.taskql.core.utils.DateAnchors;
import io.github.cyfko.taskql.core.utils.NaturalDates;
import io.github.cyfko.taskql.core.utils.ValueCoercion;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Narrows the candidate paths of a query using the task index before full evaluation.
 * <p>
 * The returned set is always a superset of the paths the query matches. When the tree
 * shape does not prove that an indexed condition must hold for every match, the optimizer
 * returns every path.
 * </p>
 *
 * <h2>Indexable conditions</h2>
 * <ul>
 *   <li>{@code status is <value>}, or a list of values (union of the status sets)</li>
 *   <li>{@code due|scheduled is <date>}: the set of the anchor day</li>
 *   <li>{@code due|scheduled} before/after family, only when the index lists its date
 *       keys: union of the sets on the matching side, boundary day included</li>
 * </ul>
 *
 * <h2>Safety rule</h2>
 * <ul>
 *   <li>No indexable condition: all paths</li>
 *   <li>One indexable condition with no {@code or} group above it: its set</li>
 *   <li>Several indexable conditions, all direct children of an {@code and} root: the
 *       intersection of their sets</li>
 *   <li>Any other shape: all paths</li>
 * </ul>
 *
 * <p>Lookups are memoized in an {@link IndexLookupCache} keyed by
 * {@link IndexLookupCache#key}, natural-language dates being resolved first. Failures
 * never propagate: they are logged and answered with all paths.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class IndexOptimizer {

    private static final Logger log = Logger.getLogger(IndexOptimizer.class.getName());

    private record Located(FilterCondition condition, boolean underOr, boolean directChild) {
    }

    private final TaskIndex index;
    private final IndexLookupCache cache;

    public IndexOptimizer(TaskIndex index, IndexLookupCache cache) {
        this.index = Objects.requireNonNull(index, "index");
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    /**
     * Computes the candidate paths of a filter tree.
     *
     * @param root          root group of the query
     * @param referenceDate day natural-language dates resolve against
     * @return a mutable set, superset of the matching paths
     */
    public Set<String> candidatePaths(FilterGroup root, LocalDate referenceDate) {
        try {
            List<Located> indexable = new ArrayList<>();
            collect(root, false, 0, indexable);

            if (indexable.isEmpty()) {
                return allPaths();
            }

            if (indexable.size() == 1) {
                Located only = indexable.get(0);
                if (only.underOr()) {
                    log.fine(() -> String.format("Condition %s sits under an 'or' group, full scan",
                            only.condition().id()));
                    return allPaths();
                }
                return lookup(only.condition(), referenceDate).orElseGet(this::allPaths);
            }

            boolean andRoot = root.conjunction() != Conjunction.OR;
            boolean allDirect = indexable.stream().allMatch(Located::directChild);
            if (!andRoot || !allDirect) {
                log.fine(() -> String.format("%d indexable conditions in an unsafe shape, full scan",
                        indexable.size()));
                return allPaths();
            }

            Set<String> result = null;
            for (Located located : indexable) {
                Optional<Set<String>> paths = lookup(located.condition(), referenceDate);
                if (paths.isEmpty()) continue;
                if (result == null) {
                    result = paths.get();
                } else {
                    result.retainAll(paths.get());
                }
                if (result.isEmpty()) break;
            }
            return result != null ? result : allPaths();
        } catch (RuntimeException e) {
            log.log(Level.WARNING, e, () -> "Index optimization failed, falling back to all paths");
            return allPaths();
        }
    }

    /**
     * Drops every memoized lookup.
     */
    public void invalidate() {
        cache.invalidateAll();
    }

    private Set<String> allPaths() {
        return new LinkedHashSet<>(index.allPaths());
    }

    private void collect(FilterNode node, boolean underOr, int depth, List<Located> out) {
        node.accept(new FilterNode.Visitor<Void>() {
            @Override
            public Void visitCondition(FilterCondition condition) {
                if (isIndexable(condition)) {
                    out.add(new Located(condition, underOr, depth == 1));
                }
                return null;
            }

            @Override
            public Void visitGroup(FilterGroup group) {
                boolean or = underOr || group.conjunction() == Conjunction.OR;
                for (FilterNode child : group.children()) {
                    collect(child, or, depth + 1, out);
                }
                return null;
            }
        });
    }

    boolean isIndexable(FilterCondition condition) {
        if (!condition.isComplete()) return false;
        Optional<FilterProperty> property = condition.property().builtIn();
        if (property.isEmpty()) return false;

        FilterOperator operator = condition.operator();
        switch (property.get()) {
            case STATUS:
                return operator == FilterOperator.IS;
            case DUE:
            case SCHEDULED:
                if (!(condition.value() instanceof String)) return false;
                if (operator == FilterOperator.IS) return true;
                return isRangeOperator(operator) && index.indexedDates().isPresent();
            default:
                return false;
        }
    }

    private static boolean isRangeOperator(FilterOperator operator) {
        return operator == FilterOperator.IS_BEFORE || operator == FilterOperator.IS_ON_OR_BEFORE
                || operator == FilterOperator.IS_AFTER || operator == FilterOperator.IS_ON_OR_AFTER;
    }

    /**
     * @return the memoized or freshly computed paths, empty when the value cannot be used
     */
    private Optional<Set<String>> lookup(FilterCondition condition, LocalDate referenceDate) {
        FilterProperty property = condition.property().builtIn().orElseThrow();
        FilterOperator operator = condition.operator();

        Object keyValue = condition.value();
        Optional<LocalDate> day = Optional.empty();
        if (property != FilterProperty.STATUS) {
            String raw = (String) condition.value();
            day = NaturalDates.resolveDay(raw, referenceDate).or(() -> DateAnchors.anchorDay(raw));
            if (day.isEmpty()) return Optional.empty();
            keyValue = day.get().toString();
        }

        String key = IndexLookupCache.key(property.getKey(), operator.getCode(), keyValue);
        Optional<Set<String>> cached = cache.get(key);
        if (cached.isPresent()) {
            log.fine(() -> String.format("Index lookup hit for '%s'", key));
            return cached;
        }

        Set<String> paths = property == FilterProperty.STATUS
                ? statusPaths(condition.value())
                : datePaths(operator, day.get());
        cache.put(key, paths);
        log.fine(() -> String.format("Index lookup '%s' resolved %d paths", key, paths.size()));
        return Optional.of(new LinkedHashSet<>(paths));
    }

    private Set<String> statusPaths(Object value) {
        Set<String> paths = new LinkedHashSet<>();
        for (Object status : ValueCoercion.items(value)) {
            if (status != null) {
                paths.addAll(index.pathsByStatus(ValueCoercion.text(status)));
            }
        }
        return paths;
    }

    private Set<String> datePaths(FilterOperator operator, LocalDate day) {
        if (operator == FilterOperator.IS) {
            return new LinkedHashSet<>(index.pathsByDate(day));
        }

        boolean before = operator == FilterOperator.IS_BEFORE || operator == FilterOperator.IS_ON_OR_BEFORE;
        Set<LocalDate> keys = index.indexedDates()
                .orElseThrow(() -> new IllegalStateException("Index no longer lists its date keys"));
        Set<String> paths = new LinkedHashSet<>();
        for (LocalDate key : keys) {
            // the boundary day is kept on both sides: time-aware comparisons can match it
            boolean onSide = before ? !key.isAfter(day) : !key.isBefore(day);
            if (onSide) {
                paths.addAll(index.pathsByDate(key));
            }
        }
        return paths;
    }
}
