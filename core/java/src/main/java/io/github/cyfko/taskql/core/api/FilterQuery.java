package io.github.cyfko.taskql.core.api;

/**
 * A complete query: the root filter group plus how matches are sorted and grouped.
 * <p>
 * Any component may be null in a query read from storage or built partially by a UI;
 * {@link TaskQueryEngine#normalize(FilterQuery)} fills the gaps with defaults. A query whose
 * root group is empty matches every task.
 * </p>
 *
 * <pre>{@code
 * FilterQuery query = new FilterQuery(
 *     FilterGroup.and(
 *         FilterCondition.of(FilterProperty.STATUS, FilterOperator.IS, "open"),
 *         FilterCondition.of(FilterProperty.PRIORITY, FilterOperator.IS, "high")),
 *     TaskSortKey.DUE, SortDirection.ASC, TaskGroupKey.NONE);
 * }</pre>
 *
 * @param root          root filter group
 * @param sortKey       primary sort key
 * @param sortDirection direction of the sort
 * @param groupKey      bucket key
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FilterQuery(FilterGroup root, TaskSortKey sortKey, SortDirection sortDirection, TaskGroupKey groupKey) {

    public FilterQuery withRoot(FilterGroup newRoot) {
        return new FilterQuery(newRoot, sortKey, sortDirection, groupKey);
    }

    public FilterQuery withSort(TaskSortKey newKey, SortDirection newDirection) {
        return new FilterQuery(root, newKey, newDirection, groupKey);
    }

    public FilterQuery withGroupKey(TaskGroupKey newGroupKey) {
        return new FilterQuery(root, sortKey, sortDirection, newGroupKey);
    }

    /**
     * @return a copy whose filter tree shares no list with this query
     */
    public FilterQuery deepCopy() {
        return new FilterQuery(root == null ? null : root.deepCopy(), sortKey, sortDirection, groupKey);
    }
}
