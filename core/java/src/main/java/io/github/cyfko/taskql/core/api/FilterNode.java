package io.github.cyfko.taskql.core.api;

/**
 * A node of a filter tree: either a leaf {@link FilterCondition} or a branch {@link FilterGroup}.
 * <p>
 * The hierarchy is closed. Code that needs to handle every node kind implements
 * {@link Visitor}, so adding a kind breaks compilation at each traversal instead of
 * silently falling through a type check.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * int conditions = root.accept(new FilterNode.Visitor<Integer>() {
 *     public Integer visitCondition(FilterCondition condition) {
 *         return 1;
 *     }
 *     public Integer visitGroup(FilterGroup group) {
 *         return group.children().stream().mapToInt(c -> c.accept(this)).sum();
 *     }
 * });
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface FilterNode permits FilterCondition, FilterGroup {

    /**
     * @return the identity of this node inside its tree
     */
    String id();

    <R> R accept(Visitor<R> visitor);

    /**
     * Exhaustive traversal over the node kinds.
     *
     * @param <R> result type
     */
    interface Visitor<R> {
        R visitCondition(FilterCondition condition);

        R visitGroup(FilterGroup group);
    }
}
