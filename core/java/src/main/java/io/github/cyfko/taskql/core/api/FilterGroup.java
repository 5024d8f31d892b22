package io.github.cyfko.taskql.core.api;

import io.github.cyfko.taskql.core.utils.FilterIds;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Branch of a filter tree combining its children with a {@link Conjunction}.
 * <p>
 * Groups are immutable. Edits are expressed by building a new group through
 * {@link #withChildren(List)}, {@link #withConjunction(Conjunction)}, {@link #append(FilterNode)}
 * or {@link #removeChildren(Predicate)}; the original tree is left untouched, so no node
 * can become its own ancestor.
 * </p>
 *
 * <h2>Evaluation rules</h2>
 * <ul>
 *   <li>A group without children matches every task.</li>
 *   <li>Incomplete condition children are ignored; nested groups always take part.</li>
 *   <li>A group left with no complete child matches every task.</li>
 * </ul>
 *
 * @param id          node identity
 * @param conjunction how children combine; null only in trees read from untrusted input
 * @param children    ordered children, never null and free of null elements
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FilterGroup(String id, Conjunction conjunction, List<FilterNode> children) implements FilterNode {

    public FilterGroup {
        if (id == null || id.isBlank()) id = FilterIds.next();
        List<FilterNode> copy = new ArrayList<>();
        if (children != null) {
            children.stream().filter(Objects::nonNull).forEach(copy::add);
        }
        children = Collections.unmodifiableList(copy);
    }

    /**
     * Creates an {@code and} group with a generated id.
     */
    public static FilterGroup and(FilterNode... children) {
        return new FilterGroup(FilterIds.next(), Conjunction.AND, Arrays.asList(children));
    }

    /**
     * Creates an {@code or} group with a generated id.
     */
    public static FilterGroup or(FilterNode... children) {
        return new FilterGroup(FilterIds.next(), Conjunction.OR, Arrays.asList(children));
    }

    public static FilterGroup empty() {
        return new FilterGroup(FilterIds.next(), Conjunction.AND, List.of());
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    public FilterGroup withChildren(List<FilterNode> newChildren) {
        return new FilterGroup(id, conjunction, newChildren);
    }

    public FilterGroup withConjunction(Conjunction newConjunction) {
        return new FilterGroup(id, newConjunction, children);
    }

    public FilterGroup append(FilterNode child) {
        List<FilterNode> next = new ArrayList<>(children);
        next.add(child);
        return withChildren(next);
    }

    /**
     * Returns a copy of this group without the direct children matching {@code filter}.
     *
     * @param filter selects the children to drop
     * @return a new group, or this group when nothing matched
     */
    public FilterGroup removeChildren(Predicate<FilterNode> filter) {
        List<FilterNode> kept = new ArrayList<>(children.size());
        for (FilterNode child : children) {
            if (!filter.test(child)) kept.add(child);
        }
        return kept.size() == children.size() ? this : withChildren(kept);
    }

    /**
     * Rebuilds this subtree node by node. The copy shares no list instance with the
     * original and keeps every id.
     *
     * @return a structurally equal tree
     */
    public FilterGroup deepCopy() {
        List<FilterNode> copies = new ArrayList<>(children.size());
        for (FilterNode child : children) {
            copies.add(child.accept(new Visitor<FilterNode>() {
                @Override
                public FilterNode visitCondition(FilterCondition condition) {
                    return new FilterCondition(condition.id(), condition.property(), condition.operator(), condition.value());
                }

                @Override
                public FilterNode visitGroup(FilterGroup group) {
                    return group.deepCopy();
                }
            }));
        }
        return new FilterGroup(id, conjunction, copies);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitGroup(this);
    }
}
