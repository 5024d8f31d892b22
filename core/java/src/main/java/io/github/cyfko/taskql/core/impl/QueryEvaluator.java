package io.github.cyfko.taskql.core.impl;

import io.github.cyfko.taskql.core.api.Conjunction;
import io.github.cyfko.taskql.core.api.FilterCondition;
import io.github.cyfko.taskql.core.api.FilterGroup;
import io.github.cyfko.taskql.core.api.FilterNode;
import io.github.cyfko.taskql.core.api.FilterOperator;
import io.github.cyfko.taskql.core.api.FilterProperty;
import io.github.cyfko.taskql.core.config.EngineConfig;
import io.github.cyfko.taskql.core.exception.FilterEvaluationException;
import io.github.cyfko.taskql.core.model.Recurrence;
import io.github.cyfko.taskql.core.model.TaskEntity;
import io.github.cyfko.taskql.core.model.UserFieldDefinition;
import io.github.cyfko.taskql.core.spi.ProjectResolver;
import io.github.cyfko.taskql.core.utils.DateAnchors;
import io.github.cyfko.taskql.core.utils.ListTokens;
import io.github.cyfko.taskql.core.utils.NaturalDates;
import io.github.cyfko.taskql.core.utils.ValueCoercion;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Decides whether a task satisfies a filter tree.
 * <p>
 * The evaluator walks the tree through {@link FilterNode.Visitor}, so every node kind is
 * handled explicitly. It is stateless apart from its configuration and may be shared
 * between threads.
 * </p>
 *
 * <h2>Groups</h2>
 * <ul>
 *   <li>Incomplete conditions are dropped before the conjunction is applied; nested groups
 *       are always kept</li>
 *   <li>A group with no remaining child matches every task</li>
 *   <li>{@code and} requires every child to match, {@code or} at least one</li>
 * </ul>
 *
 * <h2>Conditions</h2>
 * <ul>
 *   <li><strong>Equality</strong> is list-aware on both sides: any task value equal to any
 *       condition value. Date properties compare anchor days.</li>
 *   <li><strong>Contains</strong> is a case-insensitive substring test on text and a
 *       case-insensitive membership test on lists.</li>
 *   <li><strong>Dates</strong> accept natural-language values such as {@code tomorrow} or
 *       {@code in 3 days}, resolved against the reference date.</li>
 *   <li><strong>Numbers</strong> read the leading number of the value, so {@code "10-High"}
 *       counts as 10.</li>
 *   <li>{@code status.isCompleted} goes through {@link TaskCompletion}; {@code projects}
 *       contains compares names canonicalized by the {@link ProjectResolver}.</li>
 * </ul>
 *
 * <pre>{@code
 * QueryEvaluator evaluator = new QueryEvaluator(config, new UserFieldAccessor(config));
 * boolean matches = evaluator.evaluate(query.root(), task, LocalDate.of(2025, 6, 10));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class QueryEvaluator {

    private final UserFieldAccessor userFields;
    private final TaskCompletion completion;
    private final ProjectResolver projectResolver;

    public QueryEvaluator(EngineConfig config, UserFieldAccessor userFields) {
        this.userFields = Objects.requireNonNull(userFields, "userFields");
        this.completion = new TaskCompletion(config.getStatusCatalog());
        this.projectResolver = config.getProjectResolver();
    }

    /**
     * Evaluates a node against a task.
     *
     * @param node          condition or group
     * @param task          task snapshot
     * @param referenceDate day used for natural-language dates and recurring completion
     * @return true if the task matches
     * @throws FilterEvaluationException if a condition cannot be computed
     */
    public boolean evaluate(FilterNode node, TaskEntity task, LocalDate referenceDate) {
        return node.accept(new FilterNode.Visitor<Boolean>() {
            @Override
            public Boolean visitCondition(FilterCondition condition) {
                return !condition.isComplete() || matchCondition(condition, task, referenceDate);
            }

            @Override
            public Boolean visitGroup(FilterGroup group) {
                return matchGroup(group, task, referenceDate);
            }
        });
    }

    private boolean matchGroup(FilterGroup group, TaskEntity task, LocalDate referenceDate) {
        List<FilterNode> active = new ArrayList<>();
        for (FilterNode child : group.children()) {
            if (child instanceof FilterCondition condition && !condition.isComplete()) continue;
            active.add(child);
        }
        if (active.isEmpty()) return true;

        if (group.conjunction() == Conjunction.OR) {
            for (FilterNode child : active) {
                if (evaluate(child, task, referenceDate)) return true;
            }
            return false;
        }
        for (FilterNode child : active) {
            if (!evaluate(child, task, referenceDate)) return false;
        }
        return true;
    }

    private boolean matchCondition(FilterCondition condition, TaskEntity task, LocalDate referenceDate) {
        String key = condition.property().key();
        FilterOperator operator = condition.operator();
        try {
            if (condition.property().isUserField()) {
                return matchUserField(condition, task, referenceDate);
            }

            FilterProperty property = condition.property().builtIn()
                    .orElseThrow(() -> new FilterEvaluationException(
                            "Unknown property: " + key, condition.id(), key));

            if (property == FilterProperty.STATUS_IS_COMPLETED) {
                return applyOperator(completion.isCompleted(task, referenceDate), operator,
                        condition.value(), false, referenceDate);
            }
            if (property == FilterProperty.PROJECTS
                    && (operator == FilterOperator.CONTAINS || operator == FilterOperator.DOES_NOT_CONTAIN)) {
                boolean contains = projectsContain(task, condition.value());
                return operator == FilterOperator.CONTAINS ? contains : !contains;
            }

            return applyOperator(propertyValue(task, property), operator, condition.value(),
                    property.isDate(), referenceDate);
        } catch (FilterEvaluationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new FilterEvaluationException(
                    "Error applying operator '" + operator.getCode() + "': " + e.getMessage(),
                    condition.id(), key, e);
        }
    }

    private boolean matchUserField(FilterCondition condition, TaskEntity task, LocalDate referenceDate) {
        String fieldId = condition.property().userFieldId();
        UserFieldDefinition definition = userFields.definition(fieldId)
                .orElseThrow(() -> new FilterEvaluationException(
                        "Unknown user field: " + fieldId, condition.id(), condition.property().key()));

        Object raw = task.userField(definition.key());
        FilterOperator operator = condition.operator();
        switch (definition.type()) {
            case NUMBER:
                if (operator == FilterOperator.IS) return numericEquals(raw, condition.value());
                if (operator == FilterOperator.IS_NOT) return !numericEquals(raw, condition.value());
                return applyOperator(raw, operator, condition.value(), false, referenceDate);
            case BOOLEAN:
                return applyOperator(ValueCoercion.bool(raw).orElse(null), operator, condition.value(), false,
                        referenceDate);
            case DATE:
                return applyOperator(raw == null ? null : ValueCoercion.text(raw), operator, condition.value(), true,
                        referenceDate);
            case LIST:
                return applyOperator(ListTokens.normalize(raw), operator, condition.value(), false, referenceDate);
            case TEXT:
            default:
                return applyOperator(raw, operator, condition.value(), false, referenceDate);
        }
    }

    /**
     * Reads a built-in property of a task.
     *
     * @param task     task snapshot
     * @param property built-in property
     * @return the raw value; lists for tags, contexts and projects
     */
    public static Object propertyValue(TaskEntity task, FilterProperty property) {
        switch (property) {
            case TITLE:
                return task.title();
            case STATUS:
                return task.status();
            case PRIORITY:
                return task.priority();
            case TAGS:
                return task.tags();
            case CONTEXTS:
                return task.contexts();
            case PROJECTS:
                return task.projects();
            case DUE:
                return task.due();
            case SCHEDULED:
                return task.scheduled();
            case COMPLETED_DATE:
                return task.completedDate();
            case FILE_CTIME:
                return task.dateCreated();
            case FILE_MTIME:
                return task.dateModified();
            case ARCHIVED:
                return task.archived();
            case TIME_ESTIMATE:
                return task.timeEstimate();
            case STORY_POINTS:
                return task.storyPoints();
            case RECURRENCE:
                return recurrenceText(task.recurrence());
            default:
                // status.isCompleted depends on the reference date
                return null;
        }
    }

    private static String recurrenceText(Recurrence recurrence) {
        if (recurrence == null) return null;
        if (recurrence instanceof Recurrence.RuleString rule) return rule.rule();
        Recurrence.LegacyRule legacy = (Recurrence.LegacyRule) recurrence;
        return legacy.frequency();
    }

    private boolean applyOperator(Object taskValue, FilterOperator operator, Object conditionValue,
                                  boolean dateValued, LocalDate referenceDate) {
        switch (operator) {
            case IS:
                return isEqual(taskValue, conditionValue, dateValued, referenceDate);
            case IS_NOT:
                return !isEqual(taskValue, conditionValue, dateValued, referenceDate);
            case CONTAINS:
                return contains(taskValue, conditionValue);
            case DOES_NOT_CONTAIN:
                return !contains(taskValue, conditionValue);
            case IS_BEFORE:
                return compareDates(taskValue, conditionValue, referenceDate, false, false);
            case IS_AFTER:
                return compareDates(taskValue, conditionValue, referenceDate, true, false);
            case IS_ON_OR_BEFORE:
                return compareDates(taskValue, conditionValue, referenceDate, false, true);
            case IS_ON_OR_AFTER:
                return compareDates(taskValue, conditionValue, referenceDate, true, true);
            case IS_EMPTY:
                return ValueCoercion.isEmpty(taskValue);
            case IS_NOT_EMPTY:
                return !ValueCoercion.isEmpty(taskValue);
            case IS_CHECKED:
                return ValueCoercion.bool(taskValue).orElse(false);
            case IS_NOT_CHECKED:
                return !ValueCoercion.bool(taskValue).orElse(false);
            case IS_GREATER_THAN:
                return compareNumbers(taskValue, conditionValue) > 0;
            case IS_LESS_THAN:
                return compareNumbers(taskValue, conditionValue) < 0;
            default:
                throw new IllegalStateException("Unsupported operator: " + operator);
        }
    }

    private static boolean isEqual(Object taskValue, Object conditionValue, boolean dateValued,
                                   LocalDate referenceDate) {
        if (dateValued && conditionValue instanceof String expected
                && (taskValue instanceof String || NaturalDates.isNatural(expected))) {
            String actual = taskValue == null ? null : taskValue.toString();
            if (actual != null && !actual.isBlank() || NaturalDates.isNatural(expected)) {
                return DateAnchors.isSameDay(actual, NaturalDates.resolve(expected, referenceDate));
            }
        }

        for (Object actual : ValueCoercion.items(taskValue)) {
            for (Object expected : ValueCoercion.items(conditionValue)) {
                if (ValueCoercion.looselyEquals(actual, expected)) return true;
            }
        }
        return false;
    }

    private static boolean contains(Object taskValue, Object conditionValue) {
        List<Object> needles = ValueCoercion.items(conditionValue);
        if (taskValue instanceof Collection<?> items) {
            for (Object needle : needles) {
                for (Object item : items) {
                    if (item != null && needle != null
                            && ValueCoercion.text(item).equalsIgnoreCase(ValueCoercion.text(needle))) {
                        return true;
                    }
                }
            }
            return false;
        }
        if (taskValue instanceof String text) {
            String haystack = text.toLowerCase(Locale.ROOT);
            for (Object needle : needles) {
                if (needle instanceof String s && haystack.contains(s.toLowerCase(Locale.ROOT))) return true;
            }
        }
        return false;
    }

    private boolean projectsContain(TaskEntity task, Object conditionValue) {
        List<String> canonical = new ArrayList<>();
        for (String reference : task.projects()) {
            String name = projectResolver.canonicalize(reference, task.path());
            if (name != null) canonical.add(name);
        }
        for (Object expected : ValueCoercion.items(conditionValue)) {
            if (expected == null) continue;
            String name = projectResolver.canonicalize(ValueCoercion.text(expected), null);
            if (name == null) continue;
            for (String candidate : canonical) {
                if (candidate.equalsIgnoreCase(name)) return true;
            }
        }
        return false;
    }

    /**
     * Time-aware date comparison against a possibly natural-language value.
     *
     * @param after      compare "after" instead of "before"
     * @param orSameDay  also accept the same anchor day
     */
    private static boolean compareDates(Object taskValue, Object conditionValue, LocalDate referenceDate,
                                        boolean after, boolean orSameDay) {
        if (taskValue == null || conditionValue == null) return false;
        String expected = NaturalDates.resolve(ValueCoercion.text(conditionValue), referenceDate);
        Optional<DateAnchors.Anchored> left = DateAnchors.parse(ValueCoercion.text(taskValue));
        Optional<DateAnchors.Anchored> right = DateAnchors.parse(expected);
        if (left.isEmpty() || right.isEmpty()) return false;

        boolean strict = after
                ? DateAnchors.isBefore(right.get(), left.get())
                : DateAnchors.isBefore(left.get(), right.get());
        return strict || orSameDay && left.get().day().equals(right.get().day());
    }

    private static boolean numericEquals(Object taskValue, Object conditionValue) {
        OptionalDouble actual = ValueCoercion.leadingNumber(taskValue);
        if (actual.isEmpty()) return false;
        for (Object expected : ValueCoercion.items(conditionValue)) {
            OptionalDouble number = ValueCoercion.leadingNumber(expected);
            if (number.isPresent() && Double.compare(actual.getAsDouble(), number.getAsDouble()) == 0) return true;
        }
        return false;
    }

    /**
     * @return the sign of task minus condition, or 0 when either side is not numeric
     */
    private static int compareNumbers(Object taskValue, Object conditionValue) {
        OptionalDouble actual = ValueCoercion.leadingNumber(taskValue);
        OptionalDouble expected = ValueCoercion.leadingNumber(conditionValue);
        if (actual.isEmpty() || expected.isEmpty()) return 0;
        return Double.compare(actual.getAsDouble(), expected.getAsDouble());
    }
}
