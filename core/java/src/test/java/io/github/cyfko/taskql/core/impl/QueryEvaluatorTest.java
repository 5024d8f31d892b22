package io.github.cyfko.taskql.core.impl;

import io.github.cyfko.taskql.core.api.FilterCondition;
import io.github.cyfko.taskql.core.api.FilterGroup;
import io.github.cyfko.taskql.core.api.FilterOperator;
import io.github.cyfko.taskql.core.api.FilterProperty;
import io.github.cyfko.taskql.core.api.PropertySelector;
import io.github.cyfko.taskql.core.config.EngineConfig;
import io.github.cyfko.taskql.core.exception.FilterEvaluationException;
import io.github.cyfko.taskql.core.model.TaskEntity;
import io.github.cyfko.taskql.core.model.UserFieldDefinition;
import io.github.cyfko.taskql.core.model.UserFieldType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link QueryEvaluator}: group semantics and every operator family.
 *
 * @author TaskQL Test Suite
 * @since 1.0.0
 */
@DisplayName("QueryEvaluator Tests")
class QueryEvaluatorTest {

    private static final LocalDate REF = LocalDate.of(2025, 6, 10);

    private QueryEvaluator evaluator;

    @BeforeEach
    void setUp() {
        EngineConfig config = EngineConfig.builder()
                .userFields(List.of(
                        UserFieldDefinition.of("effort", UserFieldType.NUMBER),
                        UserFieldDefinition.of("reviewed", UserFieldType.BOOLEAN),
                        UserFieldDefinition.of("deadline", UserFieldType.DATE),
                        UserFieldDefinition.of("owners", UserFieldType.LIST),
                        UserFieldDefinition.of("notes", UserFieldType.TEXT)))
                .build();
        evaluator = new QueryEvaluator(config, new UserFieldAccessor(config));
    }

    private boolean matches(FilterCondition condition, TaskEntity task) {
        return evaluator.evaluate(condition, task, REF);
    }

    private static TaskEntity.Builder task() {
        return TaskEntity.builder("tasks/t.md").title("Write report");
    }

    @Nested
    @DisplayName("Groups")
    class Groups {

        @Test
        @DisplayName("Should match every task with an empty group")
        void shouldMatchEveryTaskWithEmptyGroup() {
            assertTrue(evaluator.evaluate(FilterGroup.and(), task().build(), REF));
            assertTrue(evaluator.evaluate(FilterGroup.or(), task().build(), REF));
        }

        @Test
        @DisplayName("Should ignore incomplete conditions")
        void shouldIgnoreIncompleteConditions() {
            // Given
            FilterGroup group = FilterGroup.or(
                    FilterCondition.of(PropertySelector.placeholder(), FilterOperator.IS, "x"),
                    FilterCondition.of(FilterProperty.STATUS, FilterOperator.IS, null));

            // Then: no complete child left, the group is inert
            assertTrue(evaluator.evaluate(group, task().status("done").build(), REF));
        }

        @Test
        @DisplayName("Should require all children for 'and' and one for 'or'")
        void shouldApplyConjunction() {
            // Given
            TaskEntity task = task().status("open").priority("low").build();
            FilterCondition open = FilterCondition.of(FilterProperty.STATUS, FilterOperator.IS, "open");
            FilterCondition high = FilterCondition.of(FilterProperty.PRIORITY, FilterOperator.IS, "high");

            // Then
            assertFalse(evaluator.evaluate(FilterGroup.and(open, high), task, REF));
            assertTrue(evaluator.evaluate(FilterGroup.or(open, high), task, REF));
        }

        @Test
        @DisplayName("Should keep nested groups even when they are empty")
        void shouldKeepNestedGroups() {
            // Given
            FilterGroup group = FilterGroup.and(
                    FilterGroup.or(),
                    FilterCondition.of(FilterProperty.STATUS, FilterOperator.IS, "open"));

            // Then
            assertTrue(evaluator.evaluate(group, task().status("open").build(), REF));
            assertFalse(evaluator.evaluate(group, task().status("done").build(), REF));
        }
    }

    @Nested
    @DisplayName("Equality and contains")
    class EqualityAndContains {

        @Test
        @DisplayName("Should compare lists on both sides for equality")
        void shouldCompareListsForEquality() {
            // Given
            TaskEntity task = task().status("open").build();

            // Then
            assertTrue(matches(FilterCondition.of(FilterProperty.STATUS, FilterOperator.IS,
                    List.of("done", "open")), task));
            assertFalse(matches(FilterCondition.of(FilterProperty.STATUS, FilterOperator.IS_NOT,
                    List.of("done", "open")), task));
        }

        @Test
        @DisplayName("Should match contains as a case-insensitive substring on text")
        void shouldMatchSubstringIgnoringCase() {
            TaskEntity task = task().title("Prepare Quarterly Report").build();

            assertTrue(matches(FilterCondition.of(FilterProperty.TITLE, FilterOperator.CONTAINS, "quarterly"), task));
            assertTrue(matches(FilterCondition.of(FilterProperty.TITLE, FilterOperator.DOES_NOT_CONTAIN, "budget"), task));
        }

        @Test
        @DisplayName("Should match contains as a case-insensitive membership on lists")
        void shouldMatchMembershipOnLists() {
            TaskEntity task = task().tags(List.of("Work", "urgent")).build();

            assertTrue(matches(FilterCondition.of(FilterProperty.TAGS, FilterOperator.CONTAINS, "work"), task));
            assertTrue(matches(FilterCondition.of(FilterProperty.TAGS, FilterOperator.CONTAINS,
                    List.of("home", "URGENT")), task));
            assertFalse(matches(FilterCondition.of(FilterProperty.TAGS, FilterOperator.CONTAINS, "wor"), task));
        }

        @Test
        @DisplayName("Should resolve project links before comparing")
        void shouldResolveProjectLinks() {
            TaskEntity task = task().projects(List.of("[[Projects/Apollo|The moon]]")).build();

            assertTrue(matches(FilterCondition.of(FilterProperty.PROJECTS, FilterOperator.CONTAINS, "Apollo"), task));
            assertTrue(matches(FilterCondition.of(FilterProperty.PROJECTS, FilterOperator.CONTAINS,
                    "[[Apollo]]"), task));
            assertTrue(matches(FilterCondition.of(FilterProperty.PROJECTS, FilterOperator.DOES_NOT_CONTAIN,
                    "Gemini"), task));
        }
    }

    @Nested
    @DisplayName("Emptiness and checks")
    class EmptinessAndChecks {

        @Test
        @DisplayName("Should treat blank values and lists of blank items as empty")
        void shouldTreatBlankAsEmpty() {
            FilterCondition empty = FilterCondition.of(FilterProperty.TAGS, FilterOperator.IS_EMPTY, null);

            assertTrue(matches(empty, task().build()));
            assertTrue(matches(empty, task().tags(List.of(" ", "\"\"", "''")).build()));
            assertFalse(matches(empty, task().tags(List.of("a")).build()));
        }

        @Test
        @DisplayName("Should check the archived flag")
        void shouldCheckArchivedFlag() {
            FilterCondition archived = FilterCondition.of(FilterProperty.ARCHIVED, FilterOperator.IS_CHECKED, null);

            assertTrue(matches(archived, task().archived(true).build()));
            assertFalse(matches(archived, task().archived(false).build()));
        }

        @Test
        @DisplayName("Should route status.isCompleted through the status catalog")
        void shouldUseStatusCatalogForCompletion() {
            FilterCondition completed = FilterCondition.of(FilterProperty.STATUS_IS_COMPLETED,
                    FilterOperator.IS_CHECKED, null);

            assertTrue(matches(completed, task().status("done").build()));
            assertFalse(matches(completed, task().status("open").build()));
        }

        @Test
        @DisplayName("Should complete recurring tasks per instance")
        void shouldCompleteRecurringTasksPerInstance() {
            // Given
            TaskEntity recurring = task().status("open").recurrence("FREQ=DAILY")
                    .completeInstances(Set.of("2025-06-10")).build();
            FilterCondition completed = FilterCondition.of(FilterProperty.STATUS_IS_COMPLETED,
                    FilterOperator.IS_CHECKED, null);

            // Then
            assertTrue(evaluator.evaluate(completed, recurring, REF));
            assertFalse(evaluator.evaluate(completed, recurring, REF.plusDays(1)));
        }
    }

    @Nested
    @DisplayName("Dates")
    class Dates {

        @ParameterizedTest(name = "due {0} {1} {2} -> {3}")
        @CsvSource({
                "2025-06-09,       is-before,       2025-06-10,        true",
                "2025-06-10,       is-before,       2025-06-10,        false",
                "2025-06-10T09:00, is-before,       2025-06-10,        true",
                "2025-06-10,       is-before,       2025-06-10T09:00,  false",
                "2025-06-10,       is-on-or-before, 2025-06-10T09:00,  true",
                "2025-06-11,       is-after,        2025-06-10,        true",
                "2025-06-10T23:00, is-on-or-after,  2025-06-10,        true",
                "2025-06-10T14:30, is,              2025-06-10,        true",
                "2025-06-11,       is,              tomorrow,          true",
                "2025-06-07,       is-on-or-after,  3 days ago,        true",
                "2025-06-06,       is-on-or-after,  3 days ago,        false",
                "not-a-date,       is-before,       2025-06-10,        false"
        })
        @DisplayName("Should compare dates time-aware with natural-language values")
        void shouldCompareDates(String due, String operator, String value, boolean expected) {
            // Given
            FilterCondition condition = FilterCondition.of(FilterProperty.DUE,
                    FilterOperator.fromCode(operator).orElseThrow(), value);

            // Then
            assertEquals(expected, matches(condition, task().due(due).build()));
        }

        @Test
        @DisplayName("Should not match date operators on tasks without a date")
        void shouldNotMatchMissingDates() {
            TaskEntity undated = task().build();

            assertFalse(matches(FilterCondition.of(FilterProperty.DUE, FilterOperator.IS_BEFORE, "today"), undated));
            assertFalse(matches(FilterCondition.of(FilterProperty.DUE, FilterOperator.IS, "today"), undated));
            assertTrue(matches(FilterCondition.of(FilterProperty.DUE, FilterOperator.IS_EMPTY, null), undated));
        }
    }

    @Nested
    @DisplayName("Numbers")
    class Numbers {

        @Test
        @DisplayName("Should read the leading number of the value")
        void shouldReadLeadingNumber() {
            TaskEntity task = task().userField("effort", "10-High").build();

            assertTrue(matches(FilterCondition.of(PropertySelector.user("effort"),
                    FilterOperator.IS_GREATER_THAN, 5), task));
            assertTrue(matches(FilterCondition.of(PropertySelector.user("effort"), FilterOperator.IS, "10"), task));
            assertFalse(matches(FilterCondition.of(PropertySelector.user("effort"),
                    FilterOperator.IS_LESS_THAN, 10), task));
        }

        @Test
        @DisplayName("Should never match numeric comparisons on non-numeric values")
        void shouldRejectNonNumeric() {
            TaskEntity task = task().userField("effort", "lots").build();

            assertFalse(matches(FilterCondition.of(PropertySelector.user("effort"),
                    FilterOperator.IS_GREATER_THAN, 1), task));
            assertFalse(matches(FilterCondition.of(PropertySelector.user("effort"),
                    FilterOperator.IS_LESS_THAN, 1), task));
        }

        @Test
        @DisplayName("Should compare the built-in time estimate")
        void shouldCompareTimeEstimate() {
            TaskEntity task = task().timeEstimate(45).build();

            assertTrue(matches(FilterCondition.of(FilterProperty.TIME_ESTIMATE, FilterOperator.IS, "45"), task));
            assertTrue(matches(FilterCondition.of(FilterProperty.TIME_ESTIMATE,
                    FilterOperator.IS_GREATER_THAN, 30), task));
        }
    }

    @Nested
    @DisplayName("User fields")
    class UserFields {

        @Test
        @DisplayName("Should read boolean user fields from text")
        void shouldReadBooleanFromText() {
            FilterCondition reviewed = FilterCondition.of(PropertySelector.user("reviewed"),
                    FilterOperator.IS_CHECKED, null);

            assertTrue(matches(reviewed, task().userField("reviewed", "true").build()));
            assertFalse(matches(reviewed, task().userField("reviewed", "maybe").build()));
        }

        @Test
        @DisplayName("Should match list user fields by display token or link")
        void shouldMatchListTokens() {
            TaskEntity task = task().userField("owners", "[[People/Ada Lovelace|Ada]], Grace").build();

            assertTrue(matches(FilterCondition.of(PropertySelector.user("owners"), FilterOperator.CONTAINS, "ada"), task));
            assertTrue(matches(FilterCondition.of(PropertySelector.user("owners"), FilterOperator.CONTAINS, "grace"), task));
            assertFalse(matches(FilterCondition.of(PropertySelector.user("owners"), FilterOperator.CONTAINS, "Alan"), task));
        }

        @Test
        @DisplayName("Should compare date user fields")
        void shouldCompareDateUserFields() {
            TaskEntity task = task().userField("deadline", "2025-06-12").build();

            assertTrue(matches(FilterCondition.of(PropertySelector.user("deadline"),
                    FilterOperator.IS_AFTER, "today"), task));
            assertTrue(matches(FilterCondition.of(PropertySelector.user("deadline"),
                    FilterOperator.IS, "in 2 days"), task));
        }

        @Test
        @DisplayName("Should fail with the node id on an unknown user field")
        void shouldFailOnUnknownUserField() {
            // Given
            FilterCondition condition = new FilterCondition("c-1", PropertySelector.user("ghost"),
                    FilterOperator.IS, "x");

            // When
            FilterEvaluationException e = assertThrows(FilterEvaluationException.class,
                    () -> matches(condition, task().build()));

            // Then
            assertEquals("c-1", e.getNodeId());
            assertEquals("user:ghost", e.getProperty());
        }
    }

    @Test
    @DisplayName("Should only match A in the open-and-high example")
    void shouldMatchOnlyOpenHighTask() {
        // Given
        FilterGroup root = FilterGroup.and(
                FilterCondition.of(FilterProperty.STATUS, FilterOperator.IS, "open"),
                FilterCondition.of(FilterProperty.PRIORITY, FilterOperator.IS, "high"));
        TaskEntity a = TaskEntity.builder("A").due("2025-01-10").status("open").priority("high").build();
        TaskEntity b = TaskEntity.builder("B").due("2025-01-05").status("open").priority("low").build();
        TaskEntity c = TaskEntity.builder("C").due("2025-01-01").status("done").priority("high").build();

        // Then
        assertTrue(evaluator.evaluate(root, a, REF));
        assertFalse(evaluator.evaluate(root, b, REF));
        assertFalse(evaluator.evaluate(root, c, REF));
    }
}
