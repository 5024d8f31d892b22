package io.github.cyfko.taskql.core.impl;

import io.github.cyfko.taskql.core.api.SortDirection;
import io.github.cyfko.taskql.core.api.TaskGroupKey;
import io.github.cyfko.taskql.core.api.TaskSortKey;
import io.github.cyfko.taskql.core.config.EngineConfig;
import io.github.cyfko.taskql.core.model.TaskEntity;
import io.github.cyfko.taskql.core.model.UserFieldDefinition;
import io.github.cyfko.taskql.core.model.UserFieldType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link TaskGrouper}.
 *
 * @author TaskQL Test Suite
 * @since 1.0.0
 */
@DisplayName("TaskGrouper Tests")
class TaskGrouperTest {

    private static final LocalDate REF = LocalDate.of(2025, 6, 10);

    private TaskGrouper grouper;

    @BeforeEach
    void setUp() {
        EngineConfig config = EngineConfig.builder()
                .clock(Clock.fixed(REF.atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC))
                .userFields(List.of(UserFieldDefinition.of("effort", UserFieldType.NUMBER)))
                .build();
        TaskCompletion completion = new TaskCompletion(config.getStatusCatalog());
        grouper = new TaskGrouper(config, new DateBuckets(config, completion), new UserFieldAccessor(config));
    }

    private LinkedHashMap<String, List<TaskEntity>> group(List<TaskEntity> tasks, TaskGroupKey key) {
        return grouper.group(tasks, key, TaskSortKey.DUE, SortDirection.ASC, REF);
    }

    private static List<String> keys(Map<String, ?> groups) {
        return new ArrayList<>(groups.keySet());
    }

    @Test
    @DisplayName("Should put every task in a single bucket without a group key")
    void shouldUseSingleBucketForNone() {
        List<TaskEntity> tasks = List.of(TaskEntity.builder("a.md").build(), TaskEntity.builder("b.md").build());

        LinkedHashMap<String, List<TaskEntity>> groups = group(tasks, TaskGroupKey.NONE);

        assertEquals(List.of(TaskGrouper.ALL), keys(groups));
        assertEquals(tasks, groups.get(TaskGrouper.ALL));
    }

    @Test
    @DisplayName("Should order priority buckets by descending weight and keep task order inside")
    void shouldOrderPriorityBuckets() {
        // Given
        TaskEntity low = TaskEntity.builder("l.md").priority("low").build();
        TaskEntity high1 = TaskEntity.builder("h1.md").priority("high").build();
        TaskEntity high2 = TaskEntity.builder("h2.md").priority("high").build();
        TaskEntity unset = TaskEntity.builder("u.md").build();

        // When
        LinkedHashMap<String, List<TaskEntity>> groups = group(List.of(low, high1, unset, high2), TaskGroupKey.PRIORITY);

        // Then
        assertEquals(List.of("high", "low", TaskGrouper.UNKNOWN_PRIORITY), keys(groups));
        assertEquals(List.of(high1, high2), groups.get("high"));
    }

    @Test
    @DisplayName("Should order status buckets by their declared order")
    void shouldOrderStatusBuckets() {
        List<TaskEntity> tasks = List.of(
                TaskEntity.builder("d.md").status("done").build(),
                TaskEntity.builder("o.md").status("open").build(),
                TaskEntity.builder("p.md").status("in-progress").build());

        assertEquals(List.of("open", "in-progress", "done"), keys(group(tasks, TaskGroupKey.STATUS)));
    }

    @Test
    @DisplayName("Should place a task in each of its projects with No Project last")
    void shouldGroupByEveryProject() {
        // Given
        TaskEntity both = TaskEntity.builder("b.md").projects(List.of("[[Gemini]]", "Apollo", "[[Apollo]]")).build();
        TaskEntity none = TaskEntity.builder("n.md").build();

        // When
        LinkedHashMap<String, List<TaskEntity>> groups = group(List.of(none, both), TaskGroupKey.PROJECT);

        // Then
        assertEquals(List.of("Apollo", "Gemini", TaskGrouper.NO_PROJECT), keys(groups));
        assertEquals(List.of(both), groups.get("Apollo"));
        assertEquals(List.of(both), groups.get("Gemini"));
        assertEquals(List.of(none), groups.get(TaskGrouper.NO_PROJECT));
    }

    @Test
    @DisplayName("Should group by the first context")
    void shouldGroupByFirstContext() {
        List<TaskEntity> tasks = List.of(
                TaskEntity.builder("a.md").contexts(List.of("home", "phone")).build(),
                TaskEntity.builder("b.md").build());

        assertEquals(List.of("home", TaskGrouper.NO_CONTEXT), keys(group(tasks, TaskGroupKey.CONTEXT)));
    }

    @Test
    @DisplayName("Should order due buckets semantically")
    void shouldOrderDueBuckets() {
        List<TaskEntity> tasks = List.of(
                TaskEntity.builder("n.md").build(),
                TaskEntity.builder("l.md").due("2025-07-01").build(),
                TaskEntity.builder("t.md").due("2025-06-10").build(),
                TaskEntity.builder("o.md").due("2025-06-01").status("open").build());

        assertEquals(List.of(DateBuckets.OVERDUE, DateBuckets.TODAY, DateBuckets.LATER, DateBuckets.NO_DUE_DATE),
                keys(group(tasks, TaskGroupKey.DUE)));
    }

    @Test
    @DisplayName("Should order numeric user-field buckets and follow the sort when aligned")
    void shouldOrderNumericUserFieldBuckets() {
        // Given
        List<TaskEntity> tasks = List.of(
                TaskEntity.builder("a.md").userField("effort", "10-High").build(),
                TaskEntity.builder("b.md").userField("effort", 5).build(),
                TaskEntity.builder("c.md").userField("effort", "x").build(),
                TaskEntity.builder("d.md").build());
        TaskGroupKey key = TaskGroupKey.user("effort");

        // When
        List<String> natural = keys(grouper.group(tasks, key, TaskSortKey.DUE, SortDirection.ASC, REF));
        List<String> asc = keys(grouper.group(tasks, key, TaskSortKey.user("effort"), SortDirection.ASC, REF));
        List<String> desc = keys(grouper.group(tasks, key, TaskSortKey.user("effort"), SortDirection.DESC, REF));

        // Then
        assertEquals(List.of("10", "5", UserFieldAccessor.NON_NUMERIC, UserFieldAccessor.NO_VALUE), natural);
        assertEquals(List.of("5", "10", UserFieldAccessor.NON_NUMERIC, UserFieldAccessor.NO_VALUE), asc);
        assertEquals(List.of(UserFieldAccessor.NO_VALUE, UserFieldAccessor.NON_NUMERIC, "10", "5"), desc);
    }

    @Test
    @DisplayName("Should use a fallback bucket for an undeclared user field")
    void shouldUseFallbackForUndeclaredField() {
        LinkedHashMap<String, List<TaskEntity>> groups =
                group(List.of(TaskEntity.builder("a.md").build()), TaskGroupKey.user("ghost"));

        assertEquals(List.of(UserFieldAccessor.UNKNOWN_FIELD), keys(groups));
    }

    @Test
    @DisplayName("Should reverse aligned priority buckets for descending order")
    void shouldReverseAlignedPriorityBuckets() {
        List<TaskEntity> tasks = List.of(
                TaskEntity.builder("l.md").priority("low").build(),
                TaskEntity.builder("h.md").priority("high").build());

        LinkedHashMap<String, List<TaskEntity>> groups =
                grouper.group(tasks, TaskGroupKey.PRIORITY, TaskSortKey.PRIORITY, SortDirection.DESC, REF);

        assertEquals(List.of("low", "high"), keys(groups));
    }

    // ============================================================================
    // Completeness over mixed fixtures
    // ============================================================================

    static List<TaskEntity> mixedTasks() {
        return List.of(
                TaskEntity.builder("a.md").status("open").priority("high").due("2025-06-01")
                        .contexts(List.of("home")).projects(List.of("Apollo")).build(),
                TaskEntity.builder("b.md").status("done").priority("low").due("2025-06-10")
                        .scheduled("2025-06-11").contexts(List.of("work", "phone")).build(),
                TaskEntity.builder("c.md").status("in-progress").scheduled("2025-06-09")
                        .projects(List.of("Apollo", "Gemini")).build(),
                TaskEntity.builder("d.md").priority("high").due("2025-07-01")
                        .projects(List.of("Gemini")).build(),
                TaskEntity.builder("e.md").status("open").build(),
                TaskEntity.builder("f.md").status("open").due("2025-06-12").scheduled("2025-06-10")
                        .contexts(List.of("home")).build());
    }

    static Stream<Arguments> groupKeysAndDirections() {
        return Stream.of(TaskGroupKey.NONE, TaskGroupKey.STATUS, TaskGroupKey.PRIORITY, TaskGroupKey.CONTEXT,
                        TaskGroupKey.PROJECT, TaskGroupKey.DUE, TaskGroupKey.SCHEDULED)
                .flatMap(key -> Stream.of(SortDirection.ASC, SortDirection.DESC)
                        .map(direction -> Arguments.of(key, direction)));
    }

    private static Map<String, Long> pathCounts(Map<String, List<TaskEntity>> groups) {
        return groups.values().stream()
                .flatMap(List::stream)
                .collect(Collectors.groupingBy(TaskEntity::path, Collectors.counting()));
    }

    @ParameterizedTest(name = "{0} {1}")
    @MethodSource("groupKeysAndDirections")
    @DisplayName("Should place each task in exactly the buckets its key assigns")
    void shouldPlaceEveryTaskInItsBuckets(TaskGroupKey key, SortDirection direction) {
        // Given
        List<TaskEntity> tasks = mixedTasks();

        // When
        LinkedHashMap<String, List<TaskEntity>> groups = grouper.group(tasks, key, TaskSortKey.DUE, direction, REF);

        // Then
        Map<String, Long> expected = tasks.stream().collect(Collectors.toMap(TaskEntity::path,
                task -> TaskGroupKey.PROJECT.equals(key) && !task.projects().isEmpty()
                        ? (long) task.projects().size() : 1L));
        assertEquals(expected, pathCounts(groups));
        groups.values().forEach(bucket -> assertFalse(bucket.isEmpty()));
    }

    @ParameterizedTest
    @EnumSource(SortDirection.class)
    @DisplayName("Should only put a task under a project it references")
    void shouldOnlyUseReferencedProjects(SortDirection direction) {
        LinkedHashMap<String, List<TaskEntity>> groups =
                grouper.group(mixedTasks(), TaskGroupKey.PROJECT, TaskSortKey.DUE, direction, REF);

        groups.forEach((bucket, members) -> members.forEach(task -> {
            if (TaskGrouper.NO_PROJECT.equals(bucket)) {
                assertTrue(task.projects().isEmpty(), task.path());
            } else {
                assertTrue(task.projects().contains(bucket), task.path() + " in " + bucket);
            }
        }));
    }
}
