package io.github.cyfko.taskql.core.api;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TaskKeysTest {

    @Test
    void testSortKeyParse() {
        assertEquals(Optional.of(TaskSortKey.MANUAL_ORDER), TaskSortKey.parse("manualOrder"));
        assertEquals(Optional.of(TaskSortKey.user("effort")), TaskSortKey.parse("user:effort"));
        assertTrue(TaskSortKey.parse("dueDate").isEmpty());
        assertTrue(TaskSortKey.parse("user:").isEmpty());
        assertTrue(TaskSortKey.parse(null).isEmpty());
    }

    @Test
    void testSortKeyRejectsUnknown() {
        assertThrows(IllegalArgumentException.class, () -> new TaskSortKey("size"));
    }

    @Test
    void testSortKeyUserField() {
        TaskSortKey key = TaskSortKey.user("effort");

        assertTrue(key.isUserField());
        assertEquals("effort", key.userFieldId());
        assertEquals("user:effort", key.toString());
        assertNull(TaskSortKey.DUE.userFieldId());
    }

    @Test
    void testGroupKeyParse() {
        assertEquals(Optional.of(TaskGroupKey.PROJECT), TaskGroupKey.parse("project"));
        assertTrue(TaskGroupKey.parse("tags").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> new TaskGroupKey("projects"));
    }

    @Test
    void testGroupKeyMatchesSortKey() {
        assertTrue(TaskGroupKey.PRIORITY.matches(TaskSortKey.PRIORITY));
        assertTrue(TaskGroupKey.DUE.matches(TaskSortKey.DUE));
        assertTrue(TaskGroupKey.SCHEDULED.matches(TaskSortKey.SCHEDULED));
        assertTrue(TaskGroupKey.user("effort").matches(TaskSortKey.user("effort")));

        assertFalse(TaskGroupKey.user("effort").matches(TaskSortKey.user("size")));
        assertFalse(TaskGroupKey.DUE.matches(TaskSortKey.SCHEDULED));
        assertFalse(TaskGroupKey.STATUS.matches(TaskSortKey.TITLE));
        assertFalse(TaskGroupKey.PRIORITY.matches(null));
    }

    @Test
    void testQuickFilterConditions() {
        FilterCondition hideDone = QuickFilter.SHOW_COMPLETED.hidingCondition();

        assertEquals("status.isCompleted", hideDone.property().key());
        assertEquals(FilterOperator.IS_NOT_CHECKED, hideDone.operator());
        assertNull(hideDone.value());
        assertTrue(QuickFilter.SHOW_COMPLETED.isHidingCondition(hideDone));

        assertFalse(QuickFilter.SHOW_ARCHIVED.isHidingCondition(hideDone));
        assertFalse(QuickFilter.SHOW_RECURRING.isHidingCondition(FilterGroup.and(
                QuickFilter.SHOW_RECURRING.hidingCondition())));
        assertTrue(QuickFilter.SHOW_RECURRING.isHidingCondition(
                FilterCondition.of(FilterProperty.RECURRENCE, FilterOperator.IS_EMPTY, "ignored")));
    }
}
