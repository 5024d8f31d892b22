package io.github.cyfko.taskql.core.impl;

import io.github.cyfko.taskql.core.model.StatusCatalog;
import io.github.cyfko.taskql.core.model.TaskEntity;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Completion rule shared by the evaluator, the grouper and the statistics.
 * <p>
 * A recurring task has no single status: the instance of a given day is complete when that
 * day is listed in the task's completed instances. Other tasks are complete when their
 * status is flagged as completed in the {@link StatusCatalog}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TaskCompletion {

    private final StatusCatalog statusCatalog;

    public TaskCompletion(StatusCatalog statusCatalog) {
        this.statusCatalog = Objects.requireNonNull(statusCatalog, "statusCatalog");
    }

    /**
     * @param task task to inspect
     * @param day  anchor day of the instance, used for recurring tasks only
     * @return true if the task (or its instance on {@code day}) is complete
     */
    public boolean isCompleted(TaskEntity task, LocalDate day) {
        if (task.isRecurring()) {
            return day != null && task.completeInstances().contains(day.toString());
        }
        return statusCatalog.isCompleted(task.status());
    }
}
