package io.github.cyfko.taskql.core.spi;

import io.github.cyfko.taskql.core.model.TaskEntity;

import java.time.LocalDate;

/**
 * Decides whether an instance of a recurring task falls on a given day.
 * <p>
 * Implementations must be pure: the answer depends only on the task and the day, never on
 * the host clock or time zone.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface RecurrenceEvaluator {

    /**
     * @param task a task whose {@link TaskEntity#recurrence()} is set
     * @param day  anchor day
     * @return true if an instance of {@code task} is due on {@code day}
     */
    boolean isDueOn(TaskEntity task, LocalDate day);

    /**
     * Evaluator used when none is configured: no instance is ever due.
     *
     * @return an evaluator answering false
     */
    static RecurrenceEvaluator never() {
        return (task, day) -> false;
    }
}
