package io.github.cyfko.taskql.core.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Tasks shown on one day of an agenda view, already sorted.
 *
 * @param date  the day
 * @param tasks tasks for that day
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record AgendaDay(LocalDate date, List<TaskEntity> tasks) {

    public AgendaDay {
        tasks = List.copyOf(tasks);
    }
}
