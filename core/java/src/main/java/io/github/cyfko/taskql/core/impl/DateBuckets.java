package io.github.cyfko.taskql.core.impl;

import io.github.cyfko.taskql.core.config.EngineConfig;
import io.github.cyfko.taskql.core.model.TaskEntity;
import io.github.cyfko.taskql.core.spi.RecurrenceEvaluator;
import io.github.cyfko.taskql.core.utils.DateAnchors;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Derives the due and scheduled buckets of a task relative to a reference date.
 * <p>
 * A date before the reference day, or earlier on the reference day when that day is today
 * and the date carries a time, is in the past. Past dates of completed tasks land in the
 * "no date" bucket when completed tasks are hidden from overdue; otherwise a date is
 * {@code Today}, {@code Tomorrow}, {@code This week} (up to seven days ahead) or
 * {@code Later}. Missing and unparsable dates land in the "no date" bucket.
 * </p>
 * <p>
 * A recurring task whose rule makes it due on the reference date is bucketed on that date
 * before its anchor due date is considered.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class DateBuckets {

    public static final String OVERDUE = "Overdue";
    public static final String PAST_SCHEDULED = "Past scheduled";
    public static final String TODAY = "Today";
    public static final String TOMORROW = "Tomorrow";
    public static final String THIS_WEEK = "This week";
    public static final String LATER = "Later";
    public static final String NO_DUE_DATE = "No due date";
    public static final String NO_SCHEDULED_DATE = "No scheduled date";

    public static final List<String> DUE_ORDER =
            List.of(OVERDUE, TODAY, TOMORROW, THIS_WEEK, LATER, NO_DUE_DATE);
    public static final List<String> SCHEDULED_ORDER =
            List.of(PAST_SCHEDULED, TODAY, TOMORROW, THIS_WEEK, LATER, NO_SCHEDULED_DATE);

    private final Clock clock;
    private final boolean hideCompletedFromOverdue;
    private final TaskCompletion completion;
    private final RecurrenceEvaluator recurrence;

    public DateBuckets(EngineConfig config, TaskCompletion completion) {
        this.clock = config.getClock();
        this.hideCompletedFromOverdue = config.isHideCompletedFromOverdue();
        this.completion = completion;
        this.recurrence = config.getRecurrenceEvaluator();
    }

    public String dueBucket(TaskEntity task, LocalDate referenceDate) {
        if (task.isRecurring() && recurrence.isDueOn(task, referenceDate)) {
            return classify(referenceDate.toString(), task, referenceDate, OVERDUE, NO_DUE_DATE);
        }
        return classify(task.due(), task, referenceDate, OVERDUE, NO_DUE_DATE);
    }

    public String scheduledBucket(TaskEntity task, LocalDate referenceDate) {
        return classify(task.scheduled(), task, referenceDate, PAST_SCHEDULED, NO_SCHEDULED_DATE);
    }

    private String classify(String raw, TaskEntity task, LocalDate referenceDate, String past, String none) {
        Optional<DateAnchors.Anchored> parsed = DateAnchors.parse(raw);
        if (parsed.isEmpty()) return none;

        DateAnchors.Anchored date = parsed.get();
        if (isPast(date, referenceDate)) {
            if (hideCompletedFromOverdue && completion.isCompleted(task, date.day())) return none;
            return past;
        }

        LocalDate day = date.day();
        if (day.equals(referenceDate)) return TODAY;
        if (day.equals(referenceDate.plusDays(1))) return TOMORROW;
        if (!day.isAfter(referenceDate.plusDays(7))) return THIS_WEEK;
        return LATER;
    }

    /**
     * @param date          parsed task date
     * @param referenceDate reference day
     * @return true if the date lies before the reference day, or earlier today
     */
    public boolean isPast(DateAnchors.Anchored date, LocalDate referenceDate) {
        if (date.day().isBefore(referenceDate)) return true;
        return date.day().equals(referenceDate)
                && date.hasTime()
                && referenceDate.equals(LocalDate.now(clock))
                && date.instant().isBefore(clock.instant());
    }
}
