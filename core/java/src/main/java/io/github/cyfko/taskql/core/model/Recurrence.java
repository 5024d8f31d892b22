package io.github.cyfko.taskql.core.model;

import java.util.List;

/**
 * Recurrence attached to a task. The engine never expands it; it only passes the task to
 * a {@link io.github.cyfko.taskql.core.spi.RecurrenceEvaluator}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface Recurrence permits Recurrence.RuleString, Recurrence.LegacyRule {

    /**
     * An RFC 5545 style rule, e.g. {@code "FREQ=WEEKLY;BYDAY=MO,WE"}.
     *
     * @param rule rule text
     */
    record RuleString(String rule) implements Recurrence {
    }

    /**
     * Structured rule kept for tasks written before rule strings were introduced.
     *
     * @param frequency  {@code daily}, {@code weekly}, {@code monthly} or {@code yearly}
     * @param daysOfWeek day abbreviations for weekly rules
     * @param dayOfMonth day for monthly and yearly rules, may be null
     * @param monthOfYear month for yearly rules, may be null
     */
    record LegacyRule(String frequency, List<String> daysOfWeek, Integer dayOfMonth, Integer monthOfYear)
            implements Recurrence {

        public LegacyRule {
            daysOfWeek = daysOfWeek == null ? List.of() : List.copyOf(daysOfWeek);
        }
    }
}
