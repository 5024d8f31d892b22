package io.github.cyfko.taskql.core.utils;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves the relative date words a user may type in a date condition.
 * <p>
 * Supported: {@code today}, {@code tomorrow}, {@code yesterday}, {@code next week},
 * {@code last week}, {@code in N days}, {@code N days ago}. Matching ignores case and
 * surrounding blanks. Words resolve against the reference date of the evaluation, never
 * against the host clock.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class NaturalDates {

    private static final Pattern IN_DAYS = Pattern.compile("^in (\\d{1,4}) days?$");
    private static final Pattern DAYS_AGO = Pattern.compile("^(\\d{1,4}) days? ago$");

    private NaturalDates() {
    }

    /**
     * @param value condition value
     * @param reference the evaluation's reference date
     * @return the resolved day, or empty if {@code value} is not a relative date word
     */
    public static Optional<LocalDate> resolveDay(String value, LocalDate reference) {
        if (value == null) return Optional.empty();
        String text = value.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");

        switch (text) {
            case "today":
                return Optional.of(reference);
            case "tomorrow":
                return Optional.of(reference.plusDays(1));
            case "yesterday":
                return Optional.of(reference.minusDays(1));
            case "next week":
                return Optional.of(reference.plusWeeks(1));
            case "last week":
                return Optional.of(reference.minusWeeks(1));
            default:
                break;
        }

        Matcher in = IN_DAYS.matcher(text);
        if (in.matches()) return Optional.of(reference.plusDays(Long.parseLong(in.group(1))));
        Matcher ago = DAYS_AGO.matcher(text);
        if (ago.matches()) return Optional.of(reference.minusDays(Long.parseLong(ago.group(1))));
        return Optional.empty();
    }

    public static boolean isNatural(String value) {
        return resolveDay(value, LocalDate.EPOCH).isPresent();
    }

    /**
     * Replaces a relative date word by its ISO calendar date and leaves anything else as is.
     *
     * @param value condition value
     * @param reference the evaluation's reference date
     * @return an ISO date string, or {@code value} unchanged
     */
    public static String resolve(String value, LocalDate reference) {
        return resolveDay(value, reference).map(LocalDate::toString).orElse(value);
    }
}
