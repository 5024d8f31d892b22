package io.github.cyfko.taskql.core.utils;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single place where task date strings become comparable values.
 * <p>
 * Every date in the engine is reduced to its <em>anchor day</em>: the UTC calendar day of
 * the instant it denotes. Timestamps without an offset are read as UTC. No method of this
 * class consults the host time zone, so the same input always lands in the same day.
 * </p>
 *
 * <h2>Accepted forms</h2>
 * <ul>
 *   <li>{@code 2025-06-10}: calendar date</li>
 *   <li>{@code 2025-06-10T14:30}, {@code 2025-06-10T14:30:15}: timestamp read as UTC</li>
 *   <li>{@code 2025-06-10 14:30}: same as above with a space separator</li>
 *   <li>{@code 2025-06-10T14:30+02:00}, {@code 2025-06-10T12:30Z}: timestamp with offset</li>
 *   <li>{@code 2025-W24}: ISO week, anchored on its Monday</li>
 * </ul>
 *
 * <h2>Time-aware ordering</h2>
 * <p>
 * Two timestamps compare as instants and two calendar dates compare as days. When only one
 * side carries a time, the calendar date stands for the last instant of its day, so
 * {@code 2025-06-10T09:00} is before {@code 2025-06-10}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class DateAnchors {

    private static final Pattern DATE_ONLY = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern ISO_WEEK = Pattern.compile("^(\\d{4})-W(\\d{2})$");
    private static final Pattern SPACE_DATE_TIME = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}) (\\d{2}:\\d{2}.*)$");
    private static final Pattern HAS_TIME = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}");

    private DateAnchors() {
    }

    /**
     * A parsed task date.
     *
     * @param day     anchor day (UTC calendar day)
     * @param instant the instant for timestamps, null for calendar dates
     */
    public record Anchored(LocalDate day, Instant instant) {

        public boolean hasTime() {
            return instant != null;
        }

        /**
         * @return the instant itself for timestamps, the last instant of the day otherwise
         */
        public Instant endInstant() {
            return instant != null ? instant : day.atTime(LocalTime.MAX).toInstant(ZoneOffset.UTC);
        }
    }

    /**
     * Parses a task date string.
     *
     * @param raw date text, may be null
     * @return the anchored value, or empty when {@code raw} is blank or not a recognized date
     */
    public static Optional<Anchored> parse(String raw) {
        if (raw == null) return Optional.empty();
        String text = raw.trim();
        if (text.isEmpty()) return Optional.empty();

        try {
            if (DATE_ONLY.matcher(text).matches()) {
                return Optional.of(new Anchored(LocalDate.parse(text), null));
            }

            Matcher week = ISO_WEEK.matcher(text);
            if (week.matches()) {
                return isoWeekMonday(Integer.parseInt(week.group(1)), Integer.parseInt(week.group(2)))
                        .map(monday -> new Anchored(monday, null));
            }

            Matcher spaced = SPACE_DATE_TIME.matcher(text);
            if (spaced.matches()) {
                text = spaced.group(1) + "T" + spaced.group(2);
            }
            if (!HAS_TIME.matcher(text).find()) return Optional.empty();

            Instant instant = parseInstant(text);
            return Optional.of(new Anchored(anchorDay(instant), instant));
        } catch (DateTimeParseException | NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Instant parseInstant(String text) {
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        }
    }

    private static Optional<LocalDate> isoWeekMonday(int year, int week) {
        if (week < 1 || week > 53) return Optional.empty();
        LocalDate reference = LocalDate.of(year, 1, 4);
        if (week > reference.range(IsoFields.WEEK_OF_WEEK_BASED_YEAR).getMaximum()) return Optional.empty();
        return Optional.of(reference
                .with(IsoFields.WEEK_OF_WEEK_BASED_YEAR, week)
                .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)));
    }

    /**
     * The canonical anchoring function: the UTC calendar day of an instant.
     *
     * @param instant any instant
     * @return its UTC calendar day
     */
    public static LocalDate anchorDay(Instant instant) {
        return LocalDate.ofInstant(instant, ZoneOffset.UTC);
    }

    /**
     * @param raw date text
     * @return the anchor day of {@code raw}, or empty if it does not parse
     */
    public static Optional<LocalDate> anchorDay(String raw) {
        return parse(raw).map(Anchored::day);
    }

    /**
     * @param raw date text
     * @return true when {@code raw} is a timestamp rather than a calendar date
     */
    public static boolean hasTime(String raw) {
        return raw != null && HAS_TIME.matcher(raw.trim()).find();
    }

    /**
     * Time-aware strict ordering of two date strings.
     *
     * @return true if {@code a} is strictly before {@code b}; false when either does not parse
     */
    public static boolean isBefore(String a, String b) {
        Optional<Anchored> left = parse(a);
        Optional<Anchored> right = parse(b);
        if (left.isEmpty() || right.isEmpty()) return false;
        return isBefore(left.get(), right.get());
    }

    public static boolean isBefore(Anchored a, Anchored b) {
        if (a.hasTime() && b.hasTime()) return a.instant().isBefore(b.instant());
        if (!a.hasTime() && !b.hasTime()) return a.day().isBefore(b.day());
        return a.endInstant().isBefore(b.endInstant());
    }

    /**
     * @return true if both strings parse and fall on the same anchor day
     */
    public static boolean isSameDay(String a, String b) {
        Optional<LocalDate> left = anchorDay(a);
        Optional<LocalDate> right = anchorDay(b);
        return left.isPresent() && left.equals(right);
    }

    /**
     * Sort comparator for optional date strings: valid dates in time-aware order, then
     * unparsable values, then missing ones.
     *
     * @param a first date, may be null or blank
     * @param b second date, may be null or blank
     * @return negative, zero or positive as {@code a} sorts before, with or after {@code b}
     */
    public static int compareNullsLast(String a, String b) {
        boolean aMissing = a == null || a.isBlank();
        boolean bMissing = b == null || b.isBlank();
        if (aMissing && bMissing) return 0;
        if (aMissing) return 1;
        if (bMissing) return -1;

        Optional<Anchored> left = parse(a);
        Optional<Anchored> right = parse(b);
        if (left.isEmpty() && right.isEmpty()) return 0;
        if (left.isEmpty()) return 1;
        if (right.isEmpty()) return -1;

        if (isBefore(left.get(), right.get())) return -1;
        if (isBefore(right.get(), left.get())) return 1;
        return 0;
    }
}
