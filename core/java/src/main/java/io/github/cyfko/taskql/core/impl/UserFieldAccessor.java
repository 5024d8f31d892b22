package io.github.cyfko.taskql.core.impl;

import io.github.cyfko.taskql.core.config.EngineConfig;
import io.github.cyfko.taskql.core.model.TaskEntity;
import io.github.cyfko.taskql.core.model.UserFieldDefinition;
import io.github.cyfko.taskql.core.utils.DateAnchors;
import io.github.cyfko.taskql.core.utils.ListTokens;
import io.github.cyfko.taskql.core.utils.ValueCoercion;

import java.text.Collator;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Typed access to user-defined fields for sorting and grouping.
 * <p>
 * Each field id is resolved once against the field definitions into a typed strategy
 * (text, number, boolean, date or list) which is then reused by every comparison and bucket
 * derivation. None of the operations throw: values of the wrong shape rank after valid
 * values, and missing values rank last.
 * </p>
 *
 * <h2>Ranks</h2>
 * <table>
 *   <caption>Value ranks per field type</caption>
 *   <tr><th>Type</th><th>Valid</th><th>Invalid</th><th>Missing</th></tr>
 *   <tr><td>text</td><td>non-blank text</td><td>blank text</td><td>absent</td></tr>
 *   <tr><td>number</td><td>leading number</td><td>non-numeric text</td><td>absent or blank</td></tr>
 *   <tr><td>boolean</td><td>true, then false</td><td>-</td><td>anything else</td></tr>
 *   <tr><td>date</td><td>parsable date</td><td>unparsable text</td><td>absent or blank</td></tr>
 *   <tr><td>list</td><td>first display token</td><td>no token</td><td>absent</td></tr>
 * </table>
 *
 * <h2>Buckets</h2>
 * <p>
 * Grouping by a user field derives one bucket name per task: the value itself (numbers
 * without trailing fraction, dates as their ISO anchor day, lists by their first display
 * token) or one of the fallback names {@value #UNKNOWN_FIELD}, {@value #NO_VALUE},
 * {@value #NO_DATE}, {@value #EMPTY}, {@value #NON_NUMERIC} and {@value #INVALID_DATE}.
 * Fallback buckets always order after value buckets.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class UserFieldAccessor {

    public static final String UNKNOWN_FIELD = "unknown-field";
    public static final String NO_VALUE = "no-value";
    public static final String NO_DATE = "no-date";
    public static final String EMPTY = "empty";
    public static final String NON_NUMERIC = "non-numeric";
    public static final String INVALID_DATE = "invalid-date";

    private static final int VALID = 0;
    private static final int INVALID = 1;
    private static final int MISSING = 2;

    private final Map<String, UserFieldDefinition> definitions;
    private final Collator collator;
    private final Map<String, TypedField> resolved = new ConcurrentHashMap<>();

    public UserFieldAccessor(EngineConfig config) {
        this.definitions = config.getUserFieldsById();
        this.collator = Collator.getInstance(config.getCollationLocale());
    }

    public Optional<UserFieldDefinition> definition(String fieldId) {
        return Optional.ofNullable(fieldId == null ? null : definitions.get(fieldId));
    }

    /**
     * @param fieldId user field id
     * @return ascending comparator of tasks by the field value
     */
    public Comparator<TaskEntity> comparator(String fieldId) {
        TypedField field = field(fieldId);
        return field::compare;
    }

    /**
     * @param task    task to classify
     * @param fieldId user field id
     * @return the bucket name of the task
     */
    public String bucket(TaskEntity task, String fieldId) {
        TypedField field = field(fieldId);
        return field.bucket(field.raw(task));
    }

    /**
     * Display order of the buckets of a field: numbers descending, {@code true} before
     * {@code false}, dates ascending, text alphabetically.
     *
     * @param fieldId user field id
     * @return bucket name comparator
     */
    public Comparator<String> bucketOrder(String fieldId) {
        TypedField field = field(fieldId);
        return (a, b) -> field.compareBucketNames(a, b, false);
    }

    /**
     * Bucket order matching the ascending sort order of the same field, fallbacks included.
     *
     * @param fieldId user field id
     * @return bucket name comparator
     */
    public Comparator<String> sortAlignedBucketOrder(String fieldId) {
        TypedField field = field(fieldId);
        return (a, b) -> field.compareBucketNames(a, b, true);
    }

    private TypedField field(String fieldId) {
        return resolved.computeIfAbsent(fieldId == null ? "" : fieldId, this::resolve);
    }

    private TypedField resolve(String fieldId) {
        UserFieldDefinition definition = definitions.get(fieldId);
        if (definition == null) return new UnknownField();
        switch (definition.type()) {
            case NUMBER:
                return new NumberField(definition.key());
            case BOOLEAN:
                return new BooleanField(definition.key());
            case DATE:
                return new DateField(definition.key());
            case LIST:
                return new ListField(definition.key());
            case TEXT:
            default:
                return new TextField(definition.key());
        }
    }

    private abstract class TypedField {
        private final String key;

        TypedField(String key) {
            this.key = key;
        }

        Object raw(TaskEntity task) {
            return key == null ? null : task.userField(key);
        }

        abstract int rank(Object raw);

        /** Both values have the valid rank. */
        abstract int compareValid(Object a, Object b);

        abstract String bucket(Object raw);

        /** Both names are value buckets. */
        abstract int compareValueBuckets(String a, String b, boolean sortAligned);

        int emptyRank() {
            return INVALID;
        }

        final int compare(TaskEntity a, TaskEntity b) {
            Object x = raw(a);
            Object y = raw(b);
            int rx = rank(x);
            int ry = rank(y);
            if (rx != ry) return Integer.compare(rx, ry);
            return rx == VALID ? compareValid(x, y) : 0;
        }

        final int compareBucketNames(String a, String b, boolean sortAligned) {
            int ra = bucketRank(a);
            int rb = bucketRank(b);
            if (ra != rb) return Integer.compare(ra, rb);
            if (ra == VALID) return compareValueBuckets(a, b, sortAligned);
            return a.compareTo(b);
        }

        private int bucketRank(String bucket) {
            switch (bucket) {
                case NON_NUMERIC:
                case INVALID_DATE:
                    return INVALID;
                case NO_VALUE:
                case NO_DATE:
                case UNKNOWN_FIELD:
                    return MISSING;
                case EMPTY:
                    return emptyRank();
                default:
                    return VALID;
            }
        }
    }

    private final class UnknownField extends TypedField {
        UnknownField() {
            super(null);
        }

        @Override
        int rank(Object raw) {
            return MISSING;
        }

        @Override
        int compareValid(Object a, Object b) {
            return 0;
        }

        @Override
        String bucket(Object raw) {
            return UNKNOWN_FIELD;
        }

        @Override
        int compareValueBuckets(String a, String b, boolean sortAligned) {
            return collator.compare(a, b);
        }
    }

    private final class TextField extends TypedField {
        TextField(String key) {
            super(key);
        }

        @Override
        int rank(Object raw) {
            if (raw == null) return MISSING;
            return ValueCoercion.text(raw).isBlank() ? INVALID : VALID;
        }

        @Override
        int compareValid(Object a, Object b) {
            return collator.compare(ValueCoercion.text(a).trim(), ValueCoercion.text(b).trim());
        }

        @Override
        String bucket(Object raw) {
            if (raw == null) return NO_VALUE;
            String text = ValueCoercion.text(raw).trim();
            return text.isEmpty() ? EMPTY : text;
        }

        @Override
        int compareValueBuckets(String a, String b, boolean sortAligned) {
            return collator.compare(a, b);
        }
    }

    private final class NumberField extends TypedField {
        NumberField(String key) {
            super(key);
        }

        @Override
        int rank(Object raw) {
            if (ValueCoercion.isEmpty(raw)) return MISSING;
            return ValueCoercion.leadingNumber(raw).isPresent() ? VALID : INVALID;
        }

        @Override
        int compareValid(Object a, Object b) {
            return Double.compare(ValueCoercion.leadingNumber(a).getAsDouble(),
                    ValueCoercion.leadingNumber(b).getAsDouble());
        }

        @Override
        String bucket(Object raw) {
            if (raw == null) return NO_VALUE;
            if (ValueCoercion.isEmpty(raw)) return EMPTY;
            OptionalDouble number = ValueCoercion.leadingNumber(raw);
            return number.isPresent() ? ValueCoercion.formatNumber(number.getAsDouble()) : NON_NUMERIC;
        }

        @Override
        int emptyRank() {
            return MISSING;
        }

        @Override
        int compareValueBuckets(String a, String b, boolean sortAligned) {
            double x = ValueCoercion.leadingNumber(a).orElse(0);
            double y = ValueCoercion.leadingNumber(b).orElse(0);
            return sortAligned ? Double.compare(x, y) : Double.compare(y, x);
        }
    }

    private final class BooleanField extends TypedField {
        BooleanField(String key) {
            super(key);
        }

        @Override
        int rank(Object raw) {
            return ValueCoercion.bool(raw).isPresent() ? VALID : MISSING;
        }

        @Override
        int compareValid(Object a, Object b) {
            // true first
            return Boolean.compare(ValueCoercion.bool(b).get(), ValueCoercion.bool(a).get());
        }

        @Override
        String bucket(Object raw) {
            return ValueCoercion.bool(raw).map(String::valueOf).orElse(NO_VALUE);
        }

        @Override
        int compareValueBuckets(String a, String b, boolean sortAligned) {
            return Boolean.compare(Boolean.parseBoolean(b), Boolean.parseBoolean(a));
        }
    }

    private final class DateField extends TypedField {
        DateField(String key) {
            super(key);
        }

        @Override
        int rank(Object raw) {
            if (raw == null || ValueCoercion.text(raw).isBlank()) return MISSING;
            return DateAnchors.parse(ValueCoercion.text(raw)).isPresent() ? VALID : INVALID;
        }

        @Override
        int compareValid(Object a, Object b) {
            return DateAnchors.compareNullsLast(ValueCoercion.text(a), ValueCoercion.text(b));
        }

        @Override
        String bucket(Object raw) {
            if (raw == null || ValueCoercion.text(raw).isBlank()) return NO_DATE;
            return DateAnchors.anchorDay(ValueCoercion.text(raw))
                    .map(LocalDate::toString)
                    .orElse(INVALID_DATE);
        }

        @Override
        int compareValueBuckets(String a, String b, boolean sortAligned) {
            try {
                return LocalDate.parse(a).compareTo(LocalDate.parse(b));
            } catch (DateTimeParseException e) {
                return a.compareTo(b);
            }
        }
    }

    private final class ListField extends TypedField {
        ListField(String key) {
            super(key);
        }

        @Override
        int rank(Object raw) {
            if (raw == null) return MISSING;
            return ListTokens.firstDisplayToken(raw) == null ? INVALID : VALID;
        }

        @Override
        int compareValid(Object a, Object b) {
            return collator.compare(ListTokens.firstDisplayToken(a), ListTokens.firstDisplayToken(b));
        }

        @Override
        String bucket(Object raw) {
            if (raw == null) return NO_VALUE;
            String token = ListTokens.firstDisplayToken(raw);
            return token == null ? EMPTY : token;
        }

        @Override
        int compareValueBuckets(String a, String b, boolean sortAligned) {
            return collator.compare(a, b);
        }
    }
}
