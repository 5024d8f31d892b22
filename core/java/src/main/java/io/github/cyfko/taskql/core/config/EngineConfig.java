package io.github.cyfko.taskql.core.config;

import io.github.cyfko.taskql.core.model.PriorityCatalog;
import io.github.cyfko.taskql.core.model.StatusCatalog;
import io.github.cyfko.taskql.core.model.UserFieldDefinition;
import io.github.cyfko.taskql.core.spi.ProjectResolver;
import io.github.cyfko.taskql.core.spi.RecurrenceEvaluator;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Global configuration of a query engine.
 * <p>
 * Gathers the workspace vocabulary (statuses, priorities, user fields), the external
 * collaborators the engine calls into and the tuning knobs of evaluation. Instances are
 * immutable and built through {@link #builder()}.
 * </p>
 *
 * <h2>Defaults</h2>
 * <ul>
 *   <li>Statuses and priorities: {@link StatusCatalog#defaults()}, {@link PriorityCatalog#defaults()}</li>
 *   <li>No user fields</li>
 *   <li>Completed tasks are never bucketed as overdue</li>
 *   <li>Point lookups in batches of 50</li>
 *   <li>{@link CachePolicy#defaults()}</li>
 *   <li>UTC system clock, root locale for collation</li>
 *   <li>{@link ProjectResolver#linkText()}, {@link RecurrenceEvaluator#never()}</li>
 * </ul>
 *
 * <pre>{@code
 * EngineConfig config = EngineConfig.builder()
 *     .userFields(List.of(UserFieldDefinition.of("effort", UserFieldType.NUMBER)))
 *     .recurrenceEvaluator(myRuleEngine::isDueOn)
 *     .collationLocale(Locale.FRENCH)
 *     .build();
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class EngineConfig {

    private final StatusCatalog statusCatalog;
    private final PriorityCatalog priorityCatalog;
    private final List<UserFieldDefinition> userFields;
    private final Map<String, UserFieldDefinition> userFieldsById;
    private final boolean hideCompletedFromOverdue;
    private final int batchSize;
    private final CachePolicy cachePolicy;
    private final Clock clock;
    private final Locale collationLocale;
    private final ProjectResolver projectResolver;
    private final RecurrenceEvaluator recurrenceEvaluator;

    private EngineConfig(Builder builder) {
        this.statusCatalog = builder.statusCatalog;
        this.priorityCatalog = builder.priorityCatalog;
        this.userFields = List.copyOf(builder.userFields);
        Map<String, UserFieldDefinition> byId = new LinkedHashMap<>();
        for (UserFieldDefinition field : userFields) {
            byId.put(field.id(), field);
        }
        this.userFieldsById = Collections.unmodifiableMap(byId);
        this.hideCompletedFromOverdue = builder.hideCompletedFromOverdue;
        this.batchSize = builder.batchSize;
        this.cachePolicy = builder.cachePolicy;
        this.clock = builder.clock;
        this.collationLocale = builder.collationLocale;
        this.projectResolver = builder.projectResolver;
        this.recurrenceEvaluator = builder.recurrenceEvaluator;
    }

    public static Builder builder() { return new Builder(); }

    public static EngineConfig defaults() { return builder().build(); }

    public StatusCatalog getStatusCatalog() { return statusCatalog; }
    public PriorityCatalog getPriorityCatalog() { return priorityCatalog; }
    public List<UserFieldDefinition> getUserFields() { return userFields; }
    public Map<String, UserFieldDefinition> getUserFieldsById() { return userFieldsById; }
    public boolean isHideCompletedFromOverdue() { return hideCompletedFromOverdue; }
    public int getBatchSize() { return batchSize; }
    public CachePolicy getCachePolicy() { return cachePolicy; }
    public Clock getClock() { return clock; }
    public Locale getCollationLocale() { return collationLocale; }
    public ProjectResolver getProjectResolver() { return projectResolver; }
    public RecurrenceEvaluator getRecurrenceEvaluator() { return recurrenceEvaluator; }

    public Optional<UserFieldDefinition> findUserField(String id) {
        return Optional.ofNullable(id == null ? null : userFieldsById.get(id));
    }

    /**
     * @return today's UTC calendar day according to the configured clock
     */
    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /**
     * Builder for {@link EngineConfig}.
     */
    public static final class Builder {
        private StatusCatalog statusCatalog = StatusCatalog.defaults();
        private PriorityCatalog priorityCatalog = PriorityCatalog.defaults();
        private List<UserFieldDefinition> userFields = List.of();
        private boolean hideCompletedFromOverdue = true;
        private int batchSize = 50;
        private CachePolicy cachePolicy = CachePolicy.defaults();
        private Clock clock = Clock.systemUTC();
        private Locale collationLocale = Locale.ROOT;
        private ProjectResolver projectResolver = ProjectResolver.linkText();
        private RecurrenceEvaluator recurrenceEvaluator = RecurrenceEvaluator.never();

        public Builder statusCatalog(StatusCatalog catalog) {
            this.statusCatalog = Objects.requireNonNull(catalog, "statusCatalog");
            return this;
        }

        public Builder priorityCatalog(PriorityCatalog catalog) {
            this.priorityCatalog = Objects.requireNonNull(catalog, "priorityCatalog");
            return this;
        }

        public Builder userFields(List<UserFieldDefinition> fields) {
            this.userFields = Objects.requireNonNull(fields, "userFields");
            return this;
        }

        public Builder hideCompletedFromOverdue(boolean hide) {
            this.hideCompletedFromOverdue = hide;
            return this;
        }

        public Builder batchSize(int size) {
            if (size <= 0) {
                throw new IllegalArgumentException("batchSize must be positive, got: " + size);
            }
            this.batchSize = size;
            return this;
        }

        public Builder cachePolicy(CachePolicy policy) {
            this.cachePolicy = Objects.requireNonNull(policy, "cachePolicy");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock").withZone(ZoneOffset.UTC);
            return this;
        }

        public Builder collationLocale(Locale locale) {
            this.collationLocale = Objects.requireNonNull(locale, "collationLocale");
            return this;
        }

        public Builder projectResolver(ProjectResolver resolver) {
            this.projectResolver = Objects.requireNonNull(resolver, "projectResolver");
            return this;
        }

        public Builder recurrenceEvaluator(RecurrenceEvaluator evaluator) {
            this.recurrenceEvaluator = Objects.requireNonNull(evaluator, "recurrenceEvaluator");
            return this;
        }

        public EngineConfig build() { return new EngineConfig(this); }
    }
}
