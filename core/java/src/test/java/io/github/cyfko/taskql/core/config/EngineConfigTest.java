package io.github.cyfko.taskql.core.config;

import io.github.cyfko.taskql.core.model.UserFieldDefinition;
import io.github.cyfko.taskql.core.model.UserFieldType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link EngineConfig} and {@link CachePolicy}.
 * Covers defaults, overrides and argument validation.
 *
 * @author TaskQL Test Suite
 * @since 1.0.0
 */
@DisplayName("EngineConfig Tests")
class EngineConfigTest {

    // ============================================================================
    // Defaults
    // ============================================================================

    @Test
    @DisplayName("Should build EngineConfig with default values")
    void shouldBuildWithDefaults() {
        // When
        EngineConfig config = EngineConfig.defaults();

        // Then
        assertTrue(config.isHideCompletedFromOverdue(), "Completed tasks should be hidden from Overdue by default");
        assertEquals(50, config.getBatchSize());
        assertEquals(CachePolicy.defaults(), config.getCachePolicy());
        assertEquals(Locale.ROOT, config.getCollationLocale());
        assertTrue(config.getUserFields().isEmpty());
        assertEquals(3, config.getStatusCatalog().statuses().size());
        assertEquals(4, config.getPriorityCatalog().priorities().size());
    }

    // ============================================================================
    // Overrides
    // ============================================================================

    @Test
    @DisplayName("Should index user fields by id and keep their declaration order")
    void shouldIndexUserFields() {
        // Given
        List<UserFieldDefinition> fields = new ArrayList<>(List.of(
                UserFieldDefinition.of("effort", UserFieldType.NUMBER),
                UserFieldDefinition.of("owners", UserFieldType.LIST)));

        // When
        EngineConfig config = EngineConfig.builder().userFields(fields).build();
        fields.clear();

        // Then
        assertEquals(List.of("effort", "owners"), new ArrayList<>(config.getUserFieldsById().keySet()));
        assertEquals(2, config.getUserFields().size());
        assertEquals(UserFieldType.LIST, config.findUserField("owners").orElseThrow().type());
        assertTrue(config.findUserField("ghost").isEmpty());
        assertTrue(config.findUserField(null).isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> config.getUserFieldsById().clear());
    }

    @Test
    @DisplayName("Should read today from the configured clock in UTC")
    void shouldReadTodayInUtc() {
        // Given: 23:30 in New York is already the next day in UTC
        Clock local = Clock.fixed(Instant.parse("2025-06-11T03:30:00Z"), ZoneId.of("America/New_York"));

        // When
        EngineConfig config = EngineConfig.builder().clock(local).build();

        // Then
        assertEquals(LocalDate.of(2025, 6, 11), config.today());
        assertEquals(ZoneOffset.UTC, config.getClock().getZone());
    }

    @Test
    @DisplayName("Should reject invalid builder arguments")
    void shouldRejectInvalidArguments() {
        EngineConfig.Builder builder = EngineConfig.builder();

        assertThrows(IllegalArgumentException.class, () -> builder.batchSize(0));
        assertThrows(NullPointerException.class, () -> builder.clock(null));
        assertThrows(NullPointerException.class, () -> builder.userFields(null));
        assertThrows(NullPointerException.class, () -> builder.cachePolicy(null));
        assertThrows(NullPointerException.class, () -> builder.recurrenceEvaluator(null));
    }

    // ============================================================================
    // Cache policy
    // ============================================================================

    @Test
    @DisplayName("Should expose the documented cache policy presets")
    void shouldExposeCachePolicyPresets() {
        CachePolicy defaults = CachePolicy.defaults();

        assertEquals(Duration.ofSeconds(30), defaults.lookupTtl());
        assertEquals(Duration.ofSeconds(30), defaults.optionsFreshnessWindow());
        assertEquals(Duration.ofMinutes(5), defaults.optionsMaxAge());
        assertEquals(1000, defaults.maxEntries());
        assertTrue(defaults.isEnabled());
        assertFalse(CachePolicy.none().isEnabled());
        assertEquals(10, CachePolicy.custom(Duration.ofSeconds(1), 10).maxEntries());
    }

    @Test
    @DisplayName("Should reject negative durations and non-positive sizes")
    void shouldRejectInvalidCachePolicy() {
        assertThrows(IllegalArgumentException.class,
                () -> new CachePolicy(Duration.ofSeconds(-1), Duration.ZERO, Duration.ZERO, 10));
        assertThrows(IllegalArgumentException.class, () -> CachePolicy.custom(Duration.ofSeconds(1), 0));
        assertThrows(NullPointerException.class,
                () -> new CachePolicy(null, Duration.ZERO, Duration.ZERO, 10));
    }
}
