package io.github.cyfko.taskql.core.api;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FilterPropertyTest {

    @ParameterizedTest
    @EnumSource(FilterProperty.class)
    void testFromKeyRoundTrip(FilterProperty property) {
        assertEquals(Optional.of(property), FilterProperty.fromKey(property.getKey()));
    }

    @Test
    void testFromKeyIsExact() {
        assertTrue(FilterProperty.fromKey("Title").isEmpty());
        assertTrue(FilterProperty.fromKey("user:effort").isEmpty());
        assertTrue(FilterProperty.fromKey(null).isEmpty());
    }

    @Test
    void testSupportedOperators() {
        assertTrue(FilterProperty.TAGS.supports(FilterOperator.CONTAINS));
        assertFalse(FilterProperty.TAGS.supports(FilterOperator.IS));
        assertTrue(FilterProperty.DUE.supports(FilterOperator.IS_ON_OR_BEFORE));
        assertFalse(FilterProperty.TIME_ESTIMATE.supports(FilterOperator.IS_EMPTY));
        assertFalse(FilterProperty.ARCHIVED.supports(null));
    }

    @Test
    void testOperatorsAreUnmodifiable() {
        assertThrows(UnsupportedOperationException.class,
                () -> FilterProperty.TITLE.getOperators().add(FilterOperator.IS_CHECKED));
    }

    @Test
    void testIsDate() {
        assertTrue(FilterProperty.FILE_MTIME.isDate());
        assertTrue(FilterProperty.COMPLETED_DATE.isDate());
        assertFalse(FilterProperty.STATUS_IS_COMPLETED.isDate());
    }

    @Test
    void testPropertySelector() {
        PropertySelector user = PropertySelector.user("effort");

        assertEquals("user:effort", user.key());
        assertTrue(user.isUserField());
        assertEquals("effort", user.userFieldId());
        assertTrue(user.builtIn().isEmpty());

        PropertySelector due = PropertySelector.parse(" due ");
        assertEquals(Optional.of(FilterProperty.DUE), due.builtIn());
        assertNull(due.userFieldId());

        assertSame(PropertySelector.placeholder(), PropertySelector.parse("  "));
        assertTrue(PropertySelector.parse(null).isPlaceholder());
        assertFalse(new PropertySelector("user:").isUserField());
    }
}
