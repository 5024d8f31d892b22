package io.github.cyfko.taskql.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.taskql.core.api.Conjunction;
import io.github.cyfko.taskql.core.api.FilterCondition;
import io.github.cyfko.taskql.core.api.FilterGroup;
import io.github.cyfko.taskql.core.api.FilterNode;
import io.github.cyfko.taskql.core.api.FilterOperator;
import io.github.cyfko.taskql.core.api.FilterQuery;
import io.github.cyfko.taskql.core.api.PropertySelector;
import io.github.cyfko.taskql.core.api.SortDirection;
import io.github.cyfko.taskql.core.api.TaskGroupKey;
import io.github.cyfko.taskql.core.api.TaskSortKey;
import io.github.cyfko.taskql.core.exception.FilterValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FilterQueryJsonCodec}.
 *
 * @author TaskQL Test Suite
 * @since 1.0.0
 */
@DisplayName("FilterQueryJsonCodec Tests")
class FilterQueryJsonCodecTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private FilterQueryJsonCodec codec;

    @BeforeEach
    void setUp() {
        codec = new FilterQueryJsonCodec(mapper);
    }

    private static FilterQuery sampleQuery() {
        FilterGroup root = new FilterGroup("root", Conjunction.AND, List.of(
                new FilterCondition("c1", PropertySelector.parse("status"), FilterOperator.IS, "open"),
                new FilterGroup("g1", Conjunction.OR, List.of(
                        new FilterCondition("c2", PropertySelector.parse("tags"), FilterOperator.CONTAINS, List.of("work", "home")),
                        new FilterCondition("c3", PropertySelector.user("effort"), FilterOperator.IS_GREATER_THAN, 3),
                        new FilterCondition("c4", PropertySelector.parse("archived"), FilterOperator.IS_NOT_CHECKED, null)))));
        return new FilterQuery(root, TaskSortKey.PRIORITY, SortDirection.DESC, TaskGroupKey.PROJECT);
    }

    // ============================================================================
    // Writing
    // ============================================================================

    @Nested
    @DisplayName("Writing")
    class Writing {

        @Test
        @DisplayName("Should write the root group with sort and group settings inlined")
        void shouldWriteRootGroup() throws Exception {
            // When
            JsonNode json = mapper.readTree(codec.write(sampleQuery()));

            // Then
            assertEquals("group", json.get("type").asText());
            assertEquals("root", json.get("id").asText());
            assertEquals("and", json.get("conjunction").asText());
            assertEquals("priority", json.get("sortKey").asText());
            assertEquals("desc", json.get("sortDirection").asText());
            assertEquals("project", json.get("groupKey").asText());
            assertEquals(2, json.get("children").size());
        }

        @Test
        @DisplayName("Should write conditions with wire codes and raw values")
        void shouldWriteConditions() {
            // When
            JsonNode group = codec.toTree(sampleQuery()).get("children").get(1);
            JsonNode tags = group.get("children").get(0);
            JsonNode effort = group.get("children").get(1);
            JsonNode archived = group.get("children").get(2);

            // Then
            assertEquals("or", group.get("conjunction").asText());
            assertEquals("condition", tags.get("type").asText());
            assertEquals("contains", tags.get("operator").asText());
            assertEquals("work", tags.get("value").get(0).asText());
            assertEquals("user:effort", effort.get("property").asText());
            assertEquals("is-greater-than", effort.get("operator").asText());
            assertEquals(3, effort.get("value").asInt());
            assertTrue(archived.get("value").isNull());
        }

        @Test
        @DisplayName("Should write an incomplete condition with a null operator")
        void shouldWriteIncompleteCondition() {
            FilterQuery query = new FilterQuery(FilterGroup.and(
                    new FilterCondition("draft", PropertySelector.placeholder(), null, null)),
                    TaskSortKey.DUE, SortDirection.ASC, TaskGroupKey.NONE);

            JsonNode condition = codec.toTree(query).get("children").get(0);

            assertEquals("", condition.get("property").asText());
            assertTrue(condition.get("operator").isNull());
        }
    }

    // ============================================================================
    // Reading
    // ============================================================================

    @Nested
    @DisplayName("Reading")
    class Reading {

        @Test
        @DisplayName("Should read back what it wrote")
        void shouldReadBackWrittenQuery() {
            // Given
            FilterQuery query = sampleQuery();

            // When
            FilterQuery read = codec.read(codec.write(query));

            // Then
            assertEquals(query, read);
        }

        @Test
        @DisplayName("Should apply defaults for missing settings and ignore unknown fields")
        void shouldApplyDefaults() {
            // Given
            String json = "{\"id\":\"r\",\"viewMode\":\"kanban\",\"children\":[" +
                    "{\"id\":\"c\",\"property\":\"title\",\"operator\":\"contains\",\"value\":\"x\",\"color\":\"red\"}]}";

            // When
            FilterQuery query = codec.read(json);

            // Then
            assertEquals("r", query.root().id());
            assertEquals(Conjunction.AND, query.root().conjunction());
            assertEquals(TaskSortKey.DUE, query.sortKey());
            assertEquals(SortDirection.ASC, query.sortDirection());
            assertEquals(TaskGroupKey.NONE, query.groupKey());
            FilterCondition condition = (FilterCondition) query.root().children().get(0);
            assertEquals(FilterOperator.CONTAINS, condition.operator());
            assertEquals("x", condition.value());
        }

        @Test
        @DisplayName("Should fall back to defaults for unknown keys")
        void shouldFallBackForUnknownKeys() {
            FilterQuery query = codec.read(
                    "{\"type\":\"group\",\"conjunction\":\"xor\",\"sortKey\":\"size\",\"sortDirection\":\"up\",\"groupKey\":\"tags\"}");

            assertEquals(Conjunction.AND, query.root().conjunction());
            assertEquals(TaskSortKey.DUE, query.sortKey());
            assertEquals(SortDirection.ASC, query.sortDirection());
            assertEquals(TaskGroupKey.NONE, query.groupKey());
            assertTrue(query.root().isEmpty());
            assertTrue(query.root().id().startsWith("filter_"));
        }

        @Test
        @DisplayName("Should read an unknown operator as an incomplete condition")
        void shouldReadUnknownOperatorAsIncomplete() {
            FilterQuery query = codec.read(
                    "{\"children\":[{\"type\":\"condition\",\"property\":\"due\",\"operator\":\"is-around\",\"value\":\"today\"}]}");

            FilterCondition condition = (FilterCondition) query.root().children().get(0);

            assertNull(condition.operator());
            assertFalse(condition.isComplete());
            assertEquals("due", condition.property().key());
        }

        @Test
        @DisplayName("Should skip nodes of unknown type and non-object children")
        void shouldSkipUnknownNodes() {
            FilterQuery query = codec.read(
                    "{\"children\":[{\"type\":\"comment\"},42,null,{\"children\":[]}]}");

            List<FilterNode> children = query.root().children();

            assertEquals(1, children.size());
            assertInstanceOf(FilterGroup.class, children.get(0));
        }

        @Test
        @DisplayName("Should read a blank property as the placeholder")
        void shouldReadBlankProperty() {
            FilterQuery query = codec.read("{\"children\":[{\"type\":\"condition\",\"property\":\" \",\"operator\":\"is\"}]}");

            FilterCondition condition = (FilterCondition) query.root().children().get(0);

            assertTrue(condition.property().isPlaceholder());
            assertNull(condition.value());
        }

        @ParameterizedTest
        @ValueSource(strings = {"{not json", "[]", "\"text\"", "null"})
        @DisplayName("Should reject input that is not a JSON object")
        void shouldRejectNonObjects(String json) {
            assertThrows(FilterValidationException.class, () -> codec.read(json));
        }
    }
}
