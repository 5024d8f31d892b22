package io.github.cyfko.taskql.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Reads and writes {@link FilterQuery} and {@link SavedView} as JSON.
 * <p>
 * A query is written as its root group with the sort and group settings inlined:
 * </p>
 * <pre>{@code
 * {
 *   "type": "group", "id": "root", "conjunction": "and",
 *   "children": [
 *     {"type": "condition", "id": "c1", "property": "status", "operator": "is", "value": "open"}
 *   ],
 *   "sortKey": "due", "sortDirection": "asc", "groupKey": "none"
 * }
 * }</pre>
 * <p>
 * Reading is lenient because saved views outlive the code that wrote them: unknown fields
 * are ignored, an unknown operator leaves the condition incomplete, and a missing or
 * unknown conjunction, sort key, direction or group key falls back to its default
 * ({@code and}, {@code due}, {@code asc}, {@code none}). Only input that is not JSON, or
 * whose top level is not an object, is rejected.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FilterQueryJsonCodec {

    private static final Logger log = Logger.getLogger(FilterQueryJsonCodec.class.getName());

    static final String TYPE_GROUP = "group";
    static final String TYPE_CONDITION = "condition";

    private final ObjectMapper mapper;

    public FilterQueryJsonCodec() {
        this(new ObjectMapper());
    }

    /**
     * @param mapper mapper used for parsing and for condition values; it is copied and
     *               configured to ignore unknown properties
     */
    public FilterQueryJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper").copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    // ------------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------------

    public String write(FilterQuery query) {
        return stringify(toTree(query));
    }

    /**
     * @throws FilterValidationException if {@code json} is not a JSON object
     */
    public FilterQuery read(String json) {
        return fromTree(parse(json));
    }

    public ObjectNode toTree(FilterQuery query) {
        Objects.requireNonNull(query, "query");
        FilterGroup root = query.root() != null ? query.root() : FilterGroup.empty();
        ObjectNode node = writeNode(root);
        node.put("sortKey", query.sortKey() != null ? query.sortKey().key() : TaskSortKey.DUE.key());
        node.put("sortDirection", code(query.sortDirection()));
        node.put("groupKey", query.groupKey() != null ? query.groupKey().key() : TaskGroupKey.NONE.key());
        return node;
    }

    public FilterQuery fromTree(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new FilterValidationException("Query JSON must be an object");
        }
        FilterGroup root = readGroup(node);

        String sort = text(node, "sortKey");
        TaskSortKey sortKey = TaskSortKey.parse(sort).orElseGet(() -> {
            if (sort != null) log.warning(() -> String.format("Unknown sort key '%s', using 'due'", sort));
            return TaskSortKey.DUE;
        });
        SortDirection direction = SortDirection.fromCode(text(node, "sortDirection")).orElse(SortDirection.ASC);
        String group = text(node, "groupKey");
        TaskGroupKey groupKey = TaskGroupKey.parse(group).orElseGet(() -> {
            if (group != null) log.warning(() -> String.format("Unknown group key '%s', using 'none'", group));
            return TaskGroupKey.NONE;
        });

        return new FilterQuery(root, sortKey, direction, groupKey);
    }

    // ------------------------------------------------------------------------
    // Saved views
    // ------------------------------------------------------------------------

    public String writeViews(List<SavedView> views) {
        ArrayNode array = mapper.createArrayNode();
        for (SavedView view : views) {
            array.add(toTree(view));
        }
        return stringify(array);
    }

    /**
     * Reads a JSON array of saved views. Entries that are not objects or carry no query
     * are skipped with a warning.
     *
     * @throws FilterValidationException if {@code json} is not a JSON array
     */
    public List<SavedView> readViews(String json) {
        JsonNode node = parse(json);
        if (!node.isArray()) {
            throw new FilterValidationException("Saved views JSON must be an array");
        }
        List<SavedView> views = new ArrayList<>();
        for (int i = 0; i < node.size(); i++) {
            JsonNode entry = node.get(i);
            if (!entry.isObject() || !entry.path("query").isObject()) {
                int index = i;
                log.warning(() -> String.format("Skipping saved view %d: not an object with a query", index));
                continue;
            }
            views.add(new SavedView(text(entry, "id"), text(entry, "name"), fromTree(entry.get("query"))));
        }
        return views;
    }

    public ObjectNode toTree(SavedView view) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", view.id());
        node.put("name", view.name());
        node.set("query", toTree(view.query()));
        return node;
    }

    // ------------------------------------------------------------------------
    // Nodes
    // ------------------------------------------------------------------------

    private ObjectNode writeNode(FilterNode node) {
        return node.accept(new FilterNode.Visitor<ObjectNode>() {
            @Override
            public ObjectNode visitCondition(FilterCondition condition) {
                ObjectNode out = mapper.createObjectNode();
                out.put("type", TYPE_CONDITION);
                out.put("id", condition.id());
                out.put("property", condition.property().key());
                if (condition.operator() != null) {
                    out.put("operator", condition.operator().getCode());
                } else {
                    out.putNull("operator");
                }
                out.set("value", mapper.valueToTree(condition.value()));
                return out;
            }

            @Override
            public ObjectNode visitGroup(FilterGroup group) {
                ObjectNode out = mapper.createObjectNode();
                out.put("type", TYPE_GROUP);
                out.put("id", group.id());
                out.put("conjunction", group.conjunction() != null ? group.conjunction().getCode()
                        : Conjunction.AND.getCode());
                ArrayNode children = out.putArray("children");
                for (FilterNode child : group.children()) {
                    children.add(child.accept(this));
                }
                return out;
            }
        });
    }

    private FilterNode readNode(JsonNode node) {
        String type = text(node, "type");
        if (TYPE_GROUP.equals(type) || (type == null && node.has("children"))) {
            return readGroup(node);
        }
        if (TYPE_CONDITION.equals(type) || type == null) {
            return readCondition(node);
        }
        log.warning(() -> String.format("Skipping filter node of unknown type '%s'", type));
        return null;
    }

    private FilterGroup readGroup(JsonNode node) {
        Conjunction conjunction = Conjunction.fromCode(text(node, "conjunction")).orElse(Conjunction.AND);
        List<FilterNode> children = new ArrayList<>();
        JsonNode array = node.path("children");
        for (JsonNode child : array) {
            if (child.isObject()) {
                children.add(readNode(child));
            }
        }
        return new FilterGroup(text(node, "id"), conjunction, children);
    }

    private FilterCondition readCondition(JsonNode node) {
        String operatorCode = text(node, "operator");
        FilterOperator operator = FilterOperator.fromCode(operatorCode).orElse(null);
        if (operator == null && operatorCode != null) {
            log.fine(() -> String.format("Unknown operator '%s' read as an incomplete condition", operatorCode));
        }
        JsonNode value = node.get("value");
        Object parsed;
        try {
            parsed = value == null || value.isNull() ? null : mapper.treeToValue(value, Object.class);
        } catch (JsonProcessingException e) {
            throw new FilterValidationException("Unreadable value in condition '" + text(node, "id") + "'", e);
        }
        return new FilterCondition(text(node, "id"), PropertySelector.parse(text(node, "property")), operator,
                parsed);
    }

    // ------------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------------

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isValueNode() && !value.isNull() ? value.asText() : null;
    }

    private static String code(SortDirection direction) {
        return (direction != null ? direction : SortDirection.ASC).getCode();
    }

    private JsonNode parse(String json) {
        Objects.requireNonNull(json, "json");
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new FilterValidationException("Malformed query JSON: " + e.getOriginalMessage(), e);
        }
    }

    private String stringify(JsonNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write query JSON", e);
        }
    }
}
