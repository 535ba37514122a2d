package com.playpilot.orchestrator.template;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Typed field definitions for one template, parsed from its JSON schema:
 *
 * <pre>
 * {
 *   "type": "object",
 *   "properties": {
 *     "port": {"type": "integer", "default": 80},
 *     "web_server": {"type": "string", "enum": ["nginx", "apache2"]}
 *   },
 *   "required": ["hosts"]
 * }
 * </pre>
 *
 * The field set is closed: a name not declared here is never legal in a
 * render request.
 */
public final class VariableSchema {

    public enum FieldType {
        STRING("a string"), INTEGER("an integer"), NUMBER("a number"), BOOLEAN("a boolean"),
        ARRAY("a list"), OBJECT("an object"), ANY("any value");

        private final String article;

        FieldType(String article) {
            this.article = article;
        }

        public String article() { return article; }

        boolean accepts(Object value) {
            return switch (this) {
                case STRING  -> value instanceof String;
                case INTEGER -> value instanceof Integer || value instanceof Long
                        || value instanceof Short || value instanceof java.math.BigInteger;
                case NUMBER  -> value instanceof Number;
                case BOOLEAN -> value instanceof Boolean;
                case ARRAY   -> value instanceof Collection;
                case OBJECT  -> value instanceof Map;
                case ANY     -> true;
            };
        }

        static FieldType parse(String field, String type) {
            if (type == null) return ANY;
            return switch (type) {
                case "string"  -> STRING;
                case "integer" -> INTEGER;
                case "number"  -> NUMBER;
                case "boolean" -> BOOLEAN;
                case "array"   -> ARRAY;
                case "object"  -> OBJECT;
                default -> throw new IllegalArgumentException(
                        "Unsupported type '" + type + "' for field " + field);
            };
        }
    }

    /**
     * @param allowed      null when the field is not an enum
     * @param defaultValue null when the schema declares no default
     */
    public record Field(String name, FieldType type, boolean required, List<Object> allowed, Object defaultValue) {}

    private static final VariableSchema EMPTY = new VariableSchema(Map.of());

    // Declaration order: required fields first, then the rest of "properties"
    private final Map<String, Field> fields;

    private VariableSchema(Map<String, Field> fields) {
        this.fields = fields;
    }

    public static VariableSchema empty() {
        return EMPTY;
    }

    /**
     * Parse a stored schema. Null or blank text is the empty schema.
     *
     * @throws IllegalArgumentException if the text is not a well-formed schema
     */
    public static VariableSchema parse(String json, ObjectMapper objectMapper) {
        if (json == null || json.isBlank()) {
            return EMPTY;
        }
        try {
            return fromNode(objectMapper.readTree(json), objectMapper);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid variables schema: " + e.getOriginalMessage(), e);
        }
    }

    public static VariableSchema fromNode(JsonNode root, ObjectMapper objectMapper) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return EMPTY;
        }
        if (!root.isObject()) {
            throw new IllegalArgumentException("Invalid variables schema: expected a JSON object");
        }

        Set<String> required = new LinkedHashSet<>();
        JsonNode req = root.path("required");
        if (!req.isMissingNode()) {
            if (!req.isArray()) {
                throw new IllegalArgumentException("Invalid variables schema: 'required' must be an array");
            }
            req.forEach(n -> required.add(n.asText()));
        }

        JsonNode props = root.path("properties");
        if (!props.isMissingNode() && !props.isObject()) {
            throw new IllegalArgumentException("Invalid variables schema: 'properties' must be an object");
        }

        Map<String, Field> fields = new LinkedHashMap<>();
        for (String name : required) {
            fields.put(name, field(name, props.path(name), true, objectMapper));
        }
        Iterator<Map.Entry<String, JsonNode>> it = props.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            fields.putIfAbsent(e.getKey(), field(e.getKey(), e.getValue(), false, objectMapper));
        }
        return new VariableSchema(Collections.unmodifiableMap(fields));
    }

    private static Field field(String name, JsonNode def, boolean required, ObjectMapper objectMapper) {
        String typeName = def.hasNonNull("type") ? def.get("type").asText() : null;
        FieldType type = FieldType.parse(name, typeName);

        List<Object> allowed = null;
        if (def.has("enum")) {
            if (!def.get("enum").isArray()) {
                throw new IllegalArgumentException("Invalid variables schema: enum of " + name + " must be an array");
            }
            allowed = new ArrayList<>();
            for (JsonNode v : def.get("enum")) {
                allowed.add(toValue(v, objectMapper));
            }
            allowed = Collections.unmodifiableList(allowed);
        }
        Object defaultValue = def.hasNonNull("default") ? toValue(def.get("default"), objectMapper) : null;
        return new Field(name, type, required, allowed, defaultValue);
    }

    private static Object toValue(JsonNode node, ObjectMapper objectMapper) {
        try {
            return objectMapper.treeToValue(node, Object.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid variables schema: " + e.getOriginalMessage(), e);
        }
    }

    public Map<String, Field> fields()       { return fields; }
    public boolean           declares(String name) { return fields.containsKey(name); }
    public Field             field(String name)    { return fields.get(name); }
}
