package io.specrouter.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.specrouter.core.error.ModelGenerationException;
import java.util.Map;
import java.util.Set;

/**
 * Rewrites the contract's {@code components/schemas} into a self-contained JSON Schema 2020-12
 * {@code $defs} bundle and rejects constructs no model can be built from.
 *
 * <ul>
 *   <li>{@code #/components/schemas/X} references become {@code #/$defs/X}; any other reference,
 *       or one naming an undefined component, fails generation;
 *   <li>OpenAPI 3.0 {@code nullable: true} becomes a {@code null} type branch;
 *   <li>boolean {@code exclusiveMinimum}/{@code exclusiveMaximum} become numeric bounds;
 *   <li>{@code example}, {@code discriminator}, {@code xml}, {@code externalDocs} and {@code x-*}
 *       extensions are dropped.
 * </ul>
 *
 * The input tree is never modified.
 */
final class SchemaNormalizer {

    static final String COMPONENT_PREFIX = "#/components/schemas/";
    static final String DEFS_PREFIX = "#/$defs/";

    private static final Set<String> VALID_TYPES =
            Set.of("object", "array", "string", "number", "integer", "boolean", "null");
    private static final Set<String> DROPPED_KEYS = Set.of("example", "discriminator", "xml", "externalDocs");
    private static final Set<String> SCHEMA_ARRAY_KEYS = Set.of("allOf", "anyOf", "oneOf", "prefixItems");
    private static final Set<String> SCHEMA_KEYS =
            Set.of("items", "not", "additionalProperties", "contains", "propertyNames", "if", "then", "else");
    private static final Set<String> SCHEMA_MAP_KEYS = Set.of("properties", "patternProperties");

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final String source;
    private final Set<String> componentNames;

    SchemaNormalizer(String source, Set<String> componentNames) {
        this.source = source;
        this.componentNames = componentNames;
    }

    /**
     * Normalizes every component.
     *
     * @param components the {@code components/schemas} object
     * @return a new {@code $defs} object in declaration order
     * @throws ModelGenerationException naming the first offending component
     */
    ObjectNode normalize(JsonNode components) {
        ObjectNode defs = NODES.objectNode();
        for (Map.Entry<String, JsonNode> entry : components.properties()) {
            String name = entry.getKey();
            if (!entry.getValue().isObject()) {
                throw malformed(name, "schema must be an object");
            }
            defs.set(name, normalizeSchema(entry.getValue(), name, name));
        }
        return defs;
    }

    private JsonNode normalizeSchema(JsonNode schema, String component, String at) {
        if (schema.isBoolean()) {
            return schema;
        }
        if (!schema.isObject()) {
            throw malformed(component, "schema at '" + at + "' must be an object");
        }

        ObjectNode out = NODES.objectNode();
        for (Map.Entry<String, JsonNode> entry : schema.properties()) {
            String key = entry.getKey();
            JsonNode value = entry.getValue();
            if (key.startsWith("x-") || DROPPED_KEYS.contains(key) || key.equals("nullable")) {
                continue;
            }
            switch (key) {
                case "$ref" -> out.put("$ref", rewriteRef(value, component, at));
                case "type" -> out.set("type", checkType(value, component, at));
                case "required" -> out.set("required", checkStringArray(value, component, at + ".required"));
                case "enum" -> {
                    if (!value.isArray()) {
                        throw malformed(component, "'enum' at '" + at + "' must be an array");
                    }
                    out.set("enum", value.deepCopy());
                }
                default -> {
                    if (SCHEMA_MAP_KEYS.contains(key)) {
                        out.set(key, normalizeSchemaMap(value, component, at + "." + key));
                    } else if (SCHEMA_ARRAY_KEYS.contains(key)) {
                        out.set(key, normalizeSchemaArray(value, component, at + "." + key));
                    } else if (SCHEMA_KEYS.contains(key)) {
                        if (key.equals("items") && value.isArray()) {
                            throw malformed(component, "'items' at '" + at + "' must be a schema, not an array");
                        }
                        out.set(key, normalizeSchema(value, component, at + "." + key));
                    } else {
                        out.set(key, value.deepCopy());
                    }
                }
            }
        }

        rewriteExclusiveBound(out, "exclusiveMinimum", "minimum", component, at);
        rewriteExclusiveBound(out, "exclusiveMaximum", "maximum", component, at);

        if (schema.path("nullable").asBoolean(false)) {
            return makeNullable(out);
        }
        return out;
    }

    private ObjectNode normalizeSchemaMap(JsonNode value, String component, String at) {
        if (!value.isObject()) {
            throw malformed(component, "'" + at + "' must be an object");
        }
        ObjectNode out = NODES.objectNode();
        for (Map.Entry<String, JsonNode> entry : value.properties()) {
            out.set(entry.getKey(), normalizeSchema(entry.getValue(), component, at + "." + entry.getKey()));
        }
        return out;
    }

    private ArrayNode normalizeSchemaArray(JsonNode value, String component, String at) {
        if (!value.isArray() || value.isEmpty()) {
            throw malformed(component, "'" + at + "' must be a non-empty array");
        }
        ArrayNode out = NODES.arrayNode();
        int i = 0;
        for (JsonNode item : value) {
            out.add(normalizeSchema(item, component, at + "[" + i++ + "]"));
        }
        return out;
    }

    private String rewriteRef(JsonNode ref, String component, String at) {
        if (!ref.isTextual()) {
            throw malformed(component, "'$ref' at '" + at + "' must be a string");
        }
        String value = ref.asText();
        String target;
        if (value.startsWith(COMPONENT_PREFIX)) {
            target = value.substring(COMPONENT_PREFIX.length());
        } else if (value.startsWith(DEFS_PREFIX)) {
            target = value.substring(DEFS_PREFIX.length());
        } else {
            throw new ModelGenerationException(
                    "Unresolved reference '" + value + "' in component '" + component + "'", component, source);
        }
        if (!componentNames.contains(target)) {
            throw new ModelGenerationException(
                    "Unresolved reference '" + value + "' in component '" + component + "': no schema named '"
                            + target + "'",
                    component,
                    source);
        }
        return DEFS_PREFIX + target;
    }

    private JsonNode checkType(JsonNode type, String component, String at) {
        if (type.isTextual()) {
            if (!VALID_TYPES.contains(type.asText())) {
                throw malformed(component, "unknown type '" + type.asText() + "' at '" + at + "'");
            }
            return type;
        }
        if (type.isArray() && !type.isEmpty()) {
            for (JsonNode item : type) {
                if (!item.isTextual() || !VALID_TYPES.contains(item.asText())) {
                    throw malformed(component, "unknown type " + item + " at '" + at + "'");
                }
            }
            return type.deepCopy();
        }
        throw malformed(component, "'type' at '" + at + "' must be a string or array of strings");
    }

    private JsonNode checkStringArray(JsonNode value, String component, String at) {
        if (!value.isArray()) {
            throw malformed(component, "'" + at + "' must be an array");
        }
        for (JsonNode item : value) {
            if (!item.isTextual()) {
                throw malformed(component, "'" + at + "' must contain only strings");
            }
        }
        return value.deepCopy();
    }

    /** OpenAPI 3.0 {@code exclusiveMinimum: true} qualifies {@code minimum}; 2020-12 holds the bound. */
    private void rewriteExclusiveBound(ObjectNode out, String exclusiveKey, String boundKey, String component, String at) {
        JsonNode exclusive = out.get(exclusiveKey);
        if (exclusive == null || !exclusive.isBoolean()) {
            return;
        }
        out.remove(exclusiveKey);
        if (exclusive.booleanValue()) {
            JsonNode bound = out.remove(boundKey);
            if (bound == null || !bound.isNumber()) {
                throw malformed(component, "'" + exclusiveKey + "' at '" + at + "' requires a numeric '" + boundKey + "'");
            }
            out.set(exclusiveKey, bound);
        }
    }

    private static JsonNode makeNullable(ObjectNode schema) {
        JsonNode type = schema.get("type");
        if (type != null && type.isTextual()) {
            ArrayNode types = NODES.arrayNode().add(type.asText()).add("null");
            schema.set("type", types);
            JsonNode values = schema.get("enum");
            if (values != null && values.isArray()) {
                ((ArrayNode) values).addNull();
            }
            return schema;
        }
        if (type != null && type.isArray()) {
            ArrayNode types = (ArrayNode) type;
            boolean hasNull = false;
            for (JsonNode t : types) {
                hasNull |= t.asText().equals("null");
            }
            if (!hasNull) {
                types.add("null");
            }
            return schema;
        }
        ObjectNode wrapper = NODES.objectNode();
        wrapper.putArray("anyOf").add(schema).add(NODES.objectNode().put("type", "null"));
        return wrapper;
    }

    private ModelGenerationException malformed(String component, String reason) {
        return new ModelGenerationException(
                "Malformed schema component '" + component + "': " + reason, component, source);
    }
}
