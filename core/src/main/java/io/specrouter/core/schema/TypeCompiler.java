package io.specrouter.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import io.specrouter.core.error.ModelGenerationException;
import io.specrouter.core.schema.TypeDescriptor.Kind;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Compiles normalized {@code $defs} schemas into {@link TypeDescriptor} trees. */
final class TypeCompiler {

    private final JsonNode defs;
    private final String source;

    TypeCompiler(JsonNode defs, String source) {
        this.defs = defs;
        this.source = source;
    }

    /** Compiles every entry of the bundle, keyed by component name. */
    Map<String, TypeDescriptor> compileAll() {
        Map<String, TypeDescriptor> result = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> entry : defs.properties()) {
            result.put(entry.getKey(), compile(entry.getValue(), entry.getKey(), new HashSet<>()));
        }
        return result;
    }

    private TypeDescriptor compile(JsonNode schema, String component, Set<String> expanding) {
        if (schema.isBoolean()) {
            if (schema.booleanValue()) {
                return TypeDescriptor.builder(Kind.ANY).build();
            }
            throw malformed(component, "a 'false' schema accepts no value");
        }
        TypeDescriptor type = compileShape(schema, component, expanding);
        JsonNode defaultValue = schema.get("default");
        return defaultValue != null ? type.withDefault(defaultValue) : type;
    }

    private TypeDescriptor compileShape(JsonNode schema, String component, Set<String> expanding) {
        JsonNode ref = schema.get("$ref");
        if (ref != null) {
            return TypeDescriptor.builder(Kind.REF)
                    .refName(ref.asText().substring(SchemaNormalizer.DEFS_PREFIX.length()))
                    .build();
        }

        JsonNode choices = schema.has("anyOf") ? schema.get("anyOf") : schema.get("oneOf");
        if (choices != null) {
            return compileChoice(choices, component, expanding);
        }

        JsonNode allOf = schema.get("allOf");
        if (allOf != null) {
            return compileAllOf(schema, allOf, component, expanding);
        }

        List<String> types = new ArrayList<>();
        JsonNode typeNode = schema.get("type");
        if (typeNode != null && typeNode.isTextual()) {
            types.add(typeNode.asText());
        } else if (typeNode != null) {
            typeNode.forEach(t -> types.add(t.asText()));
        }
        boolean nullable = types.remove("null");

        JsonNode enumNode = schema.has("enum") ? schema.get("enum") : null;
        if (enumNode == null && schema.has("const")) {
            enumNode = schema.get("const");
        }
        if (enumNode != null) {
            TypeDescriptor.Builder b = TypeDescriptor.builder(Kind.ENUM);
            if (enumNode.isArray()) {
                for (JsonNode value : enumNode) {
                    if (value.isNull()) {
                        nullable = true;
                    } else {
                        b.enumValue(value);
                    }
                }
            } else {
                b.enumValue(enumNode);
            }
            return b.nullable(nullable).build();
        }

        if (types.isEmpty()) {
            if (nullable) {
                return TypeDescriptor.builder(Kind.NULL).nullable(true).build();
            }
            if (schema.has("properties") || schema.has("additionalProperties") || schema.has("required")) {
                return compileTyped("object", schema, component, expanding);
            }
            if (schema.has("items")) {
                return compileTyped("array", schema, component, expanding);
            }
            return TypeDescriptor.builder(Kind.ANY).build();
        }
        if (types.size() == 1) {
            TypeDescriptor single = compileTyped(types.get(0), schema, component, expanding);
            return nullable ? single.asNullable() : single;
        }
        TypeDescriptor.Builder union = TypeDescriptor.builder(Kind.UNION).nullable(nullable);
        for (String type : types) {
            union.variant(compileTyped(type, schema, component, expanding));
        }
        return union.build();
    }

    private TypeDescriptor compileTyped(String type, JsonNode schema, String component, Set<String> expanding) {
        return switch (type) {
            case "string" -> switch (schema.path("format").asText("")) {
                case "date" -> TypeDescriptor.builder(Kind.DATE).build();
                case "date-time" -> TypeDescriptor.builder(Kind.DATE_TIME).build();
                default -> TypeDescriptor.builder(Kind.STRING).build();
            };
            case "number" -> TypeDescriptor.builder(Kind.NUMBER).build();
            case "integer" -> TypeDescriptor.builder(Kind.INTEGER).build();
            case "boolean" -> TypeDescriptor.builder(Kind.BOOLEAN).build();
            case "null" -> TypeDescriptor.builder(Kind.NULL).nullable(true).build();
            case "array" -> TypeDescriptor.builder(Kind.ARRAY)
                    .items(schema.has("items")
                            ? compile(schema.get("items"), component, expanding)
                            : TypeDescriptor.builder(Kind.ANY).build())
                    .build();
            case "object" -> compileObject(schema, component, expanding).build();
            default -> throw malformed(component, "unknown type '" + type + "'");
        };
    }

    private TypeDescriptor.Builder compileObject(JsonNode schema, String component, Set<String> expanding) {
        TypeDescriptor.Builder b = TypeDescriptor.builder(Kind.OBJECT);
        for (Map.Entry<String, JsonNode> property : schema.path("properties").properties()) {
            b.property(property.getKey(), compile(property.getValue(), component, expanding));
        }
        schema.path("required").forEach(name -> b.required(name.asText()));
        JsonNode additional = schema.get("additionalProperties");
        if (additional != null && additional.isBoolean()) {
            b.additionalAllowed(additional.booleanValue());
        } else if (additional != null && additional.isObject()) {
            b.additionalAllowed(Boolean.TRUE).additionalType(compile(additional, component, expanding));
        }
        return b;
    }

    private TypeDescriptor compileChoice(JsonNode choices, String component, Set<String> expanding) {
        boolean nullable = false;
        List<TypeDescriptor> variants = new ArrayList<>();
        for (JsonNode choice : choices) {
            TypeDescriptor variant = compile(choice, component, expanding);
            if (variant.kind() == Kind.NULL) {
                nullable = true;
            } else {
                variants.add(variant);
            }
        }
        if (variants.isEmpty()) {
            return TypeDescriptor.builder(Kind.NULL).nullable(true).build();
        }
        if (variants.size() == 1) {
            return nullable ? variants.get(0).asNullable() : variants.get(0);
        }
        TypeDescriptor.Builder union = TypeDescriptor.builder(Kind.UNION).nullable(nullable);
        variants.forEach(union::variant);
        return union.build();
    }

    /** Objects are merged into one closed set of properties; a single non-object branch is unwrapped. */
    private TypeDescriptor compileAllOf(JsonNode schema, JsonNode allOf, String component, Set<String> expanding) {
        if (allOf.size() == 1 && !schema.has("properties")) {
            return compile(allOf.get(0), component, expanding);
        }
        TypeDescriptor.Builder merged = TypeDescriptor.builder(Kind.OBJECT);
        List<JsonNode> parts = new ArrayList<>();
        allOf.forEach(parts::add);
        if (schema.has("properties") || schema.has("required")) {
            parts.add(schema);
        }
        for (JsonNode part : parts) {
            Set<String> chain = new HashSet<>(expanding);
            JsonNode resolved = resolveForMerge(part, component, chain);
            if (resolved.has("allOf")) {
                TypeDescriptor nested = compileAllOf(resolved, resolved.get("allOf"), component, chain);
                nested.properties().forEach(merged::property);
                nested.required().forEach(merged::required);
                continue;
            }
            if (!resolved.has("properties") && !"object".equals(resolved.path("type").asText())) {
                throw malformed(component, "'allOf' can only combine object schemas");
            }
            TypeDescriptor object = compileObject(resolved, component, chain).build();
            object.properties().forEach(merged::property);
            object.required().forEach(merged::required);
            if (object.additionalAllowed() != null) {
                merged.additionalAllowed(object.additionalAllowed());
            }
        }
        return merged.build();
    }

    private JsonNode resolveForMerge(JsonNode part, String component, Set<String> expanding) {
        JsonNode current = part;
        while (current.has("$ref")) {
            String name = current.get("$ref").asText().substring(SchemaNormalizer.DEFS_PREFIX.length());
            if (!expanding.add(name)) {
                throw malformed(component, "circular 'allOf' through '" + name + "'");
            }
            current = defs.get(name);
        }
        return current;
    }

    private ModelGenerationException malformed(String component, String reason) {
        return new ModelGenerationException(
                "Malformed schema component '" + component + "': " + reason, component, source);
    }
}
