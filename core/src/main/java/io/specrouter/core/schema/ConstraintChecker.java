package io.specrouter.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.specrouter.core.error.ModelGenerationException;
import io.specrouter.core.model.ValidationError;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks value constraints ({@code minimum}, {@code maxLength}, {@code pattern}, ...) of one model
 * with the networknt JSON Schema validator. Runs on the coerced payload only, so type, required
 * and unknown-field errors are never reported twice.
 */
final class ConstraintChecker {

    static final String DRAFT_2020_12 = "https://json-schema.org/draft/2020-12/schema";

    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    /** networknt keyword → reported error kind. */
    private static final Map<String, String> KINDS = Map.ofEntries(
            Map.entry("minimum", "greater_than_equal"),
            Map.entry("exclusiveMinimum", "greater_than"),
            Map.entry("maximum", "less_than_equal"),
            Map.entry("exclusiveMaximum", "less_than"),
            Map.entry("multipleOf", "multiple_of"),
            Map.entry("minLength", "string_too_short"),
            Map.entry("maxLength", "string_too_long"),
            Map.entry("pattern", "string_pattern_mismatch"),
            Map.entry("minItems", "too_short"),
            Map.entry("maxItems", "too_long"),
            Map.entry("uniqueItems", "unique_items"),
            Map.entry("minProperties", "too_short"),
            Map.entry("maxProperties", "too_long"),
            Map.entry("anyOf", "value_error"));

    private final JsonSchema schema;

    private ConstraintChecker(JsonSchema schema) {
        this.schema = schema;
    }

    /**
     * Compiles the constraint schema for one component of the bundle.
     *
     * @throws ModelGenerationException if networknt rejects the schema
     */
    static ConstraintChecker compile(String component, JsonNode defs, String source) {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.put("$schema", DRAFT_2020_12);
        root.put("$ref", SchemaNormalizer.DEFS_PREFIX + component);
        root.set("$defs", defs);
        try {
            return new ConstraintChecker(SCHEMA_FACTORY.getSchema(root));
        } catch (RuntimeException e) {
            throw new ModelGenerationException(
                    "Malformed schema component '" + component + "': " + e.getMessage(), e, component, source);
        }
    }

    /** Constraint violations of a coerced payload, ordered by location. */
    List<ValidationError> check(JsonNode value) {
        Set<ValidationMessage> messages = schema.validate(value);
        List<ValidationError> errors = new ArrayList<>();
        for (ValidationMessage message : messages) {
            String kind = KINDS.get(message.getType());
            if (kind == null) {
                continue;
            }
            List<Object> loc = parseLocation(String.valueOf(message.getInstanceLocation()));
            errors.add(new ValidationError(kind, loc, describe(message.getMessage()), valueAt(value, loc)));
        }
        errors.sort(Comparator.comparing(ValidationError::locationString));
        return errors;
    }

    /** Strips the {@code $.path: } prefix networknt puts in front of every message. */
    static String describe(String message) {
        String text = message;
        if (text.startsWith("$")) {
            int colon = text.indexOf(": ");
            if (colon > 0) {
                text = text.substring(colon + 2);
            }
        }
        if (text.isEmpty()) {
            return "Value error";
        }
        return "Input " + text;
    }

    /** Parses {@code $.a.b[0]} and {@code $['a b']} into location segments. */
    static List<Object> parseLocation(String path) {
        List<Object> loc = new ArrayList<>();
        int i = path.startsWith("$") ? 1 : 0;
        while (i < path.length()) {
            char c = path.charAt(i);
            if (c == '.') {
                int end = i + 1;
                while (end < path.length() && path.charAt(end) != '.' && path.charAt(end) != '[') {
                    end++;
                }
                loc.add(path.substring(i + 1, end));
                i = end;
            } else if (c == '[') {
                int end = path.indexOf(']', i);
                if (end < 0) {
                    break;
                }
                String inner = path.substring(i + 1, end);
                if (inner.startsWith("'") && inner.endsWith("'") && inner.length() >= 2) {
                    loc.add(inner.substring(1, inner.length() - 1));
                } else {
                    try {
                        loc.add(Integer.parseInt(inner));
                    } catch (NumberFormatException e) {
                        loc.add(inner);
                    }
                }
                i = end + 1;
            } else {
                i++;
            }
        }
        return loc;
    }

    private static JsonNode valueAt(JsonNode root, List<Object> loc) {
        JsonNode current = root;
        for (Object segment : loc) {
            current = segment instanceof Integer index ? current.path(index) : current.path(segment.toString());
        }
        return current.isMissingNode() ? null : current;
    }
}
