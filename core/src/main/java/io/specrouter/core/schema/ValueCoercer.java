package io.specrouter.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.specrouter.core.model.ValidationError;
import io.specrouter.core.schema.TypeDescriptor.Kind;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Checks a JSON value against a {@link TypeDescriptor} and produces its canonical form: numbers
 * parsed from strings, booleans from their textual spellings, temporal values in ISO form, unknown
 * fields dropped. Which inputs are accepted depends on the {@link ValidationMode}.
 *
 * <p>All errors in a payload are collected, each with the location of the offending value.
 */
final class ValueCoercer {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private static final Pattern INTEGER_TEXT = Pattern.compile("[+-]?\\d+");
    private static final Pattern NUMBER_TEXT = Pattern.compile("[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");
    private static final Set<String> TRUE_TEXT = Set.of("1", "on", "t", "true", "y", "yes");
    private static final Set<String> FALSE_TEXT = Set.of("0", "off", "f", "false", "n", "no");

    private final ValidationMode mode;
    private final Function<String, TypeDescriptor> resolver;
    private final ValueCoercer exact;

    ValueCoercer(ValidationMode mode, Function<String, TypeDescriptor> resolver) {
        this.mode = mode;
        this.resolver = resolver;
        this.exact = mode == ValidationMode.STRICT ? this : new ValueCoercer(ValidationMode.STRICT, resolver, null);
    }

    private ValueCoercer(ValidationMode mode, Function<String, TypeDescriptor> resolver, ValueCoercer exact) {
        this.mode = mode;
        this.resolver = resolver;
        this.exact = exact != null ? exact : this;
    }

    ValidationMode mode() {
        return mode;
    }

    /**
     * Coerces one value.
     *
     * @param loc    location of the value, extended for nested values
     * @param errors receives every error found
     * @return the canonical value, or {@code null} if at least one error was added
     */
    JsonNode coerce(TypeDescriptor type, JsonNode input, List<Object> loc, List<ValidationError> errors) {
        if (input == null || input.isNull()) {
            if (type.nullable() || type.kind() == Kind.ANY || type.kind() == Kind.NULL) {
                return NODES.nullNode();
            }
            if (type.kind() == Kind.REF) {
                return coerce(resolver.apply(type.refName()), input, loc, errors);
            }
        }
        return switch (type.kind()) {
            case STRING -> coerceString(input, loc, errors);
            case NUMBER -> coerceNumber(input, loc, errors);
            case INTEGER -> coerceInteger(input, loc, errors);
            case BOOLEAN -> coerceBoolean(input, loc, errors);
            case DATE -> coerceDate(input, loc, errors);
            case DATE_TIME -> coerceDateTime(input, loc, errors);
            case ENUM -> coerceEnum(type, input, loc, errors);
            case ARRAY -> coerceArray(type, input, loc, errors);
            case OBJECT -> coerceObject(type, input, loc, errors);
            case UNION -> coerceUnion(type, input, loc, errors);
            case REF -> coerce(resolver.apply(type.refName()), input, loc, errors);
            case NULL -> fail(errors, "none_required", loc, "Input should be None", input);
            case ANY -> input.deepCopy();
        };
    }

    // --- Primitives ---

    private JsonNode coerceString(JsonNode input, List<Object> loc, List<ValidationError> errors) {
        if (input != null && input.isTextual()) {
            return input;
        }
        return fail(errors, "string_type", loc, "Input should be a valid string", input);
    }

    private JsonNode coerceNumber(JsonNode input, List<Object> loc, List<ValidationError> errors) {
        if (input != null && input.isNumber()) {
            return input;
        }
        if (mode == ValidationMode.LAX && input != null) {
            if (input.isTextual()) {
                String text = input.asText().trim();
                if (NUMBER_TEXT.matcher(text).matches()) {
                    return NODES.numberNode(new BigDecimal(text));
                }
                return fail(
                        errors,
                        "float_parsing",
                        loc,
                        "Input should be a valid number, unable to parse string as a number",
                        input);
            }
            if (input.isBoolean()) {
                return NODES.numberNode(input.booleanValue() ? 1.0 : 0.0);
            }
        }
        return fail(errors, "float_type", loc, "Input should be a valid number", input);
    }

    private JsonNode coerceInteger(JsonNode input, List<Object> loc, List<ValidationError> errors) {
        if (input != null && input.isIntegralNumber()) {
            return input;
        }
        if (mode == ValidationMode.LAX && input != null) {
            if (input.isFloatingPointNumber()) {
                BigDecimal value = input.decimalValue();
                if (value.signum() == 0 || value.stripTrailingZeros().scale() <= 0) {
                    return integerNode(value.toBigIntegerExact());
                }
                return fail(
                        errors,
                        "int_from_float",
                        loc,
                        "Input should be a valid integer, got a number with a fractional part",
                        input);
            }
            if (input.isTextual()) {
                String text = input.asText().trim();
                if (INTEGER_TEXT.matcher(text).matches()) {
                    return integerNode(new BigInteger(text));
                }
                return fail(
                        errors,
                        "int_parsing",
                        loc,
                        "Input should be a valid integer, unable to parse string as an integer",
                        input);
            }
            if (input.isBoolean()) {
                return NODES.numberNode(input.booleanValue() ? 1 : 0);
            }
        }
        return fail(errors, "int_type", loc, "Input should be a valid integer", input);
    }

    private JsonNode coerceBoolean(JsonNode input, List<Object> loc, List<ValidationError> errors) {
        if (input != null && input.isBoolean()) {
            return input;
        }
        if (mode == ValidationMode.LAX && input != null && !input.isNull()) {
            if (input.isNumber()) {
                BigDecimal value = input.decimalValue();
                if (value.compareTo(BigDecimal.ONE) == 0) {
                    return NODES.booleanNode(true);
                }
                if (value.signum() == 0) {
                    return NODES.booleanNode(false);
                }
            } else if (input.isTextual()) {
                String text = input.asText().trim().toLowerCase(Locale.ROOT);
                if (TRUE_TEXT.contains(text)) {
                    return NODES.booleanNode(true);
                }
                if (FALSE_TEXT.contains(text)) {
                    return NODES.booleanNode(false);
                }
            }
            if (input.isNumber() || input.isTextual()) {
                return fail(errors, "bool_parsing", loc, "Input should be a valid boolean, unable to interpret input", input);
            }
        }
        return fail(errors, "bool_type", loc, "Input should be a valid boolean", input);
    }

    // --- Temporal ---

    private JsonNode coerceDate(JsonNode input, List<Object> loc, List<ValidationError> errors) {
        try {
            return NODES.textNode((mode == ValidationMode.STRICT
                            ? StrictTemporalParsers.parseDate(input)
                            : LaxTemporalParsers.parseDate(input))
                    .toString());
        } catch (TemporalFormatException e) {
            errors.add(new ValidationError(e.type(), loc, e.getMessage(), input, e.ctx()));
            return null;
        }
    }

    private JsonNode coerceDateTime(JsonNode input, List<Object> loc, List<ValidationError> errors) {
        try {
            Temporal value = mode == ValidationMode.STRICT
                    ? StrictTemporalParsers.parseDateTime(input)
                    : LaxTemporalParsers.parseDateTime(input);
            if (value instanceof OffsetDateTime odt) {
                return NODES.textNode(DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(odt));
            }
            return NODES.textNode(DateTimeFormatter.ISO_LOCAL_DATE_TIME.format((LocalDateTime) value));
        } catch (TemporalFormatException e) {
            errors.add(new ValidationError(e.type(), loc, e.getMessage(), input, e.ctx()));
            return null;
        }
    }

    // --- Composites ---

    private JsonNode coerceEnum(TypeDescriptor type, JsonNode input, List<Object> loc, List<ValidationError> errors) {
        for (JsonNode allowed : type.enumValues()) {
            if (allowed.equals(input)
                    || (allowed.isNumber() && input != null && input.isNumber()
                            && allowed.decimalValue().compareTo(input.decimalValue()) == 0)) {
                return allowed.deepCopy();
            }
        }
        String expected = expectedValues(type.enumValues());
        return fail(errors, "enum", loc, "Input should be " + expected, input, Map.of("expected", expected));
    }

    private JsonNode coerceArray(TypeDescriptor type, JsonNode input, List<Object> loc, List<ValidationError> errors) {
        if (input == null || !input.isArray()) {
            return fail(errors, "list_type", loc, "Input should be a valid list", input);
        }
        ArrayNode out = NODES.arrayNode();
        int before = errors.size();
        int index = 0;
        for (JsonNode item : input) {
            JsonNode value = coerce(type.items(), item, append(loc, index++), errors);
            out.add(value != null ? value : NODES.nullNode());
        }
        return errors.size() == before ? out : null;
    }

    private JsonNode coerceObject(TypeDescriptor type, JsonNode input, List<Object> loc, List<ValidationError> errors) {
        if (input == null || !input.isObject()) {
            return fail(
                    errors,
                    "model_attributes_type",
                    loc,
                    "Input should be a valid dictionary or object to extract fields from",
                    input);
        }
        ObjectNode out = NODES.objectNode();
        int before = errors.size();

        for (Map.Entry<String, TypeDescriptor> property : type.properties().entrySet()) {
            String name = property.getKey();
            JsonNode value = input.get(name);
            if (value == null) {
                if (type.required().contains(name)) {
                    errors.add(new ValidationError("missing", append(loc, name), "Field required", input));
                } else if (property.getValue().defaultValue() != null) {
                    out.set(name, property.getValue().defaultValue().deepCopy());
                }
                continue;
            }
            JsonNode coerced = coerce(property.getValue(), value, append(loc, name), errors);
            if (coerced != null) {
                out.set(name, coerced);
            }
        }
        for (String name : type.required()) {
            if (!type.properties().containsKey(name) && !input.has(name)) {
                errors.add(new ValidationError("missing", append(loc, name), "Field required", input));
            }
        }

        Boolean explicit = type.additionalAllowed();
        boolean forbid = explicit != null ? !explicit : mode == ValidationMode.STRICT;
        boolean keep = explicit != null && explicit;
        Iterator<Map.Entry<String, JsonNode>> fields = input.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (type.properties().containsKey(field.getKey())) {
                continue;
            }
            if (forbid) {
                errors.add(new ValidationError(
                        "extra_forbidden", append(loc, field.getKey()), "Extra inputs are not permitted", field.getValue()));
            } else if (keep) {
                JsonNode extra = type.additionalType() != null
                        ? coerce(type.additionalType(), field.getValue(), append(loc, field.getKey()), errors)
                        : field.getValue().deepCopy();
                if (extra != null) {
                    out.set(field.getKey(), extra);
                }
            }
        }
        return errors.size() == before ? out : null;
    }

    /** Exact matches win over coerced ones; with no match, every variant's errors are reported. */
    private JsonNode coerceUnion(TypeDescriptor type, JsonNode input, List<Object> loc, List<ValidationError> errors) {
        List<ValidationError> collected = new ArrayList<>();
        if (exact != this) {
            for (TypeDescriptor variant : type.variants()) {
                List<ValidationError> attempt = new ArrayList<>();
                JsonNode value = exact.coerce(variant, input, loc, attempt);
                if (attempt.isEmpty()) {
                    return value;
                }
            }
        }
        for (TypeDescriptor variant : type.variants()) {
            List<ValidationError> attempt = new ArrayList<>();
            JsonNode value = coerce(variant, input, loc, attempt);
            if (attempt.isEmpty()) {
                return value;
            }
            collected.addAll(attempt);
        }
        errors.addAll(collected);
        return null;
    }

    // --- Helpers ---

    private static JsonNode integerNode(BigInteger value) {
        return value.bitLength() < 64 ? NODES.numberNode(value.longValue()) : NODES.numberNode(value);
    }

    private static JsonNode fail(List<ValidationError> errors, String type, List<Object> loc, String msg, JsonNode input) {
        return fail(errors, type, loc, msg, input, null);
    }

    private static JsonNode fail(
            List<ValidationError> errors,
            String type,
            List<Object> loc,
            String msg,
            JsonNode input,
            Map<String, Object> ctx) {
        errors.add(new ValidationError(type, loc, msg, input, ctx));
        return null;
    }

    private static List<Object> append(List<Object> loc, Object segment) {
        List<Object> extended = new ArrayList<>(loc.size() + 1);
        extended.addAll(loc);
        extended.add(segment);
        return extended;
    }

    /** Renders {@code 'a', 'b' or 'c'}. */
    static String expectedValues(List<JsonNode> values) {
        List<String> rendered = values.stream()
                .map(v -> v.isTextual() ? "'" + v.asText() + "'" : v.toString())
                .toList();
        if (rendered.size() <= 1) {
            return rendered.isEmpty() ? "" : rendered.get(0);
        }
        return String.join(", ", rendered.subList(0, rendered.size() - 1)) + " or " + rendered.get(rendered.size() - 1);
    }
}
