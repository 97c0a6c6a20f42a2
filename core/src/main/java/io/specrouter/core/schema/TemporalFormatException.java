package io.specrouter.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raised by the temporal parsers when a value is not an acceptable date or date-time. Carries the
 * error kind, message and context that end up in the field-level validation error.
 */
public final class TemporalFormatException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String type;
    private final transient JsonNode input;
    private final transient Map<String, Object> ctx;

    public TemporalFormatException(String type, String message, JsonNode input, Map<String, Object> ctx) {
        super(message);
        this.type = type;
        this.input = input;
        this.ctx = ctx != null ? Collections.unmodifiableMap(new LinkedHashMap<>(ctx)) : null;
    }

    /** Machine-readable error kind, e.g. {@code date_type}. */
    public String type() {
        return type;
    }

    public JsonNode input() {
        return input;
    }

    /** Error context, or {@code null}. */
    public Map<String, Object> ctx() {
        return ctx;
    }
}
