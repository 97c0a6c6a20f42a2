package io.specrouter.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One field-level validation failure, serialized as the entries of the {@code detail} array the
 * transport returns with status 422.
 *
 * @param type  machine-readable error kind, e.g. {@code missing} or {@code date_type}
 * @param loc   location of the offending value: field names and array indexes from the root
 * @param msg   human-readable message
 * @param input the offending input value
 * @param ctx   extra context for the error kind, or {@code null}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationError(String type, List<Object> loc, String msg, JsonNode input, Map<String, Object> ctx) {

    public ValidationError {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(msg, "msg must not be null");
        loc = loc != null ? Collections.unmodifiableList(new ArrayList<>(loc)) : List.of();
        input = input != null ? input : NullNode.getInstance();
        ctx = ctx != null ? Collections.unmodifiableMap(new LinkedHashMap<>(ctx)) : null;
    }

    public ValidationError(String type, List<Object> loc, String msg, JsonNode input) {
        this(type, loc, msg, input, null);
    }

    /** Returns a copy whose location starts with the given segments. */
    public ValidationError withPrefix(Object... prefix) {
        List<Object> prefixed = new ArrayList<>(prefix.length + loc.size());
        Collections.addAll(prefixed, prefix);
        prefixed.addAll(loc);
        return new ValidationError(type, prefixed, msg, input, ctx);
    }

    /** Dotted rendering of {@link #loc()}, e.g. {@code body.items.0.date}. */
    public String locationString() {
        if (loc.isEmpty()) {
            return "<root>";
        }
        StringBuilder sb = new StringBuilder();
        for (Object segment : loc) {
            if (sb.length() > 0) {
                sb.append('.');
            }
            sb.append(segment);
        }
        return sb.toString();
    }
}
