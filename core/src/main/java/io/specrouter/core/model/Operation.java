package io.specrouter.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * One HTTP method on one contract path. Immutable once built by the contract parser.
 *
 * @param method           the HTTP method
 * @param summary          operation summary, may be {@code null}
 * @param description      operation description, may be {@code null}
 * @param operationId      operation id, may be {@code null}
 * @param parameters       declared parameters in declaration order
 * @param requestModelName component schema name of the JSON request body, or {@code null}
 * @param responses        declared responses keyed by status code, in declaration order
 * @param headers          header parameters keyed by lower-case name
 * @param tags             declared tags
 * @param deprecated       deprecated flag
 */
public record Operation(
        HttpMethod method,
        String summary,
        String description,
        String operationId,
        List<Parameter> parameters,
        String requestModelName,
        Map<Integer, ResponseSpec> responses,
        Map<String, Parameter> headers,
        List<String> tags,
        boolean deprecated) {

    public Operation {
        Objects.requireNonNull(method, "method must not be null");
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
        responses = responses != null ? Collections.unmodifiableMap(new LinkedHashMap<>(responses)) : Map.of();
        headers = headers != null ? Collections.unmodifiableMap(new LinkedHashMap<>(headers)) : Map.of();
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    /** The response declared for the given status, if any. */
    public Optional<ResponseSpec> response(int status) {
        return Optional.ofNullable(responses.get(status));
    }

    /** Looks up a header requirement case-insensitively. */
    public Optional<Parameter> header(String name) {
        TreeMap<String, Parameter> view = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        view.putAll(headers);
        return Optional.ofNullable(view.get(name));
    }
}
