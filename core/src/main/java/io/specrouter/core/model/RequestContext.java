package io.specrouter.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * Transport-neutral view of an incoming request, passed to route dependencies and handlers.
 *
 * @param method      the request method
 * @param path        the matched route path
 * @param headers     request headers
 * @param queryParams first value per query parameter
 * @param pathParams  path parameters extracted by the transport
 */
public record RequestContext(
        HttpMethod method,
        String path,
        HttpHeaders headers,
        Map<String, String> queryParams,
        Map<String, String> pathParams) {

    public RequestContext {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(path, "path must not be null");
        headers = headers != null ? headers : HttpHeaders.empty();
        queryParams = queryParams != null ? Collections.unmodifiableMap(queryParams) : Map.of();
        pathParams = pathParams != null ? Collections.unmodifiableMap(pathParams) : Map.of();
    }

    /** A context with only method and path, for programmatic invocation. */
    public static RequestContext of(HttpMethod method, String path) {
        return new RequestContext(method, path, HttpHeaders.empty(), Map.of(), Map.of());
    }

    /** First value of a header (case-insensitive), or {@code null}. */
    public String header(String name) {
        return headers.first(name);
    }
}
