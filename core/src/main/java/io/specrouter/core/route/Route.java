package io.specrouter.core.route;

import com.fasterxml.jackson.databind.JsonNode;
import io.specrouter.core.model.HttpMethod;
import io.specrouter.core.model.Operation;
import io.specrouter.core.model.Parameter;
import io.specrouter.core.model.RequestContext;
import io.specrouter.core.schema.ModelType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A finalized route: everything the transport needs to bind and serve one (path, method).
 *
 * @param path                the contract path
 * @param method              the HTTP method
 * @param name                resolved route name
 * @param summary             summary
 * @param description         description, may be {@code null}
 * @param responseDescription description of the 200 response
 * @param tags                tags
 * @param deprecated          deprecated flag
 * @param dependencies        checks run before the handler, in order
 * @param headers             declared header parameters keyed by lower-case name
 * @param requestModel        request body model ({@link ModelType#emptyBody()} if none declared)
 * @param responseModel       200 response model, may be {@code null}
 * @param responses           non-200 responses by status
 * @param handler             the user handler
 * @param operation           the contract operation the route was derived from
 * @param source              the contract file the route came from
 */
public record Route(
        String path,
        HttpMethod method,
        String name,
        String summary,
        String description,
        String responseDescription,
        List<String> tags,
        boolean deprecated,
        List<RouteDependency> dependencies,
        Map<String, Parameter> headers,
        ModelType requestModel,
        ModelType responseModel,
        Map<Integer, AdditionalResponse> responses,
        RouteHandler handler,
        Operation operation,
        String source) {

    public Route {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(requestModel, "requestModel must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        tags = tags != null ? List.copyOf(tags) : List.of();
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        headers = headers != null ? Collections.unmodifiableMap(new LinkedHashMap<>(headers)) : Map.of();
        responses = responses != null ? Collections.unmodifiableMap(new LinkedHashMap<>(responses)) : Map.of();
    }

    /**
     * Serves one request: runs the dependencies, validates the decoded body and calls the handler.
     *
     * @param body    the decoded JSON body, {@code null} if none was sent
     * @param context the request
     * @return the handler's result
     */
    public Object invoke(JsonNode body, RequestContext context) {
        return RouteInvoker.invoke(this, body, context);
    }
}
