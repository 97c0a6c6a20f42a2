package io.specrouter.core.route;

import io.specrouter.core.model.RequestContext;
import io.specrouter.core.schema.ModelInstance;

/**
 * User code bound to a route. Receives the request body already validated against the route's
 * request model; the return value is serialized as the JSON response.
 */
@FunctionalInterface
public interface RouteHandler {

    Object handle(ModelInstance body, RequestContext context);
}
