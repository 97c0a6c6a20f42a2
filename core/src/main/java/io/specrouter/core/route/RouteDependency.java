package io.specrouter.core.route;

import io.specrouter.core.error.RouteAbortException;
import io.specrouter.core.model.RequestContext;

/** A check run before the handler of a route, e.g. header verification. */
@FunctionalInterface
public interface RouteDependency {

    /**
     * Inspects the request.
     *
     * @throws RouteAbortException to stop handling with a given status
     */
    void check(RequestContext context);
}
