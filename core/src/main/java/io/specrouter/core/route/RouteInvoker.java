package io.specrouter.core.route;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.specrouter.core.error.ModelValidationException;
import io.specrouter.core.error.RouteAbortException;
import io.specrouter.core.model.RequestContext;
import io.specrouter.core.schema.ModelInstance;

/**
 * Adapts a typed {@link RouteHandler} to the transport's untyped calling convention: the
 * transport passes the raw decoded body, the invoker validates it against the route's request
 * model and calls the handler with the validated value.
 */
final class RouteInvoker {

    /** Location prefix for request body errors. */
    static final String BODY = "body";

    /** Handler used when neither the path nor the default registration sets one. */
    static final RouteHandler DEFAULT_HANDLER = (body, context) -> JsonNodeFactory.instance.objectNode();

    private RouteInvoker() {
        // utility class
    }

    /**
     * @throws RouteAbortException      if a dependency aborts
     * @throws ModelValidationException if the body is invalid, with locations under {@code body}
     */
    static Object invoke(Route route, JsonNode body, RequestContext context) {
        for (RouteDependency dependency : route.dependencies()) {
            dependency.check(context);
        }
        ModelInstance instance;
        try {
            instance = route.requestModel().validate(body);
        } catch (ModelValidationException e) {
            throw e.prefixed(BODY);
        }
        return route.handler().handle(instance, context);
    }
}
