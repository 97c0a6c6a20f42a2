package io.specrouter.core.route;

import io.specrouter.core.model.Operation;

/** Derives a route name when the route table is finalized. */
@FunctionalInterface
public interface RouteNameFactory {

    String name(String path, Operation operation);
}
