package io.specrouter.core.spi;

import io.specrouter.core.route.Route;

/**
 * The external transport's side of route binding. A transport adapter implements this to
 * register each finalized route under its path and method; the core itself performs no network
 * I/O.
 */
public interface RouteRegistrar {

    void register(Route route);
}
