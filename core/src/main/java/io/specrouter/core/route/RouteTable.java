package io.specrouter.core.route;

import io.specrouter.core.error.UnsupportedMethodException;
import io.specrouter.core.model.HttpMethod;
import io.specrouter.core.schema.GeneratedModelModule;
import io.specrouter.core.schema.ModelType;
import io.specrouter.core.spi.RouteRegistrar;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** The finalized, read-only route table handed to a transport. */
public final class RouteTable {

    private final Map<HttpMethod, Map<String, Route>> routes;
    private final List<GeneratedModelModule> modules;

    RouteTable(Map<HttpMethod, Map<String, Route>> routes, List<GeneratedModelModule> modules) {
        Map<HttpMethod, Map<String, Route>> copy = new EnumMap<>(HttpMethod.class);
        for (HttpMethod method : HttpMethod.values()) {
            copy.put(
                    method,
                    Collections.unmodifiableMap(new LinkedHashMap<>(routes.getOrDefault(method, Map.of()))));
        }
        this.routes = Collections.unmodifiableMap(copy);
        this.modules = List.copyOf(modules);
    }

    /** Every route, POST routes first, each group in contract order. */
    public List<Route> routes() {
        List<Route> all = new ArrayList<>();
        all.addAll(routes.get(HttpMethod.POST).values());
        all.addAll(routes.get(HttpMethod.GET).values());
        return Collections.unmodifiableList(all);
    }

    public List<Route> routes(HttpMethod method) {
        return List.copyOf(routes.get(method).values());
    }

    public Optional<Route> route(String path, HttpMethod method) {
        return Optional.ofNullable(routes.get(method).get(path));
    }

    /**
     * Looks up a route by method name.
     *
     * @throws UnsupportedMethodException for methods other than GET and POST
     */
    public Optional<Route> route(String path, String method) {
        return route(path, HttpMethod.of(method));
    }

    /**
     * The 200 response model of a route.
     *
     * @return empty if the path is unknown or declares no 200 model
     * @throws UnsupportedMethodException for methods other than GET and POST
     */
    public Optional<ModelType> responseModel(String path, String method) {
        return route(path, method).map(Route::responseModel);
    }

    /** The model modules the routes refer to, in load order. */
    public List<GeneratedModelModule> modules() {
        return modules;
    }

    public int size() {
        return routes.values().stream().mapToInt(Map::size).sum();
    }

    /** Hands every route to the transport. */
    public void registerWith(RouteRegistrar registrar) {
        routes().forEach(registrar::register);
    }
}
