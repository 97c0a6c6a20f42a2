package io.specrouter.core.route;

import io.specrouter.core.model.HttpMethod;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * User registrations for one route table: a default per method plus per-path registrations per
 * method. Built fresh for every load and threaded through the {@link RouteTableBuilder}.
 */
public final class RoutesMapping {

    private final Map<HttpMethod, RouteInfo> defaults = new EnumMap<>(HttpMethod.class);
    private final Map<HttpMethod, Map<String, RouteInfo>> perPath = new EnumMap<>(HttpMethod.class);

    public RoutesMapping() {
        for (HttpMethod method : HttpMethod.values()) {
            defaults.put(method, new RouteInfo());
            perPath.put(method, new LinkedHashMap<>());
        }
    }

    /** The default registration for the method; never {@code null}. */
    public RouteInfo defaultFor(HttpMethod method) {
        return defaults.get(method);
    }

    public RouteInfo defaultGet() {
        return defaultFor(HttpMethod.GET);
    }

    public RouteInfo defaultPost() {
        return defaultFor(HttpMethod.POST);
    }

    /** Per-path registrations for the method, read-only. */
    public Map<String, RouteInfo> paths(HttpMethod method) {
        return Collections.unmodifiableMap(perPath.get(method));
    }

    public Map<String, RouteInfo> getMap() {
        return paths(HttpMethod.GET);
    }

    public Map<String, RouteInfo> postMap() {
        return paths(HttpMethod.POST);
    }

    void setDefault(HttpMethod method, RouteInfo info) {
        defaults.put(method, info);
    }

    void put(HttpMethod method, String path, RouteInfo info) {
        perPath.get(method).put(path, info);
    }

    void freeze() {
        defaults.values().forEach(RouteInfo::freeze);
        perPath.values().forEach(map -> map.values().forEach(RouteInfo::freeze));
    }
}
