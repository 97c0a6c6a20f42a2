package io.specrouter.javalin.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.HandlerType;
import io.specrouter.core.route.Route;
import io.specrouter.core.spi.RouteRegistrar;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Binds finalized routes to a Javalin application, one {@link RouteEndpoint} per route. */
public final class JavalinRouteRegistrar implements RouteRegistrar {

    private static final Logger LOG = LoggerFactory.getLogger(JavalinRouteRegistrar.class);

    private final Javalin app;
    private final ObjectMapper mapper;
    private int count;

    public JavalinRouteRegistrar(Javalin app, ObjectMapper mapper) {
        this.app = Objects.requireNonNull(app, "app must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public void register(Route route) {
        app.addHttpHandler(HandlerType.valueOf(route.method().name()), route.path(), new RouteEndpoint(route, mapper));
        count++;
        LOG.debug("Bound {} {} -> {}", route.method(), route.path(), route.name());
    }

    /** Number of routes bound so far. */
    public int count() {
        return count;
    }
}
