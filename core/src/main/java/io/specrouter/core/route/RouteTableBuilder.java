package io.specrouter.core.route;

import io.specrouter.core.error.RouteConfigurationException;
import io.specrouter.core.error.UnknownRouteException;
import io.specrouter.core.model.HttpMethod;
import io.specrouter.core.model.Operation;
import io.specrouter.core.model.PathItem;
import io.specrouter.core.model.ResponseSpec;
import io.specrouter.core.schema.GeneratedModelModule;
import io.specrouter.core.schema.ModelType;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the route table from parsed contracts, their generated models and user registrations.
 *
 * <p>For each declared (path, method) the builder derives a contract {@link RouteInfo}. At
 * {@link #build()} every field of a route is resolved in this order, first non-null wins:
 *
 * <ol>
 *   <li>the registration for that exact path ({@link #register});
 *   <li>the default registration for the method ({@link #registerDefault});
 *   <li>the contract-derived value.
 * </ol>
 *
 * The route name is resolved separately: a name factory, from the path registration or inherited
 * from the default, is invoked with the path and operation and beats any literal name. Without a
 * factory the literal name applies, then the operation id, then the path.
 *
 * <p>Not thread-safe; one builder serves one load.
 */
public final class RouteTableBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(RouteTableBuilder.class);

    static final String DEFAULT_RESPONSE_DESCRIPTION = "Successful response";

    private final Map<HttpMethod, Map<String, ContractRoute>> contract = new EnumMap<>(HttpMethod.class);
    private final Map<String, String> pathSources = new LinkedHashMap<>();
    private final List<GeneratedModelModule> modules = new ArrayList<>();
    private final RoutesMapping mapping;
    private boolean built;

    public RouteTableBuilder() {
        this(new RoutesMapping());
    }

    public RouteTableBuilder(RoutesMapping mapping) {
        this.mapping = Objects.requireNonNull(mapping, "mapping must not be null");
        for (HttpMethod method : HttpMethod.values()) {
            contract.put(method, new LinkedHashMap<>());
        }
    }

    /** A contract-derived route before overrides. */
    private record ContractRoute(String path, Operation operation, RouteInfo info, String source) {}

    /**
     * Derives the contract routes of one contract.
     *
     * @param source where the contract came from, for diagnostics
     * @throws RouteConfigurationException if a path was already declared by another contract
     * @throws io.specrouter.core.error.ModelGenerationException if a referenced model is not in
     *         the module
     */
    public RouteTableBuilder addContract(Map<String, PathItem> paths, GeneratedModelModule module, String source) {
        checkNotBuilt();
        Objects.requireNonNull(paths, "paths must not be null");
        Objects.requireNonNull(module, "module must not be null");

        Map<HttpMethod, Map<String, ContractRoute>> derived = new EnumMap<>(HttpMethod.class);
        for (PathItem item : paths.values()) {
            String previous = pathSources.get(item.path());
            if (previous != null) {
                throw new RouteConfigurationException(
                        "Path '" + item.path() + "' is declared by both " + previous + " and " + source, source);
            }
            for (Map.Entry<HttpMethod, Operation> entry : item.operations().entrySet()) {
                RouteInfo info = deriveRouteInfo(item, entry.getValue(), module);
                derived.computeIfAbsent(entry.getKey(), m -> new LinkedHashMap<>())
                        .put(item.path(), new ContractRoute(item.path(), entry.getValue(), info, source));
            }
        }

        // All models resolved: publish the contract's routes
        paths.keySet().forEach(path -> pathSources.put(path, source));
        derived.forEach((method, routes) -> contract.get(method).putAll(routes));
        modules.add(module);
        return this;
    }

    private static RouteInfo deriveRouteInfo(PathItem item, Operation operation, GeneratedModelModule module) {
        ModelType requestModel = operation.requestModelName() != null
                ? module.requireModel(operation.requestModelName())
                : ModelType.emptyBody();

        Optional<ResponseSpec> ok = operation.response(200);
        ModelType responseModel = ok.filter(ResponseSpec::hasModel)
                .map(r -> module.requireModel(r.modelName()))
                .orElse(null);
        String responseDescription = ok.map(ResponseSpec::description).orElse(DEFAULT_RESPONSE_DESCRIPTION);

        Map<Integer, AdditionalResponse> additional = new LinkedHashMap<>();
        for (ResponseSpec response : operation.responses().values()) {
            if (response.status() == 200) {
                continue;
            }
            ModelType model = null;
            if (response.hasModel()) {
                model = module.model(response.modelName()).orElse(null);
                if (model == null) {
                    LOG.debug(
                            "No model '{}' for response {} of {} {}, documenting without a schema",
                            response.modelName(),
                            response.status(),
                            operation.method(),
                            item.path());
                }
            }
            additional.put(response.status(), new AdditionalResponse(response.description(), model));
        }

        return new RouteInfo()
                .name(operation.operationId())
                .summary(operation.summary())
                .description(operation.description() != null ? operation.description() : item.description())
                .responseDescription(responseDescription != null ? responseDescription : DEFAULT_RESPONSE_DESCRIPTION)
                .tags(operation.tags())
                .deprecated(operation.deprecated())
                .headers(operation.headers())
                .requestModel(requestModel)
                .responseModel(responseModel)
                .responses(additional);
    }

    /**
     * Registers overrides for one declared route. Replaces an earlier registration for the same
     * path and method.
     *
     * @throws UnknownRouteException immediately if no contract declares the path and method
     */
    public RouteTableBuilder register(HttpMethod method, String path, RouteInfo info) {
        checkNotBuilt();
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(info, "info must not be null");
        if (!contract.get(method).containsKey(path)) {
            throw new UnknownRouteException(path, method.name(), pathSources.get(path));
        }
        mapping.put(method, path, info);
        return this;
    }

    /** Registers the default for every route of the method without its own value for a field. */
    public RouteTableBuilder registerDefault(HttpMethod method, RouteInfo info) {
        checkNotBuilt();
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(info, "info must not be null");
        mapping.setDefault(method, info);
        return this;
    }

    /** The contract-derived configuration of a declared route, before overrides. */
    public Optional<RouteInfo> contractRoute(HttpMethod method, String path) {
        ContractRoute route = contract.get(method).get(path);
        return route != null ? Optional.of(route.info().copy()) : Optional.empty();
    }

    /** Paths declared for the method, in load order. */
    public List<String> paths(HttpMethod method) {
        return List.copyOf(contract.get(method).keySet());
    }

    public RoutesMapping mapping() {
        return mapping;
    }

    public List<GeneratedModelModule> modules() {
        return List.copyOf(modules);
    }

    /**
     * Resolves every declared route and freezes all registrations.
     *
     * @return the finalized table
     * @throws IllegalStateException if called twice
     */
    public RouteTable build() {
        checkNotBuilt();
        Map<HttpMethod, Map<String, Route>> routes = new EnumMap<>(HttpMethod.class);
        for (HttpMethod method : HttpMethod.values()) {
            Map<String, Route> resolved = new LinkedHashMap<>();
            RouteInfo defaults = mapping.defaultFor(method);
            for (ContractRoute entry : contract.get(method).values()) {
                RouteInfo specific = mapping.paths(method).get(entry.path());
                resolved.put(entry.path(), resolve(method, entry, specific, defaults));
            }
            routes.put(method, resolved);
        }
        mapping.freeze();
        built = true;
        RouteTable table = new RouteTable(routes, modules);
        LOG.debug("Route table finalized: {} route(s)", table.size());
        return table;
    }

    private static Route resolve(HttpMethod method, ContractRoute entry, RouteInfo specific, RouteInfo defaults) {
        RouteInfo merged = specific != null ? specific.copy() : new RouteInfo();
        merged.fillFrom(defaults).fillFrom(entry.info());

        String name;
        if (merged.nameFactory() != null) {
            name = merged.nameFactory().name(entry.path(), entry.operation());
        } else {
            name = merged.name();
        }
        if (name == null || name.isBlank()) {
            name = entry.path();
        }

        return new Route(
                entry.path(),
                method,
                name,
                merged.summary() != null ? merged.summary() : name,
                merged.description(),
                merged.responseDescription(),
                merged.tags(),
                Boolean.TRUE.equals(merged.deprecated()),
                merged.dependencies(),
                merged.headers(),
                merged.requestModel(),
                merged.responseModel(),
                merged.responses(),
                merged.handler() != null ? merged.handler() : RouteInvoker.DEFAULT_HANDLER,
                entry.operation(),
                entry.source());
    }

    private void checkNotBuilt() {
        if (built) {
            throw new IllegalStateException("Route table already built");
        }
    }
}
