package io.specrouter.core.engine;

import io.specrouter.core.error.ContractReadException;
import io.specrouter.core.model.ContractDocument;
import io.specrouter.core.model.HttpMethod;
import io.specrouter.core.model.PathItem;
import io.specrouter.core.route.RouteInfo;
import io.specrouter.core.route.RouteTable;
import io.specrouter.core.route.RouteTableBuilder;
import io.specrouter.core.route.RoutesMapping;
import io.specrouter.core.schema.GeneratedModelModule;
import io.specrouter.core.schema.ModelGenerator;
import io.specrouter.core.schema.ModelType;
import io.specrouter.core.spec.ContractParser;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the core: loads one contract file, or every {@code *.json} file below a
 * directory, through validator chain, parser and model generator, collects user registrations,
 * and produces the {@link RouteTable} a transport binds.
 *
 * <p>Loading is all or nothing. The first contract that fails any stage aborts construction and
 * its exception propagates.
 *
 * <pre>{@code
 * SpecRouter router = SpecRouter.load(Path.of("contracts"), SpecRouterOptions.defaults());
 * router.post("/Company/BasicInfo", RouteInfo.of(handler).summary("Company basic info"));
 * RouteTable table = router.toRouteTable();
 * }</pre>
 */
public final class SpecRouter {

    private static final Logger LOG = LoggerFactory.getLogger(SpecRouter.class);

    private static final String CONTRACT_SUFFIX = ".json";

    private final RouteTableBuilder builder;
    private final SpecRouterOptions options;
    private final List<Path> contracts;
    private RouteTable table;

    private SpecRouter(RouteTableBuilder builder, SpecRouterOptions options, List<Path> contracts) {
        this.builder = builder;
        this.options = options;
        this.contracts = List.copyOf(contracts);
    }

    /**
     * Loads a contract file, or every {@code *.json} file below a directory in sorted order.
     *
     * @throws ContractReadException if the path does not exist or cannot be walked
     * @throws io.specrouter.core.error.SpecRouterException from the first contract that fails
     */
    public static SpecRouter load(Path fileOrDirectory, SpecRouterOptions options) {
        Objects.requireNonNull(fileOrDirectory, "fileOrDirectory must not be null");
        Objects.requireNonNull(options, "options must not be null");

        List<Path> files = discover(fileOrDirectory);
        ContractParser parser = new ContractParser();
        ModelGenerator generator = new ModelGenerator();
        RouteTableBuilder builder = new RouteTableBuilder(new RoutesMapping());

        long start = System.nanoTime();
        for (Path file : files) {
            ContractDocument document = options.chain().validate(file);
            Map<String, PathItem> paths = parser.parse(document);
            String name = paths.isEmpty() ? document.baseName() : paths.keySet().iterator().next();
            GeneratedModelModule module = generator.generate(document, name, options.generator());
            builder.addContract(paths, module, file.toString());
            LOG.info(
                    "Loaded contract {}: paths={}, models={}, module={}",
                    file,
                    paths.size(),
                    module.models().size(),
                    module.id());
        }
        LOG.debug(
                "Router ready: contracts={}, validators={}, mode={}, loadMs={}",
                files.size(),
                options.chain().names(),
                options.generator().mode(),
                (System.nanoTime() - start) / 1_000_000);
        return new SpecRouter(builder, options, files);
    }

    /** Loads a single contract file or directory with baseline validation and lax models. */
    public static SpecRouter load(Path fileOrDirectory) {
        return load(fileOrDirectory, SpecRouterOptions.defaults());
    }

    private static List<Path> discover(Path root) {
        if (Files.isRegularFile(root)) {
            return List.of(root);
        }
        if (!Files.isDirectory(root)) {
            throw new ContractReadException("Contract path does not exist: " + root, null, root.toString());
        }
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(CONTRACT_SUFFIX))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ContractReadException("Failed to list contracts under " + root, e, root.toString());
        }
    }

    // ── Registrations ──

    /**
     * Registers overrides for a declared POST route.
     *
     * @throws io.specrouter.core.error.UnknownRouteException if no contract declares it
     */
    public SpecRouter post(String path, RouteInfo info) {
        builder.register(HttpMethod.POST, path, info);
        return this;
    }

    /** Registers the default for every POST route. */
    public SpecRouter post(RouteInfo info) {
        builder.registerDefault(HttpMethod.POST, info);
        return this;
    }

    /**
     * Registers overrides for a declared GET route.
     *
     * @throws io.specrouter.core.error.UnknownRouteException if no contract declares it
     */
    public SpecRouter get(String path, RouteInfo info) {
        builder.register(HttpMethod.GET, path, info);
        return this;
    }

    /** Registers the default for every GET route. */
    public SpecRouter get(RouteInfo info) {
        builder.registerDefault(HttpMethod.GET, info);
        return this;
    }

    public Map<String, RouteInfo> postMap() {
        return builder.mapping().postMap();
    }

    public Map<String, RouteInfo> getMap() {
        return builder.mapping().getMap();
    }

    public RoutesMapping mapping() {
        return builder.mapping();
    }

    // ── Introspection ──

    /**
     * The contract-derived configuration of a declared route, before overrides.
     *
     * @throws io.specrouter.core.error.UnsupportedMethodException for methods other than GET and
     *                                                            POST
     */
    public Optional<RouteInfo> routeInfo(String path, String method) {
        return builder.contractRoute(HttpMethod.of(method), path);
    }

    /**
     * The 200 response model declared for a route.
     *
     * @throws io.specrouter.core.error.UnsupportedMethodException for methods other than GET and
     *                                                            POST
     */
    public Optional<ModelType> responseModel(String path, String method) {
        return routeInfo(path, method).map(RouteInfo::responseModel);
    }

    /** Looks a model up by component name across every loaded contract. */
    public Optional<ModelType> model(String name) {
        return builder.modules().stream()
                .map(module -> module.model(name))
                .flatMap(Optional::stream)
                .findFirst();
    }

    public List<GeneratedModelModule> modules() {
        return builder.modules();
    }

    /** Contract files in load order. */
    public List<Path> contracts() {
        return contracts;
    }

    public SpecRouterOptions options() {
        return options;
    }

    /**
     * Finalizes the registrations into the route table. The first call builds and freezes; later
     * calls return the same table, and further registrations are rejected.
     */
    public synchronized RouteTable toRouteTable() {
        if (table == null) {
            table = builder.build();
            LOG.info("Route table built: routes={}, contracts={}", table.size(), contracts.size());
        }
        return table;
    }
}
