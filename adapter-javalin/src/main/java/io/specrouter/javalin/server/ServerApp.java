package io.specrouter.javalin.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.specrouter.core.engine.SpecRouter;
import io.specrouter.core.engine.SpecRouterOptions;
import io.specrouter.core.openapi.OpenApiExporter;
import io.specrouter.core.route.RouteTable;
import io.specrouter.core.schema.GeneratorOptions;
import io.specrouter.core.validator.ValidatorChain;
import io.specrouter.core.validator.ValidatorRegistry;
import io.specrouter.javalin.config.ConfigLoader;
import io.specrouter.javalin.config.ServerConfig;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates the server startup sequence.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Load configuration from YAML and the environment overlay
 *   <li>Build the validator chain from the configured names
 *   <li>Load every contract into a {@link SpecRouter}
 *   <li>Apply user registrations and finalize the route table
 *   <li>Bind routes, the OpenAPI document and the health endpoint
 *   <li>Start Javalin
 * </ol>
 *
 * <p>Separate from {@link io.specrouter.javalin.ServerMain} so tests can start a server without
 * going through {@code main()}.
 */
public final class ServerApp {

    private static final Logger LOG = LoggerFactory.getLogger(ServerApp.class);

    private final Javalin app;
    private final SpecRouter router;
    private final RouteTable table;
    private final ServerConfig config;

    private ServerApp(Javalin app, SpecRouter router, RouteTable table, ServerConfig config) {
        this.app = app;
        this.router = router;
        this.table = table;
        this.config = config;
    }

    /**
     * Loads the configuration named by the arguments and starts a server with the default
     * handlers.
     *
     * @param args command-line arguments, e.g. {@code --config path/to/spec-router.yaml}
     */
    public static ServerApp start(String[] args) {
        Path configPath = ConfigLoader.resolveConfigPath(args);
        ServerConfig config = ConfigLoader.load(configPath);
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.info("Configuration loaded from {}", configPath);
        return start(config, router -> {});
    }

    /**
     * Starts a server.
     *
     * @param config        server configuration
     * @param registrations applied to the loaded router before the route table is finalized
     */
    public static ServerApp start(ServerConfig config, Consumer<SpecRouter> registrations) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(registrations, "registrations must not be null");
        long startTime = System.nanoTime();

        // 1. Validator chain
        ValidatorRegistry registry = ValidatorRegistry.withBuiltins();
        int providers = registry.loadProviders(Thread.currentThread().getContextClassLoader());
        ValidatorChain chain = registry.chain(config.validators());
        LOG.info("Validator chain: {} (providers={})", chain.names(), providers);

        // 2. Contracts
        GeneratorOptions generator = GeneratorOptions.builder()
                .strict(config.strict())
                .retainArtifact(config.artifactDir() != null)
                .artifactDir(config.artifactDir() != null ? Path.of(config.artifactDir()) : null)
                .build();
        SpecRouter router = SpecRouter.load(
                Path.of(config.contractsPath()),
                SpecRouterOptions.builder().chain(chain).generator(generator).build());

        // 3. Registrations
        registrations.accept(router);
        RouteTable table = router.toRouteTable();

        // 4. Bind
        ObjectMapper mapper = new ObjectMapper();
        Javalin app = Javalin.create(javalinConfig -> javalinConfig.showJavalinBanner = false);
        JavalinRouteRegistrar registrar = new JavalinRouteRegistrar(app, mapper);
        table.registerWith(registrar);

        String openapi = new OpenApiExporter(mapper).toJson(table, config.openapiTitle(), config.openapiVersion());
        app.get(config.openapiPath(), ctx -> {
            ctx.contentType(RouteEndpoint.JSON);
            ctx.result(openapi);
        });
        if (config.healthEnabled()) {
            app.get(config.healthPath(), new HealthHandler());
        }

        // 5. Start
        app.start(config.host(), config.port());

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "spec-router started: port={}, contracts={}, routes={}, validators={}, mode={}, startupMs={}",
                app.port(),
                router.contracts().size(),
                registrar.count(),
                chain.names(),
                generator.mode(),
                elapsedMs);

        return new ServerApp(app, router, table, config);
    }

    /** The port the server listens on. */
    public int port() {
        return app.port();
    }

    public Javalin javalin() {
        return app;
    }

    public SpecRouter router() {
        return router;
    }

    public RouteTable routeTable() {
        return table;
    }

    public ServerConfig config() {
        return config;
    }

    public void stop() {
        app.stop();
        LOG.info("spec-router stopped");
    }
}
