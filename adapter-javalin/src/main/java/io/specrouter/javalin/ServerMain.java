package io.specrouter.javalin;

import io.specrouter.javalin.server.ServerApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the route server. Delegates to {@link ServerApp#start(String[])}; on failure
 * logs the error and exits with status 1.
 */
public final class ServerMain {

    private static final Logger LOG = LoggerFactory.getLogger(ServerMain.class);

    private ServerMain() {
        // utility class
    }

    /**
     * @param args command-line arguments, e.g. {@code --config path/to/spec-router.yaml}
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            ServerApp.start(args);
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
