package switchkeeper;

import switchkeeper.engine.config.Dependencies;
import switchkeeper.engine.config.EngineConfig;
import switchkeeper.engine.server.MaintenanceNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Service entry point.
 * 
 * Starts the HTTP server first, then the trigger scheduler, so schedules that fire
 * right away already have their operator surface.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) {
        EngineConfig config = EngineConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        MaintenanceNettyServer server = new MaintenanceNettyServer(deps.routerHandler());

        log.info("Starting maintenance server on port {}...", config.serverPort());
        if (!server.start(config.serverHost(), config.serverPort())) {
            log.error("Server did not start, exiting");
            deps.close();
            System.exit(1);
        }

        if (config.schedulerEnabled()) {
            deps.startScheduler();
        } else {
            log.warn("Scheduler disabled; schedules will only run on demand");
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.stop();
            deps.close();
        }, "switchkeeper-shutdown"));
    }
}
