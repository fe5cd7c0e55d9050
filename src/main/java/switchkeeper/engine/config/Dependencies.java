package switchkeeper.engine.config;

import switchkeeper.engine.api.v1.DeviceController;
import switchkeeper.engine.api.v1.HealthController;
import switchkeeper.engine.api.v1.MaintenanceController;
import switchkeeper.engine.api.v1.PortScheduleController;
import switchkeeper.engine.api.v1.RunController;
import switchkeeper.engine.api.v1.ScheduleController;
import switchkeeper.engine.core.Poller;
import switchkeeper.engine.core.Sleeper;
import switchkeeper.engine.core.TaskLauncher;
import switchkeeper.engine.gateway.ControllerGateway;
import switchkeeper.engine.gateway.DeviceGateway;
import switchkeeper.engine.lock.DeviceLockRegistry;
import switchkeeper.engine.repository.PortScheduleRepository;
import switchkeeper.engine.repository.RunLedger;
import switchkeeper.engine.repository.ScheduleRepository;
import switchkeeper.engine.scheduler.ScheduleRunner;
import switchkeeper.engine.scheduler.TriggerScheduler;
import switchkeeper.engine.server.RouterHandler;
import switchkeeper.engine.service.LoggingNotifier;
import switchkeeper.engine.service.MaintenanceNotifier;
import switchkeeper.engine.service.PortCycleService;
import switchkeeper.engine.service.PortScheduleService;
import switchkeeper.engine.service.RebootService;
import switchkeeper.engine.service.ScheduleService;
import switchkeeper.engine.service.SiteResolver;
import switchkeeper.engine.store.Database;
import switchkeeper.engine.store.JdbcPortScheduleRepository;
import switchkeeper.engine.store.JdbcRunLedger;
import switchkeeper.engine.store.JdbcScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 * 
 * Usage:
 * 
 * <pre>
 * Dependencies deps = Dependencies.create(EngineConfig.fromEnv());
 * deps.startScheduler(); // register triggers for enabled schedules
 * RebootService reboots = deps.rebootService();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final EngineConfig config;
    private final Database database;
    private final ScheduleRepository scheduleRepository;
    private final PortScheduleRepository portScheduleRepository;
    private final RunLedger runLedger;

    private final DeviceGateway gateway;
    private final DeviceLockRegistry lockRegistry;
    private final TaskLauncher launcher;
    private final TaskLauncher requestWorkers;
    private final Poller poller;

    private final SiteResolver siteResolver;
    private final MaintenanceNotifier notifier;
    private final PortCycleService portCycleService;
    private final RebootService rebootService;
    private final ScheduleRunner scheduleRunner;
    private final TriggerScheduler scheduler;
    private final ScheduleService scheduleService;
    private final PortScheduleService portScheduleService;

    // Controllers
    private final HealthController healthController;
    private final ScheduleController scheduleController;
    private final PortScheduleController portScheduleController;
    private final RunController runController;
    private final MaintenanceController maintenanceController;
    private final DeviceController deviceController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private Dependencies(EngineConfig config, DeviceGateway gateway, Sleeper sleeper) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.gateway = gateway;
        this.lockRegistry = new DeviceLockRegistry();
        this.launcher = new TaskLauncher("switchkeeper-task");
        this.requestWorkers = new TaskLauncher("switchkeeper-http");
        this.poller = new Poller(sleeper);

        // Repositories
        this.scheduleRepository = new JdbcScheduleRepository(database);
        this.portScheduleRepository = new JdbcPortScheduleRepository(database);
        this.runLedger = new JdbcRunLedger(database);

        // Operations
        this.siteResolver = new SiteResolver(gateway);
        this.notifier = new LoggingNotifier();
        this.portCycleService = new PortCycleService(gateway, lockRegistry, runLedger, poller, config);
        this.rebootService = new RebootService(gateway, runLedger, siteResolver, launcher, notifier, poller,
                config);

        // Scheduling; the schedule services reload the scheduler, so they come after it
        this.scheduleRunner = new ScheduleRunner(scheduleRepository, portScheduleRepository, rebootService,
                portCycleService, siteResolver, Clock.systemUTC());
        this.scheduler = new TriggerScheduler(scheduleRepository, portScheduleRepository, scheduleRunner,
                launcher, config);
        this.scheduleService = new ScheduleService(scheduleRepository, scheduler);
        this.portScheduleService = new PortScheduleService(portScheduleRepository, scheduler, portCycleService,
                siteResolver, launcher, sleeper, config);

        // Controllers
        this.healthController = new HealthController(database, scheduler, runLedger);
        this.scheduleController = new ScheduleController(scheduleService, scheduler);
        this.portScheduleController = new PortScheduleController(portScheduleService, scheduler);
        this.runController = new RunController(runLedger);
        this.maintenanceController = new MaintenanceController(rebootService, portCycleService, siteResolver,
                scheduler);
        this.deviceController = new DeviceController(gateway);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies talking to the configured controller.
     */
    public static Dependencies create(EngineConfig config) {
        return new Dependencies(config, new ControllerGateway(config), Sleeper.SYSTEM);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(EngineConfig.fromEnv());
    }

    /**
     * Create dependencies around a given gateway and sleeper (tests, simulators).
     */
    public static Dependencies create(EngineConfig config, DeviceGateway gateway, Sleeper sleeper) {
        return new Dependencies(config, gateway, sleeper);
    }

    // Getters
    public EngineConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public ScheduleRepository scheduleRepository() {
        return scheduleRepository;
    }

    public PortScheduleRepository portScheduleRepository() {
        return portScheduleRepository;
    }

    public RunLedger runLedger() {
        return runLedger;
    }

    public DeviceGateway gateway() {
        return gateway;
    }

    public DeviceLockRegistry lockRegistry() {
        return lockRegistry;
    }

    public TaskLauncher launcher() {
        return launcher;
    }

    public PortCycleService portCycleService() {
        return portCycleService;
    }

    public RebootService rebootService() {
        return rebootService;
    }

    public ScheduleService scheduleService() {
        return scheduleService;
    }

    public PortScheduleService portScheduleService() {
        return portScheduleService;
    }

    public TriggerScheduler scheduler() {
        return scheduler;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(requestWorkers)
                    .registerController(healthController)
                    .registerController(scheduleController)
                    .registerController(portScheduleController)
                    .registerController(runController)
                    .registerController(maintenanceController)
                    .registerController(deviceController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Start the trigger scheduler. Should be called after server startup.
     */
    public void startScheduler() {
        scheduler.start();
    }

    public void stopScheduler() {
        scheduler.stop();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop scheduler first so nothing new is launched
        try {
            scheduler.stop();
        } catch (Exception e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }

        try {
            launcher.close();
        } catch (Exception e) {
            log.warn("Error stopping task launcher: {}", e.getMessage());
        }

        try {
            requestWorkers.close();
        } catch (Exception e) {
            log.warn("Error stopping request workers: {}", e.getMessage());
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
