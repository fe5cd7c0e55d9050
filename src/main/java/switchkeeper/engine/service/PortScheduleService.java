package switchkeeper.engine.service;

import switchkeeper.engine.config.EngineConfig;
import switchkeeper.engine.core.MaintenanceException;
import switchkeeper.engine.core.Sleeper;
import switchkeeper.engine.core.TaskLauncher;
import switchkeeper.engine.model.BulkDispatch;
import switchkeeper.engine.model.PortSchedule;
import switchkeeper.engine.model.RunRecord;
import switchkeeper.engine.model.TriggerSource;
import switchkeeper.engine.repository.PortScheduleRepository;
import switchkeeper.engine.scheduler.TriggerScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Business logic for port cycle schedules, including running every schedule of a
 * site at once.
 */
public class PortScheduleService {

    private static final Logger log = LoggerFactory.getLogger(PortScheduleService.class);

    private final PortScheduleRepository repository;
    private final TriggerScheduler scheduler;
    private final PortCycleService portCycleService;
    private final SiteResolver siteResolver;
    private final TaskLauncher launcher;
    private final Sleeper sleeper;
    private final Duration stagger;

    public PortScheduleService(PortScheduleRepository repository, TriggerScheduler scheduler,
            PortCycleService portCycleService, SiteResolver siteResolver, TaskLauncher launcher, Sleeper sleeper,
            EngineConfig config) {
        this.repository = repository;
        this.scheduler = scheduler;
        this.portCycleService = portCycleService;
        this.siteResolver = siteResolver;
        this.launcher = launcher;
        this.sleeper = sleeper;
        this.stagger = config.bulkStagger();
    }

    /**
     * Create a port schedule from a draft; id and timestamps are assigned here.
     *
     * @throws IllegalArgumentException for an invalid port index or off duration
     */
    public PortSchedule create(PortSchedule.Builder draft) {
        Instant now = Instant.now();
        // port index and off duration ranges are enforced by the PortSchedule constructor
        PortSchedule schedule = draft
                .id(repository.generateId())
                .createdAt(now)
                .updatedAt(now)
                .lastRunAt(null)
                .build();

        repository.save(schedule);
        log.info("Created port schedule: {} ({} port {})", schedule.name(), schedule.deviceId(),
                schedule.portIdx());

        scheduler.reload();
        return schedule;
    }

    public Optional<PortSchedule> update(String scheduleId, PortSchedule.Builder changes) {
        Optional<PortSchedule> existing = repository.findById(scheduleId);
        if (existing.isEmpty()) {
            return Optional.empty();
        }

        PortSchedule updated = changes
                .id(scheduleId)
                .createdAt(existing.get().createdAt())
                .lastRunAt(existing.get().lastRunAt())
                .updatedAt(Instant.now())
                .build();

        repository.update(updated);
        log.info("Updated port schedule {}", scheduleId);

        scheduler.reload();
        return Optional.of(updated);
    }

    public boolean delete(String scheduleId) {
        boolean deleted = repository.delete(scheduleId);
        if (deleted) {
            log.info("Deleted port schedule {}", scheduleId);
            scheduler.reload();
        }
        return deleted;
    }

    public Optional<PortSchedule> toggle(String scheduleId) {
        Optional<PortSchedule> existing = repository.findById(scheduleId);
        if (existing.isEmpty()) {
            return Optional.empty();
        }

        PortSchedule toggled = existing.get().toBuilder()
                .enabled(!existing.get().enabled())
                .updatedAt(Instant.now())
                .build();
        repository.update(toggled);
        log.info("Port schedule {} {}", scheduleId, toggled.enabled() ? "enabled" : "disabled");

        scheduler.reload();
        return Optional.of(toggled);
    }

    public Optional<PortSchedule> findById(String scheduleId) {
        return repository.findById(scheduleId);
    }

    public List<PortSchedule> findAll() {
        return repository.findAll();
    }

    /**
     * Cycle every enabled port schedule of a site now. Records are created up front,
     * then each cycle starts {@code index * stagger} after the call so the controller is
     * not flooded. Returns without waiting for any cycle.
     *
     * @throws NoSchedulesException if the site has no enabled port schedules
     */
    public BulkDispatch runSiteNow(String siteName) {
        List<PortSchedule> schedules = repository.findEnabledBySite(siteName);
        if (schedules.isEmpty()) {
            throw new NoSchedulesException(siteName);
        }

        String siteDisplay = siteResolver.displayName(siteName);
        Map<String, String> deviceNames = portCycleService.deviceNames(siteName);

        List<String> runIds = new ArrayList<>();
        for (int i = 0; i < schedules.size(); i++) {
            PortSchedule schedule = schedules.get(i);
            PortCycleRequest request = PortCycleRequest.of(schedule, siteName);
            RunContext context = new RunContext(
                    schedule.id(),
                    TriggerSource.BULK,
                    PortCycleService.portDisplayName(deviceNames, schedule.deviceId(), schedule.portIdx()),
                    siteDisplay);

            RunRecord run = portCycleService.startRun(request, context);
            runIds.add(run.id());

            Duration delay = stagger.multipliedBy(i);
            launcher.launch("bulk-cycle " + run.id(), () -> {
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    portCycleService.abandon(run, "Interrupted before start");
                    throw MaintenanceException.interrupted("staggering " + run.id(), e);
                }
                portCycleService.execute(run, request);
            });
        }

        log.info("Started {} port cycles for site '{}'", schedules.size(), siteDisplay);
        return new BulkDispatch(siteDisplay, schedules.size(), runIds);
    }
}
