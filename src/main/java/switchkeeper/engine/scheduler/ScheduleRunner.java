package switchkeeper.engine.scheduler;

import switchkeeper.engine.model.PortSchedule;
import switchkeeper.engine.model.RebootMode;
import switchkeeper.engine.model.RunRecord;
import switchkeeper.engine.model.Schedule;
import switchkeeper.engine.model.TriggerSource;
import switchkeeper.engine.repository.PortScheduleRepository;
import switchkeeper.engine.repository.ScheduleRepository;
import switchkeeper.engine.service.PortCycleRequest;
import switchkeeper.engine.service.PortCycleService;
import switchkeeper.engine.service.RebootService;
import switchkeeper.engine.service.RunContext;
import switchkeeper.engine.service.SiteResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Executes a fired trigger. The schedule is re-read at fire time, so edits and
 * disables made after registration are honoured.
 */
public class ScheduleRunner {

    private static final Logger log = LoggerFactory.getLogger(ScheduleRunner.class);

    private final ScheduleRepository schedules;
    private final PortScheduleRepository portSchedules;
    private final RebootService rebootService;
    private final PortCycleService portCycleService;
    private final SiteResolver siteResolver;
    private final Clock clock;

    public ScheduleRunner(ScheduleRepository schedules, PortScheduleRepository portSchedules,
            RebootService rebootService, PortCycleService portCycleService, SiteResolver siteResolver, Clock clock) {
        this.schedules = schedules;
        this.portSchedules = portSchedules;
        this.rebootService = rebootService;
        this.portCycleService = portCycleService;
        this.siteResolver = siteResolver;
        this.clock = clock;
    }

    /**
     * Run a device reboot schedule in its configured mode.
     */
    public void runSchedule(String scheduleId) {
        log.info("Executing device schedule {}", scheduleId);

        Optional<Schedule> found = schedules.findById(scheduleId);
        if (found.isEmpty() || !found.get().enabled()) {
            log.warn("Schedule {} not found or disabled", scheduleId);
            return;
        }
        Schedule schedule = found.get();
        schedules.markRun(scheduleId, Instant.now(clock));

        if (schedule.mode() == RebootMode.ROLLING) {
            rebootService.rebootRolling(schedule);
        } else {
            rebootService.rebootParallel(schedule);
        }
    }

    /**
     * Run a port cycle schedule as a tracked run.
     *
     * @return the terminal record, empty if the schedule was skipped
     */
    public Optional<RunRecord> runPortSchedule(String scheduleId) {
        log.info("Executing port schedule {}", scheduleId);

        Optional<PortSchedule> found = portSchedules.findById(scheduleId);
        if (found.isEmpty() || !found.get().enabled()) {
            log.warn("Port schedule {} not found or disabled", scheduleId);
            return Optional.empty();
        }
        PortSchedule schedule = found.get();
        portSchedules.markRun(scheduleId, Instant.now(clock));

        String site = siteResolver.resolve(schedule);
        RunContext context = new RunContext(
                schedule.id(),
                TriggerSource.SCHEDULED,
                portCycleService.portDisplayName(schedule.deviceId(), schedule.portIdx(), site),
                siteResolver.displayName(site));

        return Optional.of(portCycleService.runTracked(PortCycleRequest.of(schedule, site), context));
    }
}
