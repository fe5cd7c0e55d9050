package switchkeeper.engine.service;

import switchkeeper.engine.model.Schedule;
import switchkeeper.engine.repository.ScheduleRepository;
import switchkeeper.engine.scheduler.TriggerScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Business logic for device reboot schedules.
 * Every mutation reloads the trigger scheduler so the change takes effect at once.
 */
public class ScheduleService {

    private static final Logger log = LoggerFactory.getLogger(ScheduleService.class);

    private final ScheduleRepository repository;
    private final TriggerScheduler scheduler;

    public ScheduleService(ScheduleRepository repository, TriggerScheduler scheduler) {
        this.repository = repository;
        this.scheduler = scheduler;
    }

    /**
     * Create a schedule from a draft; id and timestamps are assigned here.
     *
     * @throws IllegalArgumentException if the draft has no devices
     */
    public Schedule create(Schedule.Builder draft) {
        Instant now = Instant.now();
        Schedule schedule = draft
                .id(repository.generateId())
                .createdAt(now)
                .updatedAt(now)
                .lastRunAt(null)
                .build();
        validate(schedule);

        repository.save(schedule);
        log.info("Created schedule: {} ({})", schedule.name(), schedule.id());

        scheduler.reload();
        return schedule;
    }

    /**
     * Replace a schedule's definition. Creation and last-run times are kept.
     */
    public Optional<Schedule> update(String scheduleId, Schedule.Builder changes) {
        Optional<Schedule> existing = repository.findById(scheduleId);
        if (existing.isEmpty()) {
            return Optional.empty();
        }

        Schedule updated = changes
                .id(scheduleId)
                .createdAt(existing.get().createdAt())
                .lastRunAt(existing.get().lastRunAt())
                .updatedAt(Instant.now())
                .build();
        validate(updated);

        repository.update(updated);
        log.info("Updated schedule: {} ({})", updated.name(), scheduleId);

        scheduler.reload();
        return Optional.of(updated);
    }

    public boolean delete(String scheduleId) {
        boolean deleted = repository.delete(scheduleId);
        if (deleted) {
            log.info("Deleted schedule {}", scheduleId);
            scheduler.reload();
        }
        return deleted;
    }

    /**
     * Flip the enabled flag.
     */
    public Optional<Schedule> toggle(String scheduleId) {
        Optional<Schedule> existing = repository.findById(scheduleId);
        if (existing.isEmpty()) {
            return Optional.empty();
        }

        Schedule toggled = existing.get().toBuilder()
                .enabled(!existing.get().enabled())
                .updatedAt(Instant.now())
                .build();
        repository.update(toggled);
        log.info("Schedule {} {}", scheduleId, toggled.enabled() ? "enabled" : "disabled");

        scheduler.reload();
        return Optional.of(toggled);
    }

    public Optional<Schedule> findById(String scheduleId) {
        return repository.findById(scheduleId);
    }

    public List<Schedule> findAll() {
        return repository.findAll();
    }

    private static void validate(Schedule schedule) {
        if (schedule.deviceIds().isEmpty()) {
            throw new IllegalArgumentException("schedule must target at least one device");
        }
        if (schedule.delayBetweenDevices() < 0) {
            throw new IllegalArgumentException("delayBetweenDevices must be >= 0");
        }
        if (schedule.maxWaitTime() < 0) {
            throw new IllegalArgumentException("maxWaitTime must be >= 0");
        }
    }
}
