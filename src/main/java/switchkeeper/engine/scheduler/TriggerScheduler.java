package switchkeeper.engine.scheduler;

import switchkeeper.engine.config.EngineConfig;
import switchkeeper.engine.core.TaskLauncher;
import switchkeeper.engine.model.PortSchedule;
import switchkeeper.engine.model.Recurrence;
import switchkeeper.engine.model.Schedule;
import switchkeeper.engine.repository.PortScheduleRepository;
import switchkeeper.engine.repository.ScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Turns enabled schedules into timed triggers.
 * <p>
 * A single timer thread computes fire times and hands each fire to the
 * {@link TaskLauncher}; it never runs an operation itself. After a fire the trigger
 * re-arms for its next instant, but only while it is still the registered trigger for
 * its key, so a reload that raced the fire wins.
 * <p>
 * Reload replaces the whole registry under this object's monitor. Operations already
 * launched keep running; they hold no reference to the registry.
 */
public class TriggerScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TriggerScheduler.class);

    private final ScheduledExecutorService timer;
    private final ScheduleRepository schedules;
    private final PortScheduleRepository portSchedules;
    private final ScheduleRunner runner;
    private final TaskLauncher launcher;
    private final ZoneId zone;
    private final Clock clock;

    private final Map<String, RegisteredTrigger> registry = new LinkedHashMap<>();

    private volatile boolean running = false;

    public TriggerScheduler(ScheduleRepository schedules, PortScheduleRepository portSchedules, ScheduleRunner runner,
            TaskLauncher launcher, EngineConfig config) {
        this(schedules, portSchedules, runner, launcher, config.timeZone(), Clock.systemUTC());
    }

    public TriggerScheduler(ScheduleRepository schedules, PortScheduleRepository portSchedules, ScheduleRunner runner,
            TaskLauncher launcher, ZoneId zone, Clock clock) {
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "switchkeeper-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.schedules = schedules;
        this.portSchedules = portSchedules;
        this.runner = runner;
        this.launcher = launcher;
        this.zone = zone;
        this.clock = clock;
    }

    /**
     * Start the timer and register every enabled schedule.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        log.info("Starting scheduler (zone {})", zone);
        running = true;
        reload();
        log.info("Scheduler started");
    }

    /**
     * Drop every trigger and register one per enabled schedule again.
     * Safe to call any number of times; the registry ends up the same.
     */
    public synchronized ReloadReport reload() {
        if (!running) {
            log.debug("Scheduler not running, reload skipped");
            return ReloadReport.empty();
        }
        log.info("Reloading schedules from database...");

        for (RegisteredTrigger trigger : registry.values()) {
            trigger.cancel();
        }
        registry.clear();

        List<String> registered = new ArrayList<>();
        List<ReloadReport.Failure> failures = new ArrayList<>();

        List<Schedule> enabled = schedules.findEnabled();
        for (Schedule s : enabled) {
            register(TriggerKind.REBOOT_SCHEDULE, s.id(), s.name(), s.recurrence(), registered, failures);
        }
        List<PortSchedule> enabledPorts = portSchedules.findEnabled();
        for (PortSchedule s : enabledPorts) {
            register(TriggerKind.PORT_SCHEDULE, s.id(), s.name(), s.recurrence(), registered, failures);
        }

        log.info("Loaded {} device schedules and {} port schedules ({} failed)",
                enabled.size(), enabledPorts.size(), failures.size());
        return new ReloadReport(registered, failures);
    }

    private void register(TriggerKind kind, String scheduleId, String name, Recurrence recurrence,
            List<String> registered, List<ReloadReport.Failure> failures) {
        String key = kind.keyFor(scheduleId);
        try {
            TriggerRule rule = TriggerRule.from(recurrence);
            RegisteredTrigger trigger = new RegisteredTrigger(key, kind, scheduleId, name, rule);
            arm(trigger);
            registry.put(key, trigger);
            registered.add(key);
            log.info("Added trigger {} for '{}' ({}), next fire {}", key, name, rule, trigger.nextFire);
        } catch (RuntimeException e) {
            log.error("Failed to add trigger {} for '{}': {}", key, name, e.getMessage());
            failures.add(new ReloadReport.Failure(key, scheduleId, e.getMessage()));
        }
    }

    private void arm(RegisteredTrigger trigger) {
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));
        // never fire the same instant twice if the timer woke slightly early
        ZonedDateTime from = trigger.nextFire != null && trigger.nextFire.isAfter(now.toInstant())
                ? trigger.nextFire.atZone(zone)
                : now;
        ZonedDateTime next = trigger.rule.nextFireAfter(from);
        long delayMs = Math.max(0, Duration.between(now, next).toMillis());

        trigger.nextFire = next.toInstant();
        trigger.future = timer.schedule(() -> fire(trigger), delayMs, TimeUnit.MILLISECONDS);
    }

    private void fire(RegisteredTrigger trigger) {
        synchronized (this) {
            if (!running || registry.get(trigger.key) != trigger) {
                log.debug("Stale trigger {} ignored", trigger.key);
                return;
            }
            log.info("Trigger {} fired for '{}'", trigger.key, trigger.name);
            dispatch(trigger.kind, trigger.scheduleId);
            arm(trigger);
        }
    }

    private void dispatch(TriggerKind kind, String scheduleId) {
        String key = kind.keyFor(scheduleId);
        if (kind == TriggerKind.REBOOT_SCHEDULE) {
            launcher.launch(key, () -> runner.runSchedule(scheduleId));
        } else {
            launcher.launch(key, () -> runner.runPortSchedule(scheduleId));
        }
    }

    /**
     * Launch a registered trigger's work immediately, leaving its timer untouched.
     *
     * @return false if no trigger is registered under {@code key}
     */
    public synchronized boolean triggerNow(String key) {
        RegisteredTrigger trigger = registry.get(key);
        if (trigger == null) {
            return false;
        }
        log.info("Trigger {} run on demand", key);
        dispatch(trigger.kind, trigger.scheduleId);
        return true;
    }

    /**
     * Registered triggers ordered by next fire time.
     */
    public synchronized List<TriggerInfo> triggers() {
        List<TriggerInfo> infos = new ArrayList<>();
        for (RegisteredTrigger t : registry.values()) {
            infos.add(new TriggerInfo(t.key, t.kind, t.scheduleId, t.name, t.rule.toString(), t.nextFire));
        }
        infos.sort(Comparator.comparing(TriggerInfo::nextFire));
        return infos;
    }

    /**
     * Stop the scheduler. Launched operations are not interrupted.
     */
    public void stop() {
        if (!running) {
            return;
        }

        synchronized (this) {
            running = false;
            for (RegisteredTrigger trigger : registry.values()) {
                trigger.cancel();
            }
            registry.clear();
        }
        timer.shutdown();

        try {
            if (!timer.awaitTermination(5, TimeUnit.SECONDS)) {
                timer.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            timer.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    private static final class RegisteredTrigger {
        final String key;
        final TriggerKind kind;
        final String scheduleId;
        final String name;
        final TriggerRule rule;
        volatile ScheduledFuture<?> future;
        volatile Instant nextFire;

        RegisteredTrigger(String key, TriggerKind kind, String scheduleId, String name, TriggerRule rule) {
            this.key = key;
            this.kind = kind;
            this.scheduleId = scheduleId;
            this.name = name;
            this.rule = rule;
        }

        void cancel() {
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }
    }
}
