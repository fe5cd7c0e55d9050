package switchkeeper.engine.scheduler;

import org.junit.jupiter.api.*;
import switchkeeper.engine.config.EngineConfig;
import switchkeeper.engine.core.Poller;
import switchkeeper.engine.core.TaskLauncher;
import switchkeeper.engine.lock.DeviceLockRegistry;
import switchkeeper.engine.model.JobKind;
import switchkeeper.engine.model.PortSchedule;
import switchkeeper.engine.model.Recurrence;
import switchkeeper.engine.model.RunRecord;
import switchkeeper.engine.model.RunStatus;
import switchkeeper.engine.model.Schedule;
import switchkeeper.engine.service.PortCycleService;
import switchkeeper.engine.service.RebootService;
import switchkeeper.engine.service.SiteResolver;
import switchkeeper.engine.store.Database;
import switchkeeper.engine.store.JdbcPortScheduleRepository;
import switchkeeper.engine.store.JdbcRunLedger;
import switchkeeper.engine.store.JdbcScheduleRepository;
import switchkeeper.engine.support.FakeGateway;
import switchkeeper.engine.support.RecordingNotifier;
import switchkeeper.engine.support.RecordingSleeper;
import switchkeeper.engine.support.TestDatabases;

import java.sql.Connection;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TriggerSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private static Database db;
    private static JdbcScheduleRepository schedules;
    private static JdbcPortScheduleRepository portSchedules;
    private static JdbcRunLedger ledger;

    private FakeGateway gateway;
    private TaskLauncher launcher;
    private TriggerScheduler scheduler;

    @BeforeAll
    static void setupDb() {
        db = TestDatabases.database("trigger-scheduler");
        schedules = new JdbcScheduleRepository(db);
        portSchedules = new JdbcPortScheduleRepository(db);
        ledger = new JdbcRunLedger(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void setUp() throws Exception {
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement()) {
            st.execute("DELETE FROM run_records");
            st.execute("DELETE FROM port_schedules");
            st.execute("DELETE FROM schedules");
            conn.commit();
        }

        gateway = new FakeGateway();
        gateway.addDevice("sw-1", "Core Switch").port(5, "Camera", "net-cams");

        RecordingSleeper sleeper = new RecordingSleeper();
        Poller poller = new Poller(sleeper);
        EngineConfig config = EngineConfig.defaults();
        launcher = new TaskLauncher("test-task");
        SiteResolver siteResolver = new SiteResolver(gateway);

        PortCycleService portCycleService = new PortCycleService(gateway, new DeviceLockRegistry(), ledger, poller,
                config);
        RebootService rebootService = new RebootService(gateway, ledger, siteResolver, launcher,
                new RecordingNotifier(), poller, config);
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        ScheduleRunner runner = new ScheduleRunner(schedules, portSchedules, rebootService, portCycleService,
                siteResolver, clock);

        scheduler = new TriggerScheduler(schedules, portSchedules, runner, launcher, ZoneOffset.UTC, clock);
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
        launcher.close();
    }

    @Test
    void reloadIsIdempotent() {
        Schedule s = saveSchedule("nightly", Recurrence.daily("03:00"), true);
        PortSchedule p = savePortSchedule("cam", Recurrence.hourly(30), true);

        scheduler.start();
        ReloadReport first = scheduler.reload();
        ReloadReport second = scheduler.reload();

        assertEquals(Set.copyOf(first.registered()), Set.copyOf(second.registered()));
        assertEquals(2, second.registeredCount());
        assertTrue(second.registered().contains(TriggerKind.REBOOT_SCHEDULE.keyFor(s.id())));
        assertTrue(second.registered().contains(TriggerKind.PORT_SCHEDULE.keyFor(p.id())));
        assertEquals(2, scheduler.triggers().size());
    }

    @Test
    void triggersAreOrderedByNextFire() {
        saveSchedule("nightly", Recurrence.daily("03:00"), true);
        savePortSchedule("cam", Recurrence.hourly(30), true);

        scheduler.start();
        List<TriggerInfo> triggers = scheduler.triggers();

        assertEquals(Instant.parse("2026-01-15T10:30:00Z"), triggers.get(0).nextFire());
        assertEquals(TriggerKind.PORT_SCHEDULE, triggers.get(0).kind());
        assertEquals(Instant.parse("2026-01-16T03:00:00Z"), triggers.get(1).nextFire());
        assertEquals("daily at 03:00", triggers.get(1).rule());
    }

    @Test
    void unknownFrequencyFailsOnlyItsOwnSchedule() {
        Schedule good = saveSchedule("good", Recurrence.daily("03:00"), true);
        Schedule bad = saveSchedule("bad", new Recurrence("fortnightly", "03:00", null, null), true);

        scheduler.start();
        ReloadReport report = scheduler.reload();

        assertEquals(List.of(TriggerKind.REBOOT_SCHEDULE.keyFor(good.id())), report.registered());
        assertEquals(1, report.failures().size());
        assertEquals(bad.id(), report.failures().get(0).scheduleId());
        assertTrue(report.failures().get(0).reason().contains("fortnightly"));
    }

    @Test
    void disabledSchedulesGetNoTrigger() {
        saveSchedule("off", Recurrence.daily("03:00"), false);
        savePortSchedule("off-port", Recurrence.daily("04:00"), false);

        scheduler.start();

        assertTrue(scheduler.triggers().isEmpty());
    }

    @Test
    void reloadWhileStoppedDoesNothing() {
        saveSchedule("nightly", Recurrence.daily("03:00"), true);

        ReloadReport report = scheduler.reload();

        assertFalse(scheduler.isRunning());
        assertEquals(0, report.registeredCount());
        assertTrue(scheduler.triggers().isEmpty());
    }

    @Test
    void stopClearsTriggers() {
        saveSchedule("nightly", Recurrence.daily("03:00"), true);
        scheduler.start();
        assertEquals(1, scheduler.triggers().size());

        scheduler.stop();

        assertFalse(scheduler.isRunning());
        assertTrue(scheduler.triggers().isEmpty());
    }

    @Test
    void triggerNowRejectsUnknownKey() {
        scheduler.start();

        assertFalse(scheduler.triggerNow(TriggerKind.REBOOT_SCHEDULE.keyFor("sch-missing")));
    }

    @Test
    void triggerNowRunsPortSchedule() throws Exception {
        PortSchedule p = savePortSchedule("cam", Recurrence.daily("04:00"), true);
        scheduler.start();

        assertTrue(scheduler.triggerNow(TriggerKind.PORT_SCHEDULE.keyFor(p.id())));

        assertTrue(TestDatabases.eventually(() -> ledger.findBySchedule(p.id(), 10).stream()
                .anyMatch(RunRecord::isTerminal), 5000));
        RunRecord run = ledger.findBySchedule(p.id(), 10).get(0);
        assertEquals(RunStatus.COMPLETED, run.status());
        assertEquals(JobKind.POE_CYCLE, run.kind());
        assertEquals("Core Switch Port 5", run.deviceName());
        assertEquals(NOW, portSchedules.findById(p.id()).orElseThrow().lastRunAt());
        assertEquals(2, gateway.poeCalls().size());
    }

    @Test
    void triggerNowRunsRebootSchedule() throws Exception {
        Schedule s = saveSchedule("nightly", Recurrence.daily("03:00"), true);
        scheduler.start();

        assertTrue(scheduler.triggerNow(TriggerKind.REBOOT_SCHEDULE.keyFor(s.id())));

        assertTrue(TestDatabases.eventually(() -> ledger.findBySchedule(s.id(), 10).stream()
                .anyMatch(RunRecord::isTerminal), 5000));
        assertEquals(List.of("sw-1"), gateway.reboots());
    }

    private Schedule saveSchedule(String name, Recurrence recurrence, boolean enabled) {
        Schedule schedule = Schedule.builder()
                .id(schedules.generateId())
                .name(name)
                .deviceIds(List.of("sw-1"))
                .recurrence(recurrence)
                .maxWaitTime(0)
                .delayBetweenDevices(0)
                .enabled(enabled)
                .createdAt(Instant.now())
                .updatedAt(Instant.now())
                .build();
        schedules.save(schedule);
        return schedule;
    }

    private PortSchedule savePortSchedule(String name, Recurrence recurrence, boolean enabled) {
        PortSchedule schedule = PortSchedule.builder()
                .id(portSchedules.generateId())
                .name(name)
                .deviceId("sw-1")
                .portIdx(5)
                .recurrence(recurrence)
                .poeOnly(true)
                .offDuration(15)
                .enabled(enabled)
                .createdAt(Instant.now())
                .updatedAt(Instant.now())
                .build();
        portSchedules.save(schedule);
        return schedule;
    }
}
