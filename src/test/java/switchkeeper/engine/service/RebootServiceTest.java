package switchkeeper.engine.service;

import org.junit.jupiter.api.*;
import switchkeeper.engine.config.EngineConfig;
import switchkeeper.engine.core.Poller;
import switchkeeper.engine.core.TaskLauncher;
import switchkeeper.engine.gateway.DeviceNotFoundException;
import switchkeeper.engine.model.BulkRebootResult;
import switchkeeper.engine.model.Confirmation;
import switchkeeper.engine.model.RebootMode;
import switchkeeper.engine.model.RebootOutcome;
import switchkeeper.engine.model.Recurrence;
import switchkeeper.engine.model.RunRecord;
import switchkeeper.engine.model.RunStatus;
import switchkeeper.engine.model.Schedule;
import switchkeeper.engine.store.Database;
import switchkeeper.engine.store.JdbcRunLedger;
import switchkeeper.engine.support.FakeGateway;
import switchkeeper.engine.support.RecordingNotifier;
import switchkeeper.engine.support.RecordingSleeper;
import switchkeeper.engine.support.TestDatabases;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RebootServiceTest {

    private static Database db;
    private static JdbcRunLedger ledger;

    private FakeGateway gateway;
    private RecordingSleeper sleeper;
    private RecordingNotifier notifier;
    private TaskLauncher launcher;
    private RebootService service;

    @BeforeAll
    static void setupDb() {
        db = TestDatabases.database("reboots");
        ledger = new JdbcRunLedger(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void setUp() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM run_records");
            conn.commit();
        }

        gateway = new FakeGateway();
        gateway.addDevice("A", "AP Lobby");
        gateway.addDevice("B", "AP Office");
        gateway.addDevice("C", "AP Warehouse");

        sleeper = new RecordingSleeper();
        notifier = new RecordingNotifier();
        launcher = new TaskLauncher("test-reboot");
        EngineConfig config = EngineConfig.defaults()
                .withRebootTiming(Duration.ofSeconds(10), Duration.ofSeconds(10))
                .withManualOnlineTimeout(Duration.ofSeconds(300));
        service = new RebootService(gateway, ledger, new SiteResolver(gateway), launcher, notifier,
                new Poller(sleeper), config);
    }

    @AfterEach
    void tearDown() {
        launcher.close();
    }

    @Test
    void rollingStopsAtFirstFailure() {
        gateway.failRebootOf("B");

        List<RebootOutcome> outcomes = service.rebootRolling(schedule(RebootMode.ROLLING, false, 0));

        assertEquals(List.of("A", "B"), gateway.reboots(), "C must not be attempted");
        assertEquals(2, outcomes.size());
        assertEquals(RunStatus.COMPLETED, outcomes.get(0).run().status());
        assertEquals(RunStatus.FAILED, outcomes.get(1).run().status());
        assertEquals(2, ledger.findBySchedule("sch-test", 10).size());

        assertEquals(1, notifier.summaries().size());
        assertEquals(2, notifier.summaries().get(0).results().size());
    }

    @Test
    void rollingContinuesPastFailureWhenAllowed() {
        gateway.failRebootOf("B");

        List<RebootOutcome> outcomes = service.rebootRolling(schedule(RebootMode.ROLLING, true, 0));

        assertEquals(List.of("A", "B", "C"), gateway.reboots());
        assertEquals(List.of(RunStatus.COMPLETED, RunStatus.FAILED, RunStatus.COMPLETED),
                outcomes.stream().map(o -> o.run().status()).toList());
        // delay after A only: B failed, C is last
        assertEquals(List.of(Duration.ofSeconds(30)), sleeper.sleeps());
    }

    @Test
    void rollingWaitsForEachDeviceToComeBack() {
        List<RebootOutcome> outcomes = service.rebootRolling(schedule(RebootMode.ROLLING, false, 120));

        assertEquals(List.of("A", "B", "C"), gateway.reboots());
        for (RebootOutcome outcome : outcomes) {
            assertEquals(Confirmation.CONFIRMED, outcome.onlineConfirmation());
        }
        // grace + delay, grace + delay, grace
        assertEquals(List.of(
                Duration.ofSeconds(10), Duration.ofSeconds(30),
                Duration.ofSeconds(10), Duration.ofSeconds(30),
                Duration.ofSeconds(10)), sleeper.sleeps());
    }

    @Test
    void rollingMarksOfflineDeviceUnconfirmed() {
        gateway.addDevice("D", "AP Dock").offline();
        Schedule schedule = schedule(RebootMode.ROLLING, false, 60).toBuilder()
                .deviceIds(List.of("D"))
                .build();

        List<RebootOutcome> outcomes = service.rebootRolling(schedule);

        assertEquals(1, outcomes.size());
        assertEquals(RunStatus.COMPLETED, outcomes.get(0).run().status(), "the command itself succeeded");
        assertEquals(Confirmation.UNCONFIRMED, outcomes.get(0).onlineConfirmation());
    }

    @Test
    void parallelIsolatesFailures() {
        gateway.failRebootOf("B");

        List<RebootOutcome> outcomes = service.rebootParallel(schedule(RebootMode.PARALLEL, false, 0));

        assertEquals(3, outcomes.size());
        assertEquals(List.of("A", "B", "C"), outcomes.stream().map(o -> o.run().deviceId()).toList());
        assertEquals(List.of(RunStatus.COMPLETED, RunStatus.FAILED, RunStatus.COMPLETED),
                outcomes.stream().map(o -> o.run().status()).toList());
        assertEquals(3, gateway.reboots().size());
    }

    @Test
    void unknownDeviceInScheduleBecomesFailedRecord() {
        Schedule schedule = schedule(RebootMode.ROLLING, true, 0).toBuilder()
                .deviceIds(List.of("A", "ghost"))
                .build();

        List<RebootOutcome> outcomes = service.rebootRolling(schedule);

        assertEquals(2, outcomes.size());
        RunRecord ghost = outcomes.get(1).run();
        assertEquals(RunStatus.FAILED, ghost.status());
        assertEquals("ghost", ghost.deviceName());
        assertTrue(ghost.errorMessage().contains("not found"));
    }

    @Test
    void manualRebootRejectsUnknownDevice() {
        assertThrows(DeviceNotFoundException.class, () -> service.rebootOne("ghost", null));
        assertTrue(ledger.findRecent(10).isEmpty());
    }

    @Test
    void manualRebootNotifiesWhenBackOnline() throws Exception {
        RebootOutcome outcome = service.rebootOne("A", null);

        assertTrue(outcome.commandAccepted());
        assertEquals(List.of("A"), gateway.reboots());
        assertEquals("manual", ledger.findById(outcome.run().id()).orElseThrow().metadata().get("source"));
        assertTrue(TestDatabases.eventually(() -> notifier.backOnline().contains("AP Lobby"), 5000));
    }

    @Test
    void bulkRebootAggregates() {
        BulkRebootResult result = service.rebootBulk(List.of("A", "ghost", "C"), null);

        assertFalse(result.success());
        assertEquals(3, result.total());
        assertEquals(2, result.rebooted().size());
        assertEquals(1, result.failed().size());
        assertEquals("ghost", result.failed().get(0).run().deviceId());

        List<RunRecord> runs = ledger.findRecent(10);
        assertEquals(3, runs.size());
        for (RunRecord run : runs) {
            assertEquals("bulk", run.metadata().get("source"));
            assertEquals(Boolean.TRUE, run.metadata().get("bulk"));
        }
    }

    private static Schedule schedule(RebootMode mode, boolean continueOnFailure, int maxWait) {
        return Schedule.builder()
                .id("sch-test")
                .name("Nightly APs")
                .deviceIds(List.of("A", "B", "C"))
                .siteName("default")
                .recurrence(Recurrence.daily("03:00"))
                .mode(mode)
                .delayBetweenDevices(30)
                .maxWaitTime(maxWait)
                .continueOnFailure(continueOnFailure)
                .build();
    }
}
