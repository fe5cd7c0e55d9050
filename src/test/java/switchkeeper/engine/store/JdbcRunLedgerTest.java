package switchkeeper.engine.store;

import org.junit.jupiter.api.*;
import switchkeeper.engine.model.JobKind;
import switchkeeper.engine.model.RunRecord;
import switchkeeper.engine.model.RunStatus;
import switchkeeper.engine.model.TriggerSource;
import switchkeeper.engine.support.TestDatabases;

import java.sql.Connection;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcRunLedgerTest {

    private static Database db;
    private static JdbcRunLedger ledger;

    @BeforeAll
    static void setupDb() {
        db = TestDatabases.database("run-ledger");
        ledger = new JdbcRunLedger(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTable() throws Exception {
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement()) {
            st.execute("DELETE FROM run_records");
            conn.commit();
        }
    }

    @Test
    void createStoresRunningRecord() {
        RunRecord run = RunRecord.builder()
                .id("run-1")
                .scheduleId("psch-1")
                .kind(JobKind.PORT_CYCLE)
                .deviceId("sw-1")
                .deviceName("Lobby Switch Port 3")
                .portIdx(3)
                .startedAt(Instant.parse("2026-01-15T10:00:00Z"))
                .source(TriggerSource.SCHEDULED)
                .metadata("offDuration", 20)
                .build();

        assertEquals("run-1", ledger.create(run));

        RunRecord stored = ledger.findById("run-1").orElseThrow();
        assertEquals(RunStatus.RUNNING, stored.status());
        assertEquals("psch-1", stored.scheduleId());
        assertEquals(JobKind.PORT_CYCLE, stored.kind());
        assertEquals(3, stored.portIdx());
        assertEquals(Instant.parse("2026-01-15T10:00:00Z"), stored.startedAt());
        assertNull(stored.completedAt());
        assertEquals("scheduled", stored.metadata().get("source"));
        assertEquals(20, stored.metadata().get("offDuration"));
    }

    @Test
    void createAssignsIdWhenMissing() {
        String id = ledger.create(reboot(null, "sch-1", Instant.now()));

        assertTrue(id.startsWith("run-"));
        assertTrue(ledger.findById(id).isPresent());
    }

    @Test
    void finishMergesMetadataAndSetsDuration() {
        Instant started = Instant.now().minusSeconds(42);
        ledger.create(reboot("run-2", "sch-1", started));

        assertTrue(ledger.finish("run-2", RunStatus.COMPLETED, null, Map.of("linkConfirmation", "CONFIRMED")));

        RunRecord stored = ledger.findById("run-2").orElseThrow();
        assertEquals(RunStatus.COMPLETED, stored.status());
        assertNotNull(stored.completedAt());
        assertTrue(stored.durationSeconds() >= 42);
        assertEquals("manual", stored.metadata().get("source"));
        assertEquals("CONFIRMED", stored.metadata().get("linkConfirmation"));
        assertNull(stored.errorMessage());
    }

    @Test
    void finishIsRefusedOnceTerminal() {
        ledger.create(reboot("run-3", "sch-1", Instant.now()));

        assertTrue(ledger.finish("run-3", RunStatus.FAILED, "Device offline", null));
        assertFalse(ledger.finish("run-3", RunStatus.COMPLETED, null, null));

        RunRecord stored = ledger.findById("run-3").orElseThrow();
        assertEquals(RunStatus.FAILED, stored.status());
        assertEquals("Device offline", stored.errorMessage());
    }

    @Test
    void finishOfUnknownRunIsRefused() {
        assertFalse(ledger.finish("run-missing", RunStatus.COMPLETED, null, null));
    }

    @Test
    void finishRejectsNonTerminalStatus() {
        ledger.create(reboot("run-4", null, Instant.now()));

        assertThrows(IllegalArgumentException.class, () -> ledger.finish("run-4", RunStatus.RUNNING, null, null));
    }

    @Test
    void longErrorsAreTruncated() {
        ledger.create(reboot("run-5", null, Instant.now()));

        ledger.finish("run-5", RunStatus.FAILED, "x".repeat(5000), null);

        assertEquals(2048, ledger.findById("run-5").orElseThrow().errorMessage().length());
    }

    @Test
    void queriesReturnNewestFirst() {
        Instant base = Instant.parse("2026-01-15T10:00:00Z");
        ledger.create(reboot("run-a", "sch-1", base));
        ledger.create(reboot("run-b", "sch-2", base.plusSeconds(60)));
        ledger.create(reboot("run-c", "sch-1", base.plusSeconds(120)));
        ledger.finish("run-b", RunStatus.COMPLETED, null, null);

        assertEquals(List.of("run-c", "run-b", "run-a"), ids(ledger.findRecent(10)));
        assertEquals(List.of("run-c", "run-b"), ids(ledger.findRecent(2)));
        assertEquals(List.of("run-c", "run-a"), ids(ledger.findBySchedule("sch-1", 10)));
        assertEquals(List.of("run-c", "run-a"), ids(ledger.findByStatus(RunStatus.RUNNING)));
        assertEquals(List.of("run-b"), ids(ledger.findByStatus(RunStatus.COMPLETED)));
    }

    private static RunRecord reboot(String id, String scheduleId, Instant startedAt) {
        return RunRecord.builder()
                .id(id)
                .scheduleId(scheduleId)
                .kind(JobKind.REBOOT)
                .deviceId("sw-1")
                .deviceName("Lobby Switch")
                .startedAt(startedAt)
                .source(TriggerSource.MANUAL)
                .build();
    }

    private static List<String> ids(List<RunRecord> runs) {
        return runs.stream().map(RunRecord::id).toList();
    }
}
