package switchkeeper.engine.store;

import org.junit.jupiter.api.*;
import switchkeeper.engine.model.RebootMode;
import switchkeeper.engine.model.Recurrence;
import switchkeeper.engine.model.Schedule;
import switchkeeper.engine.support.TestDatabases;

import java.sql.Connection;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcScheduleRepositoryTest {

    private static Database db;
    private static JdbcScheduleRepository repo;

    @BeforeAll
    static void setupDb() {
        db = TestDatabases.database("schedules");
        repo = new JdbcScheduleRepository(db);
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
            st.execute("DELETE FROM schedules");
            conn.commit();
        }
    }

    @Test
    void saveAndFindPreservesFields() {
        Schedule schedule = Schedule.builder()
                .id(repo.generateId())
                .name("Weekly APs")
                .description("Access points, one at a time")
                .deviceIds(List.of("ap-3", "ap-1", "aa:bb:cc:dd:ee:ff"))
                .siteName("branch")
                .recurrence(Recurrence.weekly(2, "04:30"))
                .mode(RebootMode.PARALLEL)
                .delayBetweenDevices(60)
                .maxWaitTime(120)
                .continueOnFailure(true)
                .createdAt(Instant.parse("2026-01-01T00:00:00Z"))
                .updatedAt(Instant.parse("2026-01-02T00:00:00Z"))
                .build();

        repo.save(schedule);

        Schedule found = repo.findById(schedule.id()).orElseThrow();
        assertEquals("Weekly APs", found.name());
        assertEquals("Access points, one at a time", found.description());
        assertEquals(List.of("ap-3", "ap-1", "aa:bb:cc:dd:ee:ff"), found.deviceIds());
        assertEquals("branch", found.siteName());
        assertEquals(Recurrence.weekly(2, "04:30"), found.recurrence());
        assertEquals(RebootMode.PARALLEL, found.mode());
        assertEquals(60, found.delayBetweenDevices());
        assertEquals(120, found.maxWaitTime());
        assertTrue(found.continueOnFailure());
        assertTrue(found.enabled());
        assertEquals(Instant.parse("2026-01-01T00:00:00Z"), found.createdAt());
        assertNull(found.lastRunAt());
    }

    @Test
    void generatedIdsArePrefixed() {
        assertTrue(repo.generateId().startsWith("sch-"));
        assertNotEquals(repo.generateId(), repo.generateId());
    }

    @Test
    void updateOverwritesRow() {
        Schedule schedule = schedule("Nightly", true);
        repo.save(schedule);

        Schedule changed = schedule.toBuilder()
                .name("Nightly core")
                .deviceIds(List.of("sw-9"))
                .recurrence(Recurrence.monthly(15, "02:00"))
                .build();

        assertTrue(repo.update(changed));

        Schedule found = repo.findById(schedule.id()).orElseThrow();
        assertEquals("Nightly core", found.name());
        assertEquals(List.of("sw-9"), found.deviceIds());
        assertEquals(Recurrence.monthly(15, "02:00"), found.recurrence());
    }

    @Test
    void updateOfMissingScheduleReportsFalse() {
        assertFalse(repo.update(schedule("Ghost", true)));
    }

    @Test
    void findEnabledSkipsDisabled() {
        Schedule on = schedule("On", true);
        Schedule off = schedule("Off", false);
        repo.save(on);
        repo.save(off);

        assertEquals(2, repo.findAll().size());
        assertEquals(List.of(on.id()), repo.findEnabled().stream().map(Schedule::id).toList());
    }

    @Test
    void markRunStampsLastRun() {
        Schedule schedule = schedule("Nightly", true);
        repo.save(schedule);
        Instant at = Instant.parse("2026-01-15T03:00:00Z");

        repo.markRun(schedule.id(), at);

        assertEquals(at, repo.findById(schedule.id()).orElseThrow().lastRunAt());
    }

    @Test
    void deleteRemovesRow() {
        Schedule schedule = schedule("Nightly", true);
        repo.save(schedule);

        assertTrue(repo.delete(schedule.id()));
        assertFalse(repo.delete(schedule.id()));
        assertTrue(repo.findById(schedule.id()).isEmpty());
    }

    private static Schedule schedule(String name, boolean enabled) {
        return Schedule.builder()
                .id(repo.generateId())
                .name(name)
                .deviceIds(List.of("sw-1", "sw-2"))
                .recurrence(Recurrence.daily("03:00"))
                .enabled(enabled)
                .build();
    }
}
