package switchkeeper.engine.store;

import org.junit.jupiter.api.*;
import switchkeeper.engine.model.PortSchedule;
import switchkeeper.engine.model.Recurrence;
import switchkeeper.engine.support.TestDatabases;

import java.sql.Connection;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcPortScheduleRepositoryTest {

    private static Database db;
    private static JdbcPortScheduleRepository repo;

    @BeforeAll
    static void setupDb() {
        db = TestDatabases.database("port-schedules");
        repo = new JdbcPortScheduleRepository(db);
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
            st.execute("DELETE FROM port_schedules");
            conn.commit();
        }
    }

    @Test
    void saveAndFindPreservesFields() {
        PortSchedule schedule = PortSchedule.builder()
                .id(repo.generateId())
                .name("Camera 7")
                .deviceId("sw-1")
                .siteName("hq")
                .portIdx(7)
                .recurrence(Recurrence.daily("05:15"))
                .poeOnly(false)
                .offDuration(45)
                .build();

        repo.save(schedule);

        PortSchedule found = repo.findById(schedule.id()).orElseThrow();
        assertTrue(found.id().startsWith("psch-"));
        assertEquals("Camera 7", found.name());
        assertEquals("sw-1", found.deviceId());
        assertEquals("hq", found.siteName());
        assertEquals(7, found.portIdx());
        assertEquals(Recurrence.daily("05:15"), found.recurrence());
        assertFalse(found.poeOnly());
        assertEquals(45, found.offDuration());
        assertTrue(found.enabled());
    }

    @Test
    void updateAndToggle() {
        PortSchedule schedule = port("hq", 2, true);
        repo.save(schedule);

        assertTrue(repo.update(schedule.toBuilder().offDuration(90).enabled(false).build()));

        PortSchedule found = repo.findById(schedule.id()).orElseThrow();
        assertEquals(90, found.offDuration());
        assertFalse(found.enabled());
        assertTrue(repo.findEnabled().isEmpty());
    }

    @Test
    void findEnabledBySiteOrdersByPort() {
        PortSchedule p8 = port("hq", 8, true);
        PortSchedule p2 = port("hq", 2, true);
        PortSchedule p5 = port("hq", 5, true);
        PortSchedule disabled = port("hq", 1, false);
        PortSchedule otherSite = port("branch", 3, true);
        for (PortSchedule p : List.of(p8, p2, p5, disabled, otherSite)) {
            repo.save(p);
        }

        List<Integer> ports = repo.findEnabledBySite("hq").stream().map(PortSchedule::portIdx).toList();

        assertEquals(List.of(2, 5, 8), ports);
        assertTrue(repo.findEnabledBySite("nowhere").isEmpty());
        assertEquals(4, repo.findEnabled().size());
    }

    @Test
    void markRunAndDelete() {
        PortSchedule schedule = port("hq", 4, true);
        repo.save(schedule);
        Instant at = Instant.parse("2026-02-01T05:15:00Z");

        repo.markRun(schedule.id(), at);
        assertEquals(at, repo.findById(schedule.id()).orElseThrow().lastRunAt());

        assertTrue(repo.delete(schedule.id()));
        assertTrue(repo.findById(schedule.id()).isEmpty());
        assertFalse(repo.delete(schedule.id()));
    }

    private static PortSchedule port(String site, int portIdx, boolean enabled) {
        return PortSchedule.builder()
                .id(repo.generateId())
                .name("Port " + portIdx)
                .deviceId("sw-1")
                .siteName(site)
                .portIdx(portIdx)
                .recurrence(Recurrence.hourly(0))
                .enabled(enabled)
                .build();
    }
}
