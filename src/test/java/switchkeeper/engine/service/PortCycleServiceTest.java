package switchkeeper.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;
import switchkeeper.engine.config.EngineConfig;
import switchkeeper.engine.core.Poller;
import switchkeeper.engine.core.Sleeper;
import switchkeeper.engine.gateway.DeviceNotFoundException;
import switchkeeper.engine.lock.DeviceLockRegistry;
import switchkeeper.engine.model.Confirmation;
import switchkeeper.engine.model.DeviceHandle;
import switchkeeper.engine.model.JobKind;
import switchkeeper.engine.model.PoeMode;
import switchkeeper.engine.model.PortCycleOutcome;
import switchkeeper.engine.model.PortOverride;
import switchkeeper.engine.model.PortState;
import switchkeeper.engine.model.RunRecord;
import switchkeeper.engine.model.RunStatus;
import switchkeeper.engine.model.TriggerSource;
import switchkeeper.engine.store.Database;
import switchkeeper.engine.store.JdbcRunLedger;
import switchkeeper.engine.support.FakeGateway;
import switchkeeper.engine.support.RecordingSleeper;
import switchkeeper.engine.support.TestDatabases;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PortCycleServiceTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static Database db;
    private static JdbcRunLedger ledger;

    private FakeGateway gateway;
    private RecordingSleeper sleeper;
    private PortCycleService service;

    @BeforeAll
    static void setupDb() {
        db = TestDatabases.database("port-cycle");
        ledger = new JdbcRunLedger(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void setUp() throws Exception {
        gateway = new FakeGateway();
        gateway.addDevice("sw-1", "Lobby Switch")
                .port(3, "Camera", "net-cams")
                .port(4, "AP", "")
                .override(json("""
                        {"port_idx":3,"name":"Camera","forward":"customize","native_networkconf_id":"net-cams",
                         "tagged_vlan_mgmt":"custom","excluded_networkconf_ids":["net-guest"],"poe_mode":"auto"}
                        """));
        sleeper = new RecordingSleeper();
        EngineConfig config = EngineConfig.defaults()
                .withPortTiming(Duration.ofSeconds(10), Duration.ofSeconds(300));
        service = new PortCycleService(gateway, new DeviceLockRegistry(), ledger, new Poller(sleeper), config);
    }

    @Test
    void fullCycleRestoresExactOverride() throws Exception {
        PortOverride before = gateway.currentOverride("sw-1", 3);

        PortCycleOutcome outcome = service.cyclePort("sw-1", 3, Duration.ofSeconds(20), null, false);

        assertEquals(Confirmation.CONFIRMED, outcome.linkConfirmation());
        assertFalse(outcome.hasWarning());

        List<FakeGateway.OverrideWrite> writes = gateway.overrideWrites();
        assertEquals(2, writes.size());
        assertEquals("disabled", writes.get(0).override().forward());
        assertEquals("", writes.get(0).override().nativeNetworkId());
        assertEquals(before, writes.get(1).override(), "restore must write the captured override verbatim");
        assertEquals(before, gateway.currentOverride("sw-1", 3));
        assertTrue(sleeper.sleeps().contains(Duration.ofSeconds(20)), "port should be held off for the duration");
    }

    @Test
    void disableTimeoutRestoresOriginalAndFails() {
        gateway.keepPortUp("sw-1", 3);
        PortOverride before = gateway.currentOverride("sw-1", 3);

        PortTransitionTimeoutException e = assertThrows(PortTransitionTimeoutException.class,
                () -> service.cyclePort("sw-1", 3, Duration.ofSeconds(15), null, false));

        assertTrue(e.getMessage().contains("300"));
        List<FakeGateway.OverrideWrite> writes = gateway.overrideWrites();
        assertEquals(2, writes.size());
        assertEquals(before, writes.get(1).override());
        assertFalse(sleeper.sleeps().contains(Duration.ofSeconds(15)), "hold must not start when the port never went down");
    }

    @Test
    void reenableTimeoutIsUnconfirmedNotFailed() {
        gateway.keepPortDown("sw-1", 3);

        PortCycleOutcome outcome = service.cyclePort("sw-1", 3, Duration.ofSeconds(15), null, false);

        assertEquals(Confirmation.UNCONFIRMED, outcome.linkConfirmation());
        assertTrue(outcome.hasWarning());
        assertEquals(2, gateway.overrideWrites().size());
    }

    @Test
    void poeCycleOnlyTouchesPoeMode() {
        PortCycleOutcome outcome = service.cyclePort("sw-1", 3, Duration.ofSeconds(15), null, true);

        assertEquals(Confirmation.NOT_CHECKED, outcome.linkConfirmation());
        assertEquals(List.of(
                new FakeGateway.PoeCall("sw-1", 3, PoeMode.OFF),
                new FakeGateway.PoeCall("sw-1", 3, PoeMode.AUTO)), gateway.poeCalls());
        assertTrue(gateway.overrideWrites().isEmpty());
        assertTrue(sleeper.total().compareTo(Duration.ofSeconds(15)) >= 0);
    }

    @Test
    void missingDeviceIsReported() {
        assertThrows(DeviceNotFoundException.class,
                () -> service.cyclePort("ghost", 1, Duration.ofSeconds(15), null, false));
    }

    @Test
    void captureSynthesizesOverrideFromPortTable() {
        DeviceHandle device = new DeviceHandle("sw-2", "mac", "Switch", "m", "usw", true,
                List.of(new PortState(5, "Uplink", true, "auto", "native", "net-lan")),
                List.of());

        PortOverride saved = PortCycleService.captureOverride(device, 5);

        assertEquals(5, saved.portIdx());
        assertEquals("Uplink", saved.text(PortOverride.NAME));
        assertEquals("net-lan", saved.nativeNetworkId());
        assertEquals("native", saved.forward());
    }

    @Test
    void captureFillsEmptyNativeNetworkFromPortTable() throws Exception {
        DeviceHandle device = new DeviceHandle("sw-2", "mac", "Switch", "m", "usw", true,
                List.of(new PortState(2, "Desk", true, "auto", "all", "net-office")),
                List.of(PortOverride.of(json("{\"port_idx\":2,\"name\":\"Desk\",\"native_networkconf_id\":\"\"}"))));

        PortOverride saved = PortCycleService.captureOverride(device, 2);

        assertEquals("net-office", saved.nativeNetworkId());
        assertEquals("Desk", saved.text(PortOverride.NAME));
    }

    @Test
    void trackedRunRecordsOutcome() {
        PortCycleRequest request = new PortCycleRequest("sw-1", 3, false, 15, null);

        RunRecord run = service.runTracked(request, RunContext.manual("Lobby Switch Port 3", "Default"));

        assertEquals(RunStatus.COMPLETED, run.status());
        RunRecord stored = ledger.findById(run.id()).orElseThrow();
        assertEquals(RunStatus.COMPLETED, stored.status());
        assertEquals(JobKind.PORT_CYCLE, stored.kind());
        assertEquals("Lobby Switch Port 3", stored.deviceName());
        assertEquals("manual", stored.metadata().get("source"));
        assertEquals("CONFIRMED", stored.metadata().get("linkConfirmation"));
        assertNotNull(stored.completedAt());
    }

    @Test
    void trackedRunRecordsFailure() {
        gateway.keepPortUp("sw-1", 3);
        PortCycleRequest request = new PortCycleRequest("sw-1", 3, false, 15, null);

        RunRecord run = service.runTracked(request, RunContext.manual(null, null));

        assertEquals(RunStatus.FAILED, run.status());
        RunRecord stored = ledger.findById(run.id()).orElseThrow();
        assertEquals(RunStatus.FAILED, stored.status());
        assertEquals("sw-1 Port 3", stored.deviceName());
        assertNotNull(stored.errorMessage());
    }

    @Test
    void portDisplayNameFallsBackToDeviceId() {
        assertEquals("Lobby Switch Port 3", service.portDisplayName("sw-1", 3, null));
        assertEquals("ghost Port 1", service.portDisplayName("ghost", 1, null));
    }

    @Test
    void concurrentCyclesOnOneDeviceNeverOverlap() throws Exception {
        assertEquals(1, maxOverlapOf("sw-1", "sw-1"));
    }

    @Test
    void cyclesAddressedByIdAndMacShareOneLock() throws Exception {
        assertEquals(1, maxOverlapOf("sw-1", "mac-sw-1"));
    }

    @Test
    void refusedFinishReportsStoredOutcome() {
        PortCycleRequest request = new PortCycleRequest("sw-1", 3, true, 15, null);
        RunRecord run = service.startRun(request, new RunContext(null, TriggerSource.BULK, null, null));
        assertTrue(ledger.finish(run.id(), RunStatus.COMPLETED, null, Map.of("linkConfirmation", "NOT_CHECKED")));

        RunRecord reported = service.abandon(run, "Interrupted before start");

        assertEquals(RunStatus.COMPLETED, reported.status());
        assertNull(reported.errorMessage());
        assertEquals(RunStatus.COMPLETED, ledger.findById(run.id()).orElseThrow().status());
    }

    @Test
    void deviceNamesResolveByIdAndMac() {
        Map<String, String> names = service.deviceNames(null);

        assertEquals("Lobby Switch Port 3", PortCycleService.portDisplayName(names, "sw-1", 3));
        assertEquals("Lobby Switch Port 4", PortCycleService.portDisplayName(names, "MAC-SW-1", 4));
        assertEquals("ghost Port 1", PortCycleService.portDisplayName(names, "ghost", 1));
    }

    /**
     * Runs two full cycles at once, on ports 3 and 4 of the same switch, and returns the
     * largest number of cycles seen between their disable and restore writes.
     */
    private int maxOverlapOf(String firstAddress, String secondAddress) throws Exception {
        OverlapCountingGateway counting = new OverlapCountingGateway();
        counting.addDevice("sw-1", "Lobby Switch")
                .port(3, "Camera", "net-cams")
                .port(4, "AP", "net-lan");
        EngineConfig config = EngineConfig.defaults()
                .withPortTiming(Duration.ofMillis(5), Duration.ofSeconds(5));
        PortCycleService concurrent = new PortCycleService(counting, new DeviceLockRegistry(), ledger,
                new Poller(Sleeper.SYSTEM), config);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<PortCycleOutcome>> results = new ArrayList<>();
            results.add(pool.submit(() -> {
                start.await();
                return concurrent.cyclePort(firstAddress, 3, Duration.ofMillis(150), null, false);
            }));
            results.add(pool.submit(() -> {
                start.await();
                return concurrent.cyclePort(secondAddress, 4, Duration.ofMillis(150), null, false);
            }));
            start.countDown();

            for (Future<PortCycleOutcome> result : results) {
                assertEquals(Confirmation.CONFIRMED, result.get(10, TimeUnit.SECONDS).linkConfirmation());
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(4, counting.overrideWrites().size());
        return counting.maxActive();
    }

    /** Counts cycles between their disable write and their restore write */
    static class OverlapCountingGateway extends FakeGateway {
        private int active;
        private int maxActive;

        @Override
        public synchronized void setPortOverride(String deviceId, PortOverride override, String site) {
            if ("disabled".equals(override.forward())) {
                active++;
                maxActive = Math.max(maxActive, active);
            } else {
                active--;
            }
            super.setPortOverride(deviceId, override, site);
        }

        synchronized int maxActive() {
            return maxActive;
        }
    }

    private static JsonNode json(String s) throws Exception {
        return MAPPER.readTree(s);
    }
}
