package switchkeeper.engine.api.v1.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import switchkeeper.engine.model.PoeMode;
import switchkeeper.engine.model.PortSchedule;
import switchkeeper.engine.model.RebootMode;
import switchkeeper.engine.model.Recurrence;
import switchkeeper.engine.model.Schedule;
import switchkeeper.engine.service.PortCycleRequest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RequestDtoTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void scheduleRequestFillsModelDefaults() throws Exception {
        String json = """
                {
                  "name": "Nightly",
                  "deviceIds": ["sw-2", "sw-1"],
                  "frequency": " WEEKLY ",
                  "timeOfDay": "03:15",
                  "dayOfWeek": 4
                }
                """;

        ScheduleRequest req = mapper.readValue(json, ScheduleRequest.class);
        req.validate();
        Schedule schedule = req.toBuilder().id("sch-1").build();

        assertEquals(List.of("sw-2", "sw-1"), schedule.deviceIds());
        assertEquals(new Recurrence("weekly", "03:15", 4, null), schedule.recurrence());
        assertEquals(RebootMode.ROLLING, schedule.mode());
        assertEquals(300, schedule.delayBetweenDevices());
        assertEquals(300, schedule.maxWaitTime());
        assertFalse(schedule.continueOnFailure());
        assertTrue(schedule.enabled());
    }

    @Test
    void scheduleRequestValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> new ScheduleRequest(" ", null, List.of("sw-1"), null, "daily", null, null, null, null, null,
                        null, null, null).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new ScheduleRequest("n", null, List.of(), null, "daily", null, null, null, null, null, null,
                        null, null).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new ScheduleRequest("n", null, List.of("sw-1"), null, null, null, null, null, null, null,
                        null, null, null).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new ScheduleRequest("n", null, List.of("sw-1"), null, "daily", null, null, null, "sideways",
                        null, null, null, null).validate());
    }

    @Test
    void portScheduleRequestKeepsExplicitValues() throws Exception {
        String json = """
                {"name":"Cam","deviceId":"sw-1","portIdx":7,"frequency":"Hourly","timeOfDay":"00:20",
                 "poeOnly":false,"offDuration":60,"enabled":false}
                """;

        PortScheduleRequest req = mapper.readValue(json, PortScheduleRequest.class);
        req.validate();
        PortSchedule schedule = req.toBuilder().id("psch-1").build();

        assertEquals(7, schedule.portIdx());
        assertEquals("hourly", schedule.recurrence().frequency());
        assertFalse(schedule.poeOnly());
        assertEquals(60, schedule.offDuration());
        assertFalse(schedule.enabled());
    }

    @Test
    void portScheduleRequestRequiresPort() {
        PortScheduleRequest req = new PortScheduleRequest("Cam", null, "sw-1", null, null, "daily", null, null,
                null, null, null, null);

        assertThrows(IllegalArgumentException.class, req::validate);
    }

    @Test
    void cyclePortRequestDefaults() throws Exception {
        CyclePortRequest req = mapper.readValue("{\"deviceId\":\"sw-1\",\"portIdx\":3}", CyclePortRequest.class);
        req.validate();

        PortCycleRequest cycle = req.toCycleRequest();

        assertTrue(cycle.poeOnly());
        assertEquals(15, cycle.offDuration());
        assertNull(cycle.site());
    }

    @Test
    void cyclePortRequestBounds() {
        assertDoesNotThrow(() -> new CyclePortRequest("sw-1", 3, 5, null, null).validate());
        assertDoesNotThrow(() -> new CyclePortRequest("sw-1", 3, 300, null, null).validate());
        assertThrows(IllegalArgumentException.class, () -> new CyclePortRequest("sw-1", 3, 4, null, null).validate());
        assertThrows(IllegalArgumentException.class, () -> new CyclePortRequest("sw-1", 0, 20, null, null).validate());
        assertThrows(IllegalArgumentException.class, () -> new CyclePortRequest(null, 3, 20, null, null).validate());
    }

    @Test
    void bulkRebootRequestNeedsDevices() {
        assertThrows(IllegalArgumentException.class, () -> new BulkRebootRequest(List.of(), "hq").validate());
        assertDoesNotThrow(() -> new BulkRebootRequest(List.of("sw-1"), null).validate());
    }

    @Test
    void poeControlRequestParsesEveryControllerMode() throws Exception {
        PoeControlRequest req = mapper.readValue(
                "{\"deviceId\":\"sw-1\",\"portIdx\":7,\"mode\":\" Pasv24 \"}", PoeControlRequest.class);
        req.validate();

        assertEquals(PoeMode.PASV24, req.poeMode());
        assertEquals(PoeMode.PASSTHROUGH, new PoeControlRequest("sw-1", 7, "passthrough", null).poeMode());
        assertEquals(PoeMode.OFF, new PoeControlRequest("sw-1", 7, "off", null).poeMode());
    }

    @Test
    void poeControlRequestValidation() {
        assertThrows(IllegalArgumentException.class, () -> new PoeControlRequest("sw-1", 7, "turbo", null).validate());
        assertThrows(IllegalArgumentException.class, () -> new PoeControlRequest("sw-1", 7, " ", null).validate());
        assertThrows(IllegalArgumentException.class, () -> new PoeControlRequest("sw-1", 0, "auto", null).validate());
        assertThrows(IllegalArgumentException.class, () -> new PoeControlRequest(null, 7, "auto", null).validate());
    }
}
