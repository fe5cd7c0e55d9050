package switchkeeper.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import switchkeeper.engine.model.DeviceHandle;

import java.util.Set;

/**
 * Response DTO for a controller device, without its port table.
 * GET /api/v1/devices, GET /api/v1/devices/{deviceId}
 */
public record DeviceResponse(
        @JsonProperty("id") String id,
        @JsonProperty("mac") String mac,
        @JsonProperty("name") String name,
        @JsonProperty("model") String model,
        @JsonProperty("type") String type,
        @JsonProperty("online") boolean online,
        @JsonProperty("isSwitch") boolean isSwitch,
        @JsonProperty("isAp") boolean isAp,
        @JsonProperty("portCount") int portCount) {

    private static final Set<String> AP_TYPES = Set.of("uap", "u7");

    public static DeviceResponse from(DeviceHandle device) {
        return new DeviceResponse(
                device.id(),
                device.mac(),
                device.name(),
                device.model(),
                device.type(),
                device.online(),
                "usw".equals(device.type()),
                AP_TYPES.contains(device.type()),
                device.ports().size());
    }
}
