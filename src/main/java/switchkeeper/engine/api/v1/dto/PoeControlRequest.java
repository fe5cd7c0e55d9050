package switchkeeper.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import switchkeeper.engine.model.PoeMode;

/**
 * Request DTO for setting the PoE mode of one port.
 * POST /api/v1/devices/poe
 */
public record PoeControlRequest(
        @JsonProperty("deviceId") String deviceId,
        @JsonProperty("portIdx") Integer portIdx,
        @JsonProperty("mode") String mode,
        @JsonProperty("siteName") String siteName) {

    public void validate() {
        if (deviceId == null || deviceId.isBlank()) {
            throw new IllegalArgumentException("deviceId is required");
        }
        if (portIdx == null || portIdx < 1) {
            throw new IllegalArgumentException("portIdx must be >= 1");
        }
        if (mode == null || mode.isBlank()) {
            throw new IllegalArgumentException("mode is required");
        }
        poeMode();
    }

    /**
     * @throws IllegalArgumentException for a mode the controller does not know
     */
    public PoeMode poeMode() {
        return PoeMode.fromWire(mode.trim());
    }
}
