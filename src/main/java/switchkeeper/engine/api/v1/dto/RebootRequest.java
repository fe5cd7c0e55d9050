package switchkeeper.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for a manual device reboot.
 * POST /api/v1/devices/reboot
 */
public record RebootRequest(
        @JsonProperty("deviceId") String deviceId,
        @JsonProperty("siteName") String siteName) {

    public void validate() {
        if (deviceId == null || deviceId.isBlank()) {
            throw new IllegalArgumentException("deviceId is required");
        }
    }
}
