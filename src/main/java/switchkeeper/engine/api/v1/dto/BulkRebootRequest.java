package switchkeeper.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request DTO for rebooting several devices.
 * POST /api/v1/devices/bulk-reboot
 */
public record BulkRebootRequest(
        @JsonProperty("deviceIds") List<String> deviceIds,
        @JsonProperty("siteName") String siteName) {

    public void validate() {
        if (deviceIds == null || deviceIds.isEmpty()) {
            throw new IllegalArgumentException("deviceIds must not be empty");
        }
        for (String id : deviceIds) {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("deviceIds must not contain blank entries");
            }
        }
    }
}
