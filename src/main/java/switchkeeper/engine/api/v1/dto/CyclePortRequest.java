package switchkeeper.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import switchkeeper.engine.model.PortSchedule;
import switchkeeper.engine.service.PortCycleRequest;

/**
 * Request DTO for a manual port cycle.
 * POST /api/v1/ports/cycle
 */
public record CyclePortRequest(
        @JsonProperty("deviceId") String deviceId,
        @JsonProperty("portIdx") Integer portIdx,
        @JsonProperty("offDuration") Integer offDuration,
        @JsonProperty("poeOnly") Boolean poeOnly,
        @JsonProperty("siteName") String siteName) {

    private static final int DEFAULT_OFF_DURATION = 15;

    public void validate() {
        if (deviceId == null || deviceId.isBlank()) {
            throw new IllegalArgumentException("deviceId is required");
        }
        if (portIdx == null || portIdx < 1) {
            throw new IllegalArgumentException("portIdx must be >= 1");
        }
        int off = effectiveOffDuration();
        if (off < PortSchedule.MIN_OFF_DURATION || off > PortSchedule.MAX_OFF_DURATION) {
            throw new IllegalArgumentException("offDuration must be between " + PortSchedule.MIN_OFF_DURATION
                    + " and " + PortSchedule.MAX_OFF_DURATION + " seconds");
        }
    }

    public PortCycleRequest toCycleRequest() {
        return new PortCycleRequest(deviceId, portIdx, poeOnly == null || poeOnly, effectiveOffDuration(),
                siteName);
    }

    private int effectiveOffDuration() {
        return offDuration != null ? offDuration : DEFAULT_OFF_DURATION;
    }
}
