package switchkeeper.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import switchkeeper.engine.model.PortSchedule;

import java.time.Instant;

/**
 * Response DTO for a port cycle schedule.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PortScheduleResponse(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("deviceId") String deviceId,
        @JsonProperty("siteName") String siteName,
        @JsonProperty("portIdx") int portIdx,
        @JsonProperty("frequency") String frequency,
        @JsonProperty("timeOfDay") String timeOfDay,
        @JsonProperty("dayOfWeek") Integer dayOfWeek,
        @JsonProperty("dayOfMonth") Integer dayOfMonth,
        @JsonProperty("poeOnly") boolean poeOnly,
        @JsonProperty("offDuration") int offDuration,
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt,
        @JsonProperty("lastRunAt") Instant lastRunAt) {

    public static PortScheduleResponse from(PortSchedule s) {
        return new PortScheduleResponse(
                s.id(),
                s.name(),
                s.description(),
                s.deviceId(),
                s.siteName(),
                s.portIdx(),
                s.recurrence().frequency(),
                s.recurrence().timeOfDay(),
                s.recurrence().dayOfWeek(),
                s.recurrence().dayOfMonth(),
                s.poeOnly(),
                s.offDuration(),
                s.enabled(),
                s.createdAt(),
                s.updatedAt(),
                s.lastRunAt());
    }
}
