package switchkeeper.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import switchkeeper.engine.model.PortSchedule;
import switchkeeper.engine.model.Recurrence;

import java.util.Locale;

/**
 * Request DTO for creating or replacing a port cycle schedule.
 * POST /api/v1/port-schedules, PUT /api/v1/port-schedules/{id}
 */
public record PortScheduleRequest(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("deviceId") String deviceId,
        @JsonProperty("siteName") String siteName,
        @JsonProperty("portIdx") Integer portIdx,
        @JsonProperty("frequency") String frequency,
        @JsonProperty("timeOfDay") String timeOfDay,
        @JsonProperty("dayOfWeek") Integer dayOfWeek,
        @JsonProperty("dayOfMonth") Integer dayOfMonth,
        @JsonProperty("poeOnly") Boolean poeOnly,
        @JsonProperty("offDuration") Integer offDuration,
        @JsonProperty("enabled") Boolean enabled) {

    public void validate() {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (deviceId == null || deviceId.isBlank()) {
            throw new IllegalArgumentException("deviceId is required");
        }
        if (portIdx == null) {
            throw new IllegalArgumentException("portIdx is required");
        }
        if (frequency == null || frequency.isBlank()) {
            throw new IllegalArgumentException("frequency is required");
        }
    }

    public PortSchedule.Builder toBuilder() {
        PortSchedule.Builder builder = PortSchedule.builder()
                .name(name)
                .description(description)
                .deviceId(deviceId)
                .siteName(siteName)
                .portIdx(portIdx)
                .recurrence(new Recurrence(frequency.trim().toLowerCase(Locale.ROOT), timeOfDay, dayOfWeek,
                        dayOfMonth));
        if (poeOnly != null) {
            builder.poeOnly(poeOnly);
        }
        if (offDuration != null) {
            builder.offDuration(offDuration);
        }
        if (enabled != null) {
            builder.enabled(enabled);
        }
        return builder;
    }
}
