package switchkeeper.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import switchkeeper.engine.model.Schedule;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Response DTO for a device reboot schedule.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScheduleResponse(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("deviceIds") List<String> deviceIds,
        @JsonProperty("siteName") String siteName,
        @JsonProperty("frequency") String frequency,
        @JsonProperty("timeOfDay") String timeOfDay,
        @JsonProperty("dayOfWeek") Integer dayOfWeek,
        @JsonProperty("dayOfMonth") Integer dayOfMonth,
        @JsonProperty("mode") String mode,
        @JsonProperty("delayBetweenDevices") int delayBetweenDevices,
        @JsonProperty("maxWaitTime") int maxWaitTime,
        @JsonProperty("continueOnFailure") boolean continueOnFailure,
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt,
        @JsonProperty("lastRunAt") Instant lastRunAt) {

    public static ScheduleResponse from(Schedule s) {
        return new ScheduleResponse(
                s.id(),
                s.name(),
                s.description(),
                s.deviceIds(),
                s.siteName(),
                s.recurrence().frequency(),
                s.recurrence().timeOfDay(),
                s.recurrence().dayOfWeek(),
                s.recurrence().dayOfMonth(),
                s.mode().name().toLowerCase(Locale.ROOT),
                s.delayBetweenDevices(),
                s.maxWaitTime(),
                s.continueOnFailure(),
                s.enabled(),
                s.createdAt(),
                s.updatedAt(),
                s.lastRunAt());
    }
}
