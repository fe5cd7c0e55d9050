package switchkeeper.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import switchkeeper.engine.model.RebootMode;
import switchkeeper.engine.model.Recurrence;
import switchkeeper.engine.model.Schedule;

import java.util.List;
import java.util.Locale;

/**
 * Request DTO for creating or replacing a device reboot schedule.
 * POST /api/v1/schedules, PUT /api/v1/schedules/{id}
 */
public record ScheduleRequest(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("deviceIds") List<String> deviceIds,
        @JsonProperty("siteName") String siteName,
        @JsonProperty("frequency") String frequency,
        @JsonProperty("timeOfDay") String timeOfDay,
        @JsonProperty("dayOfWeek") Integer dayOfWeek,
        @JsonProperty("dayOfMonth") Integer dayOfMonth,
        @JsonProperty("mode") String mode,
        @JsonProperty("delayBetweenDevices") Integer delayBetweenDevices,
        @JsonProperty("maxWaitTime") Integer maxWaitTime,
        @JsonProperty("continueOnFailure") Boolean continueOnFailure,
        @JsonProperty("enabled") Boolean enabled) {

    /** Validate the request */
    public void validate() {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (deviceIds == null || deviceIds.isEmpty()) {
            throw new IllegalArgumentException("deviceIds must not be empty");
        }
        if (frequency == null || frequency.isBlank()) {
            throw new IllegalArgumentException("frequency is required");
        }
        parseMode();
    }

    /**
     * Draft for the schedule service. Omitted optional fields take the model defaults.
     * The frequency is stored as given; an unknown one only fails its own trigger.
     */
    public Schedule.Builder toBuilder() {
        Schedule.Builder builder = Schedule.builder()
                .name(name)
                .description(description)
                .deviceIds(deviceIds)
                .siteName(siteName)
                .recurrence(new Recurrence(frequency.trim().toLowerCase(Locale.ROOT), timeOfDay, dayOfWeek,
                        dayOfMonth))
                .mode(parseMode());
        if (delayBetweenDevices != null) {
            builder.delayBetweenDevices(delayBetweenDevices);
        }
        if (maxWaitTime != null) {
            builder.maxWaitTime(maxWaitTime);
        }
        if (continueOnFailure != null) {
            builder.continueOnFailure(continueOnFailure);
        }
        if (enabled != null) {
            builder.enabled(enabled);
        }
        return builder;
    }

    private RebootMode parseMode() {
        if (mode == null || mode.isBlank()) {
            return RebootMode.ROLLING;
        }
        try {
            return RebootMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("mode must be 'rolling' or 'parallel', got '" + mode + "'");
        }
    }
}
