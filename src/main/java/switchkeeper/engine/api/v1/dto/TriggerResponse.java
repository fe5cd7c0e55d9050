package switchkeeper.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import switchkeeper.engine.scheduler.TriggerInfo;

import java.time.Instant;

/**
 * Response DTO for one registered trigger.
 * GET /api/v1/scheduler/triggers
 */
public record TriggerResponse(
        @JsonProperty("key") String key,
        @JsonProperty("scheduleId") String scheduleId,
        @JsonProperty("name") String name,
        @JsonProperty("rule") String rule,
        @JsonProperty("nextFire") Instant nextFire) {

    public static TriggerResponse from(TriggerInfo info) {
        return new TriggerResponse(info.key(), info.scheduleId(), info.name(), info.rule(), info.nextFire());
    }
}
