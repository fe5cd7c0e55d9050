package switchkeeper.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import switchkeeper.engine.model.RunRecord;

import java.time.Instant;
import java.util.Map;

/**
 * Response DTO for a run record.
 * GET /api/v1/runs, GET /api/v1/runs/{runId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunResponse(
        @JsonProperty("runId") String runId,
        @JsonProperty("scheduleId") String scheduleId,
        @JsonProperty("kind") String kind,
        @JsonProperty("deviceId") String deviceId,
        @JsonProperty("deviceName") String deviceName,
        @JsonProperty("portIdx") Integer portIdx,
        @JsonProperty("status") String status,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt,
        @JsonProperty("durationSeconds") Long durationSeconds,
        @JsonProperty("errorMessage") String errorMessage,
        @JsonProperty("metadata") Map<String, Object> metadata) {

    public static RunResponse from(RunRecord run) {
        return new RunResponse(
                run.id(),
                run.scheduleId(),
                run.kind().wireName(),
                run.deviceId(),
                run.deviceName(),
                run.portIdx(),
                run.status().name(),
                run.startedAt(),
                run.completedAt(),
                run.durationSeconds(),
                run.errorMessage(),
                run.metadata().isEmpty() ? null : run.metadata());
    }
}
