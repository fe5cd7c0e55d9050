package switchkeeper.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import switchkeeper.engine.model.BulkRebootResult;
import switchkeeper.engine.model.RebootOutcome;

import java.util.List;

/**
 * Response DTO for a bulk reboot.
 */
public record BulkRebootResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("rebooted") List<Entry> rebooted,
        @JsonProperty("failed") List<Entry> failed,
        @JsonProperty("total") int total) {

    public static BulkRebootResponse from(BulkRebootResult result) {
        return new BulkRebootResponse(
                result.success(),
                result.rebooted().stream().map(Entry::from).toList(),
                result.failed().stream().map(Entry::from).toList(),
                result.total());
    }

    /**
     * One device of the batch.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Entry(
            @JsonProperty("deviceId") String deviceId,
            @JsonProperty("deviceName") String deviceName,
            @JsonProperty("runId") String runId,
            @JsonProperty("error") String error) {

        static Entry from(RebootOutcome outcome) {
            return new Entry(
                    outcome.run().deviceId(),
                    outcome.run().deviceName(),
                    outcome.run().id(),
                    outcome.run().errorMessage());
        }
    }
}
