package switchkeeper.engine.model;

import java.util.List;

/**
 * Aggregated result of a bulk reboot request.
 */
public record BulkRebootResult(
        List<RebootOutcome> rebooted,
        List<RebootOutcome> failed,
        int total) {

    public boolean success() {
        return failed.isEmpty();
    }
}
