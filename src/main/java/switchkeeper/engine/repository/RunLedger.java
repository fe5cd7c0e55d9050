package switchkeeper.engine.repository;

import switchkeeper.engine.model.RunRecord;
import switchkeeper.engine.model.RunStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable log of operation runs.
 * <p>
 * A record is created RUNNING by the step that starts the operation and finished
 * exactly once by the same step. Finishing a record that is no longer RUNNING is
 * refused.
 */
public interface RunLedger {

    /**
     * Persist a RUNNING record. Assigns an id when the record has none.
     *
     * @return the record id
     */
    String create(RunRecord run);

    /**
     * Move a RUNNING record to its terminal status.
     *
     * @param status        COMPLETED or FAILED
     * @param error         error message, null on success
     * @param extraMetadata merged into the stored metadata, may be null
     * @return true if the record was RUNNING and is now terminal
     */
    boolean finish(String runId, RunStatus status, String error, Map<String, Object> extraMetadata);

    Optional<RunRecord> findById(String runId);

    /**
     * Most recent runs first.
     */
    List<RunRecord> findRecent(int limit);

    List<RunRecord> findBySchedule(String scheduleId, int limit);

    List<RunRecord> findByStatus(RunStatus status);

    /**
     * @return unique ID like "run-{uuid}"
     */
    String generateId();
}
