package switchkeeper.engine.repository;

import switchkeeper.engine.model.PortSchedule;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for port cycle schedule persistence.
 */
public interface PortScheduleRepository {

    void save(PortSchedule schedule);

    /**
     * @return true if a row was updated
     */
    boolean update(PortSchedule schedule);

    Optional<PortSchedule> findById(String scheduleId);

    List<PortSchedule> findAll();

    List<PortSchedule> findEnabled();

    /**
     * Enabled schedules whose stored site is {@code siteName}.
     */
    List<PortSchedule> findEnabledBySite(String siteName);

    void markRun(String scheduleId, Instant at);

    boolean delete(String scheduleId);

    /**
     * @return unique ID like "psch-{uuid}"
     */
    String generateId();
}
