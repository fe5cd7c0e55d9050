package switchkeeper.engine.repository;

import switchkeeper.engine.model.Schedule;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for reboot schedule persistence.
 */
public interface ScheduleRepository {

    /**
     * Save a new schedule.
     *
     * @param schedule the schedule to save
     */
    void save(Schedule schedule);

    /**
     * Overwrite an existing schedule.
     *
     * @return true if a row was updated
     */
    boolean update(Schedule schedule);

    Optional<Schedule> findById(String scheduleId);

    /**
     * Get all schedules, newest first.
     */
    List<Schedule> findAll();

    /**
     * Get enabled schedules; these are the ones that get triggers.
     */
    List<Schedule> findEnabled();

    /**
     * Stamp the last execution time.
     */
    void markRun(String scheduleId, Instant at);

    boolean delete(String scheduleId);

    /**
     * Generate a new unique schedule ID.
     *
     * @return unique ID like "sch-{uuid}"
     */
    String generateId();
}
