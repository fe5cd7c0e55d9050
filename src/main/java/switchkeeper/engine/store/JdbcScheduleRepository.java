package switchkeeper.engine.store;

import switchkeeper.engine.model.RebootMode;
import switchkeeper.engine.model.Recurrence;
import switchkeeper.engine.model.Schedule;
import switchkeeper.engine.repository.ScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of ScheduleRepository.
 */
public class JdbcScheduleRepository implements ScheduleRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcScheduleRepository.class);

    private final Database db;

    public JdbcScheduleRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Schedule schedule) {
        String sql = """
                    INSERT INTO schedules (name, description, device_ids, site_name, frequency, time_of_day,
                        day_of_week, day_of_month, mode, delay_between_devices, max_wait_time,
                        continue_on_failure, enabled, created_at, updated_at, last_run_at, id)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            bind(ps, schedule);
            ps.executeUpdate();
            conn.commit();

            log.debug("Saved schedule: {}", schedule.id());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save schedule: " + schedule.id(), e);
        }
    }

    @Override
    public boolean update(Schedule schedule) {
        String sql = """
                    UPDATE schedules SET name = ?, description = ?, device_ids = ?, site_name = ?, frequency = ?,
                        time_of_day = ?, day_of_week = ?, day_of_month = ?, mode = ?, delay_between_devices = ?,
                        max_wait_time = ?, continue_on_failure = ?, enabled = ?, created_at = ?, updated_at = ?,
                        last_run_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            bind(ps, schedule);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update schedule: " + schedule.id(), e);
        }
    }

    @Override
    public Optional<Schedule> findById(String scheduleId) {
        String sql = "SELECT * FROM schedules WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, scheduleId);
            ResultSet rs = ps.executeQuery();

            if (rs.next()) {
                return Optional.of(mapRow(rs));
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find schedule: " + scheduleId, e);
        }
    }

    @Override
    public List<Schedule> findAll() {
        return executeQuery("SELECT * FROM schedules ORDER BY created_at DESC");
    }

    @Override
    public List<Schedule> findEnabled() {
        return executeQuery("SELECT * FROM schedules WHERE enabled = TRUE ORDER BY created_at");
    }

    @Override
    public void markRun(String scheduleId, Instant at) {
        String sql = "UPDATE schedules SET last_run_at = ? WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(at));
            ps.setString(2, scheduleId);
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark schedule run: " + scheduleId, e);
        }
    }

    @Override
    public boolean delete(String scheduleId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("DELETE FROM schedules WHERE id = ?")) {

            ps.setString(1, scheduleId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete schedule: " + scheduleId, e);
        }
    }

    @Override
    public String generateId() {
        return "sch-" + UUID.randomUUID().toString().substring(0, 8);
    }

    // --- Helpers ---

    // Column order matches both INSERT and UPDATE: id goes last.
    private void bind(PreparedStatement ps, Schedule s) throws SQLException {
        Recurrence r = s.recurrence();
        Instant now = Instant.now();
        ps.setString(1, s.name());
        ps.setString(2, s.description());
        ps.setString(3, Columns.writeJson(s.deviceIds()));
        ps.setString(4, s.siteName());
        ps.setString(5, r.frequency());
        ps.setString(6, r.timeOfDay());
        Columns.setNullableInt(ps, 7, r.dayOfWeek());
        Columns.setNullableInt(ps, 8, r.dayOfMonth());
        ps.setString(9, s.mode().name());
        ps.setInt(10, s.delayBetweenDevices());
        ps.setInt(11, s.maxWaitTime());
        ps.setBoolean(12, s.continueOnFailure());
        ps.setBoolean(13, s.enabled());
        ps.setTimestamp(14, Timestamp.from(s.createdAt() != null ? s.createdAt() : now));
        ps.setTimestamp(15, Timestamp.from(s.updatedAt() != null ? s.updatedAt() : now));
        ps.setTimestamp(16, Columns.timestamp(s.lastRunAt()));
        ps.setString(17, s.id());
    }

    private List<Schedule> executeQuery(String sql) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            List<Schedule> schedules = new ArrayList<>();
            ResultSet rs = ps.executeQuery();
            while (rs.next()) {
                schedules.add(mapRow(rs));
            }
            return schedules;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to query schedules", e);
        }
    }

    private Schedule mapRow(ResultSet rs) throws SQLException {
        return Schedule.builder()
                .id(rs.getString("id"))
                .name(rs.getString("name"))
                .description(rs.getString("description"))
                .deviceIds(Columns.readStringList(rs.getString("device_ids")))
                .siteName(rs.getString("site_name"))
                .recurrence(new Recurrence(
                        rs.getString("frequency"),
                        rs.getString("time_of_day"),
                        Columns.getNullableInt(rs, "day_of_week"),
                        Columns.getNullableInt(rs, "day_of_month")))
                .mode(RebootMode.valueOf(rs.getString("mode")))
                .delayBetweenDevices(rs.getInt("delay_between_devices"))
                .maxWaitTime(rs.getInt("max_wait_time"))
                .continueOnFailure(rs.getBoolean("continue_on_failure"))
                .enabled(rs.getBoolean("enabled"))
                .createdAt(Columns.toInstant(rs.getTimestamp("created_at")))
                .updatedAt(Columns.toInstant(rs.getTimestamp("updated_at")))
                .lastRunAt(Columns.toInstant(rs.getTimestamp("last_run_at")))
                .build();
    }
}
