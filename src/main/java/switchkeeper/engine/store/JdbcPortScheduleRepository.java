package switchkeeper.engine.store;

import switchkeeper.engine.model.PortSchedule;
import switchkeeper.engine.model.Recurrence;
import switchkeeper.engine.repository.PortScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of PortScheduleRepository.
 */
public class JdbcPortScheduleRepository implements PortScheduleRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcPortScheduleRepository.class);

    private final Database db;

    public JdbcPortScheduleRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(PortSchedule schedule) {
        String sql = """
                    INSERT INTO port_schedules (name, description, device_id, site_name, port_idx, frequency,
                        time_of_day, day_of_week, day_of_month, poe_only, off_duration, enabled,
                        created_at, updated_at, last_run_at, id)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            bind(ps, schedule);
            ps.executeUpdate();
            conn.commit();

            log.debug("Saved port schedule: {}", schedule.id());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save port schedule: " + schedule.id(), e);
        }
    }

    @Override
    public boolean update(PortSchedule schedule) {
        String sql = """
                    UPDATE port_schedules SET name = ?, description = ?, device_id = ?, site_name = ?, port_idx = ?,
                        frequency = ?, time_of_day = ?, day_of_week = ?, day_of_month = ?, poe_only = ?,
                        off_duration = ?, enabled = ?, created_at = ?, updated_at = ?, last_run_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            bind(ps, schedule);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update port schedule: " + schedule.id(), e);
        }
    }

    @Override
    public Optional<PortSchedule> findById(String scheduleId) {
        String sql = "SELECT * FROM port_schedules WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, scheduleId);
            ResultSet rs = ps.executeQuery();

            if (rs.next()) {
                return Optional.of(mapRow(rs));
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find port schedule: " + scheduleId, e);
        }
    }

    @Override
    public List<PortSchedule> findAll() {
        return executeQuery("SELECT * FROM port_schedules ORDER BY created_at DESC", null);
    }

    @Override
    public List<PortSchedule> findEnabled() {
        return executeQuery("SELECT * FROM port_schedules WHERE enabled = TRUE ORDER BY created_at", null);
    }

    @Override
    public List<PortSchedule> findEnabledBySite(String siteName) {
        return executeQuery(
                "SELECT * FROM port_schedules WHERE enabled = TRUE AND site_name = ? ORDER BY port_idx, created_at",
                siteName);
    }

    @Override
    public void markRun(String scheduleId, Instant at) {
        String sql = "UPDATE port_schedules SET last_run_at = ? WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(at));
            ps.setString(2, scheduleId);
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark port schedule run: " + scheduleId, e);
        }
    }

    @Override
    public boolean delete(String scheduleId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("DELETE FROM port_schedules WHERE id = ?")) {

            ps.setString(1, scheduleId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete port schedule: " + scheduleId, e);
        }
    }

    @Override
    public String generateId() {
        return "psch-" + UUID.randomUUID().toString().substring(0, 8);
    }

    // --- Helpers ---

    private void bind(PreparedStatement ps, PortSchedule s) throws SQLException {
        Recurrence r = s.recurrence();
        Instant now = Instant.now();
        ps.setString(1, s.name());
        ps.setString(2, s.description());
        ps.setString(3, s.deviceId());
        ps.setString(4, s.siteName());
        ps.setInt(5, s.portIdx());
        ps.setString(6, r.frequency());
        ps.setString(7, r.timeOfDay());
        Columns.setNullableInt(ps, 8, r.dayOfWeek());
        Columns.setNullableInt(ps, 9, r.dayOfMonth());
        ps.setBoolean(10, s.poeOnly());
        ps.setInt(11, s.offDuration());
        ps.setBoolean(12, s.enabled());
        ps.setTimestamp(13, Timestamp.from(s.createdAt() != null ? s.createdAt() : now));
        ps.setTimestamp(14, Timestamp.from(s.updatedAt() != null ? s.updatedAt() : now));
        ps.setTimestamp(15, Columns.timestamp(s.lastRunAt()));
        ps.setString(16, s.id());
    }

    private List<PortSchedule> executeQuery(String sql, String param) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            if (param != null) {
                ps.setString(1, param);
            }
            List<PortSchedule> schedules = new ArrayList<>();
            ResultSet rs = ps.executeQuery();
            while (rs.next()) {
                schedules.add(mapRow(rs));
            }
            return schedules;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to query port schedules", e);
        }
    }

    private PortSchedule mapRow(ResultSet rs) throws SQLException {
        return PortSchedule.builder()
                .id(rs.getString("id"))
                .name(rs.getString("name"))
                .description(rs.getString("description"))
                .deviceId(rs.getString("device_id"))
                .siteName(rs.getString("site_name"))
                .portIdx(rs.getInt("port_idx"))
                .recurrence(new Recurrence(
                        rs.getString("frequency"),
                        rs.getString("time_of_day"),
                        Columns.getNullableInt(rs, "day_of_week"),
                        Columns.getNullableInt(rs, "day_of_month")))
                .poeOnly(rs.getBoolean("poe_only"))
                .offDuration(rs.getInt("off_duration"))
                .enabled(rs.getBoolean("enabled"))
                .createdAt(Columns.toInstant(rs.getTimestamp("created_at")))
                .updatedAt(Columns.toInstant(rs.getTimestamp("updated_at")))
                .lastRunAt(Columns.toInstant(rs.getTimestamp("last_run_at")))
                .build();
    }
}
