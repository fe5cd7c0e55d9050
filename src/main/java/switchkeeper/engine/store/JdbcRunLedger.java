package switchkeeper.engine.store;

import switchkeeper.engine.model.JobKind;
import switchkeeper.engine.model.RunRecord;
import switchkeeper.engine.model.RunStatus;
import switchkeeper.engine.repository.RunLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of RunLedger.
 * <p>
 * {@link #finish} reads and updates inside one transaction and only touches rows still
 * RUNNING, so a record reaches a terminal status at most once.
 */
public class JdbcRunLedger implements RunLedger {

    private static final Logger log = LoggerFactory.getLogger(JdbcRunLedger.class);

    private final Database db;

    public JdbcRunLedger(Database db) {
        this.db = db;
    }

    @Override
    public String create(RunRecord run) {
        String id = run.id() != null ? run.id() : generateId();
        String sql = """
                    INSERT INTO run_records (id, schedule_id, kind, device_id, device_name, port_idx, status,
                        started_at, metadata)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, id);
            ps.setString(2, run.scheduleId());
            ps.setString(3, run.kind().name());
            ps.setString(4, run.deviceId());
            ps.setString(5, run.deviceName());
            Columns.setNullableInt(ps, 6, run.portIdx());
            ps.setString(7, RunStatus.RUNNING.name());
            ps.setTimestamp(8, Timestamp.from(run.startedAt() != null ? run.startedAt() : Instant.now()));
            ps.setString(9, Columns.writeJson(run.metadata()));

            ps.executeUpdate();
            conn.commit();

            log.debug("Created run {} ({} on {})", id, run.kind(), run.deviceId());
            return id;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create run record: " + id, e);
        }
    }

    @Override
    public boolean finish(String runId, RunStatus status, String error, Map<String, Object> extraMetadata) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }

        String sql = """
                    UPDATE run_records SET status = ?, completed_at = ?, duration_seconds = ?,
                        error_message = ?, metadata = ?
                    WHERE id = ? AND status = 'RUNNING'
                """;

        try (Connection conn = db.getConnection()) {
            RunRecord current = select(conn, runId).orElse(null);
            if (current == null || current.isTerminal()) {
                conn.rollback();
                log.warn("Refusing to finish run {}: {}", runId,
                        current == null ? "not found" : "already " + current.status());
                return false;
            }

            RunRecord done = current.finished(status, Instant.now(), error, extraMetadata);

            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, done.status().name());
                ps.setTimestamp(2, Timestamp.from(done.completedAt()));
                if (done.durationSeconds() != null) {
                    ps.setLong(3, done.durationSeconds());
                } else {
                    ps.setNull(3, Types.BIGINT);
                }
                ps.setString(4, truncate(done.errorMessage()));
                ps.setString(5, Columns.writeJson(done.metadata()));
                ps.setString(6, runId);

                int updated = ps.executeUpdate();
                conn.commit();

                if (updated > 0) {
                    log.debug("Run {} finished: {}", runId, status);
                }
                return updated > 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to finish run record: " + runId, e);
        }
    }

    @Override
    public Optional<RunRecord> findById(String runId) {
        try (Connection conn = db.getConnection()) {
            return select(conn, runId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find run record: " + runId, e);
        }
    }

    @Override
    public List<RunRecord> findRecent(int limit) {
        String sql = "SELECT * FROM run_records ORDER BY started_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find recent runs", e);
        }
    }

    @Override
    public List<RunRecord> findBySchedule(String scheduleId, int limit) {
        String sql = "SELECT * FROM run_records WHERE schedule_id = ? ORDER BY started_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, scheduleId);
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find runs for schedule: " + scheduleId, e);
        }
    }

    @Override
    public List<RunRecord> findByStatus(RunStatus status) {
        String sql = "SELECT * FROM run_records WHERE status = ? ORDER BY started_at DESC";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find runs by status", e);
        }
    }

    @Override
    public String generateId() {
        return "run-" + UUID.randomUUID().toString().substring(0, 8);
    }

    // --- Helpers ---

    private Optional<RunRecord> select(Connection conn, String runId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM run_records WHERE id = ?")) {
            ps.setString(1, runId);
            ResultSet rs = ps.executeQuery();
            if (rs.next()) {
                return Optional.of(mapRow(rs));
            }
            return Optional.empty();
        }
    }

    private List<RunRecord> executeQuery(PreparedStatement ps) throws SQLException {
        List<RunRecord> runs = new ArrayList<>();
        ResultSet rs = ps.executeQuery();
        while (rs.next()) {
            runs.add(mapRow(rs));
        }
        return runs;
    }

    private RunRecord mapRow(ResultSet rs) throws SQLException {
        long duration = rs.getLong("duration_seconds");
        Long durationSeconds = rs.wasNull() ? null : duration;

        return RunRecord.builder()
                .id(rs.getString("id"))
                .scheduleId(rs.getString("schedule_id"))
                .kind(JobKind.valueOf(rs.getString("kind")))
                .deviceId(rs.getString("device_id"))
                .deviceName(rs.getString("device_name"))
                .portIdx(Columns.getNullableInt(rs, "port_idx"))
                .status(RunStatus.valueOf(rs.getString("status")))
                .startedAt(Columns.toInstant(rs.getTimestamp("started_at")))
                .completedAt(Columns.toInstant(rs.getTimestamp("completed_at")))
                .durationSeconds(durationSeconds)
                .errorMessage(rs.getString("error_message"))
                .metadata(Columns.readMap(rs.getString("metadata")))
                .build();
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= 2048) {
            return message;
        }
        return message.substring(0, 2045) + "...";
    }
}
