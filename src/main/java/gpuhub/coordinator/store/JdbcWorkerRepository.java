package gpuhub.coordinator.store;

import gpuhub.coordinator.model.Worker;
import gpuhub.coordinator.model.WorkerStatus;
import gpuhub.coordinator.repository.WorkerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of WorkerRepository.
 */
public class JdbcWorkerRepository implements WorkerRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcWorkerRepository.class);

    private final Database db;

    public JdbcWorkerRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Worker worker) {
        String sql = """
                    MERGE INTO workers (id, name, host, port, gpu_count, gpu_model, status, active, last_probed_at, created_at)
                    KEY (id)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, worker.id());
            ps.setString(2, worker.name());
            ps.setString(3, worker.host());
            ps.setInt(4, worker.port());
            ps.setInt(5, worker.gpuCount());
            ps.setString(6, worker.gpuModel());
            ps.setString(7, worker.status().name());
            ps.setBoolean(8, worker.active());
            if (worker.lastProbedAt() != null) {
                ps.setTimestamp(9, Timestamp.from(worker.lastProbedAt()));
            } else {
                ps.setNull(9, Types.TIMESTAMP);
            }
            ps.setTimestamp(10, Timestamp.from(worker.createdAt() != null ? worker.createdAt() : Instant.now()));

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved worker: {}", worker.id());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save worker: " + worker.id(), e);
        }
    }

    @Override
    public Optional<Worker> findById(String workerId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT * FROM workers WHERE id = ?")) {

            ps.setString(1, workerId);
            ResultSet rs = ps.executeQuery();
            if (rs.next()) {
                return Optional.of(mapRow(rs));
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find worker: " + workerId, e);
        }
    }

    @Override
    public List<Worker> findAll() {
        return query("SELECT * FROM workers ORDER BY created_at ASC, id ASC");
    }

    @Override
    public List<Worker> findActive() {
        return query("SELECT * FROM workers WHERE active = TRUE ORDER BY created_at ASC, id ASC");
    }

    @Override
    public boolean updateStatus(String workerId, WorkerStatus status, Instant lastProbedAt) {
        String sql = """
                    UPDATE workers SET status = ?, last_probed_at = COALESCE(?, last_probed_at)
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            if (lastProbedAt != null) {
                ps.setTimestamp(2, Timestamp.from(lastProbedAt));
            } else {
                ps.setNull(2, Types.TIMESTAMP);
            }
            ps.setString(3, workerId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update worker status: " + workerId, e);
        }
    }

    @Override
    public boolean setActive(String workerId, boolean active) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("UPDATE workers SET active = ? WHERE id = ?")) {

            ps.setBoolean(1, active);
            ps.setString(2, workerId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update worker active flag: " + workerId, e);
        }
    }

    @Override
    public boolean delete(String workerId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("DELETE FROM workers WHERE id = ?")) {

            ps.setString(1, workerId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete worker: " + workerId, e);
        }
    }

    @Override
    public int countByStatus(WorkerStatus status) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM workers WHERE status = ?")) {

            ps.setString(1, status.name());
            ResultSet rs = ps.executeQuery();
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count workers", e);
        }
    }

    @Override
    public String generateId() {
        return "worker-" + UUID.randomUUID();
    }

    // --- Helpers ---

    private List<Worker> query(String sql) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            List<Worker> workers = new ArrayList<>();
            ResultSet rs = ps.executeQuery();
            while (rs.next()) {
                workers.add(mapRow(rs));
            }
            return workers;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to query workers", e);
        }
    }

    private Worker mapRow(ResultSet rs) throws SQLException {
        return Worker.builder()
                .id(rs.getString("id"))
                .name(rs.getString("name"))
                .host(rs.getString("host"))
                .port(rs.getInt("port"))
                .gpuCount(rs.getInt("gpu_count"))
                .gpuModel(rs.getString("gpu_model"))
                .status(WorkerStatus.valueOf(rs.getString("status")))
                .active(rs.getBoolean("active"))
                .lastProbedAt(toInstant(rs.getTimestamp("last_probed_at")))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .build();
    }

    private Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
