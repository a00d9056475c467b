package gpuhub.coordinator.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import gpuhub.coordinator.model.Job;
import gpuhub.coordinator.model.JobStatus;
import gpuhub.coordinator.model.JobTransition;
import gpuhub.coordinator.model.TransitionResult;
import gpuhub.coordinator.repository.JobRepository;
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
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.UUID;

/**
 * JDBC implementation of JobRepository.
 * The config and result maps are stored as JSON text.
 */
public class JdbcJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final Database db;

    public JdbcJobRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Job job) {
        String sql = """
                    INSERT INTO jobs (id, user_id, title, description, job_type, priority, config,
                                      status, progress, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Instant createdAt = job.createdAt() != null ? job.createdAt() : Instant.now();
            ps.setString(1, job.id());
            ps.setString(2, job.userId());
            ps.setString(3, job.title());
            ps.setString(4, job.description());
            ps.setString(5, job.jobType());
            ps.setInt(6, job.priority());
            ps.setString(7, toJson(job.config()));
            ps.setString(8, job.status().name());
            ps.setDouble(9, job.progress());
            ps.setTimestamp(10, Timestamp.from(createdAt));
            ps.setTimestamp(11, Timestamp.from(job.updatedAt() != null ? job.updatedAt() : createdAt));

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved job: {}", job.id());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save job: " + job.id(), e);
        }
    }

    @Override
    public Optional<Job> findById(String jobId) {
        String sql = "SELECT * FROM jobs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ResultSet rs = ps.executeQuery();

            if (rs.next()) {
                return Optional.of(mapRow(rs));
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find job: " + jobId, e);
        }
    }

    @Override
    public Optional<Job> findByIdAndUser(String jobId, String userId) {
        return findById(jobId).filter(job -> job.userId().equals(userId));
    }

    @Override
    public List<Job> findByStatus(JobStatus status, int limit) {
        String sql = """
                    SELECT * FROM jobs WHERE status = ?
                    ORDER BY priority DESC, created_at ASC, id ASC
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find jobs by status", e);
        }
    }

    @Override
    public List<Job> findByUser(String userId, JobStatus status, int limit) {
        String sql = status == null
                ? "SELECT * FROM jobs WHERE user_id = ? ORDER BY created_at DESC, id DESC LIMIT ?"
                : "SELECT * FROM jobs WHERE user_id = ? AND status = ? ORDER BY created_at DESC, id DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int idx = 1;
            ps.setString(idx++, userId);
            if (status != null) {
                ps.setString(idx++, status.name());
            }
            ps.setInt(idx, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find jobs of user: " + userId, e);
        }
    }

    @Override
    public int countRunningOnWorker(String workerId) {
        return count("SELECT COUNT(*) FROM jobs WHERE assigned_worker_id = ? AND status = 'RUNNING'", workerId);
    }

    @Override
    public int countRunningForUser(String userId) {
        return count("SELECT COUNT(*) FROM jobs WHERE user_id = ? AND status = 'RUNNING'", userId);
    }

    @Override
    public int countByStatus(JobStatus status) {
        return count("SELECT COUNT(*) FROM jobs WHERE status = ?", status.name());
    }

    @Override
    public TransitionResult applyTransition(String jobId, JobTransition transition) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("UPDATE jobs SET updated_at = ?");
        params.add(Instant.now());

        if (transition.targetStatus() != null) {
            sql.append(", status = ?");
            params.add(transition.targetStatus().name());
        }

        for (Map.Entry<JobTransition.Field, Object> entry : transition.fields().entrySet()) {
            JobTransition.Field field = entry.getKey();
            if (field == JobTransition.Field.PROGRESS && transition.isProgressOnly()) {
                // progress never goes backwards while running
                sql.append(", progress = GREATEST(progress, ?)");
            } else {
                sql.append(", ").append(column(field)).append(" = ?");
            }
            params.add(field == JobTransition.Field.RESULT ? new JsonValue(entry.getValue()) : entry.getValue());
        }

        StringJoiner statuses = new StringJoiner(", ", "(", ")");
        transition.allowedFrom().forEach(s -> statuses.add("?"));
        sql.append(" WHERE id = ? AND status IN ").append(statuses);
        params.add(jobId);
        transition.allowedFrom().forEach(s -> params.add(s.name()));

        try (Connection conn = db.getConnection()) {
            int updated;
            try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
                for (int i = 0; i < params.size(); i++) {
                    bind(ps, i + 1, params.get(i));
                }
                updated = ps.executeUpdate();
            }
            conn.commit();

            if (updated > 0) {
                return TransitionResult.APPLIED;
            }
            try (PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM jobs WHERE id = ?")) {
                ps.setString(1, jobId);
                ResultSet rs = ps.executeQuery();
                return rs.next() ? TransitionResult.REJECTED : TransitionResult.NOT_FOUND;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply transition to job: " + jobId, e);
        }
    }

    @Override
    public boolean updateDetails(Job job) {
        String sql = """
                    UPDATE jobs
                    SET title = ?, description = ?, priority = ?, config = ?, updated_at = ?
                    WHERE id = ? AND status NOT IN ('RUNNING', 'COMPLETED')
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, job.title());
            ps.setString(2, job.description());
            ps.setInt(3, job.priority());
            ps.setString(4, toJson(job.config()));
            ps.setTimestamp(5, Timestamp.from(Instant.now()));
            ps.setString(6, job.id());

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update job: " + job.id(), e);
        }
    }

    @Override
    public boolean delete(String jobId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("DELETE FROM jobs WHERE id = ?")) {

            ps.setString(1, jobId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete job: " + jobId, e);
        }
    }

    @Override
    public String generateId() {
        return "job-" + UUID.randomUUID();
    }

    // --- Helpers ---

    /** Marker so that a null result is written as SQL NULL in a CLOB column */
    private record JsonValue(Object value) {
    }

    private static String column(JobTransition.Field field) {
        return switch (field) {
            case PROGRESS -> "progress";
            case ASSIGNED_WORKER_ID -> "assigned_worker_id";
            case STARTED_AT -> "started_at";
            case COMPLETED_AT -> "completed_at";
            case RESULT -> "result";
            case ERROR_MESSAGE -> "error_message";
        };
    }

    private void bind(PreparedStatement ps, int idx, Object value) throws SQLException {
        if (value instanceof JsonValue json) {
            if (json.value() == null) {
                ps.setNull(idx, Types.CLOB);
            } else {
                ps.setString(idx, toJson(json.value()));
            }
        } else if (value == null) {
            ps.setNull(idx, Types.VARCHAR);
        } else if (value instanceof Instant instant) {
            ps.setTimestamp(idx, Timestamp.from(instant));
        } else if (value instanceof Double d) {
            ps.setDouble(idx, d);
        } else {
            ps.setString(idx, value.toString());
        }
    }

    private int count(String sql, String param) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, param);
            ResultSet rs = ps.executeQuery();
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count jobs", e);
        }
    }

    private List<Job> executeQuery(PreparedStatement ps) throws SQLException {
        List<Job> jobs = new ArrayList<>();
        ResultSet rs = ps.executeQuery();
        while (rs.next()) {
            jobs.add(mapRow(rs));
        }
        return jobs;
    }

    private Job mapRow(ResultSet rs) throws SQLException {
        return Job.builder()
                .id(rs.getString("id"))
                .userId(rs.getString("user_id"))
                .title(rs.getString("title"))
                .description(rs.getString("description"))
                .jobType(rs.getString("job_type"))
                .priority(rs.getInt("priority"))
                .config(fromJson(rs.getString("config")))
                .status(JobStatus.valueOf(rs.getString("status")))
                .progress(rs.getDouble("progress"))
                .assignedWorkerId(rs.getString("assigned_worker_id"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .completedAt(toInstant(rs.getTimestamp("completed_at")))
                .result(fromJson(rs.getString("result")))
                .errorMessage(rs.getString("error_message"))
                .build();
    }

    private static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not serializable as JSON", e);
        }
    }

    private static Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to parse stored JSON", e);
        }
    }

    private Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
