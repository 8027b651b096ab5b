package com.taskrelay.engine.persistence.jdbc;

import com.taskrelay.core.model.AgentRun;
import com.taskrelay.core.repository.AgentRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC-backed implementation of AgentRunRepository.
 *
 * Completion only touches rows whose completed_at is still null, so a run record
 * is written once and a late second completion (watchdog vs. process exit) is a no-op.
 */
@Repository
public class JdbcAgentRunRepository implements AgentRunRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcAgentRunRepository.class);

    private static final RowMapper<AgentRun> ROW_MAPPER = new AgentRunRowMapper();

    private final JdbcTemplate jdbcTemplate;

    public JdbcAgentRunRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void save(AgentRun run) {
        String sql = """
            INSERT INTO agent_runs (
                run_id, task_id, step_id, started_at, completed_at, exit_code, error
            ) VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.update(sql,
            run.runId(),
            run.taskId(),
            run.stepId(),
            Timestamp.from(run.startedAt()),
            toTimestamp(run.completedAt()),
            run.exitCode(),
            run.error()
        );
    }

    @Override
    public boolean complete(UUID runId, Instant completedAt, int exitCode, String error) {
        String sql = """
            UPDATE agent_runs SET
                completed_at = ?,
                exit_code = ?,
                error = ?
            WHERE run_id = ? AND completed_at IS NULL
            """;

        int rows = jdbcTemplate.update(sql, Timestamp.from(completedAt), exitCode, error, runId);
        if (rows == 0) {
            log.debug("Run {} already completed, ignoring exit code {}", runId, exitCode);
        }
        return rows > 0;
    }

    @Override
    public Optional<AgentRun> findById(UUID runId) {
        String sql = "SELECT * FROM agent_runs WHERE run_id = ?";
        List<AgentRun> results = jdbcTemplate.query(sql, ROW_MAPPER, runId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<AgentRun> findActiveByTask(UUID taskId) {
        String sql = """
            SELECT * FROM agent_runs
            WHERE task_id = ? AND completed_at IS NULL
            ORDER BY started_at DESC
            """;
        List<AgentRun> results = jdbcTemplate.query(sql, ROW_MAPPER, taskId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public int countActive() {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM agent_runs WHERE completed_at IS NULL", Integer.class);
        return count != null ? count : 0;
    }

    @Override
    public List<AgentRun> findActive() {
        String sql = """
            SELECT * FROM agent_runs
            WHERE completed_at IS NULL
            ORDER BY started_at ASC
            """;
        return jdbcTemplate.query(sql, ROW_MAPPER);
    }

    @Override
    public List<AgentRun> findActiveStartedBefore(Instant cutoff) {
        String sql = """
            SELECT * FROM agent_runs
            WHERE completed_at IS NULL AND started_at < ?
            ORDER BY started_at ASC
            """;
        return jdbcTemplate.query(sql, ROW_MAPPER, Timestamp.from(cutoff));
    }

    @Override
    public List<AgentRun> findByTask(UUID taskId) {
        String sql = """
            SELECT * FROM agent_runs
            WHERE task_id = ?
            ORDER BY started_at ASC
            """;
        return jdbcTemplate.query(sql, ROW_MAPPER, taskId);
    }

    @Override
    public void lockAdmission() {
        jdbcTemplate.queryForObject(
            "SELECT lock_id FROM dispatch_admission WHERE lock_id = 1 FOR UPDATE", Integer.class);
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static class AgentRunRowMapper implements RowMapper<AgentRun> {
        @Override
        public AgentRun mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp completedAt = rs.getTimestamp("completed_at");
            int exitCode = rs.getInt("exit_code");
            Integer boxedExitCode = rs.wasNull() ? null : exitCode;
            return new AgentRun(
                UUID.fromString(rs.getString("run_id")),
                UUID.fromString(rs.getString("task_id")),
                UUID.fromString(rs.getString("step_id")),
                rs.getTimestamp("started_at").toInstant(),
                completedAt != null ? completedAt.toInstant() : null,
                boxedExitCode,
                rs.getString("error")
            );
        }
    }
}
