package com.vidnyan.cleanup.adapter.out.store;

import com.vidnyan.cleanup.application.error.StoreConnectivityException;
import com.vidnyan.cleanup.application.port.out.FindingStore;
import com.vidnyan.cleanup.application.port.out.FindingTable;
import com.vidnyan.cleanup.domain.finding.AgentFailure;
import com.vidnyan.cleanup.domain.finding.Category;
import com.vidnyan.cleanup.domain.finding.Finding;
import com.vidnyan.cleanup.domain.finding.Severity;
import com.vidnyan.cleanup.domain.finding.Submission;
import com.vidnyan.cleanup.domain.finding.SubmissionStatus;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * JDBC finding store. Works against PostgreSQL and H2.
 * Every failure of the underlying database surfaces as {@link StoreConnectivityException}.
 */
@Slf4j
public class JdbcFindingStore implements FindingStore {

    private static final String SUBMISSIONS_DDL = """
            CREATE TABLE IF NOT EXISTS code_submissions (
                id INTEGER GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                filename TEXT,
                code_content TEXT,
                status TEXT,
                created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )""";

    // Tables created before outcomes were recorded lack the status column.
    private static final String SUBMISSIONS_STATUS_DDL =
            "ALTER TABLE code_submissions ADD COLUMN IF NOT EXISTS status TEXT";

    private static final String FAILURES_DDL = """
            CREATE TABLE IF NOT EXISTS submission_failures (
                id INTEGER GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                submission_id INTEGER,
                agent_type TEXT,
                store_name TEXT,
                error_type TEXT,
                message TEXT,
                created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )""";

    private static final String FINDINGS_DDL = """
            CREATE TABLE IF NOT EXISTS %s (
                id INTEGER GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                submission_id INTEGER,%s
                issue_type TEXT,
                line_number INTEGER,
                severity TEXT,
                description TEXT,
                suggested_fix TEXT,
                created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )""";

    private final String name;
    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;

    public JdbcFindingStore(String name, DataSource dataSource) {
        this.name = name;
        this.dataSource = dataSource;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void ensureSchema(FindingTable table) {
        String agentColumn = table.isMerged() ? "\n    agent_type TEXT," : "";
        execute("ensure-schema " + table.tableName(), () -> {
            jdbcTemplate.execute(FINDINGS_DDL.formatted(table.tableName(), agentColumn));
            return null;
        });
    }

    @Override
    public int insert(FindingTable table, long submissionId, List<Finding> findings) {
        if (findings.isEmpty()) {
            return 0;
        }
        List<Object[]> rows = new ArrayList<>(findings.size());
        for (Finding finding : findings) {
            rows.add(table.isMerged()
                    ? new Object[] {submissionId, finding.category().key(), finding.issue(), finding.line(),
                            finding.severity().name(), finding.snippet(), finding.remediation()}
                    : new Object[] {submissionId, finding.issue(), finding.line(),
                            finding.severity().name(), finding.snippet(), finding.remediation()});
        }
        String sql = table.isMerged()
                ? "INSERT INTO " + table.tableName() + " (submission_id, agent_type, issue_type, line_number, "
                        + "severity, description, suggested_fix) VALUES (?, ?, ?, ?, ?, ?, ?)"
                : "INSERT INTO " + table.tableName() + " (submission_id, issue_type, line_number, "
                        + "severity, description, suggested_fix) VALUES (?, ?, ?, ?, ?, ?)";

        execute("insert " + table.tableName(), () -> jdbcTemplate.batchUpdate(sql, rows));
        log.debug("Store '{}': inserted {} rows into {} for submission #{}",
                name, rows.size(), table.tableName(), submissionId);
        return rows.size();
    }

    @Override
    public long newSubmissionId(String filename, String content) {
        return execute("register submission", () -> {
            createSubmissionTables();
            KeyHolder keyHolder = new GeneratedKeyHolder();
            jdbcTemplate.update(connection -> {
                PreparedStatement ps = connection.prepareStatement(
                        "INSERT INTO code_submissions (filename, code_content, status) VALUES (?, ?, ?)",
                        new String[] {"id"});
                ps.setString(1, filename);
                ps.setString(2, content);
                ps.setString(3, SubmissionStatus.RUNNING.name());
                return ps;
            }, keyHolder);
            Number key = keyHolder.getKey();
            if (key == null) {
                throw new IllegalStateException("No id generated for submission " + filename);
            }
            return key.longValue();
        });
    }

    @Override
    public void recordOutcome(long submissionId, SubmissionStatus status, List<AgentFailure> failures) {
        execute("record outcome", () -> {
            createSubmissionTables();
            int updated = jdbcTemplate.update(
                    "UPDATE code_submissions SET status = ? WHERE id = ?", status.name(), submissionId);
            if (updated == 0) {
                throw new IllegalArgumentException("Unknown submission #" + submissionId);
            }
            if (!failures.isEmpty()) {
                List<Object[]> rows = failures.stream()
                        .map(f -> new Object[] {submissionId, f.category().key(), f.store(), f.errorType(), f.message()})
                        .toList();
                jdbcTemplate.batchUpdate("INSERT INTO submission_failures "
                        + "(submission_id, agent_type, store_name, error_type, message) VALUES (?, ?, ?, ?, ?)", rows);
            }
            return null;
        });
        log.debug("Store '{}': submission #{} {} with {} failures", name, submissionId, status, failures.size());
    }

    @Override
    public Optional<Submission> findSubmission(long submissionId) {
        return execute("find submission", () -> {
            createSubmissionTables();
            List<Submission> found = jdbcTemplate.query(
                    "SELECT id, filename, code_content, created_at, status FROM code_submissions WHERE id = ?",
                    (rs, rowNum) -> new Submission(
                            rs.getLong("id"),
                            rs.getString("filename"),
                            rs.getString("code_content"),
                            toInstant(rs.getTimestamp("created_at")),
                            SubmissionStatus.fromColumn(rs.getString("status"))),
                    submissionId);
            return found.stream().findFirst();
        });
    }

    @Override
    public List<AgentFailure> findFailures(long submissionId) {
        return execute("read submission_failures", () -> {
            jdbcTemplate.execute(FAILURES_DDL);
            return jdbcTemplate.query(
                    "SELECT * FROM submission_failures WHERE submission_id = ? ORDER BY id",
                    (rs, rowNum) -> new AgentFailure(
                            Category.fromKey(rs.getString("agent_type")),
                            rs.getString("store_name"),
                            rs.getString("error_type"),
                            rs.getString("message")),
                    submissionId);
        });
    }

    @Override
    public List<Finding> findFindings(FindingTable table, long submissionId) {
        RowMapper<Finding> mapper = (rs, rowNum) -> new Finding(
                table.isMerged() ? Category.fromKey(rs.getString("agent_type")) : table.category().orElseThrow(),
                rs.getString("issue_type"),
                rs.getInt("line_number"),
                rs.getString("description"),
                Severity.valueOf(rs.getString("severity")),
                rs.getString("suggested_fix"));
        return execute("read " + table.tableName(), () -> jdbcTemplate.query(
                "SELECT * FROM " + table.tableName() + " WHERE submission_id = ? ORDER BY id",
                mapper, submissionId));
    }

    @Override
    public boolean ping() {
        try {
            Integer one = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return one != null && one == 1;
        } catch (DataAccessException e) {
            log.warn("Store '{}' is not reachable: {}", name, e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        if (dataSource instanceof HikariDataSource hikari && !hikari.isClosed()) {
            log.debug("Closing store '{}'", name);
            hikari.close();
        }
    }

    private void createSubmissionTables() {
        jdbcTemplate.execute(SUBMISSIONS_DDL);
        jdbcTemplate.execute(SUBMISSIONS_STATUS_DDL);
        jdbcTemplate.execute(FAILURES_DDL);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StoreConnectivityException(name, operation, e);
        }
    }
}
