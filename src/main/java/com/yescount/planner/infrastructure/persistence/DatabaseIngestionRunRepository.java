package com.yescount.planner.infrastructure.persistence;

import com.yescount.planner.domain.model.IngestionRun;
import com.yescount.planner.domain.model.RunStatus;
import com.yescount.planner.domain.model.SourceCheck;
import com.yescount.planner.domain.model.SourceCheckStatus;
import com.yescount.planner.domain.port.out.IngestionRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Repository
public class DatabaseIngestionRunRepository implements IngestionRunRepository {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseIngestionRunRepository.class);

    private static final String RUN_COLUMNS =
            "id, started_at, finished_at, status, total_events_upserted, error_summary";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public DatabaseIngestionRunRepository(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    public long createRun() {
        Long id = jdbcTemplate.queryForObject(
                "INSERT INTO ingestion_runs (started_at, status) VALUES (?, ?) RETURNING id",
                Long.class,
                OffsetDateTime.now(clock),
                RunStatus.RUNNING.code());
        logger.debug("Created ingestion run {}", id);
        return Objects.requireNonNull(id, "insert returned no id");
    }

    @Override
    public void finalizeRun(long runId, RunStatus status, int totalEventsUpserted, String errorSummary) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Cannot finalize run " + runId + " as " + status);
        }
        int updated = jdbcTemplate.update("""
                UPDATE ingestion_runs
                SET finished_at = ?, status = ?, total_events_upserted = ?, error_summary = ?
                WHERE id = ? AND status = 'running'
                """,
                OffsetDateTime.now(clock),
                status.code(),
                totalEventsUpserted,
                SourceCheck.truncate(errorSummary == null ? "" : errorSummary, SourceCheck.MAX_ERROR_LENGTH),
                runId);
        if (updated == 0) {
            logger.warn("Run {} was not in running state, finalize as {} ignored", runId, status.code());
        }
    }

    @Override
    public void recordSourceCheck(SourceCheck check) {
        jdbcTemplate.update("""
                INSERT INTO ingestion_source_checks (
                    run_id, source_name, source_url, required, status, events_found, error, checked_at
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """,
                check.runId(),
                check.sourceName(),
                check.sourceUrl(),
                check.required(),
                check.status().code(),
                check.eventsFound(),
                check.error(),
                OffsetDateTime.now(clock));
    }

    @Override
    public Optional<IngestionRun> findLatestCompleted() {
        return jdbcTemplate.query("SELECT " + RUN_COLUMNS + """
                 FROM ingestion_runs
                WHERE status IN ('success', 'degraded') AND finished_at IS NOT NULL
                ORDER BY finished_at DESC
                LIMIT 1
                """, runRowMapper()).stream().findFirst();
    }

    @Override
    public Optional<IngestionRun> findById(long runId) {
        return jdbcTemplate.query("SELECT " + RUN_COLUMNS + " FROM ingestion_runs WHERE id = ?",
                runRowMapper(), runId).stream().findFirst();
    }

    @Override
    public List<SourceCheck> findChecks(long runId) {
        return jdbcTemplate.query("""
                SELECT run_id, source_name, source_url, required, status, events_found, error
                FROM ingestion_source_checks
                WHERE run_id = ?
                ORDER BY id
                """,
                (rs, rowNum) -> new SourceCheck(
                        rs.getLong("run_id"),
                        rs.getString("source_name"),
                        rs.getString("source_url"),
                        rs.getBoolean("required"),
                        SourceCheckStatus.fromCode(rs.getString("status")),
                        rs.getInt("events_found"),
                        rs.getString("error")),
                runId);
    }

    private static RowMapper<IngestionRun> runRowMapper() {
        return (rs, rowNum) -> new IngestionRun(
                rs.getLong("id"),
                rs.getObject("started_at", OffsetDateTime.class),
                rs.getObject("finished_at", OffsetDateTime.class),
                RunStatus.fromCode(rs.getString("status")),
                rs.getInt("total_events_upserted"),
                rs.getString("error_summary"));
    }
}
