package com.yescount.planner.domain.port.out;

import com.yescount.planner.domain.model.IngestionRun;
import com.yescount.planner.domain.model.RunStatus;
import com.yescount.planner.domain.model.SourceCheck;

import java.util.List;
import java.util.Optional;

/**
 * Bookkeeping for ingestion runs and their per-source checks.
 */
public interface IngestionRunRepository {

    /**
     * Open a run in {@link RunStatus#RUNNING} state.
     */
    long createRun();

    /**
     * Close a run. Called exactly once per run.
     */
    void finalizeRun(long runId, RunStatus status, int totalEventsUpserted, String errorSummary);

    void recordSourceCheck(SourceCheck check);

    /**
     * Most recent run that finished as success or degraded.
     */
    Optional<IngestionRun> findLatestCompleted();

    Optional<IngestionRun> findById(long runId);

    List<SourceCheck> findChecks(long runId);
}
