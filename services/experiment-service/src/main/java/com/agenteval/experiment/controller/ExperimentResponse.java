package com.agenteval.experiment.controller;

import com.agenteval.experiment.domain.ExperimentStatus;
import java.time.Instant;

public record ExperimentResponse(
    Long id,
    String name,
    Long datasetId,
    Long agentId,
    ExperimentStatus status,
    boolean runLocked,
    Instant startedAt,
    Instant finishedAt,
    CaseCounts latestCases
) {
    public record CaseCounts(long total, long pending, long running, long success, long failed) {
    }
}
