package com.agenteval.experiment.controller;

import com.agenteval.experiment.domain.RunCaseStatus;
import java.time.Instant;
import java.util.List;

public record RunCaseResponse(
    Long id,
    Long dataItemId,
    int attemptNo,
    boolean latest,
    RunCaseStatus status,
    Double finalScore,
    Long latencyMs,
    Integer inputTokens,
    Integer outputTokens,
    String errorMessage,
    String logs,
    Instant startedAt,
    Instant finishedAt,
    List<ScoreItem> scores
) {
    public record ScoreItem(Long evaluatorId, String evaluatorKey, double score, String reason) {
    }
}
