package com.agenteval.experiment.scoring;

public record EvaluatorScore(
    long evaluatorId,
    String evaluatorKey,
    String name,
    double score,
    String reason,
    String source
) {
}
