package com.agenteval.experiment.domain;

public record RunSummary(long experimentId, int caseCount, ExperimentStatus status) {
}
