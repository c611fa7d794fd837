package com.agenteval.experiment.controller;

import com.agenteval.experiment.domain.ExperimentStatus;

public record RunSummaryResponse(long experimentId, int caseCount, ExperimentStatus status) {
}
