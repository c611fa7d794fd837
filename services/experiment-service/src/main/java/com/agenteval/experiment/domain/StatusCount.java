package com.agenteval.experiment.domain;

public record StatusCount(RunCaseStatus status, Long total) {
}
