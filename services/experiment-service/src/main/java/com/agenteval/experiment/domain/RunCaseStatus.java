package com.agenteval.experiment.domain;

public enum RunCaseStatus {
    PENDING,
    RUNNING,
    SUCCESS,
    FAILED
}
