package com.agenteval.experiment.domain;

public enum ExperimentStatus {
    READY,
    QUEUED,
    RUNNING,
    FINISHED,
    FAILED,
    PARTIAL_FAILED,
    TERMINATED;

    public boolean isInFlight() {
        return this == RUNNING || this == QUEUED;
    }
}
