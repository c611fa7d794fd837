package com.agenteval.experiment.domain;

/**
 * @param terminal whether the experiment reached a final state and gets a finish timestamp
 */
public record StatusDecision(ExperimentStatus status, boolean terminal) {
}
