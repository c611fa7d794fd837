package com.agenteval.experiment.domain;

public record DataItemInput(
    long id,
    String userInput,
    String referenceTrajectory,
    String referenceOutput
) {
}
