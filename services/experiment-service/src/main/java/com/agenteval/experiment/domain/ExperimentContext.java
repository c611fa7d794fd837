package com.agenteval.experiment.domain;

public record ExperimentContext(
    long experimentId,
    long datasetId,
    long agentId,
    String agentKey,
    String agentVersion,
    String dockerImage
) {

    public static ExperimentContext of(ExperimentEntity experiment, AgentEntity agent) {
        return new ExperimentContext(
            experiment.getId(),
            experiment.getDatasetId(),
            agent.getId(),
            agent.getAgentKey(),
            agent.getVersion(),
            agent.getDockerImage()
        );
    }
}
