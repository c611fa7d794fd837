package com.agenteval.experiment.execution;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RemoteRunRequest(
    @JsonProperty("experiment_id") long experimentId,
    @JsonProperty("data_item_id") long dataItemId,
    @JsonProperty("agent_key") String agentKey,
    @JsonProperty("agent_version") String agentVersion,
    @JsonProperty("docker_image") String dockerImage,
    @JsonProperty("user_input") String userInput
) {
}
