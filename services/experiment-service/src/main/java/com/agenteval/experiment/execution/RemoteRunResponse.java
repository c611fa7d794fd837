package com.agenteval.experiment.execution;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

public record RemoteRunResponse(
    JsonNode trajectory,
    JsonNode output,
    @JsonProperty("input_tokens") Integer inputTokens,
    @JsonProperty("output_tokens") Integer outputTokens,
    String logs,
    String error
) {
}
