package com.agenteval.experiment.execution;

import com.fasterxml.jackson.databind.JsonNode;

public record CaseExecution(
    JsonNode trajectory,
    JsonNode output,
    Integer inputTokens,
    Integer outputTokens,
    String logs
) {
}
