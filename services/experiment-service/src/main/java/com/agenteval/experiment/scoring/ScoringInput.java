package com.agenteval.experiment.scoring;

import com.fasterxml.jackson.databind.JsonNode;

public record ScoringInput(
    String userInput,
    JsonNode trajectory,
    JsonNode agentOutput,
    JsonNode referenceOutput,
    JsonNode tools
) {
}
