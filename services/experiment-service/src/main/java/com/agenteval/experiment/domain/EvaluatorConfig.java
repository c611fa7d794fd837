package com.agenteval.experiment.domain;

public record EvaluatorConfig(
    long id,
    String evaluatorKey,
    String name,
    String promptTemplate,
    String baseUrl,
    String modelName,
    String apiKey
) {
}
