package com.agenteval.experiment.execution;

import com.agenteval.experiment.domain.DataItemInput;
import com.agenteval.experiment.domain.ExperimentContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Stands in for a real agent run by replaying the data item's reference trajectory and output.
 */
public class ReplayCaseExecutor implements CaseExecutor {

    private final ObjectMapper objectMapper;

    public ReplayCaseExecutor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public CaseExecution execute(ExperimentContext context, DataItemInput item) throws CaseExecutionException {
        JsonNode trajectory = parse(item.referenceTrajectory(), objectMapper.createArrayNode(), "reference trajectory", item);
        JsonNode output = parse(item.referenceOutput(), objectMapper.createObjectNode(), "reference output", item);
        String logs = "agent=" + context.agentKey() + "@" + context.agentVersion()
            + "; image=" + context.dockerImage()
            + "; mode=replay";
        return new CaseExecution(trajectory, output, null, null, logs);
    }

    private JsonNode parse(String raw, JsonNode fallback, String label, DataItemInput item) throws CaseExecutionException {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            JsonNode node = objectMapper.readTree(raw);
            return node == null || node.isNull() ? fallback : node;
        } catch (JsonProcessingException e) {
            throw new CaseExecutionException("Invalid " + label + " JSON on data item " + item.id(), e);
        }
    }
}
