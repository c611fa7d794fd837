package com.agenteval.experiment.execution;

import com.agenteval.experiment.domain.DataItemInput;
import com.agenteval.experiment.domain.ExperimentContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Posts the case to the agent runtime, which owns sandboxing and command execution.
 */
public class RemoteAgentCaseExecutor implements CaseExecutor {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public RemoteAgentCaseExecutor(RestClient agentRuntimeRestClient, ObjectMapper objectMapper) {
        this.restClient = agentRuntimeRestClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public CaseExecution execute(ExperimentContext context, DataItemInput item) throws CaseExecutionException {
        RemoteRunRequest request = new RemoteRunRequest(
            context.experimentId(),
            item.id(),
            context.agentKey(),
            context.agentVersion(),
            context.dockerImage(),
            item.userInput()
        );

        RemoteRunResponse response;
        try {
            response = restClient.post()
                .uri("/v1/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(RemoteRunResponse.class);
        } catch (RestClientException e) {
            throw new CaseExecutionException("Agent runtime call failed for data item " + item.id() + ": " + e.getMessage(), e);
        }

        if (response == null) {
            throw new CaseExecutionException("Agent runtime returned an empty body for data item " + item.id());
        }
        if (response.error() != null && !response.error().isBlank()) {
            throw new CaseExecutionException(response.error());
        }

        return new CaseExecution(
            response.trajectory() == null ? objectMapper.createArrayNode() : response.trajectory(),
            response.output() == null ? objectMapper.createObjectNode() : response.output(),
            response.inputTokens(),
            response.outputTokens(),
            response.logs() == null
                ? "agent=" + context.agentKey() + "@" + context.agentVersion() + "; mode=remote"
                : response.logs()
        );
    }
}
