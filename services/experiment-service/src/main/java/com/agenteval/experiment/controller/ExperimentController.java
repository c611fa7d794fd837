package com.agenteval.experiment.controller;

import com.agenteval.experiment.domain.EvaluateResultEntity;
import com.agenteval.experiment.domain.ExperimentEntity;
import com.agenteval.experiment.domain.ExperimentStatus;
import com.agenteval.experiment.domain.RunCaseEntity;
import com.agenteval.experiment.domain.RunSummary;
import com.agenteval.experiment.domain.StatusCounts;
import com.agenteval.experiment.exception.ExperimentException;
import com.agenteval.experiment.service.ExperimentOrchestratorService;
import com.agenteval.experiment.service.ExperimentQueryService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/experiments")
public class ExperimentController {

    private static final String ACTOR_HEADER = "X-Actor";

    private final ExperimentOrchestratorService orchestratorService;
    private final ExperimentQueryService queryService;

    public ExperimentController(ExperimentOrchestratorService orchestratorService, ExperimentQueryService queryService) {
        this.orchestratorService = orchestratorService;
        this.queryService = queryService;
    }

    @PostMapping("/{experimentId}/run")
    public RunSummaryResponse start(
        @PathVariable long experimentId,
        @RequestHeader(value = ACTOR_HEADER, defaultValue = "api") String actor
    ) {
        return toResponse(orchestratorService.startExperiment(experimentId, actor));
    }

    @PostMapping("/{experimentId}/retry-failed")
    public RunSummaryResponse retryFailed(
        @PathVariable long experimentId,
        @RequestHeader(value = ACTOR_HEADER, defaultValue = "api") String actor
    ) {
        return toResponse(orchestratorService.retryFailed(experimentId, actor));
    }

    @PostMapping("/{experimentId}/terminate")
    public ResponseEntity<Map<String, Object>> terminate(
        @PathVariable long experimentId,
        @RequestHeader(value = ACTOR_HEADER, defaultValue = "api") String actor
    ) {
        orchestratorService.terminate(experimentId, actor);
        return ResponseEntity.accepted().body(Map.of("experimentId", experimentId));
    }

    @PostMapping("/{experimentId}/refresh-status")
    public Map<String, Object> refreshStatus(@PathVariable long experimentId) {
        ExperimentStatus status = orchestratorService.refreshStatus(experimentId);
        return Map.of("experimentId", experimentId, "status", status);
    }

    @PostMapping("/{experimentId}/mark-failed")
    public Map<String, Object> markFailed(
        @PathVariable long experimentId,
        @Valid @RequestBody MarkFailedRequest request
    ) {
        int failedCases = orchestratorService.markExperimentFailed(experimentId, request.reason());
        return Map.of("experimentId", experimentId, "failedCases", failedCases);
    }

    @GetMapping("/{experimentId}")
    public ExperimentResponse get(@PathVariable long experimentId) {
        ExperimentEntity experiment = queryService.getExperiment(experimentId)
            .orElseThrow(() -> ExperimentException.notFound(experimentId));
        StatusCounts counts = queryService.getLatestCounts(experimentId);

        return new ExperimentResponse(
            experiment.getId(),
            experiment.getName(),
            experiment.getDatasetId(),
            experiment.getAgentId(),
            experiment.getStatus(),
            experiment.isRunLocked(),
            experiment.getStartedAt(),
            experiment.getFinishedAt(),
            new ExperimentResponse.CaseCounts(
                counts.total(),
                counts.pending(),
                counts.running(),
                counts.success(),
                counts.failed()
            )
        );
    }

    @GetMapping("/{experimentId}/run-cases")
    public List<RunCaseResponse> runCases(
        @PathVariable long experimentId,
        @RequestParam(defaultValue = "true") boolean latestOnly
    ) {
        if (queryService.getExperiment(experimentId).isEmpty()) {
            throw ExperimentException.notFound(experimentId);
        }
        List<RunCaseEntity> runCases = queryService.getRunCases(experimentId, latestOnly);
        Map<Long, List<EvaluateResultEntity>> results = queryService.getResultsByRunCase(runCases);

        return runCases.stream()
            .map(runCase -> toResponse(runCase, results.getOrDefault(runCase.getId(), List.of())))
            .toList();
    }

    private RunSummaryResponse toResponse(RunSummary summary) {
        return new RunSummaryResponse(summary.experimentId(), summary.caseCount(), summary.status());
    }

    private RunCaseResponse toResponse(RunCaseEntity runCase, List<EvaluateResultEntity> results) {
        List<RunCaseResponse.ScoreItem> scores = results.stream()
            .map(result -> new RunCaseResponse.ScoreItem(
                result.getEvaluatorId(),
                result.getEvaluatorKey(),
                result.getScore(),
                result.getReason()
            ))
            .toList();

        return new RunCaseResponse(
            runCase.getId(),
            runCase.getDataItemId(),
            runCase.getAttemptNo(),
            runCase.isLatest(),
            runCase.getStatus(),
            runCase.getFinalScore(),
            runCase.getLatencyMs(),
            runCase.getInputTokens(),
            runCase.getOutputTokens(),
            runCase.getErrorMessage(),
            runCase.getLogs(),
            runCase.getStartedAt(),
            runCase.getFinishedAt(),
            scores
        );
    }
}
