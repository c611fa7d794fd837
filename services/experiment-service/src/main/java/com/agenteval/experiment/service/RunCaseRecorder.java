package com.agenteval.experiment.service;

import com.agenteval.experiment.config.ExperimentProperties;
import com.agenteval.experiment.domain.DataItemInput;
import com.agenteval.experiment.domain.EvaluateResultEntity;
import com.agenteval.experiment.domain.EvaluatorConfig;
import com.agenteval.experiment.domain.ExperimentContext;
import com.agenteval.experiment.domain.RunCaseEntity;
import com.agenteval.experiment.domain.RunCaseStatus;
import com.agenteval.experiment.execution.CaseExecution;
import com.agenteval.experiment.execution.CaseExecutionException;
import com.agenteval.experiment.execution.CaseExecutor;
import com.agenteval.experiment.repository.EvaluateResultRepository;
import com.agenteval.experiment.repository.RunCaseRepository;
import com.agenteval.experiment.scoring.EvaluatorScore;
import com.agenteval.experiment.scoring.EvaluatorScoringClient;
import com.agenteval.experiment.scoring.ScoringInput;
import com.agenteval.experiment.scoring.ScoringResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.transaction.Transactional;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Executes and records a single attempt of one data item inside the caller's transaction.
 *
 * <p>Executor and scoring failures, including the per-case timeout, end as a committed
 * {@code FAILED} row. Persistence failures propagate and roll the whole batch back.
 */
@Component
public class RunCaseRecorder {

    private static final Logger LOGGER = LoggerFactory.getLogger(RunCaseRecorder.class);

    private final RunCaseRepository runCaseRepository;
    private final EvaluateResultRepository evaluateResultRepository;
    private final CaseExecutor caseExecutor;
    private final EvaluatorScoringClient scoringClient;
    private final ExecutorService caseExecutionPool;
    private final ExperimentProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RunCaseRecorder(
        RunCaseRepository runCaseRepository,
        EvaluateResultRepository evaluateResultRepository,
        CaseExecutor caseExecutor,
        EvaluatorScoringClient scoringClient,
        @Qualifier("caseExecutionPool") ExecutorService caseExecutionPool,
        ExperimentProperties properties,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        this.runCaseRepository = runCaseRepository;
        this.evaluateResultRepository = evaluateResultRepository;
        this.caseExecutor = caseExecutor;
        this.scoringClient = scoringClient;
        this.caseExecutionPool = caseExecutionPool;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Transactional(Transactional.TxType.MANDATORY)
    public RunCaseStatus runOneCase(
        ExperimentContext context,
        DataItemInput item,
        int attemptNo,
        List<EvaluatorConfig> evaluators
    ) {
        RunCaseEntity runCase = runCaseRepository.saveAndFlush(
            RunCaseEntity.startAttempt(context, item.id(), attemptNo, clock.instant())
        );
        if (runCase.getId() == null) {
            throw new IllegalStateException("Failed to create run case for data item " + item.id());
        }

        long startedNanos = System.nanoTime();
        CaseOutcome outcome;
        try {
            outcome = executeBounded(context, item, evaluators);
        } catch (TimeoutException e) {
            return recordFailure(runCase, context, "Case timed out after " + properties.getCaseTimeoutSeconds() + "s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return recordFailure(runCase, context, "Case execution interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return recordFailure(runCase, context, cause.getMessage());
        }
        long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);

        for (EvaluatorScore score : outcome.scoring().results()) {
            evaluateResultRepository.save(EvaluateResultEntity.of(
                runCase.getId(),
                score.evaluatorId(),
                score.evaluatorKey(),
                score.score(),
                score.reason(),
                rawResult(score)
            ));
        }

        CaseExecution execution = outcome.execution();
        runCase.succeed(
            outcome.scoring().finalScore(),
            json(execution.trajectory()),
            json(execution.output()),
            latencyMs,
            execution.inputTokens(),
            execution.outputTokens(),
            execution.logs(),
            clock.instant()
        );
        runCaseRepository.save(runCase);
        return RunCaseStatus.SUCCESS;
    }

    private CaseOutcome executeBounded(
        ExperimentContext context,
        DataItemInput item,
        List<EvaluatorConfig> evaluators
    ) throws TimeoutException, InterruptedException, ExecutionException {
        Callable<CaseOutcome> work = () -> {
            CaseExecution execution = caseExecutor.execute(context, item);
            ScoringResult scoring = scoringClient.score(evaluators, new ScoringInput(
                item.userInput(),
                execution.trajectory(),
                execution.output(),
                parseOrNull(item.referenceOutput()),
                objectMapper.createArrayNode()
            ));
            return new CaseOutcome(execution, scoring);
        };

        Future<CaseOutcome> future = caseExecutionPool.submit(work);
        try {
            return future.get(Math.max(1, properties.getCaseTimeoutSeconds()), TimeUnit.SECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private RunCaseStatus recordFailure(RunCaseEntity runCase, ExperimentContext context, String message) {
        String error = truncate(message, properties.getErrorMessageMaxLength());
        LOGGER.warn("Run case {} (experiment {}, data item {}, attempt {}) failed: {}",
            runCase.getId(), context.experimentId(), runCase.getDataItemId(), runCase.getAttemptNo(), error);
        runCase.fail(error, "agent=" + context.agentKey() + "; error", clock.instant());
        runCaseRepository.save(runCase);
        return RunCaseStatus.FAILED;
    }

    private JsonNode parseOrNull(String raw) throws CaseExecutionException {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new CaseExecutionException("Invalid reference output JSON", e);
        }
    }

    private String rawResult(EvaluatorScore score) {
        return objectMapper.createObjectNode().put("source", score.source()).toString();
    }

    private String json(JsonNode node) {
        return node == null ? null : node.toString();
    }

    private String truncate(String text, int max) {
        if (text == null || text.isBlank()) {
            return "unknown";
        }
        return text.length() <= max ? text : text.substring(0, max);
    }

    private record CaseOutcome(CaseExecution execution, ScoringResult scoring) {
    }
}
