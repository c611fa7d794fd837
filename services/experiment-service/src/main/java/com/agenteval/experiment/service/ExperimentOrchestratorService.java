package com.agenteval.experiment.service;

import com.agenteval.experiment.domain.AgentEntity;
import com.agenteval.experiment.domain.DataItemEntity;
import com.agenteval.experiment.domain.DataItemInput;
import com.agenteval.experiment.domain.EvaluatorConfig;
import com.agenteval.experiment.domain.EvaluatorEntity;
import com.agenteval.experiment.domain.ExperimentContext;
import com.agenteval.experiment.domain.ExperimentEntity;
import com.agenteval.experiment.domain.ExperimentStatus;
import com.agenteval.experiment.domain.RunCaseEntity;
import com.agenteval.experiment.domain.RunCaseStatus;
import com.agenteval.experiment.domain.RunSummary;
import com.agenteval.experiment.exception.ExperimentException;
import com.agenteval.experiment.repository.AgentRepository;
import com.agenteval.experiment.repository.DataItemRepository;
import com.agenteval.experiment.repository.DatasetRepository;
import com.agenteval.experiment.repository.EvaluatorRepository;
import com.agenteval.experiment.repository.ExperimentRepository;
import com.agenteval.experiment.repository.RunCaseRepository;
import jakarta.transaction.Transactional;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point of the execution engine. Every operation runs in one transaction. Start, Retry,
 * Refresh, MarkExperimentFailed and the persisted path of Terminate take the experiment row lock
 * first, so they never interleave on one experiment, even across service instances. Terminating a
 * run that executes in this process only raises its cancellation flag.
 */
@Service
public class ExperimentOrchestratorService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExperimentOrchestratorService.class);

    private static final List<RunCaseStatus> UNFINISHED = List.of(RunCaseStatus.PENDING, RunCaseStatus.RUNNING);

    private final ExperimentRepository experimentRepository;
    private final DatasetRepository datasetRepository;
    private final AgentRepository agentRepository;
    private final DataItemRepository dataItemRepository;
    private final EvaluatorRepository evaluatorRepository;
    private final RunCaseRepository runCaseRepository;
    private final RunCaseRecorder runCaseRecorder;
    private final StatusAggregator statusAggregator;
    private final RunCancellationRegistry cancellationRegistry;
    private final Clock clock;

    public ExperimentOrchestratorService(
        ExperimentRepository experimentRepository,
        DatasetRepository datasetRepository,
        AgentRepository agentRepository,
        DataItemRepository dataItemRepository,
        EvaluatorRepository evaluatorRepository,
        RunCaseRepository runCaseRepository,
        RunCaseRecorder runCaseRecorder,
        StatusAggregator statusAggregator,
        RunCancellationRegistry cancellationRegistry,
        Clock clock
    ) {
        this.experimentRepository = experimentRepository;
        this.datasetRepository = datasetRepository;
        this.agentRepository = agentRepository;
        this.dataItemRepository = dataItemRepository;
        this.evaluatorRepository = evaluatorRepository;
        this.runCaseRepository = runCaseRepository;
        this.runCaseRecorder = runCaseRecorder;
        this.statusAggregator = statusAggregator;
        this.cancellationRegistry = cancellationRegistry;
        this.clock = clock;
    }

    @Transactional
    public RunSummary startExperiment(long experimentId, String actor) {
        ExperimentEntity experiment = lockExperiment(experimentId);
        AgentEntity agent = requireLiveBindings(experiment);
        if (experiment.isRunLocked()) {
            throw ExperimentException.alreadyRunning(experimentId);
        }
        List<EvaluatorConfig> evaluators = resolveEvaluators(experimentId);

        experiment.acquireRunLock(clock.instant());
        List<DataItemEntity> items = dataItemRepository.findByDatasetIdAndDeletedAtIsNullOrderByCreatedAtAscIdAsc(
            experiment.getDatasetId()
        );
        if (items.isEmpty()) {
            experiment.resetToReady();
            LOGGER.info("Experiment {} started by {} has an empty dataset; nothing to run", experimentId, actor);
            return new RunSummary(experimentId, 0, ExperimentStatus.READY);
        }

        LOGGER.info("Starting experiment {} for {} data items with {} evaluators (actor={})",
            experimentId, items.size(), evaluators.size(), actor);
        ExperimentContext context = ExperimentContext.of(experiment, agent);
        cancellationRegistry.register(experimentId);
        try {
            int executed = 0;
            for (DataItemEntity item : items) {
                if (shouldStop(experimentId)) {
                    return terminated(experiment, executed, actor);
                }
                int attemptNo = supersedeLatest(experimentId, item.getId());
                runCaseRecorder.runOneCase(context, item.toInput(), attemptNo, evaluators);
                executed++;
            }
            ExperimentStatus status = statusAggregator.refresh(experiment);
            LOGGER.info("Experiment {} executed {} cases, status={}", experimentId, executed, status);
            return new RunSummary(experimentId, executed, status);
        } finally {
            cancellationRegistry.unregister(experimentId);
        }
    }

    /**
     * Re-executes every latest run case that failed. Does not require the run lock to be clear,
     * so finished and partially failed experiments can be retried.
     */
    @Transactional
    public RunSummary retryFailed(long experimentId, String actor) {
        ExperimentEntity experiment = lockExperiment(experimentId);
        AgentEntity agent = requireLiveBindings(experiment);
        List<EvaluatorConfig> evaluators = resolveEvaluators(experimentId);

        experiment.beginRetry();
        List<RunCaseEntity> failed = runCaseRepository.findByExperimentIdAndLatestTrueAndStatusOrderByCreatedAtAscIdAsc(
            experimentId,
            RunCaseStatus.FAILED
        );
        LOGGER.info("Retrying {} failed cases of experiment {} (actor={})", failed.size(), experimentId, actor);

        ExperimentContext context = ExperimentContext.of(experiment, agent);
        cancellationRegistry.register(experimentId);
        try {
            int retried = 0;
            for (RunCaseEntity previous : failed) {
                if (shouldStop(experimentId)) {
                    return terminated(experiment, retried, actor);
                }
                DataItemInput input = dataItemRepository.findById(previous.getDataItemId())
                    .map(DataItemEntity::toInput)
                    .orElseThrow(() -> new IllegalStateException(
                        "Data item " + previous.getDataItemId() + " of run case " + previous.getId() + " is missing"));
                previous.retire();
                runCaseRepository.saveAndFlush(previous);
                runCaseRecorder.runOneCase(context, input, previous.getAttemptNo() + 1, evaluators);
                retried++;
            }
            ExperimentStatus status = statusAggregator.refresh(experiment);
            LOGGER.info("Experiment {} retried {} cases, status={}", experimentId, retried, status);
            return new RunSummary(experimentId, retried, status);
        } finally {
            cancellationRegistry.unregister(experimentId);
        }
    }

    /**
     * Cooperative stop. A run executing in this process is signalled and terminates itself before
     * its next case; a persisted running experiment with no live run here is terminated directly.
     */
    @Transactional
    public void terminate(long experimentId, String actor) {
        if (cancellationRegistry.requestCancel(experimentId)) {
            LOGGER.info("Cancellation of experiment {} requested by {}", experimentId, actor);
            return;
        }
        ExperimentEntity experiment = lockExperiment(experimentId);
        if (!experiment.getStatus().isInFlight()) {
            throw ExperimentException.notRunning(experimentId);
        }
        experiment.terminate(clock.instant());
        LOGGER.info("Experiment {} terminated by {}", experimentId, actor);
    }

    /**
     * Recomputes the status from the latest run cases. A manually terminated experiment keeps its status.
     */
    @Transactional
    public ExperimentStatus refreshStatus(long experimentId) {
        ExperimentEntity experiment = lockExperiment(experimentId);
        if (experiment.getStatus() == ExperimentStatus.TERMINATED) {
            return ExperimentStatus.TERMINATED;
        }
        return statusAggregator.refresh(experiment);
    }

    /**
     * Used by external supervisors when the orchestrating process died mid-run.
     *
     * @return number of run cases force-failed
     */
    @Transactional
    public int markExperimentFailed(long experimentId, String reason) {
        ExperimentEntity experiment = lockExperiment(experimentId);
        experiment.markFailed(clock.instant());
        String message = reason == null || reason.isBlank() ? "unknown" : reason;
        int failedCases = runCaseRepository.forceFailLatest(experimentId, UNFINISHED, message, clock.instant());
        LOGGER.warn("Experiment {} marked failed ({} unfinished cases failed): {}", experimentId, failedCases, message);
        return failedCases;
    }

    private ExperimentEntity lockExperiment(long experimentId) {
        return experimentRepository.findActiveForUpdate(experimentId)
            .orElseThrow(() -> ExperimentException.notFound(experimentId));
    }

    private AgentEntity requireLiveBindings(ExperimentEntity experiment) {
        datasetRepository.findByIdAndDeletedAtIsNull(experiment.getDatasetId())
            .orElseThrow(() -> ExperimentException.notFound(experiment.getId()));
        return agentRepository.findByIdAndDeletedAtIsNull(experiment.getAgentId())
            .orElseThrow(() -> ExperimentException.notFound(experiment.getId()));
    }

    private List<EvaluatorConfig> resolveEvaluators(long experimentId) {
        List<EvaluatorConfig> evaluators = evaluatorRepository.findBoundToExperiment(experimentId).stream()
            .map(EvaluatorEntity::toConfig)
            .toList();
        if (evaluators.isEmpty()) {
            throw ExperimentException.noEvaluators(experimentId);
        }
        return evaluators;
    }

    /**
     * Retires the current latest attempt of the pair, if any, and returns the next attempt number.
     */
    private int supersedeLatest(long experimentId, long dataItemId) {
        return runCaseRepository.findByExperimentIdAndDataItemIdAndLatestTrue(experimentId, dataItemId)
            .map(previous -> {
                previous.retire();
                runCaseRepository.saveAndFlush(previous);
                return previous.getAttemptNo() + 1;
            })
            .orElse(1);
    }

    /**
     * Cancellation requested, or the orchestrating thread was interrupted while waiting on a case.
     */
    private boolean shouldStop(long experimentId) {
        return cancellationRegistry.isCancelled(experimentId) || Thread.currentThread().isInterrupted();
    }

    private RunSummary terminated(ExperimentEntity experiment, int executed, String actor) {
        experiment.terminate(clock.instant());
        LOGGER.info("Experiment {} stopped after {} cases on cancellation (actor={})",
            experiment.getId(), executed, actor);
        return new RunSummary(experiment.getId(), executed, ExperimentStatus.TERMINATED);
    }
}
