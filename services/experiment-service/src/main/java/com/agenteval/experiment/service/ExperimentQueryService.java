package com.agenteval.experiment.service;

import com.agenteval.experiment.domain.EvaluateResultEntity;
import com.agenteval.experiment.domain.ExperimentEntity;
import com.agenteval.experiment.domain.RunCaseEntity;
import com.agenteval.experiment.domain.StatusCounts;
import com.agenteval.experiment.repository.EvaluateResultRepository;
import com.agenteval.experiment.repository.ExperimentRepository;
import com.agenteval.experiment.repository.RunCaseRepository;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;

@Service
public class ExperimentQueryService {

    private final ExperimentRepository experimentRepository;
    private final RunCaseRepository runCaseRepository;
    private final EvaluateResultRepository evaluateResultRepository;
    private final StatusAggregator statusAggregator;

    public ExperimentQueryService(
        ExperimentRepository experimentRepository,
        RunCaseRepository runCaseRepository,
        EvaluateResultRepository evaluateResultRepository,
        StatusAggregator statusAggregator
    ) {
        this.experimentRepository = experimentRepository;
        this.runCaseRepository = runCaseRepository;
        this.evaluateResultRepository = evaluateResultRepository;
        this.statusAggregator = statusAggregator;
    }

    public Optional<ExperimentEntity> getExperiment(long experimentId) {
        return experimentRepository.findByIdAndDeletedAtIsNull(experimentId);
    }

    public StatusCounts getLatestCounts(long experimentId) {
        return statusAggregator.countLatest(experimentId);
    }

    /**
     * Latest attempts only, or the full attempt history ordered by data item then attempt number.
     */
    public List<RunCaseEntity> getRunCases(long experimentId, boolean latestOnly) {
        if (latestOnly) {
            return runCaseRepository.findByExperimentIdAndLatestTrueOrderByDataItemIdAsc(experimentId);
        }
        return runCaseRepository.findByExperimentIdOrderByDataItemIdAscAttemptNoAsc(experimentId);
    }

    public Map<Long, List<EvaluateResultEntity>> getResultsByRunCase(List<RunCaseEntity> runCases) {
        if (runCases.isEmpty()) {
            return Map.of();
        }
        List<Long> ids = runCases.stream().map(RunCaseEntity::getId).toList();
        return evaluateResultRepository.findByRunCaseIdInOrderByIdAsc(ids).stream()
            .collect(Collectors.groupingBy(EvaluateResultEntity::getRunCaseId));
    }
}
