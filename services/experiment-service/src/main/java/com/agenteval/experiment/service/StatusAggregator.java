package com.agenteval.experiment.service;

import com.agenteval.experiment.domain.ExperimentEntity;
import com.agenteval.experiment.domain.ExperimentStatus;
import com.agenteval.experiment.domain.StatusCounts;
import com.agenteval.experiment.domain.StatusDecision;
import com.agenteval.experiment.repository.RunCaseRepository;
import java.time.Clock;
import org.springframework.stereotype.Component;

/**
 * Derives an experiment's status from the statuses of its latest run cases.
 */
@Component
public class StatusAggregator {

    private final RunCaseRepository runCaseRepository;
    private final Clock clock;

    public StatusAggregator(RunCaseRepository runCaseRepository, Clock clock) {
        this.runCaseRepository = runCaseRepository;
        this.clock = clock;
    }

    public static StatusDecision decide(StatusCounts counts) {
        if (counts.total() == 0) {
            return new StatusDecision(ExperimentStatus.READY, false);
        }
        if (counts.running() > 0 || counts.pending() > 0) {
            return new StatusDecision(ExperimentStatus.RUNNING, false);
        }
        if (counts.failed() == 0) {
            return new StatusDecision(ExperimentStatus.FINISHED, true);
        }
        if (counts.success() == 0) {
            return new StatusDecision(ExperimentStatus.FAILED, true);
        }
        return new StatusDecision(ExperimentStatus.PARTIAL_FAILED, true);
    }

    public StatusCounts countLatest(long experimentId) {
        return StatusCounts.from(runCaseRepository.countLatestByStatus(experimentId));
    }

    /**
     * Recomputes and applies the status to a managed experiment; the caller's transaction persists it.
     */
    public ExperimentStatus refresh(ExperimentEntity experiment) {
        StatusDecision decision = decide(countLatest(experiment.getId()));
        experiment.applyStatus(decision, clock.instant());
        return decision.status();
    }
}
