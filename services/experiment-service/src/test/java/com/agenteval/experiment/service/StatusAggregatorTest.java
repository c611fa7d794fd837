package com.agenteval.experiment.service;

import com.agenteval.experiment.domain.ExperimentStatus;
import com.agenteval.experiment.domain.RunCaseStatus;
import com.agenteval.experiment.domain.StatusCount;
import com.agenteval.experiment.domain.StatusCounts;
import com.agenteval.experiment.domain.StatusDecision;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StatusAggregatorTest {

    @Test
    void decide_noCases_isReadyWithoutFinishTime() {
        StatusDecision decision = StatusAggregator.decide(StatusCounts.EMPTY);

        assertEquals(ExperimentStatus.READY, decision.status());
        assertFalse(decision.terminal());
    }

    @Test
    void decide_anyRunningOrPending_isRunning() {
        assertEquals(ExperimentStatus.RUNNING,
                StatusAggregator.decide(new StatusCounts(3, 0, 1, 1, 1)).status());
        assertEquals(ExperimentStatus.RUNNING,
                StatusAggregator.decide(new StatusCounts(2, 1, 0, 1, 0)).status());
        assertFalse(StatusAggregator.decide(new StatusCounts(2, 1, 0, 1, 0)).terminal());
    }

    @Test
    void decide_allSucceeded_isFinished() {
        StatusDecision decision = StatusAggregator.decide(new StatusCounts(3, 0, 0, 3, 0));

        assertEquals(ExperimentStatus.FINISHED, decision.status());
        assertTrue(decision.terminal());
    }

    @Test
    void decide_allFailed_isFailed() {
        StatusDecision decision = StatusAggregator.decide(new StatusCounts(2, 0, 0, 0, 2));

        assertEquals(ExperimentStatus.FAILED, decision.status());
        assertTrue(decision.terminal());
    }

    @Test
    void decide_mixedOutcome_isPartialFailed() {
        StatusDecision decision = StatusAggregator.decide(new StatusCounts(3, 0, 0, 2, 1));

        assertEquals(ExperimentStatus.PARTIAL_FAILED, decision.status());
        assertTrue(decision.terminal());
    }

    @Test
    void counts_fromGroupedRows_sumsPerStatus() {
        StatusCounts counts = StatusCounts.from(List.of(
                new StatusCount(RunCaseStatus.SUCCESS, 4L),
                new StatusCount(RunCaseStatus.FAILED, 2L),
                new StatusCount(RunCaseStatus.RUNNING, 1L)
        ));

        assertEquals(7, counts.total());
        assertEquals(4, counts.success());
        assertEquals(2, counts.failed());
        assertEquals(1, counts.running());
        assertEquals(0, counts.pending());
    }
}
