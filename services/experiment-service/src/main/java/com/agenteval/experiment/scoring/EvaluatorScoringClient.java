package com.agenteval.experiment.scoring;

import com.agenteval.experiment.domain.EvaluatorConfig;
import java.util.List;

/**
 * Scores one produced trajectory/output with every evaluator bound to the experiment.
 * The aggregate score policy belongs to the implementation; callers only record it.
 */
public interface EvaluatorScoringClient {

    /**
     * @throws ScoringException when scoring cannot produce a result for every evaluator
     */
    ScoringResult score(List<EvaluatorConfig> evaluators, ScoringInput input);
}
