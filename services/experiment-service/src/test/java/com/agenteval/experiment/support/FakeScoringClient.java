package com.agenteval.experiment.support;

import com.agenteval.experiment.domain.EvaluatorConfig;
import com.agenteval.experiment.scoring.EvaluatorScore;
import com.agenteval.experiment.scoring.EvaluatorScoringClient;
import com.agenteval.experiment.scoring.ScoringInput;
import com.agenteval.experiment.scoring.ScoringResult;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Gives every evaluator a full score. Inputs registered with {@link #corruptOn(String)} get
 * scores without an evaluator key, which the evaluate_results table rejects.
 */
public class FakeScoringClient implements EvaluatorScoringClient {

    private final Set<String> corrupt = ConcurrentHashMap.newKeySet();

    @Override
    public ScoringResult score(List<EvaluatorConfig> evaluators, ScoringInput input) {
        boolean dropKey = corrupt.contains(input.userInput());
        List<EvaluatorScore> scores = evaluators.stream()
                .map(ev -> new EvaluatorScore(
                        ev.id(), dropKey ? null : ev.evaluatorKey(), ev.name(), 1.0, "fake judge", "heuristic"))
                .toList();
        return ScoringResult.averaged(scores);
    }

    public void corruptOn(String userInput) {
        corrupt.add(userInput);
    }

    public void reset() {
        corrupt.clear();
    }
}
