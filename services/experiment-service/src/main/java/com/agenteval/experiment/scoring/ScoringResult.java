package com.agenteval.experiment.scoring;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

public record ScoringResult(List<EvaluatorScore> results, double finalScore) {

    /**
     * Final score as the mean of evaluator scores, rounded to three decimals; 0 when nothing was scored.
     */
    public static ScoringResult averaged(List<EvaluatorScore> results) {
        if (results.isEmpty()) {
            return new ScoringResult(List.of(), 0.0);
        }
        double sum = 0;
        for (EvaluatorScore result : results) {
            sum += result.score();
        }
        double mean = BigDecimal.valueOf(sum / results.size())
            .setScale(3, RoundingMode.HALF_UP)
            .doubleValue();
        return new ScoringResult(List.copyOf(results), mean);
    }
}
