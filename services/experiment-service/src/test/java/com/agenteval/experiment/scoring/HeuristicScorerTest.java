package com.agenteval.experiment.scoring;

import com.agenteval.experiment.domain.EvaluatorConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HeuristicScorerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final HeuristicScorer scorer = new HeuristicScorer();

    @Test
    void score_missingOutput_isZero() throws Exception {
        ScoringInput input = input("[{\"tool\":\"search\",\"args\":{\"q\":\"x\"}}]", "{}");

        assertEquals(0.0, scorer.score(evaluator("task_success"), input).score());
    }

    @Test
    void score_taskSuccess_rewardsCompletionSignal() throws Exception {
        ScoringInput done = input("[{\"tool\":\"search\",\"args\":{\"q\":\"x\"}}]", "{\"status\":\"done\"}");
        ScoringInput open = input("[{\"tool\":\"search\",\"args\":{\"q\":\"x\"}}]", "{\"status\":\"pending\"}");

        assertEquals(1.0, scorer.score(evaluator("task_success"), done).score());
        assertEquals(0.5, scorer.score(evaluator("task_success"), open).score());
    }

    @Test
    void score_trajectoryQuality_countsSteps() throws Exception {
        ScoringInput longRun = input("[{\"step\":1},{\"step\":2},{\"step\":3}]", "{\"answer\":\"ok ok\"}");
        ScoringInput shortRun = input("[{\"step\":\"only one step here\"}]", "{\"answer\":\"ok ok\"}");

        assertEquals(1.0, scorer.score(evaluator("trajectory_quality"), longRun).score());
        assertEquals(0.5, scorer.score(evaluator("trajectory_quality"), shortRun).score());
    }

    @Test
    void score_toolParams_needsParameterObject() throws Exception {
        ScoringInput withParams = input("[{\"tool\":\"search\",\"args\":{\"q\":\"x\"}}]", "{\"answer\":\"ok ok\"}");

        assertEquals(0.5, scorer.score(evaluator("tool_params"), withParams).score());
    }

    @Test
    void score_unknownEvaluator_isNeutral() throws Exception {
        ScoringInput input = input("[{\"tool\":\"search\",\"args\":{\"q\":\"x\"}}]", "{\"answer\":\"ok ok\"}");

        assertEquals(0.5, scorer.score(evaluator("politeness"), input).score());
    }

    private EvaluatorConfig evaluator(String key) {
        return new EvaluatorConfig(1L, key, key, "", null, null, null);
    }

    private ScoringInput input(String trajectory, String output) throws Exception {
        JsonNode t = mapper.readTree(trajectory);
        JsonNode o = mapper.readTree(output);
        return new ScoringInput("question", t, o, null, mapper.createArrayNode());
    }
}
