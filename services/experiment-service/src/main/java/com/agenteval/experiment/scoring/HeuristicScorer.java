package com.agenteval.experiment.scoring;

import com.agenteval.experiment.domain.EvaluatorConfig;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Deterministic fallback used when no LLM judge is reachable for an evaluator.
 */
@Component
public class HeuristicScorer {

    private static final Pattern COMPLETION_SIGNAL = Pattern.compile("(success|done|finished|完成|成功)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TOOL_CALL = Pattern.compile("(tool|function|click|type|wait|call)", Pattern.CASE_INSENSITIVE);
    private static final Pattern PARAM_OBJECT = Pattern.compile("\\{.*}", Pattern.DOTALL);

    public record Verdict(double score, String reason) {
    }

    public Verdict score(EvaluatorConfig evaluator, ScoringInput input) {
        String trajectoryText = text(input.trajectory());
        String outputText = text(input.agentOutput());
        boolean hasTrajectory = trajectoryText.length() > 20;
        boolean hasOutput = outputText.length() > 5;

        if (!hasTrajectory || !hasOutput) {
            return new Verdict(0, "trajectory or output missing");
        }

        String key = evaluator.evaluatorKey() == null ? "" : evaluator.evaluatorKey();
        return switch (key) {
            case "task_success" -> COMPLETION_SIGNAL.matcher(outputText).find()
                ? new Verdict(1, "output carries a completion signal")
                : new Verdict(0.5, "output has no explicit completion signal");
            case "trajectory_quality" -> {
                int steps = input.trajectory().isArray() ? input.trajectory().size() : 1;
                yield steps >= 3
                    ? new Verdict(1, "trajectory makes progress over " + steps + " steps")
                    : new Verdict(0.5, "trajectory has few steps");
            }
            case "tool_selection_quality" -> TOOL_CALL.matcher(trajectoryText).find()
                ? new Verdict(1, "tool calls present in trajectory")
                : new Verdict(0.5, "no explicit tool call recognised");
            case "tool_params" -> PARAM_OBJECT.matcher(trajectoryText).find()
                ? new Verdict(0.5, "parameter structure detected; an LLM judge gives a finer score")
                : new Verdict(0, "no parameter structure");
            default -> new Verdict(0.5, "unknown evaluator, neutral default score");
        };
    }

    private String text(JsonNode node) {
        return node == null || node.isNull() ? "" : node.toString();
    }
}
