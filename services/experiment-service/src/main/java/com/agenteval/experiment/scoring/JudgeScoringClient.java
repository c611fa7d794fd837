package com.agenteval.experiment.scoring;

import com.agenteval.experiment.config.ExperimentProperties;
import com.agenteval.experiment.domain.EvaluatorConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Scores each evaluator with an OpenAI-compatible LLM judge when credentials are available and
 * falls back to {@link HeuristicScorer} when the judge is disabled, unconfigured or fails.
 */
@Component
public class JudgeScoringClient implements EvaluatorScoringClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(JudgeScoringClient.class);

    private static final String SYSTEM_PROMPT = "Return JSON only: {\"score\":0|0.5|1,\"reason\":\"...\"}";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final HeuristicScorer heuristicScorer;
    private final JudgePromptRenderer promptRenderer;
    private final ExperimentProperties properties;

    public JudgeScoringClient(
        @Qualifier("judgeRestClient") RestClient judgeRestClient,
        ObjectMapper objectMapper,
        HeuristicScorer heuristicScorer,
        JudgePromptRenderer promptRenderer,
        ExperimentProperties properties
    ) {
        this.restClient = judgeRestClient;
        this.objectMapper = objectMapper;
        this.heuristicScorer = heuristicScorer;
        this.promptRenderer = promptRenderer;
        this.properties = properties;
    }

    @Override
    public ScoringResult score(List<EvaluatorConfig> evaluators, ScoringInput input) {
        List<EvaluatorScore> results = new ArrayList<>();
        for (EvaluatorConfig evaluator : evaluators) {
            Optional<HeuristicScorer.Verdict> judged = judge(evaluator, input);
            HeuristicScorer.Verdict verdict = judged.orElseGet(() -> heuristicScorer.score(evaluator, input));
            results.add(new EvaluatorScore(
                evaluator.id(),
                evaluator.evaluatorKey(),
                evaluator.name(),
                verdict.score(),
                verdict.reason(),
                judged.isPresent() ? "llm" : "heuristic"
            ));
        }
        return ScoringResult.averaged(results);
    }

    static double clampScore(double score) {
        if (score >= 0.9) {
            return 1;
        }
        if (score >= 0.6) {
            return 0.5;
        }
        return 0;
    }

    private Optional<HeuristicScorer.Verdict> judge(EvaluatorConfig evaluator, ScoringInput input) {
        ExperimentProperties.Judge judge = properties.getJudge();
        String apiKey = firstNonBlank(evaluator.apiKey(), judge.getApiKey());
        if (!judge.isEnabled() || apiKey == null) {
            return Optional.empty();
        }
        String baseUrl = firstNonBlank(evaluator.baseUrl(), judge.getDefaultBaseUrl());
        if (baseUrl == null) {
            return Optional.empty();
        }
        String model = firstNonBlank(evaluator.modelName(), judge.getDefaultModel());
        String prompt = promptRenderer.render(evaluator.promptTemplate(), input);

        try {
            JsonNode body = restClient.post()
                .uri(stripTrailingSlash(baseUrl) + "/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .header("Authorization", "Bearer " + apiKey)
                .body(Map.of(
                    "model", model,
                    "temperature", 0,
                    "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_PROMPT),
                        Map.of("role", "user", "content", prompt)
                    ),
                    "response_format", Map.of("type", "json_object")
                ))
                .retrieve()
                .body(JsonNode.class);
            return Optional.of(parseVerdict(body));
        } catch (RestClientException | JsonProcessingException | IllegalStateException ex) {
            LOGGER.warn("Judge call failed for evaluator {} ({}), using heuristic score: {}",
                evaluator.evaluatorKey(), model, ex.getMessage());
            return Optional.empty();
        }
    }

    private HeuristicScorer.Verdict parseVerdict(JsonNode body) throws JsonProcessingException {
        String content = body == null
            ? ""
            : body.path("choices").path(0).path("message").path("content").asText("");
        if (content.isBlank()) {
            throw new IllegalStateException("Judge response has no message content");
        }
        JsonNode parsed = objectMapper.readTree(content);
        JsonNode scoreNode = parsed.path("score");
        if (!scoreNode.isNumber() && !scoreNode.isTextual()) {
            throw new IllegalStateException("Judge response has no score");
        }
        double raw = scoreNode.asDouble(0);
        double score = raw == 0 || raw == 0.5 || raw == 1 ? raw : clampScore(raw);
        String reason = parsed.path("reason").asText("LLM judge returned score");
        return new HeuristicScorer.Verdict(score, reason);
    }

    private String firstNonBlank(String preferred, String fallback) {
        if (preferred != null && !preferred.isBlank()) {
            return preferred.trim();
        }
        if (fallback != null && !fallback.isBlank()) {
            return fallback.trim();
        }
        return null;
    }

    private String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
