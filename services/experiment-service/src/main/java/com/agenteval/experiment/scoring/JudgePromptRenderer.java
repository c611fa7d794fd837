package com.agenteval.experiment.scoring;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class JudgePromptRenderer {

    private final ObjectMapper objectMapper;

    public JudgePromptRenderer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String render(String template, ScoringInput input) {
        Map<String, String> replacements = new LinkedHashMap<>();
        replacements.put("{{user_input}}", input.userInput() == null ? "" : input.userInput());
        replacements.put("{{trajectory}}", pretty(input.trajectory()));
        replacements.put("{{agent_output}}", pretty(input.agentOutput()));
        replacements.put("{{reference_output}}", pretty(input.referenceOutput()));
        replacements.put("{{tools}}", pretty(input.tools()));

        String prompt = template == null ? "" : template;
        for (Map.Entry<String, String> entry : replacements.entrySet()) {
            prompt = prompt.replace(entry.getKey(), entry.getValue());
        }
        return prompt;
    }

    private String pretty(JsonNode node) {
        if (node == null) {
            return "null";
        }
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new ScoringException("Unable to render judge prompt", e);
        }
    }
}
