package com.agenteval.experiment.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "evaluators")
public class EvaluatorEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "evaluator_key", nullable = false)
    private String evaluatorKey;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "prompt_template", columnDefinition = "text")
    private String promptTemplate;

    @Column(name = "base_url")
    private String baseUrl;

    @Column(name = "model_name")
    private String modelName;

    @Column(name = "api_key")
    private String apiKey;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    public static EvaluatorEntity of(String evaluatorKey, String name, String promptTemplate) {
        EvaluatorEntity entity = new EvaluatorEntity();
        entity.evaluatorKey = evaluatorKey;
        entity.name = name;
        entity.promptTemplate = promptTemplate;
        return entity;
    }

    public EvaluatorConfig toConfig() {
        return new EvaluatorConfig(id, evaluatorKey, name, promptTemplate, baseUrl, modelName, apiKey);
    }

    public void softDelete(Instant now) {
        this.deletedAt = now;
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    public Long getId() {
        return id;
    }

    public String getEvaluatorKey() {
        return evaluatorKey;
    }

    public String getName() {
        return name;
    }

    public String getPromptTemplate() {
        return promptTemplate;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getModelName() {
        return modelName;
    }

    public String getApiKey() {
        return apiKey;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getDeletedAt() {
        return deletedAt;
    }
}
