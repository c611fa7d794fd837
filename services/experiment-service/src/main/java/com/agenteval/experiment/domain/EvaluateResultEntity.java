package com.agenteval.experiment.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "evaluate_results")
public class EvaluateResultEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "run_case_id", nullable = false, updatable = false)
    private Long runCaseId;

    @Column(name = "evaluator_id", nullable = false, updatable = false)
    private Long evaluatorId;

    @Column(name = "evaluator_key", nullable = false, updatable = false)
    private String evaluatorKey;

    @Column(name = "score", nullable = false, updatable = false)
    private double score;

    @Column(name = "reason", columnDefinition = "text", updatable = false)
    private String reason;

    @Column(name = "raw_result", columnDefinition = "text", updatable = false)
    private String rawResult;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static EvaluateResultEntity of(
        Long runCaseId,
        Long evaluatorId,
        String evaluatorKey,
        double score,
        String reason,
        String rawResult
    ) {
        EvaluateResultEntity entity = new EvaluateResultEntity();
        entity.runCaseId = runCaseId;
        entity.evaluatorId = evaluatorId;
        entity.evaluatorKey = evaluatorKey;
        entity.score = score;
        entity.reason = reason;
        entity.rawResult = rawResult;
        entity.createdAt = Instant.now();
        return entity;
    }

    public Long getId() {
        return id;
    }

    public Long getRunCaseId() {
        return runCaseId;
    }

    public Long getEvaluatorId() {
        return evaluatorId;
    }

    public String getEvaluatorKey() {
        return evaluatorKey;
    }

    public double getScore() {
        return score;
    }

    public String getReason() {
        return reason;
    }

    public String getRawResult() {
        return rawResult;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
