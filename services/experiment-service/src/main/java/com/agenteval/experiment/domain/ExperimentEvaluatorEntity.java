package com.agenteval.experiment.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

@Entity
@Table(
    name = "experiment_evaluators",
    uniqueConstraints = @UniqueConstraint(
        name = "uk_experiment_evaluators",
        columnNames = {"experiment_id", "evaluator_id"}
    )
)
public class ExperimentEvaluatorEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "experiment_id", nullable = false)
    private Long experimentId;

    @Column(name = "evaluator_id", nullable = false)
    private Long evaluatorId;

    public static ExperimentEvaluatorEntity of(Long experimentId, Long evaluatorId) {
        ExperimentEvaluatorEntity entity = new ExperimentEvaluatorEntity();
        entity.experimentId = experimentId;
        entity.evaluatorId = evaluatorId;
        return entity;
    }

    public Long getId() {
        return id;
    }

    public Long getExperimentId() {
        return experimentId;
    }

    public Long getEvaluatorId() {
        return evaluatorId;
    }
}
