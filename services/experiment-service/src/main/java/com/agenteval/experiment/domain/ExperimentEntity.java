package com.agenteval.experiment.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;

/**
 * A (dataset, agent version, evaluator set) binding. The run lock and the status are always
 * changed together, inside the transaction that performs the status transition.
 */
@Entity
@Table(name = "experiments")
public class ExperimentEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "dataset_id", nullable = false)
    private Long datasetId;

    @Column(name = "agent_id", nullable = false)
    private Long agentId;

    @Column(name = "run_locked", nullable = false)
    private boolean runLocked;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private ExperimentStatus status;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    public static ExperimentEntity create(String name, Long datasetId, Long agentId) {
        ExperimentEntity experiment = new ExperimentEntity();
        experiment.name = name;
        experiment.datasetId = datasetId;
        experiment.agentId = agentId;
        experiment.status = ExperimentStatus.READY;
        return experiment;
    }

    public void acquireRunLock(Instant now) {
        this.runLocked = true;
        this.status = ExperimentStatus.RUNNING;
        this.startedAt = now;
        this.finishedAt = null;
    }

    public void resetToReady() {
        this.runLocked = false;
        this.status = ExperimentStatus.READY;
        this.startedAt = null;
        this.finishedAt = null;
    }

    public void beginRetry() {
        this.status = ExperimentStatus.RUNNING;
        this.finishedAt = null;
    }

    public void applyStatus(StatusDecision decision, Instant now) {
        this.status = decision.status();
        this.finishedAt = decision.terminal() ? now : null;
    }

    public void terminate(Instant now) {
        this.status = ExperimentStatus.TERMINATED;
        this.runLocked = false;
        this.finishedAt = now;
    }

    public void markFailed(Instant now) {
        this.status = ExperimentStatus.FAILED;
        this.finishedAt = now;
    }

    public void softDelete(Instant now) {
        this.deletedAt = now;
    }

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Long getDatasetId() {
        return datasetId;
    }

    public Long getAgentId() {
        return agentId;
    }

    public boolean isRunLocked() {
        return runLocked;
    }

    public ExperimentStatus getStatus() {
        return status;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Instant getDeletedAt() {
        return deletedAt;
    }
}
