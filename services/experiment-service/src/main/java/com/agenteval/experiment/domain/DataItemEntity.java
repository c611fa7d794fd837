package com.agenteval.experiment.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;

/**
 * Read-only input to the engine. Reference trajectory and output are stored as raw JSON text.
 */
@Entity
@Table(name = "data_items")
public class DataItemEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "dataset_id", nullable = false)
    private Long datasetId;

    @Column(name = "user_input", columnDefinition = "text", nullable = false)
    private String userInput;

    @Column(name = "reference_trajectory", columnDefinition = "text")
    private String referenceTrajectory;

    @Column(name = "reference_output", columnDefinition = "text")
    private String referenceOutput;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    public static DataItemEntity of(Long datasetId, String userInput, String referenceTrajectory, String referenceOutput) {
        DataItemEntity entity = new DataItemEntity();
        entity.datasetId = datasetId;
        entity.userInput = userInput;
        entity.referenceTrajectory = referenceTrajectory;
        entity.referenceOutput = referenceOutput;
        return entity;
    }

    public DataItemInput toInput() {
        return new DataItemInput(id, userInput, referenceTrajectory, referenceOutput);
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

    public Long getDatasetId() {
        return datasetId;
    }

    public String getUserInput() {
        return userInput;
    }

    public String getReferenceTrajectory() {
        return referenceTrajectory;
    }

    public String getReferenceOutput() {
        return referenceOutput;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getDeletedAt() {
        return deletedAt;
    }
}
