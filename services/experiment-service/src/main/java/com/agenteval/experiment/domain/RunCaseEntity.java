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
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;

/**
 * One execution attempt of one data item. Attempt rows are never overwritten by a later attempt:
 * the previous row is retired ({@code is_latest = false}) and a new row is appended.
 */
@Entity
@Table(
    name = "run_cases",
    uniqueConstraints = @UniqueConstraint(
        name = "uk_run_cases_attempt",
        columnNames = {"experiment_id", "data_item_id", "attempt_no"}
    )
)
public class RunCaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "experiment_id", nullable = false, updatable = false)
    private Long experimentId;

    @Column(name = "data_item_id", nullable = false, updatable = false)
    private Long dataItemId;

    @Column(name = "agent_id", nullable = false, updatable = false)
    private Long agentId;

    @Column(name = "attempt_no", nullable = false, updatable = false)
    private int attemptNo;

    @Column(name = "is_latest", nullable = false)
    private boolean latest;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private RunCaseStatus status;

    @Column(name = "final_score")
    private Double finalScore;

    @Column(name = "agent_trajectory", columnDefinition = "text")
    private String agentTrajectory;

    @Column(name = "agent_output", columnDefinition = "text")
    private String agentOutput;

    @Column(name = "latency_ms")
    private Long latencyMs;

    @Column(name = "input_tokens")
    private Integer inputTokens;

    @Column(name = "output_tokens")
    private Integer outputTokens;

    @Column(name = "logs", columnDefinition = "text")
    private String logs;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static RunCaseEntity startAttempt(ExperimentContext context, long dataItemId, int attemptNo, Instant now) {
        if (attemptNo < 1) {
            throw new IllegalArgumentException("Attempt numbers start at 1, got " + attemptNo);
        }
        RunCaseEntity runCase = new RunCaseEntity();
        runCase.experimentId = context.experimentId();
        runCase.dataItemId = dataItemId;
        runCase.agentId = context.agentId();
        runCase.attemptNo = attemptNo;
        runCase.latest = true;
        runCase.status = RunCaseStatus.RUNNING;
        runCase.startedAt = now;
        return runCase;
    }

    public void retire() {
        this.latest = false;
    }

    public void succeed(
        double finalScore,
        String agentTrajectory,
        String agentOutput,
        long latencyMs,
        Integer inputTokens,
        Integer outputTokens,
        String logs,
        Instant now
    ) {
        this.status = RunCaseStatus.SUCCESS;
        this.finalScore = finalScore;
        this.agentTrajectory = agentTrajectory;
        this.agentOutput = agentOutput;
        this.latencyMs = latencyMs;
        this.inputTokens = inputTokens;
        this.outputTokens = outputTokens;
        this.logs = logs;
        this.errorMessage = null;
        this.finishedAt = now;
    }

    public void fail(String errorMessage, String logs, Instant now) {
        this.status = RunCaseStatus.FAILED;
        this.errorMessage = errorMessage;
        this.logs = logs;
        this.finishedAt = now;
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

    public Long getExperimentId() {
        return experimentId;
    }

    public Long getDataItemId() {
        return dataItemId;
    }

    public Long getAgentId() {
        return agentId;
    }

    public int getAttemptNo() {
        return attemptNo;
    }

    public boolean isLatest() {
        return latest;
    }

    public RunCaseStatus getStatus() {
        return status;
    }

    public Double getFinalScore() {
        return finalScore;
    }

    public String getAgentTrajectory() {
        return agentTrajectory;
    }

    public String getAgentOutput() {
        return agentOutput;
    }

    public Long getLatencyMs() {
        return latencyMs;
    }

    public Integer getInputTokens() {
        return inputTokens;
    }

    public Integer getOutputTokens() {
        return outputTokens;
    }

    public String getLogs() {
        return logs;
    }

    public String getErrorMessage() {
        return errorMessage;
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
}
