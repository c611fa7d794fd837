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
@Table(name = "agents")
public class AgentEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "agent_key", nullable = false)
    private String agentKey;

    @Column(name = "version", nullable = false)
    private String version;

    @Column(name = "docker_image")
    private String dockerImage;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    public static AgentEntity of(String name, String agentKey, String version, String dockerImage) {
        AgentEntity entity = new AgentEntity();
        entity.name = name;
        entity.agentKey = agentKey;
        entity.version = version;
        entity.dockerImage = dockerImage;
        return entity;
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

    public String getName() {
        return name;
    }

    public String getAgentKey() {
        return agentKey;
    }

    public String getVersion() {
        return version;
    }

    public String getDockerImage() {
        return dockerImage;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getDeletedAt() {
        return deletedAt;
    }
}
