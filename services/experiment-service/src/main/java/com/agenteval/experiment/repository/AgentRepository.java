package com.agenteval.experiment.repository;

import com.agenteval.experiment.domain.AgentEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AgentRepository extends JpaRepository<AgentEntity, Long> {

    Optional<AgentEntity> findByIdAndDeletedAtIsNull(Long id);
}
