package com.agenteval.experiment.repository;

import com.agenteval.experiment.domain.ExperimentEvaluatorEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ExperimentEvaluatorRepository extends JpaRepository<ExperimentEvaluatorEntity, Long> {
}
