package com.agenteval.experiment.repository;

import com.agenteval.experiment.domain.EvaluateResultEntity;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EvaluateResultRepository extends JpaRepository<EvaluateResultEntity, Long> {

    List<EvaluateResultEntity> findByRunCaseIdOrderByIdAsc(Long runCaseId);

    List<EvaluateResultEntity> findByRunCaseIdInOrderByIdAsc(Collection<Long> runCaseIds);
}
