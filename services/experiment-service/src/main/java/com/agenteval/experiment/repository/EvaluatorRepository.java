package com.agenteval.experiment.repository;

import com.agenteval.experiment.domain.EvaluatorEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface EvaluatorRepository extends JpaRepository<EvaluatorEntity, Long> {

    @Query("""
        select ev from EvaluatorEntity ev, ExperimentEvaluatorEntity ee
        where ee.evaluatorId = ev.id
          and ee.experimentId = :experimentId
          and ev.deletedAt is null
        order by ev.createdAt asc, ev.id asc
        """)
    List<EvaluatorEntity> findBoundToExperiment(@Param("experimentId") Long experimentId);
}
