package com.agenteval.experiment.repository;

import com.agenteval.experiment.domain.ExperimentEntity;
import com.agenteval.experiment.domain.ExperimentStatus;
import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ExperimentRepository extends JpaRepository<ExperimentEntity, Long> {

    Optional<ExperimentEntity> findByIdAndDeletedAtIsNull(Long id);

    /**
     * Row-locks the experiment ({@code SELECT ... FOR UPDATE}) until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select e from ExperimentEntity e where e.id = :id and e.deletedAt is null")
    Optional<ExperimentEntity> findActiveForUpdate(@Param("id") Long id);

    List<ExperimentEntity> findByStatusAndStartedAtBeforeAndDeletedAtIsNull(ExperimentStatus status, Instant cutoff);
}
