package com.agenteval.experiment.repository;

import com.agenteval.experiment.domain.RunCaseEntity;
import com.agenteval.experiment.domain.RunCaseStatus;
import com.agenteval.experiment.domain.StatusCount;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RunCaseRepository extends JpaRepository<RunCaseEntity, Long> {

    @Query("""
        select new com.agenteval.experiment.domain.StatusCount(rc.status, count(rc))
        from RunCaseEntity rc
        where rc.experimentId = :experimentId and rc.latest = true
        group by rc.status
        """)
    List<StatusCount> countLatestByStatus(@Param("experimentId") Long experimentId);

    Optional<RunCaseEntity> findByExperimentIdAndDataItemIdAndLatestTrue(Long experimentId, Long dataItemId);

    List<RunCaseEntity> findByExperimentIdAndLatestTrueAndStatusOrderByCreatedAtAscIdAsc(
        Long experimentId,
        RunCaseStatus status
    );

    List<RunCaseEntity> findByExperimentIdOrderByDataItemIdAscAttemptNoAsc(Long experimentId);

    List<RunCaseEntity> findByExperimentIdAndLatestTrueOrderByDataItemIdAsc(Long experimentId);

    List<RunCaseEntity> findByExperimentIdAndDataItemIdOrderByAttemptNoAsc(Long experimentId, Long dataItemId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        update RunCaseEntity rc
        set rc.status = com.agenteval.experiment.domain.RunCaseStatus.FAILED,
            rc.errorMessage = :reason,
            rc.finishedAt = :now,
            rc.updatedAt = :now
        where rc.experimentId = :experimentId
          and rc.latest = true
          and rc.status in :statuses
        """)
    int forceFailLatest(
        @Param("experimentId") Long experimentId,
        @Param("statuses") Collection<RunCaseStatus> statuses,
        @Param("reason") String reason,
        @Param("now") Instant now
    );
}
