package com.agenteval.experiment.repository;

import com.agenteval.experiment.domain.DataItemEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DataItemRepository extends JpaRepository<DataItemEntity, Long> {

    List<DataItemEntity> findByDatasetIdAndDeletedAtIsNullOrderByCreatedAtAscIdAsc(Long datasetId);
}
