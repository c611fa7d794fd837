package com.agenteval.experiment.repository;

import com.agenteval.experiment.domain.DatasetEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DatasetRepository extends JpaRepository<DatasetEntity, Long> {

    Optional<DatasetEntity> findByIdAndDeletedAtIsNull(Long id);
}
