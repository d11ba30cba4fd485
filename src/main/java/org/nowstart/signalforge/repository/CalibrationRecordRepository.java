package org.nowstart.signalforge.repository;

import java.util.Optional;
import org.nowstart.signalforge.data.entity.CalibrationRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

public interface CalibrationRecordRepository extends JpaRepository<CalibrationRecordEntity, Long> {

    Optional<CalibrationRecordEntity> findFirstByActiveTrueOrderByIdDesc();

    @Modifying
    @Query("update CalibrationRecordEntity c set c.active = false where c.active = true")
    int deactivateAll();
}
