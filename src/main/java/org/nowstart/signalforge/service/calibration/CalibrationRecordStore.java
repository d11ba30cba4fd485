package org.nowstart.signalforge.service.calibration;

import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.nowstart.signalforge.data.dto.CalibrationRecord;
import org.nowstart.signalforge.data.dto.ThresholdEvaluation;
import org.nowstart.signalforge.data.entity.CalibrationRecordEntity;
import org.nowstart.signalforge.repository.CalibrationRecordRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class CalibrationRecordStore {

    private final CalibrationRecordRepository calibrationRecordRepository;

    /**
     * Deactivates every active record and inserts the new one as active in one transaction.
     */
    @Transactional
    public CalibrationRecord supersede(ThresholdEvaluation chosen, int totalSignals, Instant computedAt) {
        calibrationRecordRepository.deactivateAll();
        CalibrationRecordEntity saved = calibrationRecordRepository.save(CalibrationRecordEntity.builder()
                .threshold(chosen.threshold())
                .qualifiedSignalCount(chosen.qualifiedCount())
                .blendedScore(chosen.score())
                .winRate(chosen.winRate())
                .avgPips(chosen.avgPips())
                .totalSignals(totalSignals)
                .computedAt(computedAt)
                .active(true)
                .build());
        return saved.toRecord();
    }
}
