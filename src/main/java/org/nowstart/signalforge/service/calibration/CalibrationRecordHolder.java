package org.nowstart.signalforge.service.calibration;

import jakarta.annotation.PostConstruct;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.signalforge.data.dto.CalibrationRecord;
import org.nowstart.signalforge.data.entity.CalibrationRecordEntity;
import org.nowstart.signalforge.repository.CalibrationRecordRepository;
import org.springframework.stereotype.Component;

/**
 * Read side of calibration. Signal generation reads a snapshot; calibration swaps in a new one
 * after its transaction commits.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CalibrationRecordHolder {

    private final CalibrationRecordRepository calibrationRecordRepository;
    private final AtomicReference<CalibrationRecord> current = new AtomicReference<>();

    @PostConstruct
    void load() {
        calibrationRecordRepository.findFirstByActiveTrueOrderByIdDesc()
                .map(CalibrationRecordEntity::toRecord)
                .ifPresentOrElse(
                        record -> {
                            current.set(record);
                            log.info("event=calibration_loaded version={} threshold={}", record.version(), record.threshold());
                        },
                        () -> log.info("event=calibration_loaded version=none")
                );
    }

    public Optional<CalibrationRecord> current() {
        return Optional.ofNullable(current.get());
    }

    public void publish(CalibrationRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("calibration record is required");
        }
        current.set(record);
    }
}
