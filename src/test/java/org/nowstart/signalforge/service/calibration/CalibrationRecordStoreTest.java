package org.nowstart.signalforge.service.calibration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.when;

import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.signalforge.data.dto.CalibrationRecord;
import org.nowstart.signalforge.data.dto.ThresholdEvaluation;
import org.nowstart.signalforge.data.entity.CalibrationRecordEntity;
import org.nowstart.signalforge.repository.CalibrationRecordRepository;

@ExtendWith(MockitoExtension.class)
class CalibrationRecordStoreTest {

    @Mock
    private CalibrationRecordRepository calibrationRecordRepository;

    @Test
    void supersede_deactivatesPreviousRecordsBeforeSavingActiveOne() {
        Instant computedAt = Instant.parse("2026-02-01T03:00:00Z");
        when(calibrationRecordRepository.save(any(CalibrationRecordEntity.class))).thenAnswer(invocation -> {
            CalibrationRecordEntity entity = invocation.getArgument(0);
            entity.setId(11L);
            return entity;
        });
        CalibrationRecordStore store = new CalibrationRecordStore(calibrationRecordRepository);

        CalibrationRecord record = store.supersede(new ThresholdEvaluation(70, 25, 18, 72.0, 9.5, 47.0), 140, computedAt);

        InOrder order = inOrder(calibrationRecordRepository);
        order.verify(calibrationRecordRepository).deactivateAll();
        ArgumentCaptor<CalibrationRecordEntity> saved = ArgumentCaptor.forClass(CalibrationRecordEntity.class);
        order.verify(calibrationRecordRepository).save(saved.capture());

        assertThat(saved.getValue().isActive()).isTrue();
        assertThat(saved.getValue().getTotalSignals()).isEqualTo(140);
        assertThat(record).isEqualTo(new CalibrationRecord(11L, 70.0, 25, 47.0, 72.0, 9.5, 140, computedAt));
    }
}
