package org.nowstart.signalforge.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.signalforge.data.dto.CalibrationRecord;
import org.nowstart.signalforge.data.dto.CalibrationRunResult;
import org.nowstart.signalforge.data.exception.SignalApiException;
import org.nowstart.signalforge.data.type.CalibrationRunStatus;
import org.nowstart.signalforge.service.calibration.CalibrationRecordHolder;
import org.nowstart.signalforge.service.calibration.ThresholdCalibrationService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

@ExtendWith(MockitoExtension.class)
class CalibrationControllerTest {

    private static final CalibrationRecord RECORD =
            new CalibrationRecord(3L, 65.0, 40, 50.2, 62.0, 8.5, 180, Instant.parse("2026-02-01T03:00:00Z"));

    @Mock
    private CalibrationRecordHolder calibrationRecordHolder;

    @Mock
    private ThresholdCalibrationService thresholdCalibrationService;

    @InjectMocks
    private CalibrationController controller;

    @Test
    void getActive_returnsCurrentRecord() {
        when(calibrationRecordHolder.current()).thenReturn(Optional.of(RECORD));

        assertThat(controller.getActive()).isEqualTo(RECORD);
    }

    @Test
    void getActive_throwsNotFoundWithoutRecord() {
        when(calibrationRecordHolder.current()).thenReturn(Optional.empty());

        assertThatThrownBy(controller::getActive)
                .isInstanceOfSatisfying(SignalApiException.class, exception -> {
                    assertThat(exception.getStatus()).isEqualTo(HttpStatus.NOT_FOUND);
                    assertThat(exception.getCode()).isEqualTo("calibration_not_found");
                });
    }

    @Test
    void run_returnsOkForCompletedRun() {
        CalibrationRunResult result = new CalibrationRunResult(CalibrationRunStatus.COMPLETED, RECORD, List.of(), List.of(), "done");
        when(thresholdCalibrationService.calibrate()).thenReturn(result);

        ResponseEntity<CalibrationRunResult> response = controller.run();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isEqualTo(result);
    }

    @Test
    void run_returnsConflictWhenRunAlreadyInProgress() {
        CalibrationRunResult result = new CalibrationRunResult(
                CalibrationRunStatus.REJECTED_CONCURRENT_RUN,
                null,
                List.of(),
                List.of(),
                "Calibration already running"
        );
        when(thresholdCalibrationService.calibrate()).thenReturn(result);

        ResponseEntity<CalibrationRunResult> response = controller.run();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    }
}
