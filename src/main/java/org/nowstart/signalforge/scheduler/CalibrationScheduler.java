package org.nowstart.signalforge.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.signalforge.data.dto.CalibrationRunResult;
import org.nowstart.signalforge.data.exception.CalibrationInsufficientDataException;
import org.nowstart.signalforge.data.exception.CalibrationTimeoutException;
import org.nowstart.signalforge.service.calibration.ThresholdCalibrationService;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class CalibrationScheduler {

    private final ThresholdCalibrationService thresholdCalibrationService;

    /**
     * Monthly run. A skipped or timed-out run keeps the active record and waits for the next slot.
     */
    @Scheduled(cron = "${signalforge.calibration.cron:0 0 3 1 * *}", zone = "UTC")
    public void run() {
        try {
            CalibrationRunResult result = thresholdCalibrationService.calibrate();
            log.info("event=calibration_scheduled status={} message=\"{}\"", result.status(), result.message());
        } catch (CalibrationInsufficientDataException e) {
            log.warn("event=calibration_scheduled status=SKIPPED samples={} required={} message=\"{}\"",
                    e.getSampleCount(), e.getRequiredSamples(), e.getMessage());
        } catch (CalibrationTimeoutException e) {
            log.warn("event=calibration_scheduled status=TIMEOUT timeout_ms={} retryable={}",
                    e.getTimeout().toMillis(), e.isRetryable());
        }
    }
}
