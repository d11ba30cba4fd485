package org.nowstart.signalforge.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.nowstart.signalforge.data.dto.CalibrationRecord;
import org.nowstart.signalforge.data.dto.CalibrationRunResult;
import org.nowstart.signalforge.data.exception.SignalApiException;
import org.nowstart.signalforge.data.type.CalibrationRunStatus;
import org.nowstart.signalforge.service.calibration.CalibrationRecordHolder;
import org.nowstart.signalforge.service.calibration.ThresholdCalibrationService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/calibration")
@Tag(name = "Calibration", description = "신뢰도 임계값 보정 조회/실행 API")
public class CalibrationController {

    private final CalibrationRecordHolder calibrationRecordHolder;
    private final ThresholdCalibrationService thresholdCalibrationService;

    public CalibrationController(
            CalibrationRecordHolder calibrationRecordHolder,
            ThresholdCalibrationService thresholdCalibrationService
    ) {
        this.calibrationRecordHolder = calibrationRecordHolder;
        this.thresholdCalibrationService = thresholdCalibrationService;
    }

    @GetMapping
    @Operation(summary = "활성 보정 결과 조회", description = "현재 시그널 생성에 적용 중인 임계값 보정 결과를 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "404", description = "보정 결과 없음")
    })
    public CalibrationRecord getActive() {
        return calibrationRecordHolder.current()
                .orElseThrow(() -> new SignalApiException(
                        HttpStatus.NOT_FOUND,
                        "calibration_not_found",
                        "No calibration record is active"
                ));
    }

    @PostMapping("/run")
    @Operation(summary = "보정 실행", description = "최근 라벨링된 시그널로 임계값 그리드 탐색을 실행하고 결과를 활성화합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "보정 완료"),
            @ApiResponse(responseCode = "409", description = "이미 보정 실행 중"),
            @ApiResponse(responseCode = "422", description = "라벨링 데이터 부족"),
            @ApiResponse(responseCode = "503", description = "과거 데이터 조회 시간 초과")
    })
    public ResponseEntity<CalibrationRunResult> run() {
        CalibrationRunResult result = thresholdCalibrationService.calibrate();
        HttpStatus status = result.status() == CalibrationRunStatus.REJECTED_CONCURRENT_RUN
                ? HttpStatus.CONFLICT
                : HttpStatus.OK;
        return ResponseEntity.status(status).body(result);
    }
}
