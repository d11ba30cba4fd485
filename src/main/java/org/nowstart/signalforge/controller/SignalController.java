package org.nowstart.signalforge.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.nowstart.signalforge.data.dto.SignalRequest;
import org.nowstart.signalforge.data.dto.SignalRecord;
import org.nowstart.signalforge.service.SignalGenerationService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/signals")
@Tag(name = "Signal", description = "캔들 기반 매매 시그널 생성 API")
public class SignalController {

    private final SignalGenerationService signalGenerationService;

    public SignalController(SignalGenerationService signalGenerationService) {
        this.signalGenerationService = signalGenerationService;
    }

    @PostMapping
    @Operation(summary = "시그널 생성", description = "타임프레임별 캔들로 시장 국면을 판정하고 방향, 신뢰도, 손절/익절 가격을 계산합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "생성 성공"),
            @ApiResponse(responseCode = "400", description = "요청 검증 실패"),
            @ApiResponse(responseCode = "422", description = "캔들 데이터 부족")
    })
    public SignalRecord generate(@RequestBody @Valid SignalRequest request) {
        return signalGenerationService.generate(request);
    }
}
