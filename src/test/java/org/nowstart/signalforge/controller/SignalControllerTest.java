package org.nowstart.signalforge.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.signalforge.data.dto.CandleDto;
import org.nowstart.signalforge.data.dto.SignalRecord;
import org.nowstart.signalforge.data.dto.SignalRequest;
import org.nowstart.signalforge.data.type.Timeframe;
import org.nowstart.signalforge.service.SignalGenerationService;

@ExtendWith(MockitoExtension.class)
class SignalControllerTest {

    @Mock
    private SignalGenerationService signalGenerationService;

    @InjectMocks
    private SignalController controller;

    @Test
    void generate_delegatesToService() {
        SignalRequest request = new SignalRequest(
                "EURUSD",
                Map.of(Timeframe.M5, List.of(new CandleDto(Instant.parse("2026-01-05T10:55:00Z"), 1.0858, 1.0865, 1.0855, 1.0860, 1000.0))),
                null,
                null,
                null,
                null,
                null,
                null
        );
        SignalRecord record = mock(SignalRecord.class);
        when(signalGenerationService.generate(request)).thenReturn(record);

        SignalRecord result = controller.generate(request);

        assertThat(result).isSameAs(record);
        verify(signalGenerationService).generate(request);
    }
}
