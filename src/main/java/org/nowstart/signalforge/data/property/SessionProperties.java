package org.nowstart.signalforge.data.property;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "signalforge.session")
public record SessionProperties(
        // 세션 판정 기준 시간대
        @NotNull @DefaultValue("UTC") ZoneId zone,
        // 거래 세션 정의(활성 시간, Initial Balance 시작 시각)
        List<@Valid SessionWindow> sessions,
        // Initial Balance 구간 길이
        @NotNull @DefaultValue("60m") Duration initialBalanceDuration,
        // Initial Balance 종료 직후 오프닝 돌파 인정 구간
        @NotNull @DefaultValue("15m") Duration breakoutWindow,
        // 금요일 시장 마감 시각(이후 주말까지 신규 진입 비권장)
        @PositiveOrZero @DefaultValue("20") int fridayCloseHour
) {

    public static final List<SessionWindow> DEFAULT_SESSIONS = List.of(
            new SessionWindow("ASIAN", 0, 7, null),
            new SessionWindow("LONDON", 7, 12, 8),
            new SessionWindow("NEW_YORK", 12, 20, 13)
    );

    public SessionProperties {
        sessions = sessions == null || sessions.isEmpty() ? DEFAULT_SESSIONS : List.copyOf(sessions);
        if (fridayCloseHour > 24) {
            throw new IllegalArgumentException("fridayCloseHour must be within 0..24");
        }
    }

    public static SessionProperties defaults() {
        return new SessionProperties(ZoneId.of("UTC"), DEFAULT_SESSIONS, Duration.ofMinutes(60), Duration.ofMinutes(15), 20);
    }

    /**
     * One trading session. Active over {@code [activeFromHour, activeToHour)}; sessions without
     * {@code ibStartHour} have no initial balance.
     */
    public record SessionWindow(
            String name,
            int activeFromHour,
            int activeToHour,
            @Min(0) @Max(23) Integer ibStartHour
    ) {

        public SessionWindow {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("session name is required");
            }
            if (activeFromHour < 0 || activeToHour > 24 || activeFromHour >= activeToHour) {
                throw new IllegalArgumentException("invalid active hours for session " + name);
            }
            if (ibStartHour != null && (ibStartHour < 0 || ibStartHour > 23)) {
                throw new IllegalArgumentException("ibStartHour must be within 0..23 for session " + name);
            }
        }

        public boolean contains(int hour) {
            return hour >= activeFromHour && hour < activeToHour;
        }

        public boolean hasInitialBalance() {
            return ibStartHour != null;
        }
    }
}
