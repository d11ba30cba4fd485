package org.nowstart.signalforge.data.dto;

import org.nowstart.signalforge.data.type.SignalDirection;

public record DirectionStats(
        SignalDirection direction,
        int count,
        double winRate,
        double avgPips
) {
}
