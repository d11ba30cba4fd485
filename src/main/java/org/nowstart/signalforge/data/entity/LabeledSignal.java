package org.nowstart.signalforge.data.entity;

import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.nowstart.signalforge.data.type.SignalDirection;
import org.nowstart.signalforge.data.type.TradeOutcome;

/**
 * Historical signal with a known outcome. Written by the outcome labeller, read by calibration.
 */
@Entity
@Table(name = "labeled_signal", indexes = @Index(name = "idx_labeled_signal_labeled_at", columnList = "labeledAt"))
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LabeledSignal extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String symbol;

    @Enumerated(EnumType.STRING)
    private SignalDirection direction;

    private double confidence;

    @Enumerated(EnumType.STRING)
    private TradeOutcome outcome;

    private double winPips;

    private double lossPips;

    private Instant labeledAt;

    public double realizedPips() {
        return outcome == TradeOutcome.WIN ? winPips : -lossPips;
    }
}
