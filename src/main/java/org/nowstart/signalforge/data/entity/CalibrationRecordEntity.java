package org.nowstart.signalforge.data.entity;

import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.nowstart.signalforge.data.dto.CalibrationRecord;

@Entity
@Table(name = "calibration_record")
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CalibrationRecordEntity extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private double threshold;

    private int qualifiedSignalCount;

    private double blendedScore;

    private double winRate;

    private double avgPips;

    private int totalSignals;

    private Instant computedAt;

    private boolean active;

    public CalibrationRecord toRecord() {
        return new CalibrationRecord(
                id,
                threshold,
                qualifiedSignalCount,
                blendedScore,
                winRate,
                avgPips,
                totalSignals,
                computedAt
        );
    }
}
