package org.nowstart.signalforge.data.dto;

import java.util.List;
import org.nowstart.signalforge.data.type.Recommendation;

public record WeightResult(
        double totalWeight,
        ModulationFactors factors,
        Recommendation recommendation,
        double positionSizeMultiplier,
        List<String> reasons
) {

    public WeightResult {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }
}
