package org.nowstart.signalforge.data.type;

public enum Recommendation {
    STRONG,
    MODERATE,
    WEAK,
    AVOID;

    public static Recommendation fromScore(double totalWeight) {
        if (totalWeight >= 75) {
            return STRONG;
        }
        if (totalWeight >= 60) {
            return MODERATE;
        }
        if (totalWeight >= 40) {
            return WEAK;
        }
        return AVOID;
    }
}
