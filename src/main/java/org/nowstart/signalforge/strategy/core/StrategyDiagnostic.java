package org.nowstart.signalforge.strategy.core;

/**
 * One explainability value produced while evaluating a signal, e.g. an indicator reading or a
 * selector flag.
 *
 * <p>Keys are stable machine-readable identifiers ({@code indicator.ema_fast}, {@code level.ib_high});
 * labels are for display. Units apply to numeric diagnostics only.
 *
 * @param key         stable diagnostic identifier used by logs and dashboard queries
 * @param label       human-readable name
 * @param type        expected value type
 * @param unit        value unit for numeric diagnostics
 * @param description optional short explanation
 * @param value       diagnostic value
 */
public record StrategyDiagnostic(
        String key,
        String label,
        StrategyDiagnosticType type,
        String unit,
        String description,
        Object value
) {

    public StrategyDiagnostic {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("diagnostic key is required");
        }
        if (type == null) {
            throw new IllegalArgumentException("diagnostic type is required");
        }
        if (value == null) {
            throw new IllegalArgumentException("diagnostic value is required");
        }
        label = (label == null || label.isBlank()) ? key : label;
        unit = unit == null ? "" : unit;
        description = description == null ? "" : description;
        if (!type.supports(value)) {
            throw new IllegalArgumentException("diagnostic " + key + " must be " + type.typeName());
        }
    }

    public static StrategyDiagnostic number(String key, String label, String unit, String description, double value) {
        return new StrategyDiagnostic(key, label, StrategyDiagnosticType.NUMBER, unit, description, value);
    }

    public static StrategyDiagnostic bool(String key, String label, String description, boolean value) {
        return new StrategyDiagnostic(key, label, StrategyDiagnosticType.BOOLEAN, "", description, value);
    }

    public static StrategyDiagnostic text(String key, String label, String description, String value) {
        return new StrategyDiagnostic(key, label, StrategyDiagnosticType.STRING, "", description, value == null ? "" : value);
    }

    /**
     * Numeric view of the value: booleans map to 1/0, strings to NaN.
     */
    public double numericValue() {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof Boolean flag) {
            return flag ? 1.0 : 0.0;
        }
        return Double.NaN;
    }
}
