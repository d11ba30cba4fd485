package org.nowstart.signalforge.strategy.core;

/**
 * Value type contract for {@link StrategyDiagnostic}.
 *
 * <p>Numeric and boolean diagnostics are emitted as {@code event=strategy_diagnostic} log lines;
 * string diagnostics only appear in the signal payload.
 */
public enum StrategyDiagnosticType {
    NUMBER(Number.class),
    BOOLEAN(Boolean.class),
    STRING(String.class);

    private final Class<?> valueType;

    StrategyDiagnosticType(Class<?> valueType) {
        this.valueType = valueType;
    }

    public boolean supports(Object value) {
        return valueType.isInstance(value);
    }

    public String typeName() {
        return valueType.getSimpleName();
    }

    public boolean emitsSeries() {
        return this != STRING;
    }
}
