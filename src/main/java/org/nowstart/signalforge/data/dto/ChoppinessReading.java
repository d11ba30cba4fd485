package org.nowstart.signalforge.data.dto;

/**
 * @param value      choppiness index in [0, 100]
 * @param degenerate true when the window had a flat range and the value is the conventional 100
 */
public record ChoppinessReading(double value, boolean degenerate) {
}
