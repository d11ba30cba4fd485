package org.nowstart.signalforge.data.dto;

public record InitialBalance(
        String sessionName,
        double high,
        double low
) {

    public InitialBalance {
        if (high < low) {
            throw new IllegalArgumentException("initial balance high must be >= low");
        }
    }

    public double range() {
        return high - low;
    }
}
