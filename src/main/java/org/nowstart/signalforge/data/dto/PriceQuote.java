package org.nowstart.signalforge.data.dto;

import jakarta.validation.constraints.Positive;

public record PriceQuote(
        @Positive double bid,
        @Positive double ask
) {

    public PriceQuote {
        if (ask < bid) {
            throw new IllegalArgumentException("ask must be >= bid");
        }
    }

    public double mid() {
        return (bid + ask) / 2.0;
    }

    public double spread() {
        return ask - bid;
    }
}
