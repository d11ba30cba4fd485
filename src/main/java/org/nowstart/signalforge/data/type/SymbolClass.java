package org.nowstart.signalforge.data.type;

import java.util.List;
import java.util.Locale;

/**
 * Instrument family used to pick pip size, minimum stop distance and round-number grid.
 */
public enum SymbolClass {
    MAJOR_FX,
    JPY_QUOTED,
    METAL,
    CRYPTO;

    private static final List<String> METAL_CODES = List.of("XAU", "XAG", "XPT", "XPD");
    private static final List<String> CRYPTO_CODES = List.of("BTC", "ETH", "SOL", "XRP", "LTC", "ADA", "DOGE");

    public static SymbolClass resolve(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol is required");
        }
        String normalized = symbol.trim().toUpperCase(Locale.ROOT);
        if (METAL_CODES.stream().anyMatch(normalized::startsWith)) {
            return METAL;
        }
        if (CRYPTO_CODES.stream().anyMatch(normalized::startsWith)) {
            return CRYPTO;
        }
        if (normalized.contains("JPY")) {
            return JPY_QUOTED;
        }
        return MAJOR_FX;
    }
}
