package com.walletscore.common;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Registry of low-volatility token symbols counted toward the stablecoin ratio.
 * Symbol based: token transfer rows carry the symbol on every network the explorer serves.
 */
@Component
public class StablecoinRegistry {

    private static final Set<String> STABLECOIN_SYMBOLS = Set.of(
            "USDC", "USDT", "DAI", "TUSD", "USDP", "FDUSD", "FRAX", "LUSD", "GUSD"
    );

    /**
     * Returns true if the given token symbol (any case, surrounding whitespace ignored) is a known stablecoin.
     */
    public boolean isStablecoinSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return false;
        }
        return STABLECOIN_SYMBOLS.contains(symbol.strip().toUpperCase(Locale.ROOT));
    }
}
