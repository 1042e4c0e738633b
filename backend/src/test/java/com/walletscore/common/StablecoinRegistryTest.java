package com.walletscore.common;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StablecoinRegistryTest {

    private StablecoinRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new StablecoinRegistry();
    }

    @Test
    @DisplayName("USDC, USDT, DAI, FRAX, LUSD are stablecoins")
    void knownStablecoins() {
        assertThat(registry.isStablecoinSymbol("USDC")).isTrue();
        assertThat(registry.isStablecoinSymbol("USDT")).isTrue();
        assertThat(registry.isStablecoinSymbol("DAI")).isTrue();
        assertThat(registry.isStablecoinSymbol("FRAX")).isTrue();
        assertThat(registry.isStablecoinSymbol("LUSD")).isTrue();
    }

    @Test
    @DisplayName("symbol match ignores case and surrounding whitespace")
    void caseAndWhitespace() {
        assertThat(registry.isStablecoinSymbol("usdc")).isTrue();
        assertThat(registry.isStablecoinSymbol(" Dai ")).isTrue();
    }

    @Test
    @DisplayName("volatile tokens are not stablecoins")
    void volatileTokens() {
        assertThat(registry.isStablecoinSymbol("WETH")).isFalse();
        assertThat(registry.isStablecoinSymbol("UNI")).isFalse();
        assertThat(registry.isStablecoinSymbol("USDC.e")).isFalse();
    }

    @Test
    @DisplayName("null or blank returns false")
    void nullOrBlank() {
        assertThat(registry.isStablecoinSymbol(null)).isFalse();
        assertThat(registry.isStablecoinSymbol("")).isFalse();
        assertThat(registry.isStablecoinSymbol("   ")).isFalse();
    }
}
