package com.walletscore.assessment;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AddressValidatorTest {

    private final AddressValidator validator = new AddressValidator();

    @Test
    @DisplayName("Valid EVM address accepted")
    void validEvmAddress() {
        assertThat(validator.isValidAddress("0x742d35Cc6634C0532925a3b844Bc454e4438f44e")).isTrue();
        assertThat(validator.isValidAddress("0x0000000000000000000000000000000000000000")).isTrue();
        assertThat(validator.isValidAddress(" 0x742d35cc6634c0532925a3b844bc454e4438f44e ")).isTrue();
    }

    @Test
    @DisplayName("Invalid address rejected")
    void invalidAddress() {
        assertThat(validator.isValidAddress(null)).isFalse();
        assertThat(validator.isValidAddress("")).isFalse();
        assertThat(validator.isValidAddress("0x123")).isFalse();
        assertThat(validator.isValidAddress("nothex")).isFalse();
        assertThat(validator.isValidAddress("0xZZ2d35Cc6634C0532925a3b844Bc454e4438f44e")).isFalse();
        assertThat(validator.isValidAddress("742d35Cc6634C0532925a3b844Bc454e4438f44e00")).isFalse();
    }
}
