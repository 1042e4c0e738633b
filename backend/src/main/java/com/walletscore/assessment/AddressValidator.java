package com.walletscore.assessment;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Validates EVM wallet addresses (0x + 40 hex chars, any case).
 */
@Component
public class AddressValidator {

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    public boolean isValidAddress(String address) {
        if (address == null || address.isBlank()) return false;
        return EVM_ADDRESS.matcher(address.trim()).matches();
    }
}
