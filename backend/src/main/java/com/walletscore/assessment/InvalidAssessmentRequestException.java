package com.walletscore.assessment;

import lombok.Getter;

/**
 * Thrown by WalletAssessmentService when a request is rejected before any upstream call.
 */
@Getter
public class InvalidAssessmentRequestException extends RuntimeException {

    public static final String INVALID_ADDRESS = "INVALID_ADDRESS";
    public static final String UNKNOWN_PROFILE = "UNKNOWN_PROFILE";
    public static final String INVALID_WINDOW = "INVALID_WINDOW";

    /** INVALID_ADDRESS, UNKNOWN_PROFILE or INVALID_WINDOW. */
    private final String errorCode;

    public InvalidAssessmentRequestException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
