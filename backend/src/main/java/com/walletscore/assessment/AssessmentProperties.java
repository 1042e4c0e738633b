package com.walletscore.assessment;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Request defaults and bounds for wallet assessments.
 */
@ConfigurationProperties(prefix = "walletscore.assessment")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class AssessmentProperties {

    /** Window used by computeScore when none is given. */
    @Positive
    private int defaultWindowDays = 30;

    /** Largest accepted window; the explorer row ceiling makes longer windows mostly truncated. */
    @Positive
    private int maxWindowDays = 365;

    /** Profile used when a request names none. */
    @NotBlank
    private String defaultProfile = "aave";
}
