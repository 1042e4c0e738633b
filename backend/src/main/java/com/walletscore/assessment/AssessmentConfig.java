package com.walletscore.assessment;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(AssessmentProperties.class)
public class AssessmentConfig {
}
