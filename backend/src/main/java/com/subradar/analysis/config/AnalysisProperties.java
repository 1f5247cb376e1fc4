package com.subradar.analysis.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Analysis run configuration. Documented in application.yml under subradar.analysis.
 */
@ConfigurationProperties(prefix = "subradar.analysis")
@Getter
@Setter
public class AnalysisProperties {

    /**
     * Overall budget for link resolution across all groups of one run. Unresolved groups get the search fallback.
     */
    private long resolutionDeadlineMs = 10_000;
}
