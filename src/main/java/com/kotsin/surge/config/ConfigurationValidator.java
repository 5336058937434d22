package com.kotsin.surge.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Validates the bound detector properties once the application is up.
 * Fails startup on hard errors, logs a warning for suspicious combinations.
 */
@Component
@Slf4j
public class ConfigurationValidator {

    @Value("${spring.profiles.active:default}")
    private String activeProfile;

    private final SurgeDetectorProperties properties;

    public ConfigurationValidator(SurgeDetectorProperties properties) {
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateConfiguration() {
        // Skip validation in test mode
        if ("test".equals(activeProfile)) {
            log.info("Skipping surge detector configuration validation in test mode");
            return;
        }
        validate(properties.toConfig());
    }

    void validate(SurgeDetectorConfig config) {
        log.info("Validating surge detector configuration...");

        List<String> errors = config.validationErrors();
        if (!errors.isEmpty()) {
            log.error("Surge detector configuration validation failed with {} errors:", errors.size());
            errors.forEach(error -> log.error("  - {}", error));
            throw new IllegalStateException("Surge detector configuration validation failed. Please fix the errors above.");
        }

        // A point can only become a surge by clearing minStandardDeviations, so
        // a value above the minor cut-point makes MINOR unreachable.
        if (config.getMinStandardDeviations() > config.getSeverityThresholds().minor()) {
            log.warn("surge.detector.min-standard-deviations={} is above severity.minor={} - MINOR surges will never be reported",
                    config.getMinStandardDeviations(), config.getSeverityThresholds().minor());
        }
        if (config.getMinDataPointsForBaseline() < 4) {
            log.warn("surge.detector.min-data-points-for-baseline={} - trend estimation needs at least 4 points",
                    config.getMinDataPointsForBaseline());
        }

        log.info("Surge detector configuration validation passed");
        logConfigurationSummary(config);
    }

    private void logConfigurationSummary(SurgeDetectorConfig config) {
        log.info("Surge Detector Configuration Summary:");
        log.info("  Sensitivity: minStdDevs={}, minPctIncrease={}%, minBaselinePoints={}",
                config.getMinStandardDeviations(), config.getMinPercentageIncrease(),
                config.getMinDataPointsForBaseline());
        log.info("  Windows: surge={}h, trend={}d, baseline={}d",
                config.getSurgeWindowHours(), config.getTrendWindowDays(), config.getBaselineWindowDays());
        log.info("  Severity cut-points: {}", config.getSeverityThresholds());
        log.info("  Recurring patterns: enabled={}, windowWeeks={}",
                config.isDetectRecurringPatterns(), config.getPatternWindowWeeks());
    }
}
