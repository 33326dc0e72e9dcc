package com.example.cronpurge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Minimum safety thresholds applied to every compiled cleanup job.
 * These values are bound from application.yml (purge.thresholds.*).
 * Requested values below a minimum are raised to it, never rejected.
 */
@Component
@ConfigurationProperties(prefix = "purge.thresholds")
@Data
public class JobThresholdProperties {

    private int minRetentionDays = 60;
    private int minLimit = 100;
}
