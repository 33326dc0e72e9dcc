package com.example.cronpurge.compiler;

import com.example.cronpurge.config.JobThresholdProperties;
import org.springframework.stereotype.Component;

@Component
public class ThresholdEnforcer {

    private final JobThresholdProperties thresholds;

    public ThresholdEnforcer(JobThresholdProperties thresholds) {
        this.thresholds = thresholds;
    }

    public static int clamp(int value, int minimum) {
        return Math.max(value, minimum);
    }

    /**
     * Batch size for one run. A missing limit counts as zero and ends up at the minimum.
     */
    public Clamped limit(Integer requested) {
        int value = requested == null ? 0 : requested;
        return new Clamped(value, clamp(value, thresholds.getMinLimit()));
    }

    public Clamped retentionDays(int requested) {
        return new Clamped(requested, clamp(requested, thresholds.getMinRetentionDays()));
    }

    public record Clamped(int requested, int effective) {

        public boolean raised() {
            return effective != requested;
        }
    }
}
