package com.embedded.testgen.regen;

import com.embedded.testgen.validation.QualityTier;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Per-file attempt budget and acceptance threshold.
 */
@Value
@Builder
public class RegenerationSettings {

    /** Generate-validate cycles allowed per file, the first attempt included. At least 1. */
    int maxAttempts;

    @NonNull
    QualityTier threshold;

    boolean regenerationEnabled;

    /**
     * @param maxRegenerationAttempts extra attempts after the first one, used only when regeneration is enabled
     */
    public static RegenerationSettings of(int maxRegenerationAttempts, QualityTier threshold, boolean regenerationEnabled) {
        if (maxRegenerationAttempts < 0) {
            throw new IllegalArgumentException("maxRegenerationAttempts must not be negative: " + maxRegenerationAttempts);
        }
        return RegenerationSettings.builder()
                .maxAttempts(regenerationEnabled ? maxRegenerationAttempts + 1 : 1)
                .threshold(threshold)
                .regenerationEnabled(regenerationEnabled)
                .build();
    }
}
