package com.embedded.testgen.validation;

import java.util.List;

/**
 * Ordinal quality classification. Declaration order is the ordering: LOW &lt; MEDIUM &lt; HIGH.
 */
public enum QualityTier {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    private final String displayName;

    QualityTier(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isAtLeast(QualityTier other) {
        return compareTo(other) >= 0;
    }

    /**
     * No issues, compiles and realistic gives HIGH; at most two issues and compiles gives MEDIUM;
     * anything else is LOW.
     */
    public static QualityTier of(boolean compiles, boolean realistic, List<String> issues) {
        if (issues.isEmpty() && compiles && realistic) {
            return HIGH;
        }
        if (issues.size() <= 2 && compiles) {
            return MEDIUM;
        }
        return LOW;
    }
}
