package com.designsync.engine.dto.classification;

/**
 * Ordered confidence of a classification. Declaration order is significance order.
 */
public enum Confidence {
    VERY_LOW,
    LOW,
    MEDIUM,
    HIGH,
    VERY_HIGH;

    public boolean isAtLeast(Confidence other) {
        return compareTo(other) >= 0;
    }

    public boolean exceeds(Confidence other) {
        return compareTo(other) > 0;
    }
}
