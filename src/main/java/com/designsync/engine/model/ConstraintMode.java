package com.designsync.engine.model;

/**
 * Edge constraint of an absolutely positioned node. Horizontal and vertical
 * values share one enum; {@link #family()} gives the axis-independent meaning.
 */
public enum ConstraintMode {
    LEFT(Family.NEAR),
    RIGHT(Family.FAR),
    TOP(Family.NEAR),
    BOTTOM(Family.FAR),
    CENTER(Family.CENTER),
    LEFT_RIGHT(Family.STRETCH),
    TOP_BOTTOM(Family.STRETCH),
    SCALE(Family.SCALE);

    public enum Family {
        NEAR,
        FAR,
        CENTER,
        STRETCH,
        SCALE
    }

    private final Family family;

    ConstraintMode(Family family) {
        this.family = family;
    }

    public Family family() {
        return family;
    }
}
