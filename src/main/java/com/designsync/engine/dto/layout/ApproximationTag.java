package com.designsync.engine.dto.layout;

/**
 * Records where the translator approximated a feature the target layout model lacks.
 */
public enum ApproximationTag {
    SPACE_BETWEEN_SPACERS,
    BASELINE_APPROXIMATED,
    SOFT_MAX_CAP,
    FILL_OUTSIDE_LAYOUT,
    ROOT_ABSOLUTE_FALLBACK,
    EFFECTS_PASSTHROUGH,
    GRADIENT_PASSTHROUGH
}
