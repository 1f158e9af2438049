package com.designsync.engine.model;

/**
 * How a node sizes itself along one axis inside its parent.
 */
public enum SizingMode {
    FIXED,
    HUG,
    FILL
}
