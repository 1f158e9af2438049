package com.designsync.engine.model;

public enum PositioningMode {
    AUTO,      // flow, placed by the parent's layout
    ABSOLUTE   // opted out of the parent's layout, placed by constraints
}
