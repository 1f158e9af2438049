package com.designsync.engine.model;

/**
 * Primary/counter axis alignment of a layout container.
 */
public enum AxisAlignment {
    START,
    CENTER,
    END,
    SPACE_BETWEEN,
    BASELINE
}
