package com.designsync.engine.model;

/**
 * Axis along which a layout container arranges its children.
 */
public enum LayoutMode {
    NONE,
    HORIZONTAL,
    VERTICAL;

    public boolean isAxis() {
        return this != NONE;
    }
}
