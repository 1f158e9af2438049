package com.designsync.engine.dto.layout;

/**
 * Nine-point alignment of children inside a layout container, in reading order.
 */
public enum ChildAnchor {
    UPPER_LEFT,
    UPPER_CENTER,
    UPPER_RIGHT,
    MIDDLE_LEFT,
    MIDDLE_CENTER,
    MIDDLE_RIGHT,
    LOWER_LEFT,
    LOWER_CENTER,
    LOWER_RIGHT;

    /**
     * @param horizontal 0 = start, 1 = center, 2 = end
     * @param vertical   0 = start (top), 1 = center, 2 = end (bottom)
     */
    public static ChildAnchor of(int horizontal, int vertical) {
        return values()[vertical * 3 + horizontal];
    }

    public int horizontal() {
        return ordinal() % 3;
    }

    public int vertical() {
        return ordinal() / 3;
    }
}
