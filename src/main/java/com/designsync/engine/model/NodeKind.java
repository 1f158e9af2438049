package com.designsync.engine.model;

/**
 * Structural kind of a design node, collapsed from the source document's type string.
 */
public enum NodeKind {
    TEXT,
    VECTOR,
    RECTANGLE,
    FRAME,
    COMPONENT,
    INSTANCE;

    public static NodeKind fromSourceType(String sourceType) {
        if (sourceType == null) {
            return FRAME;
        }
        return switch (sourceType.toUpperCase()) {
            case "TEXT" -> TEXT;
            case "VECTOR", "STAR", "POLYGON", "ELLIPSE", "LINE", "BOOLEAN_OPERATION" -> VECTOR;
            case "RECTANGLE" -> RECTANGLE;
            case "COMPONENT", "COMPONENT_SET" -> COMPONENT;
            case "INSTANCE" -> INSTANCE;
            default -> FRAME; // FRAME, GROUP, SECTION, CANVAS...
        };
    }
}
