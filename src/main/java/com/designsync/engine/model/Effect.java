package com.designsync.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Shadow or blur effect. Passed through to the instantiation side untouched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Effect {

    public enum Type {
        DROP_SHADOW,
        INNER_SHADOW,
        LAYER_BLUR,
        BACKGROUND_BLUR
    }

    private Type type;
    @Builder.Default
    private boolean visible = true;
    private RgbaColor color;
    private double offsetX;
    private double offsetY;
    private double radius;
    private double spread;
}
