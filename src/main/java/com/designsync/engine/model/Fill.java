package com.designsync.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Paint applied to a node's background. Gradients are carried as data only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Fill {

    public enum Type {
        SOLID,
        GRADIENT_LINEAR,
        GRADIENT_RADIAL,
        GRADIENT_ANGULAR,
        GRADIENT_DIAMOND,
        IMAGE
    }

    private Type type;
    @Builder.Default
    private boolean visible = true;
    @Builder.Default
    private double opacity = 1.0;
    private RgbaColor color;
    @Builder.Default
    private List<GradientStop> gradientStops = new ArrayList<>();
    private String imageHash;
    private String imageScaleMode; // FILL, FIT, CROP, TILE

    public boolean isGradient() {
        return type != null && type.name().startsWith("GRADIENT");
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GradientStop {
        private double position;
        private RgbaColor color;
    }
}
