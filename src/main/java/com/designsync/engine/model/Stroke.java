package com.designsync.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Stroke {
    private RgbaColor color;
    private double weight;
    @Builder.Default
    private boolean visible = true;
    @Builder.Default
    private double opacity = 1.0;
    private String align; // INSIDE, OUTSIDE, CENTER
}
