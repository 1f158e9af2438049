package com.designsync.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RgbaColor {
    private double r;
    private double g;
    private double b;
    @Builder.Default
    private double a = 1.0;
}
