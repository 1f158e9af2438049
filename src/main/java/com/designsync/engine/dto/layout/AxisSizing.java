package com.designsync.engine.dto.layout;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Resolved sizing directive for one axis of a node.
 *
 * <ul>
 *   <li>{@link Kind#EXACT}: {@link #size} is the final extent.</li>
 *   <li>{@link Kind#GROW}: take a {@link #weight} share of the free space; {@link #size}, when set,
 *       is a preferred size used as a soft cap.</li>
 *   <li>{@link Kind#SHRINK}: size to content; {@link #size} is unset.</li>
 * </ul>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AxisSizing {

    public enum Kind {
        EXACT,
        GROW,
        SHRINK
    }

    private Kind kind;
    private Double size;
    private double weight;
    private Double min;
    private boolean contentDriven;   // rendering extent follows content, not the stored size
    private boolean layoutManaged;   // sized by the parent's layout container

    public static AxisSizing exact(double size, Double min, boolean layoutManaged) {
        return AxisSizing.builder()
                .kind(Kind.EXACT)
                .size(size)
                .min(min)
                .layoutManaged(layoutManaged)
                .build();
    }

    public static AxisSizing grow(double weight, Double preferred, Double min) {
        return AxisSizing.builder()
                .kind(Kind.GROW)
                .weight(weight)
                .size(preferred)
                .min(min)
                .layoutManaged(true)
                .build();
    }

    public static AxisSizing shrink(Double min) {
        return AxisSizing.builder()
                .kind(Kind.SHRINK)
                .min(min)
                .contentDriven(true)
                .layoutManaged(true)
                .build();
    }
}
