package com.designsync.engine.dto.layout;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Two-axis placement of a node that is positioned outside its parent's flow.
 *
 * <p>The vertical placement is already flipped: its min edge is the bottom. Use
 * {@link #topMargin(double)} and {@link #bottomMargin(double)} to read it back in source terms.</p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AbsoluteGeometry {

    private AxisPlacement horizontal;
    private AxisPlacement vertical;
    private double referenceWidth;   // parent content width the offsets were computed against
    private double referenceHeight;  // parent content height the offsets were computed against

    public double leftMargin(double parentWidth) {
        return horizontal.minMargin(parentWidth);
    }

    public double rightMargin(double parentWidth) {
        return horizontal.maxMargin(parentWidth);
    }

    public double topMargin(double parentHeight) {
        return vertical.maxMargin(parentHeight);
    }

    public double bottomMargin(double parentHeight) {
        return vertical.minMargin(parentHeight);
    }

    public double width(double parentWidth) {
        return horizontal.size(parentWidth);
    }

    public double height(double parentHeight) {
        return vertical.size(parentHeight);
    }

    public AbsoluteGeometry copy() {
        return toBuilder()
                .horizontal(horizontal != null ? horizontal.toBuilder().build() : null)
                .vertical(vertical != null ? vertical.toBuilder().build() : null)
                .build();
    }
}
