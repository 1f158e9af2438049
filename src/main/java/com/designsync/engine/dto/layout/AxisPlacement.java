package com.designsync.engine.dto.layout;

import com.designsync.engine.model.ConstraintMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Anchor/offset geometry of an absolutely positioned node along one axis, relative to the
 * parent's content box and expressed in the target convention (values grow right and up).
 *
 * <p>For a parent content extent {@code P} the node occupies
 * {@code [anchorMin * P + offsetMin, anchorMax * P + offsetMax]}. Pinned placements use equal
 * anchors so their size is independent of {@code P}; stretched placements use anchors 0 and 1 so
 * their size follows {@code P}; scaled placements use fractional anchors and zero offsets.</p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AxisPlacement {

    private ConstraintMode.Family family;
    private double anchorMin;
    private double anchorMax;
    private double offsetMin;
    private double offsetMax;

    public double minEdge(double parentExtent) {
        return anchorMin * parentExtent + offsetMin;
    }

    public double maxEdge(double parentExtent) {
        return anchorMax * parentExtent + offsetMax;
    }

    public double size(double parentExtent) {
        return maxEdge(parentExtent) - minEdge(parentExtent);
    }

    /**
     * Distance between the parent's min edge and the node's min edge.
     */
    public double minMargin(double parentExtent) {
        return minEdge(parentExtent);
    }

    /**
     * Distance between the node's max edge and the parent's max edge.
     */
    public double maxMargin(double parentExtent) {
        return parentExtent - maxEdge(parentExtent);
    }

    /**
     * Signed distance of the node's center from the parent's center.
     */
    public double centerOffset(double parentExtent) {
        return (minEdge(parentExtent) + maxEdge(parentExtent)) / 2 - parentExtent / 2;
    }
}
