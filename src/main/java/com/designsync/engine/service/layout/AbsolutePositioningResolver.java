package com.designsync.engine.service.layout;

import com.designsync.engine.dto.layout.AbsoluteGeometry;
import com.designsync.engine.dto.layout.AxisPlacement;
import com.designsync.engine.model.ConstraintMode;
import com.designsync.engine.model.Node;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Computes anchor/offset geometry from edge constraints.
 *
 * <p>Source geometry has its origin top-left with y growing downward; the produced geometry has
 * y growing upward. Every vertical computation therefore swaps the near and far edges: a node
 * pinned to the top in the source is anchored at the max edge of the target axis.</p>
 */
@Component
@Slf4j
public class AbsolutePositioningResolver {

    /**
     * Place an absolutely positioned node inside its parent's padded content box.
     */
    public AbsoluteGeometry resolve(Node node, Node parent) {
        double contentWidth = parent.getWidth() - parent.getPaddingLeft() - parent.getPaddingRight();
        double contentHeight = parent.getHeight() - parent.getPaddingTop() - parent.getPaddingBottom();
        double relativeX = node.getX() - parent.getX() - parent.getPaddingLeft();
        double relativeY = node.getY() - parent.getY() - parent.getPaddingTop();

        ConstraintMode horizontal = node.getHorizontalConstraint() != null
                ? node.getHorizontalConstraint() : ConstraintMode.LEFT;
        ConstraintMode vertical = node.getVerticalConstraint() != null
                ? node.getVerticalConstraint() : ConstraintMode.TOP;

        return AbsoluteGeometry.builder()
                .horizontal(horizontalPlacement(horizontal.family(), relativeX, node.getWidth(), contentWidth))
                .vertical(verticalPlacement(vertical.family(), relativeY, node.getHeight(), contentHeight))
                .referenceWidth(contentWidth)
                .referenceHeight(contentHeight)
                .build();
    }

    /**
     * Flow child of a parent without axis mode: pinned to the parent's top-left corner at its
     * stored offset, measured from the parent's outer box.
     */
    public AbsoluteGeometry pinTopLeft(Node node, Node parent) {
        double relativeX = node.getX() - parent.getX();
        double relativeY = node.getY() - parent.getY();
        return AbsoluteGeometry.builder()
                .horizontal(horizontalPlacement(ConstraintMode.Family.NEAR, relativeX, node.getWidth(), parent.getWidth()))
                .vertical(verticalPlacement(ConstraintMode.Family.NEAR, relativeY, node.getHeight(), parent.getHeight()))
                .referenceWidth(parent.getWidth())
                .referenceHeight(parent.getHeight())
                .build();
    }

    /**
     * Node without a parent: centred on the origin at its stored size.
     */
    public AbsoluteGeometry atOrigin(Node node) {
        return AbsoluteGeometry.builder()
                .horizontal(centered(node.getWidth()))
                .vertical(centered(node.getHeight()))
                .build();
    }

    AxisPlacement horizontalPlacement(ConstraintMode.Family family, double start, double size, double extent) {
        double distanceFromFar = extent - (start + size);

        switch (family) {
            case FAR:
                return placement(family, 1, 1, -distanceFromFar - size, -distanceFromFar);
            case CENTER:
                double centerOffset = start + size / 2 - extent / 2;
                return placement(family, 0.5, 0.5, centerOffset - size / 2, centerOffset + size / 2);
            case STRETCH:
                return placement(family, 0, 1, start, -distanceFromFar);
            case SCALE:
                if (extent > 0) {
                    return placement(family, start / extent, (start + size) / extent, 0, 0);
                }
                log.debug("Scale constraint against empty extent, pinning to near edge");
                return placement(ConstraintMode.Family.NEAR, 0, 0, start, start + size);
            case NEAR:
            default:
                return placement(ConstraintMode.Family.NEAR, 0, 0, start, start + size);
        }
    }

    /**
     * Same families as {@link #horizontalPlacement} with source top/bottom mapped onto target
     * max/min. The returned family is expressed in the target convention.
     */
    AxisPlacement verticalPlacement(ConstraintMode.Family family, double top, double size, double extent) {
        double distanceFromBottom = extent - (top + size);

        switch (family) {
            case FAR: // bottom in source, min edge in target
                return placement(ConstraintMode.Family.NEAR, 0, 0, distanceFromBottom, distanceFromBottom + size);
            case CENTER:
                double centerOffset = extent / 2 - top - size / 2;
                return placement(family, 0.5, 0.5, centerOffset - size / 2, centerOffset + size / 2);
            case STRETCH:
                return placement(family, 0, 1, distanceFromBottom, -top);
            case SCALE:
                if (extent > 0) {
                    double bottomRatio = 1 - (top + size) / extent;
                    double topRatio = 1 - top / extent;
                    return placement(family, bottomRatio, topRatio, 0, 0);
                }
                log.debug("Scale constraint against empty extent, pinning to top edge");
                return placement(ConstraintMode.Family.FAR, 1, 1, -top - size, -top);
            case NEAR: // top in source, max edge in target
            default:
                return placement(ConstraintMode.Family.FAR, 1, 1, -top - size, -top);
        }
    }

    private AxisPlacement centered(double size) {
        return placement(ConstraintMode.Family.CENTER, 0.5, 0.5, -size / 2, size / 2);
    }

    private AxisPlacement placement(ConstraintMode.Family family, double anchorMin, double anchorMax,
                                    double offsetMin, double offsetMax) {
        return AxisPlacement.builder()
                .family(family)
                .anchorMin(anchorMin)
                .anchorMax(anchorMax)
                .offsetMin(offsetMin)
                .offsetMax(offsetMax)
                .build();
    }
}
