package com.designsync.engine.service.layout;

import com.designsync.engine.dto.layout.ApproximationTag;
import com.designsync.engine.dto.layout.AxisSizing;
import com.designsync.engine.dto.layout.ResolvedLayout;
import com.designsync.engine.model.LayoutMode;
import com.designsync.engine.model.Node;
import com.designsync.engine.model.SizingMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns FIXED/HUG/FILL declarations into per-axis sizing directives.
 *
 * <p>Inside a layout container: FIXED is an exact size clamped to min/max, HUG shrinks to
 * content, FILL grows with the node's grow weight (1 when unset). A max on a FILL axis can only
 * be expressed as a preferred size, so it is emitted as a soft cap and tagged.</p>
 *
 * <p>Outside a layout container (no parent, free-form parent, or absolute positioning) every
 * mode collapses to the stored size; FILL has no space to fill and is tagged.</p>
 */
@Component
@Slf4j
public class SizingResolver {

    public void apply(Node node, LayoutMode parentAxis, ResolvedLayout layout) {
        boolean inLayout = parentAxis != null && parentAxis.isAxis();

        layout.setHorizontal(resolveAxis(node.getSizingHorizontal(), node.getWidth(),
                node.getMinWidth(), node.getMaxWidth(), node.getLayoutGrow(), inLayout, layout));
        layout.setVertical(resolveAxis(node.getSizingVertical(), node.getHeight(),
                node.getMinHeight(), node.getMaxHeight(), node.getLayoutGrow(), inLayout, layout));

        log.debug("Sizing for {} (in layout: {}): h={} v={}", node.getId(), inLayout,
                layout.getHorizontal().getKind(), layout.getVertical().getKind());
    }

    AxisSizing resolveAxis(SizingMode mode, double measured, Double min, Double max,
                           double grow, boolean inLayout, ResolvedLayout layout) {
        SizingMode effective = mode != null ? mode : SizingMode.FIXED;
        double stored = Double.isFinite(measured) ? measured : 0;

        if (!inLayout) {
            if (effective == SizingMode.FILL) {
                layout.tag(ApproximationTag.FILL_OUTSIDE_LAYOUT);
            }
            return AxisSizing.exact(clamp(stored, min, max), min, false);
        }

        switch (effective) {
            case HUG:
                return AxisSizing.shrink(min);
            case FILL:
                double weight = grow > 0 ? grow : 1;
                if (max != null) {
                    layout.tag(ApproximationTag.SOFT_MAX_CAP);
                }
                return AxisSizing.grow(weight, max, min);
            case FIXED:
            default:
                return AxisSizing.exact(clamp(stored, min, max), min, true);
        }
    }

    static double clamp(double value, Double min, Double max) {
        double result = value;
        if (min != null && result < min) {
            result = min;
        }
        if (max != null && result > max) {
            result = max;
        }
        return result;
    }
}
