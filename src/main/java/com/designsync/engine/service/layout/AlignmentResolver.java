package com.designsync.engine.service.layout;

import com.designsync.engine.dto.layout.ApproximationTag;
import com.designsync.engine.dto.layout.AxisSizing;
import com.designsync.engine.dto.layout.ChildAnchor;
import com.designsync.engine.dto.layout.ContainerAlignment;
import com.designsync.engine.dto.layout.LayoutSlot;
import com.designsync.engine.dto.layout.ResolvedLayout;
import com.designsync.engine.model.AxisAlignment;
import com.designsync.engine.model.LayoutMode;
import com.designsync.engine.model.LayoutWrap;
import com.designsync.engine.model.Node;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps a container's primary/counter alignment onto a native nine-point child anchor.
 *
 * <p>Space-between has no native equivalent. The container is aligned to start with zero item
 * spacing, and once its children are known a flexible zero-size spacer is placed between each
 * adjacent pair of in-flow children. Baseline is aligned to start and tagged.</p>
 */
@Component
@Slf4j
public class AlignmentResolver {

    static final String SPACER_PREFIX = "_spacer";

    /**
     * Pre-order step: configure the container. Returns null when the node has no axis mode.
     */
    public ContainerAlignment configure(Node container, ResolvedLayout layout) {
        if (!container.isLayoutContainer()) {
            return null;
        }

        boolean spaceBetween = usesSpaceBetween(container);
        AxisAlignment primary = spaceBetween ? AxisAlignment.START : container.getPrimaryAxisAlign();
        AxisAlignment counter = container.getCounterAxisAlign();

        if (spaceBetween) {
            layout.tag(ApproximationTag.SPACE_BETWEEN_SPACERS);
        }
        if (primary == AxisAlignment.BASELINE || counter == AxisAlignment.BASELINE) {
            layout.tag(ApproximationTag.BASELINE_APPROXIMATED);
            log.debug("Baseline alignment on {} approximated as start", container.getId());
        }

        return ContainerAlignment.builder()
                .axis(container.getLayoutMode())
                .childAnchor(mapAlignment(primary, counter, container.getLayoutMode()))
                .spacing(spaceBetween ? 0 : container.getItemSpacing())
                .counterAxisSpacing(container.getCounterAxisSpacing())
                .wrap(container.getLayoutWrap() == LayoutWrap.WRAP)
                .paddingLeft(container.getPaddingLeft())
                .paddingRight(container.getPaddingRight())
                .paddingTop(container.getPaddingTop())
                .paddingBottom(container.getPaddingBottom())
                .spaceBetween(spaceBetween)
                .build();
    }

    /**
     * Post-order step: record the final child sequence, inserting spacers for space-between.
     *
     * @param visibleChildren children that were translated, in document order
     */
    public void finalizeSlots(Node container, ContainerAlignment alignment, List<Node> visibleChildren) {
        List<LayoutSlot> slots = new ArrayList<>();
        boolean horizontal = alignment.getAxis() == LayoutMode.HORIZONTAL;
        int inFlowSeen = 0;

        for (Node child : visibleChildren) {
            boolean inFlow = !child.isAbsolute();
            if (alignment.isSpaceBetween() && inFlow && inFlowSeen > 0) {
                slots.add(createSpacer(SPACER_PREFIX + "_" + inFlowSeen, horizontal));
            }
            slots.add(LayoutSlot.child(child.getId(), child.displayName()));
            if (inFlow) {
                inFlowSeen++;
            }
        }

        alignment.setSlots(slots);
        if (alignment.isSpaceBetween()) {
            log.debug("Inserted {} spacer(s) into {}", alignment.spacerCount(), container.getId());
        }
    }

    public static boolean usesSpaceBetween(Node container) {
        return container.getPrimaryAxisAlign() == AxisAlignment.SPACE_BETWEEN;
    }

    /**
     * Zero-size spacer: grows with weight 1 on the primary axis, fixed to zero on the counter axis.
     */
    private LayoutSlot createSpacer(String name, boolean horizontal) {
        AxisSizing primary = AxisSizing.grow(1, 0.0, 0.0);
        AxisSizing counter = AxisSizing.exact(0, 0.0, true);
        return LayoutSlot.builder()
                .kind(LayoutSlot.Kind.SPACER)
                .name(name)
                .horizontal(horizontal ? primary : counter)
                .vertical(horizontal ? counter : primary)
                .build();
    }

    /**
     * For a horizontal container primary is the x axis and counter the y axis; vertical swaps them.
     */
    ChildAnchor mapAlignment(AxisAlignment primary, AxisAlignment counter, LayoutMode mode) {
        int horizontal;
        int vertical;
        if (mode == LayoutMode.HORIZONTAL) {
            horizontal = axisIndex(primary);
            vertical = axisIndex(counter);
        } else {
            horizontal = axisIndex(counter);
            vertical = axisIndex(primary);
        }
        return ChildAnchor.of(horizontal, vertical);
    }

    private int axisIndex(AxisAlignment alignment) {
        if (alignment == null) {
            return 0;
        }
        return switch (alignment) {
            case CENTER -> 1;
            case END -> 2;
            default -> 0; // START, BASELINE, and SPACE_BETWEEN (distributed separately)
        };
    }
}
