package com.designsync.engine.dto.layout;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumSet;
import java.util.Set;

/**
 * Layout annotation attached to every translated node.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ResolvedLayout {

    public enum Placement {
        FLOW,       // placed by the parent's layout container
        FREEFORM,   // parent has no axis mode, pinned top-left at the stored offset
        ABSOLUTE,   // placed by edge constraints
        ROOT        // no parent
    }

    private Placement placement;
    private AxisSizing horizontal;
    private AxisSizing vertical;
    private ContainerAlignment container;     // null unless the node is a layout container
    private AbsoluteGeometry geometry;        // null for FLOW
    @Builder.Default
    private Set<ApproximationTag> approximations = EnumSet.noneOf(ApproximationTag.class);

    public void tag(ApproximationTag tag) {
        approximations.add(tag);
    }

    public boolean isTagged(ApproximationTag tag) {
        return approximations.contains(tag);
    }

    /**
     * Independent copy; nothing reachable from the result is shared with this layout.
     */
    public ResolvedLayout copy() {
        Set<ApproximationTag> tags = EnumSet.noneOf(ApproximationTag.class);
        tags.addAll(approximations);
        return toBuilder()
                .horizontal(horizontal != null ? horizontal.toBuilder().build() : null)
                .vertical(vertical != null ? vertical.toBuilder().build() : null)
                .container(container != null ? container.copy() : null)
                .geometry(geometry != null ? geometry.copy() : null)
                .approximations(tags)
                .build();
    }
}
