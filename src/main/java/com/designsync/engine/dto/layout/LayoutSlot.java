package com.designsync.engine.dto.layout;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of a container's resolved child sequence: a real child or a synthesized spacer.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LayoutSlot {

    public enum Kind {
        CHILD,
        SPACER
    }

    private Kind kind;
    private String nodeId;      // CHILD only
    private String name;
    private AxisSizing horizontal; // SPACER only
    private AxisSizing vertical;   // SPACER only

    public static LayoutSlot child(String nodeId, String name) {
        return LayoutSlot.builder().kind(Kind.CHILD).nodeId(nodeId).name(name).build();
    }

    public boolean isSpacer() {
        return kind == Kind.SPACER;
    }

    public LayoutSlot copy() {
        return toBuilder()
                .horizontal(horizontal != null ? horizontal.toBuilder().build() : null)
                .vertical(vertical != null ? vertical.toBuilder().build() : null)
                .build();
    }
}
