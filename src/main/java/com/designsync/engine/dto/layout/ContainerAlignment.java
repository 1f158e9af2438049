package com.designsync.engine.dto.layout;

import com.designsync.engine.model.LayoutMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Native container configuration for a node that lays out its own children.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ContainerAlignment {

    private LayoutMode axis;
    private ChildAnchor childAnchor;
    private double spacing;
    private double counterAxisSpacing;
    private boolean wrap;
    private double paddingLeft;
    private double paddingRight;
    private double paddingTop;
    private double paddingBottom;
    @Builder.Default
    private boolean controlChildWidth = true;
    @Builder.Default
    private boolean controlChildHeight = true;
    private boolean forceExpandWidth;
    private boolean forceExpandHeight;
    private boolean spaceBetween;

    /**
     * Visible children in order, with spacers when {@link #spaceBetween}. Filled after the
     * children have been resolved.
     */
    @Builder.Default
    private List<LayoutSlot> slots = new ArrayList<>();

    public long spacerCount() {
        return slots.stream().filter(LayoutSlot::isSpacer).count();
    }

    public ContainerAlignment copy() {
        List<LayoutSlot> copiedSlots = new ArrayList<>();
        for (LayoutSlot slot : slots) {
            copiedSlots.add(slot.copy());
        }
        return toBuilder().slots(copiedSlots).build();
    }
}
