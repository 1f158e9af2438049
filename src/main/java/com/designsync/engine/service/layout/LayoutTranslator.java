package com.designsync.engine.service.layout;

import com.designsync.engine.dto.layout.ApproximationTag;
import com.designsync.engine.dto.layout.ContainerAlignment;
import com.designsync.engine.dto.layout.ResolvedLayout;
import com.designsync.engine.model.Document;
import com.designsync.engine.model.Fill;
import com.designsync.engine.model.LayoutMode;
import com.designsync.engine.model.Node;
import com.designsync.engine.model.Page;
import com.designsync.engine.service.CancellationSignal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Walks every visible node of the selected pages and attaches a {@link ResolvedLayout}.
 *
 * Per node, in order:
 * 1. configure the node as a container (pre-order, before its children)
 * 2. resolve sizing against the parent's axis mode
 * 3. place it (flow, free-form, absolute, or root)
 * 4. recurse into visible children
 * 5. finalize the container's child slots (post-order, spacers need the final child set)
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LayoutTranslator {

    private final SizingResolver sizingResolver;
    private final AlignmentResolver alignmentResolver;
    private final AbsolutePositioningResolver absolutePositioningResolver;

    /**
     * Translate every selected page. Returns how many nodes carry each approximation tag.
     */
    public Map<ApproximationTag, Integer> translate(Document document, CancellationSignal signal) {
        Map<ApproximationTag, Integer> tagCounts = new EnumMap<>(ApproximationTag.class);
        int translated = 0;
        for (Page page : document.getSelectedPages()) {
            translated += translate(page, signal, tagCounts);
        }
        log.info("Translated layout of {} node(s) in document '{}', approximations: {}",
                translated, document.getName(), tagCounts);
        return tagCounts;
    }

    public int translate(Page page, CancellationSignal signal, Map<ApproximationTag, Integer> tagCounts) {
        int translated = 0;
        for (Node root : page.getChildren()) {
            if (root.isVisible()) {
                translated += translateNode(root, null, signal, tagCounts);
            }
        }
        return translated;
    }

    int translateNode(Node node, Node parent, CancellationSignal signal, Map<ApproximationTag, Integer> tagCounts) {
        signal.throwIfCancelled();

        ResolvedLayout layout = ResolvedLayout.builder().build();
        ContainerAlignment container = alignmentResolver.configure(node, layout);
        layout.setContainer(container);

        LayoutMode parentAxis = parent == null || node.isAbsolute() ? LayoutMode.NONE : parent.getLayoutMode();
        sizingResolver.apply(node, parentAxis, layout);

        place(node, parent, layout);
        tagPassthroughVisuals(node, layout);
        node.setResolvedLayout(layout);

        int translated = 1;
        List<Node> visibleChildren = new ArrayList<>();
        for (Node child : node.getChildren()) {
            if (child.isVisible()) {
                visibleChildren.add(child);
                translated += translateNode(child, node, signal, tagCounts);
            }
        }

        if (container != null) {
            alignmentResolver.finalizeSlots(node, container, visibleChildren);
        }

        for (ApproximationTag tag : layout.getApproximations()) {
            tagCounts.merge(tag, 1, Integer::sum);
        }
        return translated;
    }

    private void place(Node node, Node parent, ResolvedLayout layout) {
        if (parent == null) {
            if (node.isAbsolute()) {
                log.warn("Absolutely positioned node {} has no parent, placing it at the origin", node.getId());
                layout.tag(ApproximationTag.ROOT_ABSOLUTE_FALLBACK);
            }
            layout.setPlacement(ResolvedLayout.Placement.ROOT);
            layout.setGeometry(absolutePositioningResolver.atOrigin(node));
        } else if (node.isAbsolute()) {
            layout.setPlacement(ResolvedLayout.Placement.ABSOLUTE);
            layout.setGeometry(absolutePositioningResolver.resolve(node, parent));
        } else if (parent.isLayoutContainer()) {
            layout.setPlacement(ResolvedLayout.Placement.FLOW);
        } else {
            layout.setPlacement(ResolvedLayout.Placement.FREEFORM);
            layout.setGeometry(absolutePositioningResolver.pinTopLeft(node, parent));
        }
    }

    private void tagPassthroughVisuals(Node node, ResolvedLayout layout) {
        if (!node.getEffects().isEmpty()) {
            layout.tag(ApproximationTag.EFFECTS_PASSTHROUGH);
        }
        for (Fill fill : node.getFills()) {
            if (fill.isGradient()) {
                layout.tag(ApproximationTag.GRADIENT_PASSTHROUGH);
                break;
            }
        }
    }
}
