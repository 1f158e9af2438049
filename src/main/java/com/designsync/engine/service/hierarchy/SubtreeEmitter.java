package com.designsync.engine.service.hierarchy;

import com.designsync.engine.dto.hierarchy.ArtifactReference;
import com.designsync.engine.dto.hierarchy.EmittedNode;
import com.designsync.engine.dto.layout.ResolvedLayout;
import com.designsync.engine.model.LayoutMode;
import com.designsync.engine.model.Node;
import com.designsync.engine.service.CancellationSignal;
import com.designsync.engine.service.layout.AbsolutePositioningResolver;
import com.designsync.engine.service.layout.SizingResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Copies a node's visible subtree into emitted content.
 *
 * Every emitted node gets its own copy of the source node's resolved layout. The artifact root
 * is re-placed as a root: sized outside any layout and centred on the origin, whatever its
 * placement inside the parent it was nested in.
 */
@Component
@RequiredArgsConstructor
public class SubtreeEmitter {

    private final SizingResolver sizingResolver;
    private final AbsolutePositioningResolver absolutePositioningResolver;

    public EmittedNode emit(Node root, CancellationSignal signal) {
        EmittedNode emitted = emitDescendant(root, signal);
        emitted.setLayout(rootLayout(root));
        return emitted;
    }

    private EmittedNode emitDescendant(Node node, CancellationSignal signal) {
        signal.throwIfCancelled();
        EmittedNode emitted = shell(node);
        emitted.setLayout(node.getResolvedLayout() != null ? node.getResolvedLayout().copy() : null);
        for (Node child : node.getChildren()) {
            if (child.isVisible()) {
                emitted.getChildren().add(emitDescendant(child, signal));
            }
        }
        return emitted;
    }

    private ResolvedLayout rootLayout(Node root) {
        ResolvedLayout source = root.getResolvedLayout();
        if (source == null) {
            return null;
        }
        ResolvedLayout layout = source.copy();
        if (layout.getPlacement() != ResolvedLayout.Placement.ROOT) {
            sizingResolver.apply(root, LayoutMode.NONE, layout);
            layout.setPlacement(ResolvedLayout.Placement.ROOT);
            layout.setGeometry(absolutePositioningResolver.atOrigin(root));
        }
        return layout;
    }

    /**
     * Reference node standing in for an emitted subtree: same identity and geometry, no children.
     */
    public EmittedNode reference(EmittedNode replaced, ArtifactReference reference) {
        return EmittedNode.builder()
                .sourceNodeId(replaced.getSourceNodeId())
                .name(replaced.getName())
                .role(replaced.getRole())
                .x(replaced.getX())
                .y(replaced.getY())
                .width(replaced.getWidth())
                .height(replaced.getHeight())
                .layout(replaced.getLayout())
                .reference(reference)
                .build();
    }

    private EmittedNode shell(Node node) {
        return EmittedNode.builder()
                .sourceNodeId(node.getId())
                .name(node.displayName())
                .role(node.getSemanticRole())
                .x(node.getX())
                .y(node.getY())
                .width(node.getWidth())
                .height(node.getHeight())
                .build();
    }
}
