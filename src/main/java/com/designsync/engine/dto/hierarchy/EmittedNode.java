package com.designsync.engine.dto.hierarchy;

import com.designsync.engine.dto.classification.SemanticRole;
import com.designsync.engine.dto.layout.ResolvedLayout;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Node of an artifact's emitted content tree, handed to the instantiation side.
 * A reference node carries only its own geometry and points at another artifact.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmittedNode {

    private String sourceNodeId;
    private String name;
    private SemanticRole role;
    private double x;
    private double y;
    private double width;
    private double height;
    private ResolvedLayout layout;
    private ArtifactReference reference;
    @Builder.Default
    private List<EmittedNode> children = new ArrayList<>();

    public boolean isReference() {
        return reference != null;
    }

    public int countNodes() {
        int count = 1;
        for (EmittedNode child : children) {
            count += child.countNodes();
        }
        return count;
    }
}
