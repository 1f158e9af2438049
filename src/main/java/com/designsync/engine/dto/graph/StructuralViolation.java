package com.designsync.engine.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A broken graph invariant found before traversal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StructuralViolation {

    public enum Type {
        CYCLE,                  // a node lists one of its ancestors as a child
        SHARED_CHILD,           // a node is owned by more than one parent
        DUPLICATE_NODE_ID,
        DUPLICATE_COMPONENT_ID
    }

    private Type type;
    private List<String> nodeIds;  // e.g. [childOwner, ancestor] for a cycle
    private String description;
}
