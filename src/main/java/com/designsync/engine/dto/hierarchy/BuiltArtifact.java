package com.designsync.engine.dto.hierarchy;

import com.designsync.engine.model.HierarchyTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Output of building one unit: its identifier, tier and emitted content.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuiltArtifact {
    private String artifactId;
    private String sourceNodeId;
    private String componentId;   // set when the unit is a component definition
    private HierarchyTier tier;
    private EmittedNode root;
    private int referenceCount;   // instances replaced by references inside this artifact
}
