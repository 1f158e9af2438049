package com.designsync.engine.dto.hierarchy;

import com.designsync.engine.model.HierarchyTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Pointer to an already-built shared artifact.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArtifactReference {
    private String artifactId;
    private String componentId;
    private HierarchyTier tier;
}
