package com.designsync.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Document-level metadata of a component. Tier and artifact path are filled in
 * once the component has been built.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComponentDefinition {
    private String key;
    private String name;
    private String description;
    private String componentSetId;
    private String nodeId;
    private String pageName;
    @Builder.Default
    private HierarchyTier tier = HierarchyTier.ATOM;
    private String artifactPath;
}
