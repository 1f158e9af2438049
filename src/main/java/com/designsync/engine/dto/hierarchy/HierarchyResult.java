package com.designsync.engine.dto.hierarchy;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Build plan of a document and the artifacts built from it, in build order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HierarchyResult {
    private BuildPlan buildPlan;
    @Builder.Default
    private List<BuiltArtifact> artifacts = new ArrayList<>();
    private int referencesSubstituted;
}
