package com.designsync.engine.dto;

import com.designsync.engine.dto.hierarchy.BuildPlan;
import com.designsync.engine.dto.hierarchy.BuiltArtifact;
import com.designsync.engine.model.Document;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The annotated document together with its build plan and built artifacts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineResult {
    private Document document;
    private BuildPlan buildPlan;
    @Builder.Default
    private List<BuiltArtifact> artifacts = new ArrayList<>();
    @Builder.Default
    private Map<String, Integer> telemetry = new LinkedHashMap<>(); // counter name -> count
}
