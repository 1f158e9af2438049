package com.designsync.engine.dto.classification;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.Map;

/**
 * Counters of one classification pass.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassificationSummary {
    private int classified;
    private int externalRequests;
    private int externalAccepted;
    private int externalUnusable;
    @Builder.Default
    private Map<SemanticRole, Integer> roleCounts = new EnumMap<>(SemanticRole.class);
}
