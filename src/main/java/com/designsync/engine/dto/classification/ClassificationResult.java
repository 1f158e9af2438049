package com.designsync.engine.dto.classification;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of classifying one node: role, confidence and the reason kept for observability.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassificationResult {

    public enum Source {
        STRUCTURAL_KIND,
        INTERACTION,
        NAME_PATTERN,
        STRUCTURAL_HEURISTIC,
        DEFAULT,
        EXTERNAL
    }

    private SemanticRole role;
    private Confidence confidence;
    private String reason;
    private Source source;

    public static ClassificationResult of(SemanticRole role, Confidence confidence, Source source, String reason) {
        return ClassificationResult.builder()
                .role(role)
                .confidence(confidence)
                .source(source)
                .reason(reason)
                .build();
    }

    public static ClassificationResult unclassified() {
        return of(SemanticRole.CONTAINER, Confidence.LOW, Source.DEFAULT, "No rule matched");
    }
}
