package com.designsync.engine.dto.classification;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural summary of a node sent to the external classifier. Never contains pixel data.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassificationRequest {

    public static final int MAX_CHILD_SUMMARIES = 5;

    private String nodeId;
    private String name;
    private String kind;
    private double width;
    private double height;
    private int childCount;
    @Builder.Default
    private List<ChildSummary> children = new ArrayList<>(); // only when 1..5 children
    private boolean hasTextChild;
    private boolean hasImageFill;
    private boolean hasScrolling;
    private boolean hasInteraction;
    private boolean hasBackground;
    private boolean hasStroke;
    private double cornerRadius;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ChildSummary {
        private String name;
        private String kind;
    }
}
