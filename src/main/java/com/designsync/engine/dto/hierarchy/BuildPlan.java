package com.designsync.engine.dto.hierarchy;

import com.designsync.engine.model.HierarchyTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Build order: tiers lowest first, each an ordered list of node ids.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildPlan {

    @Builder.Default
    private List<TierBatch> batches = new ArrayList<>();

    public List<String> flatten() {
        List<String> ids = new ArrayList<>();
        for (TierBatch batch : batches) {
            ids.addAll(batch.getNodeIds());
        }
        return ids;
    }

    public TierBatch batchFor(HierarchyTier tier) {
        return batches.stream()
                .filter(b -> b.getTier() == tier)
                .findFirst()
                .orElse(null);
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TierBatch {
        private HierarchyTier tier;
        @Builder.Default
        private List<String> nodeIds = new ArrayList<>();
    }
}
