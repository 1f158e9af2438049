package com.designsync.engine.service.hierarchy;

import com.designsync.engine.dto.hierarchy.ArtifactReference;
import com.designsync.engine.model.HierarchySettings;
import com.designsync.engine.model.HierarchyTier;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * componentId to built artifact, plus the artifact ids handed out so far.
 *
 * One registry per document run, filled strictly in build order by a single thread.
 */
public class ArtifactRegistry {

    private final HierarchySettings settings;
    private final Map<String, ArtifactReference> byComponentId = new LinkedHashMap<>();
    private final Set<String> allocatedIds = new HashSet<>();

    public ArtifactRegistry(HierarchySettings settings) {
        this.settings = settings;
    }

    /**
     * Reserve {@code {root}/{TierFolder}/{name}{ext}}, suffixed with _1, _2... when taken.
     */
    public String allocateArtifactId(HierarchyTier tier, String cleanName) {
        String base = settings.getArtifactRoot() + "/" + tier.getFolderName() + "/" + cleanName;
        String candidate = base + settings.getArtifactExtension();
        int suffix = 1;
        while (!allocatedIds.add(candidate)) {
            candidate = base + "_" + suffix++ + settings.getArtifactExtension();
        }
        return candidate;
    }

    public void register(ArtifactReference reference) {
        byComponentId.putIfAbsent(reference.getComponentId(), reference);
    }

    public boolean contains(String componentId) {
        return componentId != null && byComponentId.containsKey(componentId);
    }

    public Optional<ArtifactReference> lookup(String componentId) {
        return componentId == null ? Optional.empty() : Optional.ofNullable(byComponentId.get(componentId));
    }

    public int size() {
        return byComponentId.size();
    }
}
