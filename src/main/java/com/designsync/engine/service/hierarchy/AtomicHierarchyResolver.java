package com.designsync.engine.service.hierarchy;

import com.designsync.engine.dto.hierarchy.ArtifactReference;
import com.designsync.engine.dto.hierarchy.BuildPlan;
import com.designsync.engine.dto.hierarchy.BuiltArtifact;
import com.designsync.engine.dto.hierarchy.EmittedNode;
import com.designsync.engine.dto.hierarchy.HierarchyResult;
import com.designsync.engine.model.ComponentDefinition;
import com.designsync.engine.model.Document;
import com.designsync.engine.model.HierarchySettings;
import com.designsync.engine.model.Node;
import com.designsync.engine.service.CancellationSignal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the document's units lowest tier first.
 *
 * Flow per unit:
 * 1. emit its visible subtree
 * 2. replace instances of registered components by references
 * 3. allocate its artifact id
 * 4. for a component definition, register componentId -> artifact and update the document's
 *    component metadata
 *
 * A componentId is built at most once; later definitions with the same id are skipped.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AtomicHierarchyResolver {

    private final HierarchySettings hierarchySettings;
    private final TierAssigner tierAssigner;
    private final BuildOrderPlanner buildOrderPlanner;
    private final SubtreeEmitter subtreeEmitter;
    private final InstanceSubstitutor instanceSubstitutor;

    public HierarchyResult resolve(Document document, CancellationSignal signal) {
        tierAssigner.assign(document);

        List<BuildOrderPlanner.BuildUnit> units = buildOrderPlanner.collectUnits(document);
        BuildPlan plan = buildOrderPlanner.plan(units);
        Map<String, BuildOrderPlanner.BuildUnit> unitsById = new HashMap<>();
        for (BuildOrderPlanner.BuildUnit unit : units) {
            unitsById.put(unit.getNode().getId(), unit);
        }

        ArtifactRegistry registry = new ArtifactRegistry(hierarchySettings);
        HierarchyResult result = HierarchyResult.builder().buildPlan(plan).build();

        for (BuildPlan.TierBatch batch : plan.getBatches()) {
            log.info("Building {} {} unit(s)", batch.getNodeIds().size(), batch.getTier().getFolderName());
            for (String nodeId : batch.getNodeIds()) {
                signal.throwIfCancelled();
                BuiltArtifact artifact = build(unitsById.get(nodeId), document, registry, signal);
                if (artifact != null) {
                    result.getArtifacts().add(artifact);
                    result.setReferencesSubstituted(result.getReferencesSubstituted() + artifact.getReferenceCount());
                }
            }
        }

        log.info("Built {} artifact(s) for document '{}', {} component(s) registered, {} reference(s)",
                result.getArtifacts().size(), document.getName(), registry.size(), result.getReferencesSubstituted());
        return result;
    }

    private BuiltArtifact build(BuildOrderPlanner.BuildUnit unit, Document document, ArtifactRegistry registry,
                                CancellationSignal signal) {
        Node node = unit.getNode();
        String componentId = node.isComponentDefinition() ? BuildOrderPlanner.componentIdOf(node) : null;

        if (componentId != null && registry.contains(componentId)) {
            log.debug("Component {} already built, skipping definition {}", componentId, node.getId());
            return null;
        }

        EmittedNode root = subtreeEmitter.emit(node, signal);
        int references = instanceSubstitutor.substitute(root, node, registry, signal);
        String artifactId = registry.allocateArtifactId(node.getHierarchyTier(), node.displayName());

        if (componentId != null) {
            registry.register(ArtifactReference.builder()
                    .artifactId(artifactId)
                    .componentId(componentId)
                    .tier(node.getHierarchyTier())
                    .build());
            updateComponentMetadata(document, componentId, node, unit, artifactId);
        }

        log.debug("Built {} from node {} ({} reference(s))", artifactId, node.getId(), references);
        return BuiltArtifact.builder()
                .artifactId(artifactId)
                .sourceNodeId(node.getId())
                .componentId(componentId)
                .tier(node.getHierarchyTier())
                .root(root)
                .referenceCount(references)
                .build();
    }

    private void updateComponentMetadata(Document document, String componentId, Node node,
                                         BuildOrderPlanner.BuildUnit unit, String artifactId) {
        ComponentDefinition definition = document.getComponents().computeIfAbsent(componentId,
                id -> ComponentDefinition.builder()
                        .key(id)
                        .name(node.getName())
                        .nodeId(node.getId())
                        .pageName(unit.getPage().getName())
                        .build());
        definition.setArtifactPath(artifactId);
        definition.setTier(node.getHierarchyTier());
    }
}
