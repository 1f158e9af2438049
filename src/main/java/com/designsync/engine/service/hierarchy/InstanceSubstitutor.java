package com.designsync.engine.service.hierarchy;

import com.designsync.engine.dto.hierarchy.ArtifactReference;
import com.designsync.engine.dto.hierarchy.EmittedNode;
import com.designsync.engine.model.HierarchySettings;
import com.designsync.engine.model.Node;
import com.designsync.engine.service.CancellationSignal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Replaces emitted subtrees of already-built components by references.
 *
 * Each emitted child is matched back to a logical node among its parent's declared children.
 * By default the match is by name (clean name or raw name, first sibling wins), so two siblings
 * sharing a name both resolve to the first one. With provenance matching enabled the source node
 * id is used instead. An emitted child with no logical match is left as is and not descended.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class InstanceSubstitutor {

    private final HierarchySettings hierarchySettings;
    private final SubtreeEmitter subtreeEmitter;

    /**
     * @return number of subtrees replaced by references
     */
    public int substitute(EmittedNode emittedParent, Node logicalParent, ArtifactRegistry registry,
                          CancellationSignal signal) {
        int replaced = 0;
        List<EmittedNode> children = emittedParent.getChildren();

        for (int i = 0; i < children.size(); i++) {
            signal.throwIfCancelled();
            EmittedNode emittedChild = children.get(i);
            Node logicalChild = findMatchingNode(logicalParent, emittedChild);
            if (logicalChild == null) {
                log.trace("No logical match for emitted child '{}' under {}", emittedChild.getName(), logicalParent.getId());
                continue;
            }

            Optional<ArtifactReference> reference = referenceFor(logicalChild, registry);
            if (reference.isPresent()) {
                children.set(i, subtreeEmitter.reference(emittedChild, reference.get()));
                logicalChild.setArtifactReference(reference.get());
                replaced++;
                log.debug("Replaced '{}' with reference to {}", emittedChild.getName(), reference.get().getArtifactId());
            } else {
                replaced += substitute(emittedChild, logicalChild, registry, signal);
            }
        }
        return replaced;
    }

    private Optional<ArtifactReference> referenceFor(Node logical, ArtifactRegistry registry) {
        if (logical.isComponentInstance()) {
            return registry.lookup(logical.getComponentId());
        }
        if (logical.isComponentDefinition()) {
            return registry.lookup(BuildOrderPlanner.componentIdOf(logical));
        }
        return Optional.empty();
    }

    Node findMatchingNode(Node logicalParent, EmittedNode emittedChild) {
        for (Node candidate : logicalParent.getChildren()) {
            if (hierarchySettings.isMatchByProvenance()) {
                if (candidate.getId() != null && candidate.getId().equals(emittedChild.getSourceNodeId())) {
                    return candidate;
                }
            } else if (emittedChild.getName() != null
                    && (emittedChild.getName().equals(candidate.getCleanName())
                    || emittedChild.getName().equals(candidate.getName()))) {
                return candidate;
            }
        }
        return null;
    }
}
