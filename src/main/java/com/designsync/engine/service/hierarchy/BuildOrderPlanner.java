package com.designsync.engine.service.hierarchy;

import com.designsync.engine.dto.hierarchy.BuildPlan;
import com.designsync.engine.model.Document;
import com.designsync.engine.model.HierarchyTier;
import com.designsync.engine.model.Node;
import com.designsync.engine.model.Page;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Orders build units: tiers lowest first, and inside a tier every component definition before
 * the units that contain its instances. Otherwise document order is kept.
 *
 * A build unit is a visible top-level node of a selected page or a visible component
 * definition nested anywhere below one. Units in the SKIP tier are left out.
 */
@Component
@Slf4j
public class BuildOrderPlanner {

    public List<BuildUnit> collectUnits(Document document) {
        List<BuildUnit> units = new ArrayList<>();
        for (Page page : document.getSelectedPages()) {
            for (Node root : page.getChildren()) {
                if (root.isVisible()) {
                    units.add(new BuildUnit(root, page));
                    collectNestedDefinitions(root, page, units);
                }
            }
        }
        return units;
    }

    private void collectNestedDefinitions(Node node, Page page, List<BuildUnit> units) {
        for (Node child : node.getChildren()) {
            if (!child.isVisible()) {
                continue;
            }
            if (child.isComponentDefinition()) {
                units.add(new BuildUnit(child, page));
            }
            collectNestedDefinitions(child, page, units);
        }
    }

    public BuildPlan plan(List<BuildUnit> units) {
        BuildPlan plan = BuildPlan.builder().build();
        for (HierarchyTier tier : HierarchyTier.buildOrder()) {
            List<BuildUnit> inTier = new ArrayList<>();
            for (BuildUnit unit : units) {
                if (unit.getNode().getHierarchyTier() == tier) {
                    inTier.add(unit);
                }
            }
            if (inTier.isEmpty()) {
                continue;
            }
            List<String> ordered = new ArrayList<>();
            for (BuildUnit unit : orderWithinTier(inTier)) {
                ordered.add(unit.getNode().getId());
            }
            plan.getBatches().add(BuildPlan.TierBatch.builder().tier(tier).nodeIds(ordered).build());
        }

        long skipped = units.stream().filter(u -> u.getNode().getHierarchyTier() == HierarchyTier.SKIP).count();
        if (skipped > 0) {
            log.debug("Left {} unit(s) in the skip tier out of the build plan", skipped);
        }
        return plan;
    }

    /**
     * Stable topological order: repeatedly take the first unit in document order whose
     * same-tier dependencies are already placed.
     */
    List<BuildUnit> orderWithinTier(List<BuildUnit> units) {
        Set<String> definedHere = new HashSet<>();
        for (BuildUnit unit : units) {
            if (unit.getNode().isComponentDefinition()) {
                definedHere.add(componentIdOf(unit.getNode()));
            }
        }

        List<BuildUnit> remaining = new ArrayList<>(units);
        List<BuildUnit> ordered = new ArrayList<>();
        Set<String> placed = new HashSet<>();

        while (!remaining.isEmpty()) {
            BuildUnit next = null;
            for (BuildUnit candidate : remaining) {
                Set<String> pendingDependencies = new HashSet<>(candidate.dependencies());
                pendingDependencies.retainAll(definedHere);
                pendingDependencies.removeAll(placed);
                if (candidate.getNode().isComponentDefinition()) {
                    pendingDependencies.remove(componentIdOf(candidate.getNode()));
                }
                if (pendingDependencies.isEmpty()) {
                    next = candidate;
                    break;
                }
            }
            if (next == null) {
                log.warn("Circular component usage among {} unit(s), keeping document order", remaining.size());
                ordered.addAll(remaining);
                break;
            }
            remaining.remove(next);
            ordered.add(next);
            if (next.getNode().isComponentDefinition()) {
                placed.add(componentIdOf(next.getNode()));
            }
        }
        return ordered;
    }

    /**
     * Component id of a definition; a definition without an explicit one is keyed by its node id.
     */
    public static String componentIdOf(Node definition) {
        return definition.getComponentId() != null ? definition.getComponentId() : definition.getId();
    }

    @Getter
    @RequiredArgsConstructor
    public static class BuildUnit {
        private final Node node;
        private final Page page;

        /**
         * Component ids this unit's content refers to: instances and nested definitions.
         */
        public Set<String> dependencies() {
            Set<String> ids = new LinkedHashSet<>();
            collect(node, ids);
            return ids;
        }

        private void collect(Node current, Set<String> ids) {
            for (Node child : current.getChildren()) {
                if (!child.isVisible()) {
                    continue;
                }
                if (child.isComponentInstance() && child.getComponentId() != null) {
                    ids.add(child.getComponentId());
                }
                if (child.isComponentDefinition()) {
                    ids.add(componentIdOf(child));
                }
                collect(child, ids);
            }
        }
    }
}
