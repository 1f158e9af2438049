package com.designsync.engine.service.graph;

import com.designsync.engine.dto.graph.StructuralViolation;
import com.designsync.engine.exception.DocumentStructureException;
import com.designsync.engine.model.Document;
import com.designsync.engine.model.Node;
import com.designsync.engine.model.Page;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks the ownership and identity invariants of a document with one DFS before any
 * translation starts.
 *
 * Detects:
 * 1. Cycles: a node whose child list contains one of its own ancestors
 * 2. Shared children: a node owned by two parents (or listed on two pages)
 * 3. Duplicate node ids and duplicate component ids
 *
 * Nodes are tracked by identity, never by equals/hashCode, so a malformed graph
 * cannot send the check itself into infinite recursion.
 */
@Service
@Slf4j
public class DocumentStructureValidator {

    /**
     * Validate the document, throwing with every violation found.
     */
    public void validate(Document document) {
        List<StructuralViolation> violations = findViolations(document);
        if (!violations.isEmpty()) {
            log.error("Document '{}' failed structural validation with {} violation(s)",
                    document.getName(), violations.size());
            throw new DocumentStructureException(document.getName(), violations);
        }
        log.debug("Document '{}' passed structural validation", document.getName());
    }

    public List<StructuralViolation> findViolations(Document document) {
        List<StructuralViolation> violations = new ArrayList<>();
        Map<Node, String> ownerOf = new IdentityHashMap<>();
        Map<String, List<Node>> nodesById = new LinkedHashMap<>();

        for (Page page : document.getPages()) {
            for (Node root : page.getChildren()) {
                String pageOwner = "page:" + page.getId();
                if (ownerOf.containsKey(root)) {
                    violations.add(sharedChild(ownerOf.get(root), pageOwner, root));
                    continue;
                }
                ownerOf.put(root, pageOwner);
                Set<Node> onStack = Collections.newSetFromMap(new IdentityHashMap<>());
                dfs(root, onStack, ownerOf, nodesById, violations);
            }
        }

        // ========================= IDENTITY =========================

        Map<String, String> componentOwners = new LinkedHashMap<>();
        for (Map.Entry<String, List<Node>> entry : nodesById.entrySet()) {
            List<Node> sameId = entry.getValue();
            if (sameId.size() > 1) {
                violations.add(StructuralViolation.builder()
                        .type(StructuralViolation.Type.DUPLICATE_NODE_ID)
                        .nodeIds(List.of(entry.getKey()))
                        .description("Node id '" + entry.getKey() + "' is used by " + sameId.size() + " nodes")
                        .build());
            }
            for (Node node : sameId) {
                if (!node.isComponentDefinition()) {
                    continue;
                }
                String componentId = node.getComponentId() != null ? node.getComponentId() : node.getId();
                String previous = componentOwners.putIfAbsent(componentId, node.getId());
                if (previous != null && sameId.size() == 1) {
                    violations.add(StructuralViolation.builder()
                            .type(StructuralViolation.Type.DUPLICATE_COMPONENT_ID)
                            .nodeIds(List.of(previous, node.getId()))
                            .description("Component id '" + componentId + "' is defined by both "
                                    + previous + " and " + node.getId())
                            .build());
                }
            }
        }

        return violations;
    }

    private void dfs(Node node, Set<Node> onStack, Map<Node, String> ownerOf,
                     Map<String, List<Node>> nodesById, List<StructuralViolation> violations) {
        onStack.add(node);
        nodesById.computeIfAbsent(String.valueOf(node.getId()), k -> new ArrayList<>()).add(node);

        for (Node child : node.getChildren()) {
            if (onStack.contains(child)) {
                violations.add(StructuralViolation.builder()
                        .type(StructuralViolation.Type.CYCLE)
                        .nodeIds(List.of(String.valueOf(node.getId()), String.valueOf(child.getId())))
                        .description("Node " + node.getId() + " lists its ancestor " + child.getId() + " as a child")
                        .build());
                continue;
            }
            if (ownerOf.containsKey(child)) {
                violations.add(sharedChild(ownerOf.get(child), String.valueOf(node.getId()), child));
                continue;
            }
            ownerOf.put(child, String.valueOf(node.getId()));
            dfs(child, onStack, ownerOf, nodesById, violations);
        }

        onStack.remove(node);
    }

    private StructuralViolation sharedChild(String firstOwner, String secondOwner, Node child) {
        return StructuralViolation.builder()
                .type(StructuralViolation.Type.SHARED_CHILD)
                .nodeIds(List.of(firstOwner, secondOwner, String.valueOf(child.getId())))
                .description("Node " + child.getId() + " is owned by both " + firstOwner + " and " + secondOwner)
                .build();
    }
}
