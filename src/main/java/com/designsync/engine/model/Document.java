package com.designsync.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The whole design document: pages, component metadata and style metadata.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(of = {"name", "fileKey", "version"})
public class Document {

    private String name;
    private String fileKey;
    private String lastModified;
    private String version;

    @Builder.Default
    private List<Page> pages = new ArrayList<>();

    @Builder.Default
    private Map<String, ComponentDefinition> components = new LinkedHashMap<>(); // componentId -> metadata

    @Builder.Default
    private Map<String, StyleDefinition> styles = new LinkedHashMap<>(); // styleId -> metadata

    public List<Page> getSelectedPages() {
        List<Page> results = new ArrayList<>();
        for (Page page : pages) {
            if (page.isSelected()) {
                results.add(page);
            }
        }
        return results;
    }

    public Node findNodeById(String id) {
        for (Page page : pages) {
            for (Node node : page.getChildren()) {
                Node found = node.findById(id);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    /**
     * Nodes of the selected pages annotated with the given tier, in document order.
     */
    public List<Node> getNodesByTier(HierarchyTier tier) {
        List<Node> results = new ArrayList<>();
        for (Page page : getSelectedPages()) {
            for (Node node : page.getChildren()) {
                node.collectByTier(tier, results);
            }
        }
        return results;
    }

    public List<Node> getInstancesOfComponent(String componentId) {
        List<Node> results = new ArrayList<>();
        for (Page page : pages) {
            for (Node node : page.getChildren()) {
                collectInstances(node, componentId, results);
            }
        }
        return results;
    }

    private void collectInstances(Node node, String componentId, List<Node> results) {
        if (node.isComponentInstance() && componentId.equals(node.getComponentId())) {
            results.add(node);
        }
        for (Node child : node.getChildren()) {
            collectInstances(child, componentId, results);
        }
    }
}
