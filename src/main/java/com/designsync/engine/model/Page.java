package com.designsync.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Named top-level canvas owning a forest of nodes.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(of = {"id", "name", "selected", "defaultTier"})
public class Page {

    private String id;
    private String name;
    @Builder.Default
    private boolean selected = true;
    @Builder.Default
    private HierarchyTier defaultTier = HierarchyTier.SCREEN;
    private RgbaColor backgroundColor;
    @Builder.Default
    private List<Node> children = new ArrayList<>();

    public Page addChild(Node node) {
        children.add(node);
        node.setParent(null);
        return this;
    }

    /**
     * Number of component definitions anywhere on this page.
     */
    public int componentCount() {
        int count = 0;
        for (Node child : children) {
            count += countComponents(child);
        }
        return count;
    }

    private int countComponents(Node node) {
        int count = node.isComponentDefinition() ? 1 : 0;
        for (Node child : node.getChildren()) {
            count += countComponents(child);
        }
        return count;
    }
}
