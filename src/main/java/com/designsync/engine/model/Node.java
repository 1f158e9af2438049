package com.designsync.engine.model;

import com.designsync.engine.dto.classification.ClassificationResult;
import com.designsync.engine.dto.classification.SemanticRole;
import com.designsync.engine.dto.hierarchy.ArtifactReference;
import com.designsync.engine.dto.layout.ResolvedLayout;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One visual element of a design document.
 *
 * <p>Nodes are created once by the parsing collaborator and afterwards only annotated:
 * classification, resolved layout, hierarchy tier and artifact reference. Children are
 * owned in render order; {@link #parent} is a back-reference for upward lookups only.</p>
 *
 * <p>Equality is identity: the graph may be malformed (cycles) until it has been validated,
 * so nothing here walks the tree from equals/hashCode/toString.</p>
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(of = {"id", "name", "kind"})
public class Node {

    // Identity
    private String id;
    private String name;
    private String cleanName;
    private String sourceType;
    @Builder.Default
    private NodeKind kind = NodeKind.FRAME;
    @Builder.Default
    private boolean visible = true;

    // Absolute geometry, source convention (origin top-left, y down)
    private double x;
    private double y;
    private double width;
    private double height;
    private double rotation;

    // Layout container profile: how this node arranges its own children
    @Builder.Default
    private LayoutMode layoutMode = LayoutMode.NONE;
    @Builder.Default
    private LayoutWrap layoutWrap = LayoutWrap.NO_WRAP;
    @Builder.Default
    private AxisAlignment primaryAxisAlign = AxisAlignment.START;
    @Builder.Default
    private AxisAlignment counterAxisAlign = AxisAlignment.START;
    private double itemSpacing;
    private double counterAxisSpacing;
    private double paddingLeft;
    private double paddingRight;
    private double paddingTop;
    private double paddingBottom;

    // Self-sizing profile: how this node sizes within its parent
    @Builder.Default
    private SizingMode sizingHorizontal = SizingMode.FIXED;
    @Builder.Default
    private SizingMode sizingVertical = SizingMode.FIXED;
    private Double minWidth;
    private Double maxWidth;
    private Double minHeight;
    private Double maxHeight;
    private double layoutGrow;

    // Positioning
    @Builder.Default
    private PositioningMode positioning = PositioningMode.AUTO;
    @Builder.Default
    private ConstraintMode horizontalConstraint = ConstraintMode.LEFT;
    @Builder.Default
    private ConstraintMode verticalConstraint = ConstraintMode.TOP;

    // Visuals, carried opaquely
    private RgbaColor backgroundColor;
    @Builder.Default
    private List<Fill> fills = new ArrayList<>();
    @Builder.Default
    private List<Stroke> strokes = new ArrayList<>();
    private double strokeWeight;
    @Builder.Default
    private double opacity = 1.0;
    private double cornerRadius;
    private double[] cornerRadii; // topLeft, topRight, bottomRight, bottomLeft
    private boolean clipsContent;
    @Builder.Default
    private List<Effect> effects = new ArrayList<>();
    private String imageHash;

    // Text
    private String text;
    private TextStyle textStyle;

    // Components
    private String componentId;
    private boolean componentDefinition;
    private boolean componentInstance;
    @Builder.Default
    private Map<String, String> componentProperties = new HashMap<>();

    // Interaction
    private boolean prototypeAction;
    private String prototypeDestination;

    // Overflow scrolling
    private boolean horizontalScrolling;
    private boolean verticalScrolling;

    /**
     * Tier set explicitly on this node by configuration, or null to infer it.
     */
    private HierarchyTier declaredTier;

    @Builder.Default
    private List<Node> children = new ArrayList<>();

    private Node parent;

    // Annotations written by the pipeline
    @Builder.Default
    private SemanticRole semanticRole = SemanticRole.CONTAINER;
    private ClassificationResult classification;
    private ResolvedLayout resolvedLayout;
    private HierarchyTier hierarchyTier;
    private ArtifactReference artifactReference;

    /**
     * Appends a child and sets its parent back-reference.
     */
    public Node addChild(Node child) {
        children.add(child);
        child.setParent(this);
        return this;
    }

    public boolean hasImageFill() {
        for (Fill fill : fills) {
            if (fill.getType() == Fill.Type.IMAGE) {
                return true;
            }
        }
        return false;
    }

    public boolean hasSolidBackground() {
        return !fills.isEmpty() && fills.get(0).getType() == Fill.Type.SOLID;
    }

    public boolean hasTextChild() {
        for (Node child : children) {
            if (child.getKind() == NodeKind.TEXT) {
                return true;
            }
        }
        return false;
    }

    public boolean hasScrolling() {
        return horizontalScrolling || verticalScrolling;
    }

    public boolean isAbsolute() {
        return positioning == PositioningMode.ABSOLUTE;
    }

    public boolean isLayoutContainer() {
        return layoutMode != null && layoutMode.isAxis();
    }

    /**
     * True once the hierarchy resolver replaced this node's content by a reference to an artifact.
     */
    public boolean isReference() {
        return artifactReference != null;
    }

    /**
     * First text content found on this node or, depth-first, on its descendants.
     */
    public String getTextContent() {
        if (text != null && !text.isEmpty()) {
            return text;
        }
        for (Node child : children) {
            String found = child.getTextContent();
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    public Node findById(String nodeId) {
        if (nodeId == null) {
            return null;
        }
        if (nodeId.equals(id)) {
            return this;
        }
        for (Node child : children) {
            Node found = child.findById(nodeId);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    public void collectByTier(HierarchyTier tier, List<Node> results) {
        if (hierarchyTier == tier) {
            results.add(this);
        }
        for (Node child : children) {
            child.collectByTier(tier, results);
        }
    }

    /**
     * Name used for emitted artifacts and for sibling-name matching.
     */
    public String displayName() {
        return cleanName != null ? cleanName : name;
    }
}
