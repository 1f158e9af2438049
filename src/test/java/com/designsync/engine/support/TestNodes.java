package com.designsync.engine.support;

import com.designsync.engine.model.Document;
import com.designsync.engine.model.Fill;
import com.designsync.engine.model.LayoutMode;
import com.designsync.engine.model.Node;
import com.designsync.engine.model.NodeKind;
import com.designsync.engine.model.Page;
import com.designsync.engine.model.RgbaColor;

/**
 * Small builders for hand-made design graphs.
 */
public final class TestNodes {

    private TestNodes() {
    }

    public static Node frame(String id, String name, double x, double y, double width, double height) {
        Node node = Node.builder().build();
        node.setId(id);
        node.setName(name);
        node.setKind(NodeKind.FRAME);
        node.setSourceType("FRAME");
        node.setX(x);
        node.setY(y);
        node.setWidth(width);
        node.setHeight(height);
        return node;
    }

    public static Node frame(String id, String name) {
        return frame(id, name, 0, 0, 100, 100);
    }

    public static Node text(String id, String name, String content) {
        Node node = frame(id, name, 0, 0, 80, 20);
        node.setKind(NodeKind.TEXT);
        node.setSourceType("TEXT");
        node.setText(content);
        return node;
    }

    public static Node rectangle(String id, String name, double width, double height) {
        Node node = frame(id, name, 0, 0, width, height);
        node.setKind(NodeKind.RECTANGLE);
        node.setSourceType("RECTANGLE");
        return node;
    }

    public static Node vector(String id, String name) {
        Node node = frame(id, name, 0, 0, 24, 24);
        node.setKind(NodeKind.VECTOR);
        node.setSourceType("VECTOR");
        return node;
    }

    public static Node autoLayout(String id, String name, LayoutMode mode) {
        Node node = frame(id, name, 0, 0, 300, 100);
        node.setLayoutMode(mode);
        return node;
    }

    public static Node definition(String id, String name, String componentId) {
        Node node = frame(id, name);
        node.setKind(NodeKind.COMPONENT);
        node.setSourceType("COMPONENT");
        node.setComponentDefinition(true);
        node.setComponentId(componentId);
        return node;
    }

    public static Node instance(String id, String name, String componentId) {
        Node node = frame(id, name);
        node.setKind(NodeKind.INSTANCE);
        node.setSourceType("INSTANCE");
        node.setComponentInstance(true);
        node.setComponentId(componentId);
        return node;
    }

    public static Fill solid() {
        return Fill.builder().type(Fill.Type.SOLID).color(RgbaColor.builder().r(0.2).g(0.4).b(0.8).build()).build();
    }

    public static Fill image(String hash) {
        return Fill.builder().type(Fill.Type.IMAGE).imageHash(hash).build();
    }

    public static Page page(String id, String name, Node... roots) {
        Page page = Page.builder().id(id).name(name).build();
        for (Node root : roots) {
            page.addChild(root);
        }
        return page;
    }

    public static Document document(Page... pages) {
        Document document = Document.builder().name("Test File").fileKey("test-key").build();
        for (Page page : pages) {
            document.getPages().add(page);
        }
        return document;
    }
}
