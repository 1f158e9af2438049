package com.designsync.engine.model;

import org.junit.jupiter.api.Test;

import static com.designsync.engine.support.TestNodes.definition;
import static com.designsync.engine.support.TestNodes.document;
import static com.designsync.engine.support.TestNodes.frame;
import static com.designsync.engine.support.TestNodes.instance;
import static com.designsync.engine.support.TestNodes.page;
import static com.designsync.engine.support.TestNodes.text;
import static org.assertj.core.api.Assertions.assertThat;

class DocumentTest {

    @Test
    void findsNodesAnywhereInTheDocument() {
        Node nested = frame("nested", "Nested");
        Node root = frame("root", "Root").addChild(frame("mid", "Mid").addChild(nested));
        Page hidden = page("p2", "Drafts", frame("draft", "Draft"));
        hidden.setSelected(false);
        Document doc = document(page("p1", "Home", root), hidden);

        assertThat(doc.findNodeById("nested")).isSameAs(nested);
        assertThat(doc.findNodeById("draft")).isNotNull();
        assertThat(doc.findNodeById("missing")).isNull();
        assertThat(doc.findNodeById(null)).isNull();
    }

    @Test
    void selectedPagesKeepDocumentOrder() {
        Page first = page("p1", "One");
        Page second = page("p2", "Two");
        second.setSelected(false);
        Page third = page("p3", "Three");

        assertThat(document(first, second, third).getSelectedPages()).containsExactly(first, third);
    }

    @Test
    void nodesByTierComeFromSelectedPagesOnly() {
        Node atom = frame("a", "A");
        atom.setHierarchyTier(HierarchyTier.ATOM);
        Node screen = frame("s", "S").addChild(atom);
        screen.setHierarchyTier(HierarchyTier.SCREEN);
        Node skipped = frame("x", "X");
        skipped.setHierarchyTier(HierarchyTier.ATOM);
        Page unselected = page("p2", "Old", skipped);
        unselected.setSelected(false);
        Document doc = document(page("p1", "Home", screen), unselected);

        assertThat(doc.getNodesByTier(HierarchyTier.ATOM)).containsExactly(atom);
        assertThat(doc.getNodesByTier(HierarchyTier.SCREEN)).containsExactly(screen);
        assertThat(doc.getNodesByTier(HierarchyTier.ORGANISM)).isEmpty();
    }

    @Test
    void instancesOfComponentAreCollectedAcrossPages() {
        Node first = instance("i1", "Button", "cmp-button");
        Node second = instance("i2", "Button", "cmp-button");
        Node other = instance("i3", "Chip", "cmp-chip");
        Document doc = document(
                page("p1", "Atoms", definition("d", "Button", "cmp-button")),
                page("p2", "Home", frame("home", "Home").addChild(first).addChild(other)),
                page("p3", "Settings", frame("settings", "Settings").addChild(text("t", "Title", "Hi")).addChild(second)));

        assertThat(doc.getInstancesOfComponent("cmp-button")).containsExactly(first, second);
        assertThat(doc.getInstancesOfComponent("cmp-none")).isEmpty();
    }
}
