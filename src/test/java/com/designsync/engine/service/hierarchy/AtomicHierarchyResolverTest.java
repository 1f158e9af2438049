package com.designsync.engine.service.hierarchy;

import com.designsync.engine.dto.hierarchy.BuiltArtifact;
import com.designsync.engine.dto.hierarchy.EmittedNode;
import com.designsync.engine.dto.hierarchy.HierarchyResult;
import com.designsync.engine.exception.PipelineCancelledException;
import com.designsync.engine.model.ComponentDefinition;
import com.designsync.engine.model.Document;
import com.designsync.engine.model.HierarchySettings;
import com.designsync.engine.model.HierarchyTier;
import com.designsync.engine.model.Node;
import com.designsync.engine.model.Page;
import com.designsync.engine.service.CancellationSignal;
import com.designsync.engine.service.layout.AbsolutePositioningResolver;
import com.designsync.engine.service.layout.SizingResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.designsync.engine.support.TestNodes.definition;
import static com.designsync.engine.support.TestNodes.document;
import static com.designsync.engine.support.TestNodes.frame;
import static com.designsync.engine.support.TestNodes.instance;
import static com.designsync.engine.support.TestNodes.page;
import static com.designsync.engine.support.TestNodes.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AtomicHierarchyResolverTest {

    private AtomicHierarchyResolver resolver;

    @BeforeEach
    void setUp() {
        HierarchySettings settings = HierarchySettings.builder().build();
        SubtreeEmitter emitter = new SubtreeEmitter(new SizingResolver(), new AbsolutePositioningResolver());
        resolver = new AtomicHierarchyResolver(settings, new TierAssigner(settings), new BuildOrderPlanner(),
                emitter, new InstanceSubstitutor(settings, emitter));
    }

    @Test
    void componentIsBuiltOnceAndEveryInstanceBecomesReference() {
        Node button = definition("button", "Button", "cmp-button");
        button.addChild(text("button-label", "Label", "OK"));
        Node copy = definition("button-copy", "Button", "cmp-button");

        Node home = frame("home", "Home");
        Node primary = instance("primary", "Primary", "cmp-button");
        Node secondary = instance("secondary", "Secondary", "cmp-button");
        Node footer = frame("footer", "Footer");
        Node tertiary = instance("tertiary", "Tertiary", "cmp-button");
        footer.addChild(tertiary);
        home.addChild(primary).addChild(secondary).addChild(footer);

        Page screens = page("p2", "Home", home);
        screens.setDefaultTier(HierarchyTier.ORGANISM);
        Document doc = document(page("p1", "Atoms", button, copy), screens);

        HierarchyResult result = resolver.resolve(doc, CancellationSignal.none());

        List<BuiltArtifact> artifacts = result.getArtifacts();
        assertThat(artifacts).extracting(BuiltArtifact::getSourceNodeId).containsExactly("button", "home");
        String buttonArtifact = artifacts.get(0).getArtifactId();
        assertThat(buttonArtifact).isEqualTo("ui/artifacts/Atoms/Button.artifact");

        BuiltArtifact homeArtifact = artifacts.get(1);
        assertThat(homeArtifact.getReferenceCount()).isEqualTo(3);
        EmittedNode homeRoot = homeArtifact.getRoot();
        assertThat(homeRoot.getChildren().get(0).getReference().getArtifactId()).isEqualTo(buttonArtifact);
        assertThat(homeRoot.getChildren().get(1).getReference().getArtifactId()).isEqualTo(buttonArtifact);
        assertThat(homeRoot.getChildren().get(2).getChildren().get(0).isReference()).isTrue();
        assertThat(primary.isReference()).isTrue();
        assertThat(secondary.isReference()).isTrue();
        assertThat(tertiary.getArtifactReference().getArtifactId()).isEqualTo(buttonArtifact);
        assertThat(result.getReferencesSubstituted()).isEqualTo(3);
    }

    @Test
    void lowerTiersAreBuiltBeforeHigherTiersThatUseThem() {
        Node chip = definition("chip", "Chip", "cmp-chip");
        chip.setDeclaredTier(HierarchyTier.ATOM);
        Node filterBar = definition("filters", "Filter Bar", "cmp-filters");
        filterBar.setDeclaredTier(HierarchyTier.MOLECULE);
        filterBar.addChild(instance("chip-1", "Chip", "cmp-chip"));
        Node screen = frame("screen", "Search Screen");
        screen.setDeclaredTier(HierarchyTier.ORGANISM);
        screen.addChild(instance("filters-1", "Filter Bar", "cmp-filters"));
        // document order deliberately reversed
        Document doc = document(page("p", "Everything", screen, filterBar, chip));

        HierarchyResult result = resolver.resolve(doc, CancellationSignal.none());

        assertThat(result.getBuildPlan().flatten()).containsExactly("chip", "filters", "screen");
        assertThat(result.getArtifacts()).allSatisfy(a -> {
            if (!a.getSourceNodeId().equals("chip")) {
                assertThat(a.getReferenceCount()).isEqualTo(1);
            }
        });
    }

    @Test
    void builtComponentMetadataIsUpdated() {
        Node card = definition("card", "Product Card", "cmp-card");
        card.setCleanName("Product_Card");
        Document doc = document(page("p", "Organisms", card));
        doc.getComponents().put("cmp-card", ComponentDefinition.builder().key("cmp-card").name("Product Card").build());

        resolver.resolve(doc, CancellationSignal.none());

        ComponentDefinition metadata = doc.getComponents().get("cmp-card");
        assertThat(metadata.getTier()).isEqualTo(HierarchyTier.ORGANISM);
        assertThat(metadata.getArtifactPath()).isEqualTo("ui/artifacts/Organisms/Product_Card.artifact");
    }

    @Test
    void invisibleNodesAreNotEmitted() {
        Node root = frame("root", "Root");
        Node hidden = frame("hidden", "Hidden");
        hidden.setVisible(false);
        root.addChild(frame("shown", "Shown")).addChild(hidden);

        HierarchyResult result = resolver.resolve(document(page("p", "Atoms", root)), CancellationSignal.none());

        assertThat(result.getArtifacts().get(0).getRoot().countNodes()).isEqualTo(2);
    }

    @Test
    void skipTierUnitsAreNotBuilt() {
        Page scratch = page("p", "Scratch", frame("s", "Sketch"));
        scratch.setDefaultTier(HierarchyTier.SKIP);

        HierarchyResult result = resolver.resolve(document(scratch), CancellationSignal.none());

        assertThat(result.getArtifacts()).isEmpty();
        assertThat(result.getBuildPlan().getBatches()).isEmpty();
    }

    @Test
    void cancellationStopsBetweenUnits() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();

        assertThatThrownBy(() -> resolver.resolve(document(page("p", "Atoms", frame("a", "A"))), signal))
                .isInstanceOf(PipelineCancelledException.class);
    }
}
