package com.designsync.engine.service.hierarchy;

import com.designsync.engine.dto.hierarchy.ArtifactReference;
import com.designsync.engine.dto.hierarchy.EmittedNode;
import com.designsync.engine.exception.PipelineCancelledException;
import com.designsync.engine.model.HierarchySettings;
import com.designsync.engine.model.HierarchyTier;
import com.designsync.engine.model.Node;
import com.designsync.engine.service.CancellationSignal;
import com.designsync.engine.service.layout.AbsolutePositioningResolver;
import com.designsync.engine.service.layout.SizingResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.designsync.engine.support.TestNodes.frame;
import static com.designsync.engine.support.TestNodes.instance;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InstanceSubstitutorTest {

    private final SubtreeEmitter emitter = new SubtreeEmitter(new SizingResolver(), new AbsolutePositioningResolver());
    private ArtifactRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ArtifactRegistry(HierarchySettings.builder().build());
        registry.register(ArtifactReference.builder()
                .componentId("cmp-icon")
                .artifactId("ui/artifacts/Atoms/Icon.artifact")
                .tier(HierarchyTier.ATOM)
                .build());
    }

    @Test
    void replacesRegisteredInstanceWithReferenceKeepingGeometry() {
        Node card = frame("card", "Card");
        Node icon = instance("icon", "Icon", "cmp-icon");
        icon.setX(12);
        icon.setWidth(24);
        icon.addChild(frame("glyph", "Glyph"));
        card.addChild(icon);
        EmittedNode emitted = emitter.emit(card, CancellationSignal.none());

        int replaced = substitutor(false).substitute(emitted, card, registry, CancellationSignal.none());

        EmittedNode reference = emitted.getChildren().get(0);
        assertThat(replaced).isEqualTo(1);
        assertThat(reference.isReference()).isTrue();
        assertThat(reference.getChildren()).isEmpty();
        assertThat(reference.getX()).isEqualTo(12.0);
        assertThat(reference.getWidth()).isEqualTo(24.0);
        assertThat(icon.isReference()).isTrue();
    }

    @Test
    void unregisteredInstanceIsEmittedInFull() {
        Node card = frame("card", "Card");
        card.addChild(instance("avatar", "Avatar", "cmp-avatar").addChild(frame("img", "Image")));
        EmittedNode emitted = emitter.emit(card, CancellationSignal.none());

        int replaced = substitutor(false).substitute(emitted, card, registry, CancellationSignal.none());

        assertThat(replaced).isZero();
        assertThat(emitted.getChildren().get(0).getChildren()).hasSize(1);
    }

    @Test
    void descendsIntoPlainContainers() {
        Node card = frame("card", "Card");
        Node row = frame("row", "Row");
        row.addChild(instance("icon", "Icon", "cmp-icon"));
        card.addChild(row);
        EmittedNode emitted = emitter.emit(card, CancellationSignal.none());

        assertThat(substitutor(false).substitute(emitted, card, registry, CancellationSignal.none())).isEqualTo(1);
        assertThat(emitted.getChildren().get(0).getChildren().get(0).isReference()).isTrue();
    }

    @Test
    void duplicateSiblingNamesResolveToFirstSiblingByName() {
        Node card = frame("card", "Card");
        Node plain = frame("plain", "Icon");
        Node real = instance("real", "Icon", "cmp-icon");
        card.addChild(plain).addChild(real);
        EmittedNode emitted = emitter.emit(card, CancellationSignal.none());

        int replaced = substitutor(false).substitute(emitted, card, registry, CancellationSignal.none());

        // both emitted children match the first "Icon" sibling, which is not an instance
        assertThat(replaced).isZero();
        assertThat(real.isReference()).isFalse();
    }

    @Test
    void provenanceMatchingDisambiguatesDuplicateNames() {
        Node card = frame("card", "Card");
        Node plain = frame("plain", "Icon");
        Node real = instance("real", "Icon", "cmp-icon");
        card.addChild(plain).addChild(real);
        EmittedNode emitted = emitter.emit(card, CancellationSignal.none());

        int replaced = substitutor(true).substitute(emitted, card, registry, CancellationSignal.none());

        assertThat(replaced).isEqualTo(1);
        assertThat(emitted.getChildren().get(0).isReference()).isFalse();
        assertThat(emitted.getChildren().get(1).isReference()).isTrue();
    }

    @Test
    void cancellationIsObservedBetweenChildren() {
        Node card = frame("card", "Card");
        card.addChild(instance("icon", "Icon", "cmp-icon"));
        EmittedNode emitted = emitter.emit(card, CancellationSignal.none());
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();

        assertThatThrownBy(() -> substitutor(false).substitute(emitted, card, registry, signal))
                .isInstanceOf(PipelineCancelledException.class);
        assertThat(emitted.getChildren().get(0).isReference()).isFalse();
    }

    private InstanceSubstitutor substitutor(boolean matchByProvenance) {
        return new InstanceSubstitutor(HierarchySettings.builder().matchByProvenance(matchByProvenance).build(), emitter);
    }
}
