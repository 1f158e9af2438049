package com.designsync.engine.service;

import com.designsync.engine.dto.PipelineResult;
import com.designsync.engine.dto.classification.SemanticRole;
import com.designsync.engine.exception.DocumentStructureException;
import com.designsync.engine.exception.PipelineCancelledException;
import com.designsync.engine.model.AxisAlignment;
import com.designsync.engine.model.Document;
import com.designsync.engine.model.HierarchySettings;
import com.designsync.engine.model.LayoutMode;
import com.designsync.engine.model.LlmConfiguration;
import com.designsync.engine.model.Node;
import com.designsync.engine.service.classification.ExternalTypeClassifier;
import com.designsync.engine.service.classification.RuleBasedClassifier;
import com.designsync.engine.service.classification.TypeClassificationService;
import com.designsync.engine.service.classification.rules.InteractionRule;
import com.designsync.engine.service.classification.rules.NamePatternRule;
import com.designsync.engine.service.classification.rules.NameTokenizer;
import com.designsync.engine.service.classification.rules.StructuralHeuristicRule;
import com.designsync.engine.service.classification.rules.StructuralKindRule;
import com.designsync.engine.service.graph.DocumentStructureValidator;
import com.designsync.engine.service.graph.NodeNameSanitizer;
import com.designsync.engine.service.hierarchy.AtomicHierarchyResolver;
import com.designsync.engine.service.hierarchy.BuildOrderPlanner;
import com.designsync.engine.service.hierarchy.InstanceSubstitutor;
import com.designsync.engine.service.hierarchy.SubtreeEmitter;
import com.designsync.engine.service.hierarchy.TierAssigner;
import com.designsync.engine.service.layout.AbsolutePositioningResolver;
import com.designsync.engine.service.layout.AlignmentResolver;
import com.designsync.engine.service.layout.LayoutTranslator;
import com.designsync.engine.service.layout.SizingResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.designsync.engine.support.TestNodes.autoLayout;
import static com.designsync.engine.support.TestNodes.definition;
import static com.designsync.engine.support.TestNodes.document;
import static com.designsync.engine.support.TestNodes.frame;
import static com.designsync.engine.support.TestNodes.instance;
import static com.designsync.engine.support.TestNodes.page;
import static com.designsync.engine.support.TestNodes.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DesignSyncPipelineTest {

    @Mock
    private ExternalTypeClassifier externalTypeClassifier;

    private DesignSyncPipeline pipeline;

    @BeforeEach
    void setUp() {
        HierarchySettings settings = HierarchySettings.builder().build();
        RuleBasedClassifier ruleBasedClassifier = new RuleBasedClassifier(
                new StructuralKindRule(),
                new InteractionRule(),
                new NamePatternRule(new NameTokenizer()),
                new StructuralHeuristicRule());
        SubtreeEmitter emitter = new SubtreeEmitter(new SizingResolver(), new AbsolutePositioningResolver());

        pipeline = new DesignSyncPipeline(
                new DocumentStructureValidator(),
                new NodeNameSanitizer(),
                new TypeClassificationService(ruleBasedClassifier, externalTypeClassifier,
                        LlmConfiguration.builder().build()),
                new LayoutTranslator(new SizingResolver(), new AlignmentResolver(), new AbsolutePositioningResolver()),
                new AtomicHierarchyResolver(settings, new TierAssigner(settings), new BuildOrderPlanner(),
                        emitter, new InstanceSubstitutor(settings, emitter)));
    }

    @Test
    void processesDocumentEndToEnd() {
        when(externalTypeClassifier.isAvailable()).thenReturn(false);

        Node button = definition("button", "Primary Button", "cmp-button");
        Node label = text("label", "Label", "OK");
        button.addChild(label);

        Node home = frame("home", "Home", 0, 0, 360, 640);
        Node toolbar = autoLayout("toolbar", "Toolbar", LayoutMode.HORIZONTAL);
        toolbar.setPrimaryAxisAlign(AxisAlignment.SPACE_BETWEEN);
        Node buy = instance("buy", "Primary Button", "cmp-button");
        toolbar.addChild(frame("back", "Back")).addChild(frame("title", "Title")).addChild(buy);
        home.addChild(toolbar);

        Document doc = document(page("p1", "Atoms", button), page("p2", "Home", home));

        PipelineResult result = pipeline.process(doc);

        assertThat(result.getDocument()).isSameAs(doc);
        assertThat(result.getTelemetry())
                .containsEntry("names.derived", 7)
                .containsEntry("classification.nodes", 7)
                .containsEntry("classification.external.requests", 0)
                .containsEntry("layout.space_between_spacers", 1)
                .containsEntry("hierarchy.artifacts", 2)
                .containsEntry("hierarchy.references", 1)
                .containsEntry("hierarchy.tier.atom", 5)
                .containsEntry("hierarchy.tier.molecule", 2)
                .doesNotContainKey("hierarchy.tier.screen");

        assertThat(label.getSemanticRole()).isEqualTo(SemanticRole.LABEL);
        assertThat(toolbar.getResolvedLayout().getContainer().spacerCount()).isEqualTo(2);
        assertThat(result.getBuildPlan().flatten()).containsExactly("button", "home");
        assertThat(result.getArtifacts().get(0).getArtifactId()).isEqualTo("ui/artifacts/Atoms/Primary_Button.artifact");
        assertThat(buy.getArtifactReference().getArtifactId()).isEqualTo("ui/artifacts/Atoms/Primary_Button.artifact");
        assertThat(doc.getComponents().get("cmp-button").getArtifactPath())
                .isEqualTo("ui/artifacts/Atoms/Primary_Button.artifact");
    }

    @Test
    void rejectsStructurallyInvalidDocumentBeforeAnyStage() {
        Node shared = frame("shared", "Shared");
        Document doc = document(page("p1", "One", shared), page("p2", "Two", shared));

        assertThatThrownBy(() -> pipeline.process(doc))
                .isInstanceOf(DocumentStructureException.class)
                .satisfies(e -> assertThat(((DocumentStructureException) e).getOffendingNodeIds()).contains("shared"));

        assertThat(shared.getCleanName()).isNull();
        assertThat(shared.getResolvedLayout()).isNull();
        verify(externalTypeClassifier, never()).classifyAsync(any());
    }

    @Test
    void cancelledSignalStopsPipeline() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();
        Document doc = document(page("p", "Home", frame("a", "A")));

        assertThatThrownBy(() -> pipeline.process(doc, signal))
                .isInstanceOf(PipelineCancelledException.class);
    }
}
