package com.designsync.engine.service;

import com.designsync.engine.dto.PipelineResult;
import com.designsync.engine.dto.classification.ClassificationSummary;
import com.designsync.engine.dto.hierarchy.HierarchyResult;
import com.designsync.engine.dto.layout.ApproximationTag;
import com.designsync.engine.model.Document;
import com.designsync.engine.model.HierarchyTier;
import com.designsync.engine.service.classification.TypeClassificationService;
import com.designsync.engine.service.graph.DocumentStructureValidator;
import com.designsync.engine.service.graph.NodeNameSanitizer;
import com.designsync.engine.service.hierarchy.AtomicHierarchyResolver;
import com.designsync.engine.service.layout.LayoutTranslator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Runs one document through validation, classification, layout translation and the atomic
 * hierarchy, in that order, on the calling thread.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DesignSyncPipeline {

    private final DocumentStructureValidator structureValidator;
    private final NodeNameSanitizer nameSanitizer;
    private final TypeClassificationService classificationService;
    private final LayoutTranslator layoutTranslator;
    private final AtomicHierarchyResolver hierarchyResolver;

    public PipelineResult process(Document document) {
        return process(document, CancellationSignal.none());
    }

    public PipelineResult process(Document document, CancellationSignal signal) {
        log.info("Processing document '{}' ({} page(s), {} selected)", document.getName(),
                document.getPages().size(), document.getSelectedPages().size());

        structureValidator.validate(document);
        signal.throwIfCancelled();

        Map<String, Integer> telemetry = new LinkedHashMap<>();
        telemetry.put("names.derived", nameSanitizer.fillMissingCleanNames(document));

        ClassificationSummary classification = classificationService.classify(document, signal);
        telemetry.put("classification.nodes", classification.getClassified());
        telemetry.put("classification.external.requests", classification.getExternalRequests());
        telemetry.put("classification.external.accepted", classification.getExternalAccepted());
        telemetry.put("classification.external.unusable", classification.getExternalUnusable());

        Map<ApproximationTag, Integer> approximations = layoutTranslator.translate(document, signal);
        for (Map.Entry<ApproximationTag, Integer> entry : approximations.entrySet()) {
            telemetry.put("layout." + entry.getKey().name().toLowerCase(Locale.ROOT), entry.getValue());
        }

        HierarchyResult hierarchy = hierarchyResolver.resolve(document, signal);
        telemetry.put("hierarchy.artifacts", hierarchy.getArtifacts().size());
        telemetry.put("hierarchy.references", hierarchy.getReferencesSubstituted());
        for (HierarchyTier tier : HierarchyTier.values()) {
            int nodes = document.getNodesByTier(tier).size();
            if (nodes > 0) {
                telemetry.put("hierarchy.tier." + tier.name().toLowerCase(Locale.ROOT), nodes);
            }
        }

        log.info("Finished document '{}': {}", document.getName(), telemetry);
        return PipelineResult.builder()
                .document(document)
                .buildPlan(hierarchy.getBuildPlan())
                .artifacts(hierarchy.getArtifacts())
                .telemetry(telemetry)
                .build();
    }
}
