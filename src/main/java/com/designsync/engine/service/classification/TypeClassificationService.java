package com.designsync.engine.service.classification;

import com.designsync.engine.dto.classification.ClassificationRequest;
import com.designsync.engine.dto.classification.ClassificationResult;
import com.designsync.engine.dto.classification.ClassificationSummary;
import com.designsync.engine.dto.classification.Confidence;
import com.designsync.engine.model.Document;
import com.designsync.engine.model.LlmConfiguration;
import com.designsync.engine.model.Node;
import com.designsync.engine.model.Page;
import com.designsync.engine.service.CancellationSignal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Assigns a semantic role to every node of the selected pages.
 *
 * Nodes are classified locally in document order. A node whose local result is below MEDIUM is
 * also sent to the external classifier when one is available; in parallel mode all such calls
 * are issued during the walk and joined afterwards in document order. The external answer
 * replaces the local one only when it is strictly more confident.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TypeClassificationService {

    private static final Confidence EXTERNAL_THRESHOLD = Confidence.MEDIUM;

    private final RuleBasedClassifier ruleBasedClassifier;
    private final ExternalTypeClassifier externalTypeClassifier;
    private final LlmConfiguration classifierLlmConfiguration;

    public ClassificationSummary classify(Document document, CancellationSignal signal) {
        ClassificationSummary summary = ClassificationSummary.builder().build();
        boolean externalAvailable = externalTypeClassifier.isAvailable();
        List<PendingCall> pending = new ArrayList<>();
        List<Node> visited = new ArrayList<>();

        for (Page page : document.getSelectedPages()) {
            for (Node root : page.getChildren()) {
                visit(root, signal, externalAvailable, pending, visited, summary);
            }
        }

        for (PendingCall call : pending) {
            resolve(call, signal, summary);
        }

        for (Node node : visited) {
            summary.getRoleCounts().merge(node.getSemanticRole(), 1, Integer::sum);
        }
        summary.setClassified(visited.size());

        log.info("Classified {} node(s) of document '{}' ({} external request(s), {} accepted)",
                summary.getClassified(), document.getName(),
                summary.getExternalRequests(), summary.getExternalAccepted());
        return summary;
    }

    private void visit(Node node, CancellationSignal signal, boolean externalAvailable,
                       List<PendingCall> pending, List<Node> visited, ClassificationSummary summary) {
        signal.throwIfCancelled();

        ClassificationResult local = ruleBasedClassifier.classify(node);
        apply(node, local);
        visited.add(node);

        if (externalAvailable && !local.getConfidence().isAtLeast(EXTERNAL_THRESHOLD)) {
            summary.setExternalRequests(summary.getExternalRequests() + 1);
            CompletableFuture<Optional<ClassificationResult>> future;
            try {
                future = signal.link(externalTypeClassifier.classifyAsync(buildRequest(node)));
            } catch (RuntimeException e) {
                // executor rejection or proxy failure: keep the local answer
                log.warn("Could not submit external classification of {}: {}", node.getId(), e.getMessage());
                future = CompletableFuture.completedFuture(Optional.empty());
            }
            PendingCall call = new PendingCall(node, local, future);
            if (classifierLlmConfiguration.isParallel()) {
                pending.add(call);
            } else {
                resolve(call, signal, summary);
            }
        }

        for (Node child : node.getChildren()) {
            visit(child, signal, externalAvailable, pending, visited, summary);
        }
    }

    private void resolve(PendingCall call, CancellationSignal signal, ClassificationSummary summary) {
        Optional<ClassificationResult> answer;
        try {
            answer = call.future.join();
        } catch (CancellationException e) {
            signal.throwIfCancelled();
            answer = Optional.empty();
        } catch (CompletionException e) {
            log.warn("External classification of {} failed: {}", call.node.getId(), e.getMessage());
            answer = Optional.empty();
        }
        signal.throwIfCancelled();

        if (answer.isEmpty()) {
            summary.setExternalUnusable(summary.getExternalUnusable() + 1);
            return;
        }
        if (answer.get().getConfidence().exceeds(call.local.getConfidence())) {
            apply(call.node, answer.get());
            summary.setExternalAccepted(summary.getExternalAccepted() + 1);
        }
    }

    private void apply(Node node, ClassificationResult result) {
        node.setClassification(result);
        node.setSemanticRole(result.getRole());
    }

    ClassificationRequest buildRequest(Node node) {
        List<ClassificationRequest.ChildSummary> children = new ArrayList<>();
        int childCount = node.getChildren().size();
        if (childCount > 0 && childCount <= ClassificationRequest.MAX_CHILD_SUMMARIES) {
            for (Node child : node.getChildren()) {
                children.add(ClassificationRequest.ChildSummary.builder()
                        .name(child.getName())
                        .kind(String.valueOf(child.getKind()))
                        .build());
            }
        }

        return ClassificationRequest.builder()
                .nodeId(node.getId())
                .name(node.getName())
                .kind(node.getSourceType() != null ? node.getSourceType() : String.valueOf(node.getKind()))
                .width(node.getWidth())
                .height(node.getHeight())
                .childCount(childCount)
                .children(children)
                .hasTextChild(node.hasTextChild())
                .hasImageFill(node.hasImageFill())
                .hasScrolling(node.hasScrolling())
                .hasInteraction(node.isPrototypeAction())
                .hasBackground(!node.getFills().isEmpty())
                .hasStroke(!node.getStrokes().isEmpty())
                .cornerRadius(node.getCornerRadius())
                .build();
    }

    private static final class PendingCall {
        private final Node node;
        private final ClassificationResult local;
        private final CompletableFuture<Optional<ClassificationResult>> future;

        private PendingCall(Node node, ClassificationResult local,
                            CompletableFuture<Optional<ClassificationResult>> future) {
            this.node = node;
            this.local = local;
            this.future = future;
        }
    }
}
