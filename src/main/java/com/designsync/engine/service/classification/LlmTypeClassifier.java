package com.designsync.engine.service.classification;

import com.designsync.engine.dto.classification.ClassificationRequest;
import com.designsync.engine.dto.classification.ClassificationResult;
import com.designsync.engine.dto.classification.Confidence;
import com.designsync.engine.dto.classification.SemanticRole;
import com.designsync.engine.exception.ExternalClassifierException;
import com.designsync.engine.model.LlmConfiguration;
import com.designsync.engine.service.llm.LlmService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * External classifier backed by an LLM. Sends the structural summary of a node, never pixel
 * data, and expects exactly one role name back. A parsed answer carries MEDIUM confidence.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LlmTypeClassifier implements ExternalTypeClassifier {

    static final String SYSTEM_PROMPT =
            "You classify UI design elements. Answer with exactly one type name and nothing else.";

    private final LlmService llmService;
    private final LlmConfiguration classifierLlmConfiguration;
    private final SemanticRoleParser roleParser;

    @Override
    public boolean isAvailable() {
        return classifierLlmConfiguration.isUsable();
    }

    @Override
    @Async("classifierExecutor")
    public CompletableFuture<Optional<ClassificationResult>> classifyAsync(ClassificationRequest request) {
        return CompletableFuture.completedFuture(classify(request));
    }

    public Optional<ClassificationResult> classify(ClassificationRequest request) {
        if (!isAvailable()) {
            return Optional.empty();
        }
        try {
            String answer = llmService.generate(classifierLlmConfiguration, SYSTEM_PROMPT, buildPrompt(request));
            Optional<SemanticRole> role = roleParser.parse(answer);
            if (role.isEmpty()) {
                log.warn("Unusable classifier answer for node {}: '{}'", request.getNodeId(), answer);
                return Optional.empty();
            }
            log.debug("External classifier labelled node {} as {}", request.getNodeId(), role.get());
            return Optional.of(ClassificationResult.of(role.get(), Confidence.MEDIUM,
                    ClassificationResult.Source.EXTERNAL, "External classification"));
        } catch (ExternalClassifierException e) {
            log.warn("External classifier failed for node {}: {}", request.getNodeId(), e.getMessage());
            return Optional.empty();
        }
    }

    String buildPrompt(ClassificationRequest request) {
        StringBuilder sb = new StringBuilder();
        sb.append("Analyze this UI element and determine its semantic type.\n\n");
        sb.append("Name: ").append(request.getName()).append('\n');
        sb.append("Kind: ").append(request.getKind()).append('\n');
        sb.append("Size: ").append(request.getWidth()).append('x').append(request.getHeight()).append('\n');
        sb.append("Child count: ").append(request.getChildCount()).append('\n');
        sb.append("Has text child: ").append(request.isHasTextChild()).append('\n');
        sb.append("Has image fill: ").append(request.isHasImageFill()).append('\n');
        sb.append("Has scrolling: ").append(request.isHasScrolling()).append('\n');
        sb.append("Has interaction: ").append(request.isHasInteraction()).append('\n');
        sb.append("Has background: ").append(request.isHasBackground()).append('\n');
        sb.append("Has stroke: ").append(request.isHasStroke()).append('\n');
        sb.append("Corner radius: ").append(request.getCornerRadius()).append('\n');

        if (!request.getChildren().isEmpty()) {
            sb.append("\nChildren:\n");
            for (ClassificationRequest.ChildSummary child : request.getChildren()) {
                sb.append("  - ").append(child.getName()).append(" (").append(child.getKind()).append(")\n");
            }
        }

        sb.append("\nReturn ONLY one of these types (no other text):\n");
        sb.append(Arrays.stream(SemanticRole.values())
                .map(SemanticRole::displayName)
                .collect(Collectors.joining(", ")));
        return sb.toString();
    }
}
