package com.designsync.engine.service.classification.rules;

import com.designsync.engine.dto.classification.ClassificationResult;
import com.designsync.engine.dto.classification.Confidence;
import com.designsync.engine.dto.classification.SemanticRole;
import com.designsync.engine.model.Node;
import com.designsync.engine.model.NodeKind;
import org.springframework.stereotype.Component;

import java.util.Optional;

import static com.designsync.engine.dto.classification.ClassificationResult.Source.STRUCTURAL_HEURISTIC;

/**
 * Last local tier: guesses from fills, scrolling, child shape and aspect ratio.
 */
@Component
public class StructuralHeuristicRule implements ClassificationRule {

    private static final double BUTTON_MAX_WIDTH = 400;
    private static final double BUTTON_MAX_HEIGHT = 100;
    private static final double DIVIDER_RATIO = 20;

    @Override
    public Optional<ClassificationResult> evaluate(Node node) {
        int childCount = node.getChildren().size();

        if (node.hasImageFill() && childCount == 0) {
            return result(SemanticRole.IMAGE, Confidence.HIGH, "Has image fill and no children");
        }
        if (node.hasScrolling()) {
            return result(SemanticRole.SCROLL_VIEW, Confidence.HIGH, "Has scrolling enabled");
        }
        if (childCount > 0 && childCount <= 3 && node.hasTextChild()
                && node.hasSolidBackground() && node.getCornerRadius() > 0
                && node.getWidth() < BUTTON_MAX_WIDTH && node.getHeight() < BUTTON_MAX_HEIGHT) {
            return result(SemanticRole.BUTTON, Confidence.LOW, "Small rounded frame with text and background");
        }
        if (childCount >= 1 && childCount <= 2 && node.hasTextChild() && !node.getStrokes().isEmpty()) {
            return result(SemanticRole.INPUT_FIELD, Confidence.LOW, "Frame with text and stroke");
        }
        if ((node.getKind() == NodeKind.RECTANGLE || node.getKind() == NodeKind.FRAME)
                && node.getWidth() > 0 && node.getHeight() > 0) {
            double ratio = node.getWidth() / node.getHeight();
            if (ratio > DIVIDER_RATIO || ratio < 1 / DIVIDER_RATIO) {
                return result(SemanticRole.DIVIDER, Confidence.LOW, "Very thin element");
            }
        }
        return Optional.empty();
    }

    @Override
    public Confidence acceptanceThreshold() {
        return Confidence.VERY_LOW;
    }

    private Optional<ClassificationResult> result(SemanticRole role, Confidence confidence, String reason) {
        return Optional.of(ClassificationResult.of(role, confidence, STRUCTURAL_HEURISTIC, reason));
    }
}
