package com.designsync.engine.service.classification.rules;

import com.designsync.engine.dto.classification.ClassificationResult;
import com.designsync.engine.dto.classification.Confidence;
import com.designsync.engine.dto.classification.SemanticRole;
import com.designsync.engine.model.Node;
import org.springframework.stereotype.Component;

import java.util.Optional;

import static com.designsync.engine.dto.classification.ClassificationResult.Source.STRUCTURAL_KIND;

/**
 * Roles implied by the structural kind alone. Only a HIGH or better answer is final; a vector
 * is an icon candidate that a name can still override.
 */
@Component
public class StructuralKindRule implements ClassificationRule {

    private static final double THIN_RATIO = 10;

    @Override
    public Optional<ClassificationResult> evaluate(Node node) {
        if (node.getKind() == null) {
            return Optional.empty();
        }
        switch (node.getKind()) {
            case TEXT:
                return Optional.of(ClassificationResult.of(SemanticRole.LABEL, Confidence.VERY_HIGH,
                        STRUCTURAL_KIND, "Text node"));
            case VECTOR:
                return Optional.of(ClassificationResult.of(SemanticRole.ICON, Confidence.MEDIUM,
                        STRUCTURAL_KIND, "Vector primitive"));
            case RECTANGLE:
                if (node.hasImageFill()) {
                    return Optional.of(ClassificationResult.of(SemanticRole.IMAGE, Confidence.HIGH,
                            STRUCTURAL_KIND, "Rectangle with image fill"));
                }
                if (node.getWidth() > node.getHeight() * THIN_RATIO || node.getHeight() > node.getWidth() * THIN_RATIO) {
                    return Optional.of(ClassificationResult.of(SemanticRole.DIVIDER, Confidence.MEDIUM,
                            STRUCTURAL_KIND, "Very thin rectangle"));
                }
                return Optional.empty();
            default:
                return Optional.empty();
        }
    }

    @Override
    public Confidence acceptanceThreshold() {
        return Confidence.HIGH;
    }
}
