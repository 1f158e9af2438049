package com.designsync.engine.service.classification.rules;

import com.designsync.engine.dto.classification.ClassificationResult;
import com.designsync.engine.dto.classification.Confidence;
import com.designsync.engine.dto.classification.SemanticRole;
import com.designsync.engine.model.Node;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * A node carrying a prototype interaction is a trigger.
 */
@Component
public class InteractionRule implements ClassificationRule {

    @Override
    public Optional<ClassificationResult> evaluate(Node node) {
        if (!node.isPrototypeAction()) {
            return Optional.empty();
        }
        return Optional.of(ClassificationResult.of(SemanticRole.BUTTON, Confidence.HIGH,
                ClassificationResult.Source.INTERACTION, "Has prototype interaction"));
    }

    @Override
    public Confidence acceptanceThreshold() {
        return Confidence.VERY_LOW;
    }
}
