package com.designsync.engine.service.classification.rules;

import com.designsync.engine.dto.classification.ClassificationResult;
import com.designsync.engine.dto.classification.Confidence;
import com.designsync.engine.model.Node;

import java.util.Optional;

/**
 * One tier of the local classifier. Tiers are evaluated in a fixed order; the first whose
 * candidate reaches its acceptance threshold decides the role.
 */
public interface ClassificationRule {

    Optional<ClassificationResult> evaluate(Node node);

    /**
     * Minimum confidence at which this rule's candidate ends the evaluation.
     */
    Confidence acceptanceThreshold();
}
