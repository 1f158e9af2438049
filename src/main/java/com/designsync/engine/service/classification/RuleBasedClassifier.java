package com.designsync.engine.service.classification;

import com.designsync.engine.dto.classification.ClassificationResult;
import com.designsync.engine.model.Node;
import com.designsync.engine.service.classification.rules.ClassificationRule;
import com.designsync.engine.service.classification.rules.InteractionRule;
import com.designsync.engine.service.classification.rules.NamePatternRule;
import com.designsync.engine.service.classification.rules.StructuralHeuristicRule;
import com.designsync.engine.service.classification.rules.StructuralKindRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Local classifier: structural kind, then interaction, then name, then structural heuristics.
 *
 * Evaluation stops at the first rule whose candidate reaches that rule's threshold. When none
 * does, the most confident candidate seen is returned (earlier rules win ties), and when no
 * rule produced anything the node is a plain container with LOW confidence.
 */
@Service
@Slf4j
public class RuleBasedClassifier {

    private final List<ClassificationRule> rules;

    public RuleBasedClassifier(StructuralKindRule structuralKindRule,
                               InteractionRule interactionRule,
                               NamePatternRule namePatternRule,
                               StructuralHeuristicRule structuralHeuristicRule) {
        this.rules = List.of(structuralKindRule, interactionRule, namePatternRule, structuralHeuristicRule);
    }

    public ClassificationResult classify(Node node) {
        ClassificationResult best = null;

        for (ClassificationRule rule : rules) {
            Optional<ClassificationResult> candidate = rule.evaluate(node);
            if (candidate.isEmpty()) {
                continue;
            }
            ClassificationResult result = candidate.get();
            if (result.getConfidence().isAtLeast(rule.acceptanceThreshold())) {
                return result;
            }
            if (best == null || result.getConfidence().exceeds(best.getConfidence())) {
                best = result;
            }
        }

        // a rejected candidate still beats the default: "Section Title" stays LABEL/LOW, not CONTAINER
        if (best != null) {
            log.trace("No rule accepted for {}, keeping best candidate {}", node.getId(), best.getRole());
            return best;
        }
        return ClassificationResult.unclassified();
    }
}
