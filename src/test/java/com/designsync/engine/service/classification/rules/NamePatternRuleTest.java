package com.designsync.engine.service.classification.rules;

import com.designsync.engine.dto.classification.ClassificationResult;
import com.designsync.engine.dto.classification.Confidence;
import com.designsync.engine.dto.classification.SemanticRole;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static com.designsync.engine.support.TestNodes.frame;
import static org.assertj.core.api.Assertions.assertThat;

class NamePatternRuleTest {

    private final NamePatternRule rule = new NamePatternRule(new NameTokenizer());

    @Test
    void matchesDelimiterBoundedToken() {
        Optional<ClassificationResult> result = rule.evaluate(frame("n", "Submit_Btn"));

        assertThat(result).isPresent();
        assertThat(result.get().getRole()).isEqualTo(SemanticRole.BUTTON);
        assertThat(result.get().getConfidence()).isEqualTo(Confidence.HIGH);
        assertThat(result.get().getSource()).isEqualTo(ClassificationResult.Source.NAME_PATTERN);
    }

    @Test
    void doesNotMatchInsideLongerWord() {
        assertThat(rule.evaluate(frame("n", "Subtle"))).isEmpty();
        assertThat(rule.evaluate(frame("n", "Iconography Notes"))).isEmpty();
        assertThat(rule.evaluate(frame("n", "Buttonless"))).isEmpty();
    }

    @Test
    void trailingNumbersDoNotHideKeyword() {
        assertThat(rule.evaluate(frame("n", "Button2"))).get()
                .extracting(ClassificationResult::getRole).isEqualTo(SemanticRole.BUTTON);
        assertThat(rule.evaluate(frame("n", "icon24"))).get()
                .extracting(ClassificationResult::getRole).isEqualTo(SemanticRole.ICON);
        assertThat(rule.evaluate(frame("n", "Card01"))).get()
                .extracting(ClassificationResult::getRole).isEqualTo(SemanticRole.CARD);
    }

    @Test
    void matchingIsCaseInsensitive() {
        assertThat(rule.evaluate(frame("n", "SEARCH"))).get()
                .extracting(ClassificationResult::getRole).isEqualTo(SemanticRole.INPUT_FIELD);
    }

    @Test
    void earlierFamilyWinsWhenSeveralMatch() {
        // "close" is a button keyword, "icon" an icon keyword; button is tried first
        assertThat(rule.evaluate(frame("n", "Icon Close"))).get()
                .extracting(ClassificationResult::getRole).isEqualTo(SemanticRole.BUTTON);
    }

    @Test
    void joinedTokensMatchCompoundKeyword() {
        assertThat(rule.evaluate(frame("n", "Top Bar"))).get()
                .extracting(ClassificationResult::getRole).isEqualTo(SemanticRole.HEADER);
        assertThat(rule.evaluate(frame("n", "userImage"))).get()
                .extracting(ClassificationResult::getRole).isEqualTo(SemanticRole.IMAGE);
    }

    @Test
    void familiesCarryTheirOwnConfidence() {
        assertThat(rule.evaluate(frame("n", "Product Card"))).get()
                .extracting(ClassificationResult::getConfidence).isEqualTo(Confidence.MEDIUM);
        assertThat(rule.evaluate(frame("n", "Section Title"))).get()
                .extracting(ClassificationResult::getConfidence).isEqualTo(Confidence.LOW);
    }
}
