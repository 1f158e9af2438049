package com.designsync.engine.service.classification;

import com.designsync.engine.dto.classification.SemanticRole;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Parses a free-text role answer. The whole answer, normalized, must name a role; anything else
 * is unusable.
 */
@Component
public class SemanticRoleParser {

    private static final Map<String, SemanticRole> LABELS = new HashMap<>();

    static {
        for (SemanticRole role : SemanticRole.values()) {
            LABELS.put(normalize(role.name()), role);
        }
        LABELS.put("input", SemanticRole.INPUT_FIELD);
        LABELS.put("scroll", SemanticRole.SCROLL_VIEW);
        LABELS.put("nav", SemanticRole.NAVIGATION);
        LABELS.put("progress", SemanticRole.PROGRESS_BAR);
        LABELS.put("tabcontrol", SemanticRole.TAB_CONTROL);
    }

    public Optional<SemanticRole> parse(String answer) {
        if (answer == null || answer.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(LABELS.get(normalize(answer)));
    }

    /**
     * Lowercase, drop separators, whitespace and trailing punctuation: "Input Field." gives "inputfield".
     */
    static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s_\\-.\"'`*]", "");
    }
}
