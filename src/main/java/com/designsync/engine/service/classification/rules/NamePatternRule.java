package com.designsync.engine.service.classification.rules;

import com.designsync.engine.dto.classification.ClassificationResult;
import com.designsync.engine.dto.classification.Confidence;
import com.designsync.engine.dto.classification.SemanticRole;
import com.designsync.engine.model.Node;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Matches whole name tokens against keyword families. Families are tried in declaration order
 * and the first family with a matching keyword wins.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NamePatternRule implements ClassificationRule {

    static final List<KeywordFamily> FAMILIES = List.of(
            family("button", SemanticRole.BUTTON, Confidence.HIGH,
                    "btn", "button", "cta", "action", "submit", "cancel", "confirm", "close"),
            family("input", SemanticRole.INPUT_FIELD, Confidence.HIGH,
                    "input", "field", "textfield", "text-field", "textarea", "search"),
            family("toggle", SemanticRole.TOGGLE, Confidence.HIGH,
                    "toggle", "switch", "checkbox", "check", "radio"),
            family("slider", SemanticRole.SLIDER, Confidence.HIGH,
                    "slider", "range", "scrubber"),
            family("dropdown", SemanticRole.DROPDOWN, Confidence.HIGH,
                    "dropdown", "select", "picker", "menu", "combobox"),
            family("image", SemanticRole.IMAGE, Confidence.HIGH,
                    "image", "img", "photo", "picture", "thumbnail", "cover"),
            family("icon", SemanticRole.ICON, Confidence.HIGH,
                    "icon", "icn", "glyph", "symbol"),
            family("scroll", SemanticRole.SCROLL_VIEW, Confidence.HIGH,
                    "scroll", "scrollview", "scrollable", "scroller"),
            family("list", SemanticRole.LIST, Confidence.MEDIUM,
                    "list", "grid", "collection", "items"),
            family("card", SemanticRole.CARD, Confidence.MEDIUM,
                    "card", "tile", "panel", "cell"),
            family("navigation", SemanticRole.NAVIGATION, Confidence.HIGH,
                    "nav", "navbar", "navigation", "menubar", "sidebar", "bottombar", "tabbar"),
            family("header", SemanticRole.HEADER, Confidence.HIGH,
                    "header", "topbar", "appbar", "titlebar"),
            family("footer", SemanticRole.FOOTER, Confidence.HIGH,
                    "footer"),
            family("modal", SemanticRole.MODAL, Confidence.HIGH,
                    "modal", "dialog", "popup", "overlay", "sheet"),
            family("tooltip", SemanticRole.TOOLTIP, Confidence.HIGH,
                    "tooltip", "hint", "popover"),
            family("progress", SemanticRole.PROGRESS_BAR, Confidence.HIGH,
                    "progress", "loading", "spinner", "loader"),
            family("tab", SemanticRole.TAB_CONTROL, Confidence.MEDIUM,
                    "tab", "tabs", "tabcontrol", "tabview"),
            family("badge", SemanticRole.BADGE, Confidence.MEDIUM,
                    "badge", "tag", "chip", "pill", "notification"),
            family("avatar", SemanticRole.AVATAR, Confidence.HIGH,
                    "avatar", "profile", "user-image"),
            family("divider", SemanticRole.DIVIDER, Confidence.MEDIUM,
                    "divider", "separator", "line", "hr"),
            family("spacer", SemanticRole.SPACER, Confidence.MEDIUM,
                    "spacer", "gap", "padding"),
            family("label", SemanticRole.LABEL, Confidence.LOW,
                    "label", "title", "text", "caption", "subtitle", "heading", "description")
    );

    private final NameTokenizer tokenizer;

    @Override
    public Optional<ClassificationResult> evaluate(Node node) {
        String name = node.getName() != null ? node.getName() : node.getCleanName();
        Set<String> candidates = tokenizer.candidates(name);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }

        for (KeywordFamily family : FAMILIES) {
            for (String keyword : family.getKeywords()) {
                if (candidates.contains(keyword)) {
                    log.trace("Name '{}' matched keyword '{}' of family {}", name, keyword, family.getName());
                    return Optional.of(ClassificationResult.of(family.getRole(), family.getConfidence(),
                            ClassificationResult.Source.NAME_PATTERN,
                            "Name contains " + family.getName() + " keyword '" + keyword + "'"));
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public Confidence acceptanceThreshold() {
        return Confidence.MEDIUM;
    }

    private static KeywordFamily family(String name, SemanticRole role, Confidence confidence, String... keywords) {
        return new KeywordFamily(name, role, confidence,
                Arrays.stream(keywords).map(NameTokenizer::normalizeKeyword).distinct().toList());
    }

    @Getter
    @RequiredArgsConstructor
    static final class KeywordFamily {
        private final String name;
        private final SemanticRole role;
        private final Confidence confidence;
        private final List<String> keywords;
    }
}
