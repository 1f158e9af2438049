package com.designsync.engine.dto.classification;

import java.util.EnumSet;
import java.util.Set;

/**
 * Semantic UI role assigned to a node by the type classifier.
 */
public enum SemanticRole {
    CONTAINER,
    BUTTON,
    LABEL,
    INPUT_FIELD,
    TOGGLE,
    SLIDER,
    DROPDOWN,
    IMAGE,
    ICON,
    SCROLL_VIEW,
    LIST,
    CARD,
    NAVIGATION,
    HEADER,
    FOOTER,
    MODAL,
    TOOLTIP,
    PROGRESS_BAR,
    TAB_CONTROL,
    TAB,
    BADGE,
    AVATAR,
    DIVIDER,
    SPACER;

    private static final Set<SemanticRole> INTERACTIVE =
            EnumSet.of(BUTTON, INPUT_FIELD, TOGGLE, SLIDER, DROPDOWN, TAB);

    private static final Set<SemanticRole> CONTAINERS =
            EnumSet.of(CONTAINER, CARD, NAVIGATION, HEADER, FOOTER, MODAL, SCROLL_VIEW, LIST, TAB_CONTROL);

    public boolean isInteractive() {
        return INTERACTIVE.contains(this);
    }

    /**
     * Roles whose widget needs a click trigger.
     */
    public boolean needsTrigger() {
        return this == BUTTON || this == TAB;
    }

    public boolean isText() {
        return this == LABEL;
    }

    public boolean isImage() {
        return this == IMAGE || this == ICON || this == AVATAR;
    }

    public boolean isContainer() {
        return CONTAINERS.contains(this);
    }

    /**
     * Label shown to the external classifier, e.g. {@code InputField} for {@link #INPUT_FIELD}.
     */
    public String displayName() {
        StringBuilder sb = new StringBuilder();
        for (String part : name().split("_")) {
            sb.append(part.charAt(0)).append(part.substring(1).toLowerCase());
        }
        return sb.toString();
    }
}
