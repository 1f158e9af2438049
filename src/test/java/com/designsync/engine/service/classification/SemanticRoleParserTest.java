package com.designsync.engine.service.classification;

import com.designsync.engine.dto.classification.SemanticRole;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SemanticRoleParserTest {

    private final SemanticRoleParser parser = new SemanticRoleParser();

    @Test
    void parsesRoleNamesInAnyCommonSpelling() {
        assertThat(parser.parse("InputField")).contains(SemanticRole.INPUT_FIELD);
        assertThat(parser.parse("  input_field \n")).contains(SemanticRole.INPUT_FIELD);
        assertThat(parser.parse("Progress Bar.")).contains(SemanticRole.PROGRESS_BAR);
        assertThat(parser.parse("\"Button\"")).contains(SemanticRole.BUTTON);
    }

    @Test
    void acceptsShortAliases() {
        assertThat(parser.parse("input")).contains(SemanticRole.INPUT_FIELD);
        assertThat(parser.parse("scroll")).contains(SemanticRole.SCROLL_VIEW);
        assertThat(parser.parse("nav")).contains(SemanticRole.NAVIGATION);
        assertThat(parser.parse("progress")).contains(SemanticRole.PROGRESS_BAR);
        assertThat(parser.parse("TabControl")).contains(SemanticRole.TAB_CONTROL);
        assertThat(parser.parse("Tab")).contains(SemanticRole.TAB);
    }

    @Test
    void rejectsAnythingElse() {
        assertThat(parser.parse(null)).isEmpty();
        assertThat(parser.parse("")).isEmpty();
        assertThat(parser.parse("I think this is a Button")).isEmpty();
        assertThat(parser.parse("Widget")).isEmpty();
    }
}
