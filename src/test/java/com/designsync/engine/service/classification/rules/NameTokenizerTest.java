package com.designsync.engine.service.classification.rules;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NameTokenizerTest {

    private final NameTokenizer tokenizer = new NameTokenizer();

    @Test
    void splitsOnDelimitersAndCamelCase() {
        assertThat(tokenizer.tokenize("Submit_Btn")).containsExactly("submit", "btn");
        assertThat(tokenizer.tokenize("nav/top-bar.primary item")).containsExactly("nav", "top", "bar", "primary", "item");
        assertThat(tokenizer.tokenize("primaryButtonLarge")).containsExactly("primary", "button", "large");
    }

    @Test
    void splitsBetweenLettersAndDigits() {
        assertThat(tokenizer.tokenize("Button2")).containsExactly("button", "2");
        assertThat(tokenizer.tokenize("icon24")).containsExactly("icon", "24");
        assertThat(tokenizer.tokenize("Card01 v2")).containsExactly("card", "01", "v", "2");
    }

    @Test
    void candidatesIncludeJoinedNeighbours() {
        assertThat(tokenizer.candidates("text-field")).contains("text", "field", "textfield");
        assertThat(tokenizer.candidates("Subtle")).containsExactly("subtle");
    }

    @Test
    void emptyForMissingName() {
        assertThat(tokenizer.tokenize(null)).isEmpty();
        assertThat(tokenizer.candidates("")).isEmpty();
    }
}
