package com.designsync.engine.service.classification.rules;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Splits a layer name into lowercase tokens.
 *
 * Boundaries are {@code _ - / .}, whitespace, lower-to-upper camel case transitions and
 * letter/digit transitions, so "Submit_Btn", "submit-btn" and "submitBtn" all give [submit, btn]
 * and "icon24" gives [icon, 24]. Concatenations of up to three adjacent tokens are also
 * produced as match candidates ("text-field" gives "textfield").
 */
@Component
public class NameTokenizer {

    private static final Pattern DELIMITERS = Pattern.compile("[_\\-/.\\s]+");
    private static final Pattern WORD_BOUNDARY =
            Pattern.compile("(?<=\\p{Ll})(?=\\p{Lu})|(?<=\\p{L})(?=\\p{Nd})|(?<=\\p{Nd})(?=\\p{L})");
    private static final int MAX_JOINED_TOKENS = 3;

    public List<String> tokenize(String name) {
        List<String> tokens = new ArrayList<>();
        if (name == null) {
            return tokens;
        }
        for (String part : DELIMITERS.split(name)) {
            for (String word : WORD_BOUNDARY.split(part)) {
                if (!word.isEmpty()) {
                    tokens.add(word.toLowerCase(Locale.ROOT));
                }
            }
        }
        return tokens;
    }

    /**
     * Single tokens plus joined runs of adjacent tokens.
     */
    public Set<String> candidates(String name) {
        List<String> tokens = tokenize(name);
        Set<String> candidates = new LinkedHashSet<>(tokens);
        for (int start = 0; start < tokens.size(); start++) {
            StringBuilder joined = new StringBuilder(tokens.get(start));
            for (int end = start + 1; end < tokens.size() && end - start < MAX_JOINED_TOKENS; end++) {
                joined.append(tokens.get(end));
                candidates.add(joined.toString());
            }
        }
        return candidates;
    }

    /**
     * Keyword in the same normalized form as the candidates.
     */
    public static String normalizeKeyword(String keyword) {
        return DELIMITERS.matcher(keyword).replaceAll("").toLowerCase(Locale.ROOT);
    }
}
