package com.designsync.engine.service.graph;

import com.designsync.engine.model.Document;
import com.designsync.engine.model.Node;
import com.designsync.engine.model.Page;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

/**
 * Produces identifier-safe node names.
 *
 * Rules:
 * - every character other than a word character or hyphen becomes '_'
 * - runs of '_' collapse to one, leading/trailing '_' are trimmed
 * - null, blank or fully stripped names become "Unnamed"
 */
@Service
@Slf4j
public class NodeNameSanitizer {

    public static final String UNNAMED = "Unnamed";

    private static final Pattern UNSAFE_CHARS = Pattern.compile("[^\\w\\-]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern REPEATED_UNDERSCORES = Pattern.compile("_+");

    public String clean(String name) {
        if (name == null || name.isBlank()) {
            return UNNAMED;
        }
        String clean = UNSAFE_CHARS.matcher(name).replaceAll("_");
        clean = REPEATED_UNDERSCORES.matcher(clean).replaceAll("_");
        clean = trimUnderscores(clean);
        return clean.isEmpty() ? UNNAMED : clean;
    }

    /**
     * Fill in the clean name of every node the parser left without one.
     */
    public int fillMissingCleanNames(Document document) {
        int filled = 0;
        for (Page page : document.getPages()) {
            for (Node root : page.getChildren()) {
                filled += fill(root);
            }
        }
        if (filled > 0) {
            log.debug("Derived clean names for {} node(s) of document '{}'", filled, document.getName());
        }
        return filled;
    }

    private int fill(Node node) {
        int filled = 0;
        if (node.getCleanName() == null) {
            node.setCleanName(clean(node.getName()));
            filled++;
        }
        for (Node child : node.getChildren()) {
            filled += fill(child);
        }
        return filled;
    }

    private String trimUnderscores(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '_') start++;
        while (end > start && value.charAt(end - 1) == '_') end--;
        return value.substring(start, end);
    }
}
