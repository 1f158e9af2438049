package com.designsync.engine.service.hierarchy;

import com.designsync.engine.model.Document;
import com.designsync.engine.model.HierarchySettings;
import com.designsync.engine.model.HierarchyTier;
import com.designsync.engine.model.Node;
import com.designsync.engine.model.Page;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Annotates every node of the selected pages with its hierarchy tier.
 *
 * Precedence: a tier declared on the node, then the tier configured for its page (by page
 * name, else the page's own default), then inference from the subtree's depth and the number
 * of component instances it contains. SCREEN counts as "not declared" at node and page level.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TierAssigner {

    private final HierarchySettings hierarchySettings;

    public void assign(Document document) {
        for (Page page : document.getSelectedPages()) {
            HierarchyTier pageTier = pageTier(page);
            log.debug("Page '{}' tier: {}", page.getName(), pageTier != null ? pageTier : "inferred");
            for (Node root : page.getChildren()) {
                assign(root, pageTier);
            }
        }
    }

    private void assign(Node node, HierarchyTier pageTier) {
        node.setHierarchyTier(determine(node, pageTier));
        for (Node child : node.getChildren()) {
            assign(child, pageTier);
        }
    }

    /**
     * Configured tier of a page, or null when its nodes should be inferred.
     */
    public HierarchyTier pageTier(Page page) {
        HierarchyTier configured = hierarchySettings.tierForPageName(page.getName());
        if (configured != null) {
            return configured;
        }
        HierarchyTier pageDefault = page.getDefaultTier();
        return pageDefault != null && pageDefault != HierarchyTier.SCREEN ? pageDefault : null;
    }

    public HierarchyTier determine(Node node, HierarchyTier pageTier) {
        if (node.getDeclaredTier() != null && node.getDeclaredTier() != HierarchyTier.SCREEN) {
            return node.getDeclaredTier();
        }
        if (pageTier != null) {
            return pageTier;
        }
        return infer(node);
    }

    public static HierarchyTier infer(Node node) {
        int depth = maxDepth(node);
        int instances = countInstances(node);

        if (depth <= 2 && instances == 0) {
            return HierarchyTier.ATOM;
        } else if (depth <= 4 && instances <= 3) {
            return HierarchyTier.MOLECULE;
        } else if (depth <= 6) {
            return HierarchyTier.ORGANISM;
        }
        return HierarchyTier.SCREEN;
    }

    /**
     * Levels below the node; a leaf has depth 0.
     */
    static int maxDepth(Node node) {
        int max = 0;
        for (Node child : node.getChildren()) {
            max = Math.max(max, 1 + maxDepth(child));
        }
        return max;
    }

    static int countInstances(Node node) {
        int count = 0;
        for (Node child : node.getChildren()) {
            if (child.isComponentInstance()) {
                count++;
            }
            count += countInstances(child);
        }
        return count;
    }
}
