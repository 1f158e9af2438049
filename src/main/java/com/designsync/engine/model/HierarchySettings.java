package com.designsync.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Settings of the atomic hierarchy resolver.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HierarchySettings {

    @Builder.Default
    private String atomsPageName = "Atoms";
    @Builder.Default
    private String moleculesPageName = "Molecules";
    @Builder.Default
    private String organismsPageName = "Organisms";
    @Builder.Default
    private String artifactRoot = "ui/artifacts";
    @Builder.Default
    private String artifactExtension = ".artifact";

    /**
     * Match emitted children back to their logical node by source id instead of by name.
     */
    private boolean matchByProvenance;

    /**
     * Explicit tier of a page by its name, or null when the page name is not configured.
     */
    public HierarchyTier tierForPageName(String pageName) {
        if (pageName == null) {
            return null;
        }
        if (pageName.equalsIgnoreCase(atomsPageName)) {
            return HierarchyTier.ATOM;
        }
        if (pageName.equalsIgnoreCase(moleculesPageName)) {
            return HierarchyTier.MOLECULE;
        }
        if (pageName.equalsIgnoreCase(organismsPageName)) {
            return HierarchyTier.ORGANISM;
        }
        return null;
    }
}
