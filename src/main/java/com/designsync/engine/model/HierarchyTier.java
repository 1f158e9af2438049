package com.designsync.engine.model;

import java.util.List;

/**
 * Atomic design tier. Lower tiers are built first because higher tiers reference them.
 */
public enum HierarchyTier {
    SKIP(0, "Skip"),
    ATOM(1, "Atoms"),
    MOLECULE(2, "Molecules"),
    ORGANISM(3, "Organisms"),
    SCREEN(4, "Screens");

    private final int rank;
    private final String folderName;

    HierarchyTier(int rank, String folderName) {
        this.rank = rank;
        this.folderName = folderName;
    }

    public int getRank() {
        return rank;
    }

    public String getFolderName() {
        return folderName;
    }

    /**
     * Tiers in the order they must be built. SKIP is never built.
     */
    public static List<HierarchyTier> buildOrder() {
        return List.of(ATOM, MOLECULE, ORGANISM, SCREEN);
    }
}
