package com.designsync.engine.config;

import com.designsync.engine.model.HierarchySettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Hierarchy settings read from application.yml.
 */
@Configuration
@Slf4j
public class DesignSyncConfig {

    @Value("${designsync.hierarchy.atoms-page-name:Atoms}")
    private String atomsPageName;

    @Value("${designsync.hierarchy.molecules-page-name:Molecules}")
    private String moleculesPageName;

    @Value("${designsync.hierarchy.organisms-page-name:Organisms}")
    private String organismsPageName;

    @Value("${designsync.hierarchy.artifact-root:ui/artifacts}")
    private String artifactRoot;

    @Value("${designsync.hierarchy.artifact-extension:.artifact}")
    private String artifactExtension;

    @Value("${designsync.hierarchy.match-by-provenance:false}")
    private boolean matchByProvenance;

    @Bean
    public HierarchySettings hierarchySettings() {
        log.info("[DesignSync Config] Artifacts under '{}', tier pages: {}/{}/{}, provenance matching: {}",
                artifactRoot, atomsPageName, moleculesPageName, organismsPageName, matchByProvenance);

        return HierarchySettings.builder()
                .atomsPageName(atomsPageName)
                .moleculesPageName(moleculesPageName)
                .organismsPageName(organismsPageName)
                .artifactRoot(artifactRoot)
                .artifactExtension(artifactExtension)
                .matchByProvenance(matchByProvenance)
                .build();
    }
}
