package com.campaignkeeper;

import com.campaignkeeper.modules.ModuleDefinition;
import com.campaignkeeper.modules.ModuleRegistry;
import com.campaignkeeper.storage.ContentChangeListener;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Deletes files generated from a module's entities (rendered maps and the like)
 * whenever one of those entities changes, so they are rebuilt on next request.
 */
public class DerivedArtifactCleaner implements ContentChangeListener {

    private final Path campaignsRoot;
    private final ModuleRegistry modules;
    private final AppLogger logger = AppLogger.get();

    public DerivedArtifactCleaner(Path campaignsRoot, ModuleRegistry modules) {
        this.campaignsRoot = campaignsRoot.toAbsolutePath().normalize();
        this.modules = modules;
    }

    @Override
    public void onContentChanged(String campaignId, String moduleId, String entityId, ChangeType type) {
        ModuleDefinition module = modules.get(moduleId);
        if (module == null) {
            return;
        }
        Path campaignDir = campaignsRoot.resolve(campaignId).normalize();
        for (String artifact : module.getDerivedArtifacts()) {
            Path path = campaignDir.resolve(artifact).normalize();
            if (!path.startsWith(campaignDir)) {
                logger.warn("[DerivedArtifactCleaner] Ignoring artifact outside campaign: " + artifact);
                continue;
            }
            try {
                if (Files.deleteIfExists(path)) {
                    logger.info("[DerivedArtifactCleaner] Invalidated " + artifact + " after " + type
                        + " of " + moduleId + "/" + entityId);
                }
            } catch (IOException e) {
                logger.warn("[DerivedArtifactCleaner] Failed to delete " + artifact + ": " + e.getMessage());
            }
        }
    }
}
