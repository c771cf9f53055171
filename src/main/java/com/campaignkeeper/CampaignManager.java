package com.campaignkeeper;

import com.campaignkeeper.models.CampaignConfig;
import com.campaignkeeper.validation.ContentValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reads campaign configs ({@code <campaignsRoot>/<id>/campaign.yaml}) and tracks the
 * active campaign. Creating and deleting campaigns is handled elsewhere.
 */
public class CampaignManager {

    public static final String CONFIG_FILE = "campaign.yaml";

    private final Path campaignsRoot;
    private final ObjectMapper yamlMapper;
    private final FileLock fileLock;
    private final AppLogger logger = AppLogger.get();
    private volatile CampaignConfig active;

    public CampaignManager(Path campaignsRoot, ObjectMapper yamlMapper, FileLock fileLock) {
        this.campaignsRoot = campaignsRoot.toAbsolutePath().normalize();
        this.yamlMapper = yamlMapper;
        this.fileLock = fileLock;
    }

    /**
     * Campaigns with a readable config, most recently accessed first.
     */
    public List<CampaignConfig> list() throws IOException {
        List<CampaignConfig> campaigns = new ArrayList<>();
        if (!Files.isDirectory(campaignsRoot)) {
            return campaigns;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(campaignsRoot)) {
            for (Path dir : stream) {
                if (!Files.isDirectory(dir)) continue;
                try {
                    CampaignConfig config = readConfig(dir);
                    if (config != null) {
                        campaigns.add(config);
                    }
                } catch (IOException e) {
                    logger.warn("[CampaignManager] Failed to read campaign config in " + dir.getFileName()
                        + " (" + e.getMessage() + ")");
                }
            }
        }
        campaigns.sort(Comparator
            .comparing((CampaignConfig c) -> c.getLastAccessed() != null ? c.getLastAccessed() : "", Comparator.reverseOrder())
            .thenComparing(c -> c.getName() != null ? c.getName() : "", String.CASE_INSENSITIVE_ORDER));
        return campaigns;
    }

    public CampaignConfig load(String campaignId) throws IOException {
        ContentStore.requireSafeSegment(campaignId, "Campaign id");
        return readConfig(campaignsRoot.resolve(campaignId));
    }

    public CampaignConfig getActive() {
        return active;
    }

    /**
     * @throws ContentValidationException if no campaign has been activated
     */
    public CampaignConfig requireActive() {
        CampaignConfig current = active;
        if (current == null) {
            throw new ContentValidationException("No active campaign");
        }
        return current;
    }

    /**
     * Makes {@code campaignId} active and records the access time.
     *
     * @return the campaign, or {@code null} if it has no config
     */
    public CampaignConfig setActive(String campaignId) throws IOException {
        CampaignConfig campaign = load(campaignId);
        if (campaign == null) {
            return null;
        }
        if (campaign.getId() == null || campaign.getId().isBlank()) {
            campaign.setId(campaignId);
        }
        campaign.setLastAccessed(Instant.now().toString());
        writeConfig(campaignsRoot.resolve(campaignId), campaign);
        active = campaign;
        logger.info("[CampaignManager] Active campaign: " + campaign.getId());
        return campaign;
    }

    private CampaignConfig readConfig(Path campaignDir) throws IOException {
        Path configPath = campaignDir.resolve(CONFIG_FILE);
        if (!Files.isRegularFile(configPath)) {
            return null;
        }
        CampaignConfig config = yamlMapper.readValue(Files.readString(configPath, StandardCharsets.UTF_8), CampaignConfig.class);
        if (config != null && (config.getId() == null || config.getId().isBlank())) {
            config.setId(campaignDir.getFileName().toString());
        }
        return config;
    }

    private void writeConfig(Path campaignDir, CampaignConfig config) throws IOException {
        Path target = campaignDir.resolve(CONFIG_FILE);
        Path tmpFile = target.resolveSibling(CONFIG_FILE + ".tmp");
        String yaml = yamlMapper.writeValueAsString(config);
        try {
            fileLock.withLock(target.toString(), () -> {
                Files.writeString(tmpFile, yaml, StandardCharsets.UTF_8);
                Files.move(tmpFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                return null;
            });
        } catch (IOException | RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted waiting for lock on " + target.getFileName());
        } catch (Exception e) {
            throw new IOException(e);
        }
    }
}
