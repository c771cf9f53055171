package com.campaignkeeper;

import com.campaignkeeper.models.CampaignConfig;
import com.campaignkeeper.storage.FrontmatterCodec;
import com.campaignkeeper.validation.ContentValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CampaignManagerTest {

    @TempDir
    Path campaignsRoot;

    private CampaignManager manager;

    @BeforeEach
    void setUp() {
        manager = new CampaignManager(campaignsRoot, new FrontmatterCodec().yamlMapper(), new FileLock());
    }

    @Test
    void listsReadableCampaignsMostRecentFirst() throws Exception {
        writeConfig("old", "id: old\nname: Old Game\nlastAccessed: '2023-01-01T00:00:00Z'\n");
        writeConfig("new", "id: new\nname: New Game\nlastAccessed: '2024-06-01T00:00:00Z'\nmodules:\n  - npcs\n");
        writeConfig("broken", "id: [\n");
        Files.createDirectories(campaignsRoot.resolve("no-config"));

        List<String> ids = manager.list().stream().map(CampaignConfig::getId).collect(Collectors.toList());

        assertEquals(List.of("new", "old"), ids);
    }

    @Test
    void idDefaultsToDirectoryName() throws Exception {
        writeConfig("rimward", "name: Rimward\n");

        assertEquals("rimward", manager.load("rimward").getId());
        assertNull(manager.load("missing"));
    }

    @Test
    void setActiveRecordsAccessTimeOnDisk() throws Exception {
        writeConfig("rimward", "id: rimward\nname: Rimward\nunknownKey: kept out\n");

        CampaignConfig active = manager.setActive("rimward");

        assertSame(active, manager.getActive());
        assertSame(active, manager.requireActive());
        assertNotNull(active.getLastAccessed());
        assertEquals(active.getLastAccessed(), manager.load("rimward").getLastAccessed());
        assertFalse(Files.exists(campaignsRoot.resolve("rimward").resolve(CampaignManager.CONFIG_FILE + ".tmp")));
    }

    @Test
    void requireActiveFailsWithoutCampaign() throws Exception {
        ContentValidationException e = assertThrows(ContentValidationException.class, manager::requireActive);
        assertEquals("No active campaign", e.getMessage());
        assertNull(manager.setActive("missing"));
        assertNull(manager.getActive());
    }

    @Test
    void rejectsUnsafeCampaignIds() {
        assertThrows(ContentValidationException.class, () -> manager.load("../elsewhere"));
    }

    private void writeConfig(String id, String yaml) throws Exception {
        Path dir = campaignsRoot.resolve(id);
        Files.createDirectories(dir);
        Files.writeString(dir.resolve(CampaignManager.CONFIG_FILE), yaml, StandardCharsets.UTF_8);
    }
}
