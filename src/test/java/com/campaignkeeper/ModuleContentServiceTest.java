package com.campaignkeeper;

import com.campaignkeeper.models.Entity;
import com.campaignkeeper.models.EntityInput;
import com.campaignkeeper.models.EntityUpdate;
import com.campaignkeeper.modules.CampaignModules;
import com.campaignkeeper.modules.ModuleRegistry;
import com.campaignkeeper.storage.FrontmatterCodec;
import com.campaignkeeper.validation.ContentValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModuleContentServiceTest {

    private static final String CAMPAIGN = "rimward";

    @TempDir
    Path campaignsRoot;

    private CampaignManager campaigns;
    private ContentStore store;
    private ModuleContentService service;

    @BeforeEach
    void setUp() throws Exception {
        Path campaignDir = Files.createDirectories(campaignsRoot.resolve(CAMPAIGN));
        Files.writeString(campaignDir.resolve(CampaignManager.CONFIG_FILE), "id: rimward\nname: Rimward\n",
            StandardCharsets.UTF_8);

        FileLock fileLock = new FileLock();
        FrontmatterCodec codec = new FrontmatterCodec();
        ModuleRegistry modules = new ModuleRegistry();
        store = new ContentStore(campaignsRoot, modules, fileLock, codec);
        store.addListener(new DerivedArtifactCleaner(campaignsRoot, modules));
        CampaignModules.registerAll(modules, new RelationshipIndex(store, modules));

        campaigns = new CampaignManager(campaignsRoot, codec.yamlMapper(), fileLock);
        service = new ModuleContentService(campaigns, store, modules);
    }

    @Test
    void requiresAnActiveCampaign() {
        ContentValidationException e = assertThrows(ContentValidationException.class, () -> service.list("npcs"));
        assertEquals("No active campaign", e.getMessage());
    }

    @Test
    void crudAgainstActiveCampaign() throws Exception {
        campaigns.setActive(CAMPAIGN);

        Entity created = service.create("npcs", new EntityInput("Mira", "Engineer.", Map.of("occupation", "Engineer")));
        Entity updated = service.update("npcs", created.getId(), new EntityUpdate(null, null, Map.of("goals", "Fix the drive")));

        assertEquals(1, service.list("npcs").size());
        assertEquals("Fix the drive", updated.getFrontmatter().get("goals"));
        assertEquals("Engineer", service.get("npcs", created.getId()).getFrontmatter().get("occupation"));
        assertTrue(service.delete("npcs", created.getId()));
        assertNull(service.get("npcs", created.getId()));
        assertNull(service.update("npcs", created.getId(), new EntityUpdate("x", null, null)));
    }

    @Test
    void schemaViolationsBlockTheWrite() throws Exception {
        campaigns.setActive(CAMPAIGN);

        ContentValidationException e = assertThrows(ContentValidationException.class,
            () -> service.create("lore", new EntityInput("The Fall", null, Map.of("type", "gossip"))));

        assertTrue(e.getDetails().get(0).startsWith("type: must be one of"));
        assertTrue(service.list("lore").isEmpty());
    }

    @Test
    void updateValidatesMergedFrontmatter() throws Exception {
        campaigns.setActive(CAMPAIGN);
        Entity created = service.create("npcs", new EntityInput("Mira", null, null));

        assertThrows(ContentValidationException.class,
            () -> service.update("npcs", created.getId(), new EntityUpdate(null, null, Map.of("tags", "not-a-list"))));
        assertFalse(store.get(CAMPAIGN, "npcs", created.getId()).getFrontmatter().containsKey("tags"));
    }

    @Test
    void parentMustExist() throws Exception {
        campaigns.setActive(CAMPAIGN);

        ContentValidationException e = assertThrows(ContentValidationException.class,
            () -> service.create("locations", new EntityInput("Dock", null, Map.of("parent", "nowhere"))));

        assertEquals("Parent location not found", e.getMessage());
    }

    @Test
    void parentCycleIsRejectedAndNothingChanges() throws Exception {
        campaigns.setActive(CAMPAIGN);
        createLocation("system", null);
        createLocation("planet", "system");
        createLocation("city", "planet");

        ContentValidationException e = assertThrows(ContentValidationException.class,
            () -> service.update("locations", "system", new EntityUpdate(null, null, Map.of("parent", "city"))));

        assertEquals(CycleDetector.CIRCULAR_REFERENCE, e.getMessage());
        assertNull(store.get(CAMPAIGN, "locations", "system").getFrontmatter().get("parent"));

        Entity moved = service.update("locations", "city", new EntityUpdate(null, null, Map.of("parent", "system")));
        assertEquals("system", moved.getFrontmatter().get("parent"));
    }

    @Test
    void clearingParentNeedsNoCheck() throws Exception {
        campaigns.setActive(CAMPAIGN);
        createLocation("system", null);
        createLocation("planet", "system");

        Map<String, Object> clear = new HashMap<>();
        clear.put("parent", null);
        Entity updated = service.update("locations", "planet", new EntityUpdate(null, null, clear));

        assertFalse(updated.getFrontmatter().containsKey("parent"));
    }

    @Test
    void locationWritesInvalidateTheRenderedMap() throws Exception {
        campaigns.setActive(CAMPAIGN);
        Path artifact = campaignsRoot.resolve(CAMPAIGN).resolve(CampaignModules.PLAYER_MAP_ARTIFACT);
        Files.writeString(artifact, "<html></html>", StandardCharsets.UTF_8);

        service.create("npcs", new EntityInput("Unrelated", null, null));
        assertTrue(Files.exists(artifact));

        createLocation("station", null);
        assertFalse(Files.exists(artifact));
    }

    @Test
    void unknownModuleIsRejected() throws Exception {
        campaigns.setActive(CAMPAIGN);

        ContentValidationException e = assertThrows(ContentValidationException.class, () -> service.list("starships"));
        assertEquals("Unknown module: starships", e.getMessage());
        assertEquals(List.of(), service.list("ships"));
    }

    private void createLocation(String id, String parent) throws Exception {
        Map<String, Object> fm = new LinkedHashMap<>();
        fm.put("id", id);
        if (parent != null) {
            fm.put("parent", parent);
        }
        service.create("locations", new EntityInput(id.toUpperCase(), null, fm));
    }
}
