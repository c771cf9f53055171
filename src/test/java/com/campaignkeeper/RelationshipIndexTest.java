package com.campaignkeeper;

import com.campaignkeeper.models.EntityInput;
import com.campaignkeeper.models.EntityMetadata;
import com.campaignkeeper.models.RelatedEntities;
import com.campaignkeeper.models.ReverseReference;
import com.campaignkeeper.modules.ModuleDefinition;
import com.campaignkeeper.modules.ModuleRegistry;
import com.campaignkeeper.storage.FrontmatterCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RelationshipIndexTest {

    private static final String CAMPAIGN = "rimward";

    @TempDir
    Path campaignsRoot;

    private ContentStore store;
    private RelationshipIndex index;

    @BeforeEach
    void setUp() throws Exception {
        Files.createDirectories(campaignsRoot.resolve(CAMPAIGN));
        ModuleRegistry modules = new ModuleRegistry()
            .register(new ModuleDefinition("npcs", "NPCs", "npcs"))
            .register(new ModuleDefinition("ships", "Ships", "ships"))
            .register(new ModuleDefinition("locations", "Locations", "locations"));
        store = new ContentStore(campaignsRoot, modules, new FileLock(), new FrontmatterCodec());
        index = new RelationshipIndex(store, modules);
        index.registerFields("npcs", List.of("relatedCharacters", "location"));
        index.registerFields("ships", List.of("affiliations"));
    }

    @Test
    void registerFieldsIsAnIdempotentUnion() {
        index.registerFields("npcs", List.of("location"));
        index.registerFields("npcs", List.of("faction"));

        assertEquals(Set.of("relatedCharacters", "location", "faction"), index.getFields("npcs"));
        assertTrue(index.getFields("lore").isEmpty());
    }

    @Test
    void reverseReferencesCoverSingleAndListFields() throws Exception {
        create("locations", "port-ash", "Port Ash", Map.of());
        create("npcs", "mira", "Mira", Map.of());
        create("npcs", "vex", "Vex", Map.of("location", "port-ash", "relatedCharacters", List.of("mira", 7)));
        create("ships", "eel", "Gilded Eel", Map.of("affiliations", List.of("mira", "vex")));

        Map<String, List<ReverseReference>> reverse = index.computeReverseReferences(CAMPAIGN);

        assertEquals(List.of(new ReverseReference("npcs", "vex", "location")), reverse.get("port-ash"));
        assertEquals(Set.of(
                new ReverseReference("npcs", "vex", "relatedCharacters"),
                new ReverseReference("ships", "eel", "affiliations")),
            Set.copyOf(reverse.get("mira")));
        assertEquals(List.of(new ReverseReference("ships", "eel", "affiliations")), reverse.get("vex"));
        assertFalse(reverse.containsKey("7"));
    }

    @Test
    void reverseReferencesFollowDeletes() throws Exception {
        create("npcs", "mira", "Mira", Map.of());
        create("npcs", "vex", "Vex", Map.of("relatedCharacters", List.of("mira")));
        assertTrue(index.computeReverseReferences(CAMPAIGN).containsKey("mira"));

        store.delete(CAMPAIGN, "npcs", "vex");

        assertFalse(index.computeReverseReferences(CAMPAIGN).containsKey("mira"));
    }

    @Test
    void relatedListsBothDirectionsAndSkipsDanglingIds() throws Exception {
        create("locations", "port-ash", "Port Ash", Map.of());
        create("npcs", "mira", "Mira", Map.of());
        create("npcs", "vex", "Vex", Map.of("location", "port-ash", "relatedCharacters", List.of("mira", "gone")));
        create("ships", "eel", "Gilded Eel", Map.of("affiliations", List.of("vex")));

        RelatedEntities related = index.getRelated(CAMPAIGN, "vex");

        assertEquals(List.of("mira", "port-ash"), ids(related.getReferences()));
        assertEquals(List.of("eel"), ids(related.getReferencedBy()));
    }

    @Test
    void resolveIdsKeepsRequestedOrder() throws Exception {
        create("npcs", "mira", "Mira", Map.of());
        create("ships", "eel", "Gilded Eel", Map.of());

        assertEquals(List.of("eel", "mira"), ids(index.resolveIds(CAMPAIGN, Arrays.asList("eel", "nobody", "mira"))));
    }

    @Test
    void extractIdsIgnoresNonStrings() {
        assertEquals(List.of("a"), RelationshipIndex.extractIds("a"));
        assertEquals(List.of("a", "b"), RelationshipIndex.extractIds(Arrays.asList("a", 1, null, "", "b")));
        assertTrue(RelationshipIndex.extractIds(42).isEmpty());
        assertTrue(RelationshipIndex.extractIds(null).isEmpty());
    }

    private void create(String moduleId, String id, String name, Map<String, Object> fields) throws Exception {
        Map<String, Object> fm = new LinkedHashMap<>(fields);
        fm.put("id", id);
        store.create(CAMPAIGN, moduleId, new EntityInput(name, null, fm));
    }

    private static List<String> ids(List<EntityMetadata> items) {
        return items.stream().map(EntityMetadata::getId).collect(Collectors.toList());
    }
}
