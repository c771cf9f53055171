package com.campaignkeeper;

import com.campaignkeeper.models.Entity;
import com.campaignkeeper.models.EntityMetadata;
import com.campaignkeeper.models.RelatedEntities;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ContentFilterTest {

    @Test
    void eitherConventionHidesAnItem() {
        assertTrue(ContentFilter.isHiddenFromPlayers(Map.<String, Object>of("hidden", true)));
        assertTrue(ContentFilter.isHiddenFromPlayers(Map.<String, Object>of("playerVisible", false)));
        assertTrue(ContentFilter.isHiddenFromPlayers(Map.<String, Object>of("hidden", true, "playerVisible", true)));
        assertFalse(ContentFilter.isHiddenFromPlayers(Map.<String, Object>of("hidden", false)));
        assertFalse(ContentFilter.isHiddenFromPlayers(Map.<String, Object>of("playerVisible", true)));
        assertFalse(ContentFilter.isHiddenFromPlayers(Map.<String, Object>of("hidden", "true")));
        assertFalse(ContentFilter.isHiddenFromPlayers(Map.<String, Object>of()));
    }

    @Test
    void filterDmOnlyContentStripsFlagsAndKeepsTheRest() {
        Map<String, Object> fm = new LinkedHashMap<>();
        fm.put("id", "vex");
        fm.put("name", "Vex");
        fm.put("dmOnly", "Secretly a spy");
        fm.put("hidden", false);
        fm.put("playerVisible", true);
        fm.put("occupation", "Captain");
        Entity entity = new Entity(fm, "Body", "npcs/vex.md", "2024-01-01T00:00:00Z");

        Entity filtered = ContentFilter.filterDmOnlyContent(entity);

        assertEquals(List.of("id", "name", "occupation"), List.copyOf(filtered.getFrontmatter().keySet()));
        assertEquals("Body", filtered.getContent());
        assertEquals("npcs/vex.md", filtered.getFilePath());
        assertTrue(entity.getFrontmatter().containsKey("dmOnly"));
    }

    @Test
    void listFilterDropsHiddenAndKeepsOrder() {
        List<EntityMetadata> items = List.of(
            meta("a", Map.of("dmOnly", "x")),
            meta("b", Map.of("hidden", true)),
            meta("c", Map.of("playerVisible", false)),
            meta("d", Map.of("playerVisible", true)));

        List<EntityMetadata> filtered = ContentFilter.filterDmOnlyMetadataList(items);

        assertEquals(List.of("a", "d"), filtered.stream().map(EntityMetadata::getId).collect(Collectors.toList()));
        for (EntityMetadata item : filtered) {
            for (String field : ContentFilter.DM_ONLY_FIELDS) {
                assertNull(item.get(field));
            }
        }
    }

    @Test
    void excludeSystemRecordsDropsUnderscoreIds() {
        List<EntityMetadata> items = List.of(meta("_map-config", Map.of()), meta("port", Map.of()));

        assertEquals(List.of("port"), ContentFilter.excludeSystemRecords(items).stream()
            .map(EntityMetadata::getId).collect(Collectors.toList()));
    }

    @Test
    void filterRelatedAppliesToBothSides() {
        RelatedEntities related = new RelatedEntities(
            List.of(meta("x", Map.of("hidden", true)), meta("y", Map.of())),
            List.of(meta("z", Map.of("playerVisible", false))));

        RelatedEntities filtered = ContentFilter.filterRelated(related);

        assertEquals(1, filtered.getReferences().size());
        assertEquals("y", filtered.getReferences().get(0).getId());
        assertTrue(filtered.getReferencedBy().isEmpty());
    }

    private static EntityMetadata meta(String id, Map<String, Object> extra) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("id", id);
        fields.put("name", id);
        fields.putAll(extra);
        return new EntityMetadata(fields, "x/" + id + ".md", null);
    }
}
