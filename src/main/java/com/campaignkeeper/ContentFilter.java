package com.campaignkeeper;

import com.campaignkeeper.models.Entity;
import com.campaignkeeper.models.EntityMetadata;
import com.campaignkeeper.models.RelatedEntities;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Player-safe projections. Two hiding conventions coexist across modules,
 * {@code hidden: true} and {@code playerVisible: false}; either one hides an item.
 * Nothing here mutates its input.
 */
public final class ContentFilter {

    public static final Set<String> DM_ONLY_FIELDS = Set.of("dmOnly", "hidden", "playerVisible");

    private ContentFilter() {
    }

    public static boolean isHiddenFromPlayers(Map<String, Object> fields) {
        if (fields == null) {
            return false;
        }
        return Boolean.TRUE.equals(fields.get("hidden")) || Boolean.FALSE.equals(fields.get("playerVisible"));
    }

    public static boolean isHiddenFromPlayers(EntityMetadata metadata) {
        return metadata != null && isHiddenFromPlayers(metadata.getFields());
    }

    public static boolean isHiddenFromPlayers(Entity entity) {
        return entity != null && isHiddenFromPlayers(entity.getFrontmatter());
    }

    public static Entity filterDmOnlyContent(Entity entity) {
        return new Entity(stripDmOnly(entity.getFrontmatter()), entity.getContent(),
            entity.getFilePath(), entity.getModified());
    }

    public static EntityMetadata filterDmOnlyMetadata(EntityMetadata metadata) {
        return new EntityMetadata(stripDmOnly(metadata.getFields()), metadata.getFilePath(), metadata.getModified());
    }

    /**
     * Drops hidden items, then strips DM-only fields from the rest, keeping order.
     */
    public static List<EntityMetadata> filterDmOnlyMetadataList(List<EntityMetadata> metadataList) {
        return metadataList.stream()
            .filter(item -> !isHiddenFromPlayers(item))
            .map(ContentFilter::filterDmOnlyMetadata)
            .collect(Collectors.toList());
    }

    /**
     * Removes module configuration records (ids starting with {@code _}).
     */
    public static List<EntityMetadata> excludeSystemRecords(List<EntityMetadata> metadataList) {
        return metadataList.stream()
            .filter(item -> !ContentStore.isConfigRecord(item.getId()))
            .collect(Collectors.toList());
    }

    public static RelatedEntities filterRelated(RelatedEntities related) {
        return new RelatedEntities(
            filterDmOnlyMetadataList(related.getReferences()),
            filterDmOnlyMetadataList(related.getReferencedBy()));
    }

    private static Map<String, Object> stripDmOnly(Map<String, Object> fields) {
        Map<String, Object> cleaned = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            if (!DM_ONLY_FIELDS.contains(entry.getKey())) {
                cleaned.put(entry.getKey(), entry.getValue());
            }
        }
        return cleaned;
    }
}
