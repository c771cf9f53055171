package com.campaignkeeper;

import com.campaignkeeper.models.Entity;
import com.campaignkeeper.models.EntityMetadata;
import com.campaignkeeper.models.ModuleInfo;
import com.campaignkeeper.models.RelatedEntities;
import com.campaignkeeper.models.SearchResult;
import com.campaignkeeper.modules.ModuleRegistry;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only, player-safe view of a campaign.
 */
public class PlayerContentService {

    public static final List<String> DEFAULT_SEARCH_MODULES = List.of("npcs", "lore");
    private static final List<String> SNIPPET_FIELDS = List.of("description", "personality", "appearance");
    private static final int SNIPPET_LENGTH = 100;

    private final ContentStore store;
    private final RelationshipIndex relationships;
    private final ModuleRegistry modules;

    public PlayerContentService(ContentStore store, RelationshipIndex relationships, ModuleRegistry modules) {
        this.store = store;
        this.relationships = relationships;
        this.modules = modules;
    }

    public List<ModuleInfo> listModules() {
        return modules.getAllInfo();
    }

    public List<EntityMetadata> list(String campaignId, String moduleId) throws IOException {
        return ContentFilter.filterDmOnlyMetadataList(ContentFilter.excludeSystemRecords(store.list(campaignId, moduleId)));
    }

    /**
     * @return the filtered entity, or {@code null} if it is missing, hidden or a config record
     */
    public Entity get(String campaignId, String moduleId, String id) throws IOException {
        if (ContentStore.isConfigRecord(id)) {
            return null;
        }
        Entity entity = store.get(campaignId, moduleId, id);
        if (entity == null || ContentFilter.isHiddenFromPlayers(entity)) {
            return null;
        }
        return ContentFilter.filterDmOnlyContent(entity);
    }

    public RelatedEntities related(String campaignId, String entityId) throws IOException {
        return ContentFilter.filterRelated(relationships.getRelated(campaignId, entityId));
    }

    /**
     * Case-insensitive match on the name or any visible string field, sorted by name.
     * Module ids that are not registered contribute nothing.
     */
    public List<SearchResult> search(String campaignId, String query, List<String> moduleIds) throws IOException {
        String needle = query != null ? query.trim().toLowerCase(Locale.ROOT) : "";
        List<SearchResult> results = new ArrayList<>();
        if (needle.isEmpty()) {
            return results;
        }

        List<String> targets = moduleIds == null || moduleIds.isEmpty() ? DEFAULT_SEARCH_MODULES : moduleIds;
        for (String rawModuleId : targets) {
            String moduleId = rawModuleId.trim();
            if (moduleId.isEmpty() || modules.get(moduleId) == null) continue;
            for (EntityMetadata meta : list(campaignId, moduleId)) {
                if (!matches(meta, needle)) continue;
                Object type = meta.get("type");
                results.add(new SearchResult(moduleId, meta.getId(), meta.getName(), snippet(meta),
                    type instanceof String ? (String) type : null));
            }
        }

        results.sort(Comparator.comparing(SearchResult::getName, String.CASE_INSENSITIVE_ORDER));
        return results;
    }

    private boolean matches(EntityMetadata meta, String needle) {
        for (Map.Entry<String, Object> field : meta.getFields().entrySet()) {
            if (field.getValue() instanceof String
                && ((String) field.getValue()).toLowerCase(Locale.ROOT).contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private String snippet(EntityMetadata meta) {
        for (String field : SNIPPET_FIELDS) {
            Object value = meta.get(field);
            if (value instanceof String && !((String) value).isBlank()) {
                String text = (String) value;
                return text.length() > SNIPPET_LENGTH ? text.substring(0, SNIPPET_LENGTH) + "..." : text;
            }
        }
        return "";
    }
}
