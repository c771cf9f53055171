package com.campaignkeeper;

import com.campaignkeeper.models.EntityMetadata;
import com.campaignkeeper.models.RelatedEntities;
import com.campaignkeeper.models.ReverseReference;
import com.campaignkeeper.modules.ModuleDefinition;
import com.campaignkeeper.modules.ModuleRegistry;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Knows which frontmatter fields of each module point at other entities, and answers
 * "who references X" by scanning the campaign on every query. Nothing derived from
 * entity files is cached here.
 */
public class RelationshipIndex {

    private final Map<String, Set<String>> fieldsByModule = new ConcurrentHashMap<>();
    private final ContentStore store;
    private final ModuleRegistry modules;
    private final AppLogger logger = AppLogger.get();

    public RelationshipIndex(ContentStore store, ModuleRegistry modules) {
        this.store = store;
        this.modules = modules;
    }

    /**
     * Adds {@code fields} to the module's relationship fields. Registering the same
     * fields again changes nothing.
     */
    public void registerFields(String moduleId, Collection<String> fields) {
        if (moduleId == null || moduleId.isBlank()) {
            throw new IllegalArgumentException("Module id is required");
        }
        Set<String> incoming = new LinkedHashSet<>();
        if (fields != null) {
            for (String field : fields) {
                if (field != null && !field.isBlank()) {
                    incoming.add(field);
                }
            }
        }
        Set<String> merged = fieldsByModule.merge(moduleId, Collections.unmodifiableSet(incoming), (existing, added) -> {
            Set<String> union = new LinkedHashSet<>(existing);
            union.addAll(added);
            return Collections.unmodifiableSet(union);
        });
        logger.info("[RelationshipIndex] " + moduleId + " relationship fields: " + merged);
    }

    public Set<String> getFields(String moduleId) {
        Set<String> fields = moduleId != null ? fieldsByModule.get(moduleId) : null;
        return fields != null ? fields : Collections.emptySet();
    }

    /**
     * Target entity id to every (module, entity, field) that references it, read from disk.
     */
    public Map<String, List<ReverseReference>> computeReverseReferences(String campaignId) throws IOException {
        return reverseReferences(snapshot(campaignId));
    }

    /**
     * What {@code entityId} links to and what links to it, as metadata. Ids that no
     * longer resolve are left out.
     */
    public RelatedEntities getRelated(String campaignId, String entityId) throws IOException {
        Map<String, List<EntityMetadata>> byModule = snapshot(campaignId);
        Map<String, EntityMetadata> catalog = new LinkedHashMap<>();
        Map<String, String> moduleOf = new LinkedHashMap<>();
        for (Map.Entry<String, List<EntityMetadata>> entry : byModule.entrySet()) {
            for (EntityMetadata meta : entry.getValue()) {
                if (catalog.putIfAbsent(meta.getId(), meta) == null) {
                    moduleOf.put(meta.getId(), entry.getKey());
                }
            }
        }

        List<EntityMetadata> references = new ArrayList<>();
        EntityMetadata self = catalog.get(entityId);
        if (self != null) {
            Set<String> outgoing = new LinkedHashSet<>();
            for (String field : getFields(moduleOf.get(entityId))) {
                outgoing.addAll(extractIds(self.get(field)));
            }
            for (String targetId : outgoing) {
                EntityMetadata target = catalog.get(targetId);
                if (target != null) {
                    references.add(target);
                }
            }
        }

        List<EntityMetadata> referencedBy = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (ReverseReference ref : reverseReferences(byModule).getOrDefault(entityId, List.of())) {
            EntityMetadata source = catalog.get(ref.getSourceEntityId());
            if (source != null && seen.add(ref.getSourceEntityId())) {
                referencedBy.add(source);
            }
        }

        return new RelatedEntities(references, referencedBy);
    }

    /**
     * Metadata for each id found in any module, in the order given.
     */
    public List<EntityMetadata> resolveIds(String campaignId, List<String> ids) throws IOException {
        Map<String, EntityMetadata> catalog = new LinkedHashMap<>();
        for (List<EntityMetadata> entities : snapshot(campaignId).values()) {
            for (EntityMetadata meta : entities) {
                catalog.putIfAbsent(meta.getId(), meta);
            }
        }
        List<EntityMetadata> resolved = new ArrayList<>();
        for (String id : ids) {
            EntityMetadata meta = catalog.get(id);
            if (meta != null) {
                resolved.add(meta);
            }
        }
        return resolved;
    }

    private Map<String, List<EntityMetadata>> snapshot(String campaignId) throws IOException {
        Map<String, List<EntityMetadata>> byModule = new LinkedHashMap<>();
        for (ModuleDefinition module : modules.getAll()) {
            byModule.put(module.getId(), store.list(campaignId, module.getId()));
        }
        return byModule;
    }

    private Map<String, List<ReverseReference>> reverseReferences(Map<String, List<EntityMetadata>> byModule) {
        Map<String, List<ReverseReference>> reverse = new LinkedHashMap<>();
        for (Map.Entry<String, List<EntityMetadata>> entry : byModule.entrySet()) {
            String moduleId = entry.getKey();
            Set<String> fields = getFields(moduleId);
            if (fields.isEmpty()) {
                continue;
            }
            for (EntityMetadata source : entry.getValue()) {
                for (String field : fields) {
                    for (String targetId : extractIds(source.get(field))) {
                        reverse.computeIfAbsent(targetId, k -> new ArrayList<>())
                            .add(new ReverseReference(moduleId, source.getId(), field));
                    }
                }
            }
        }
        return reverse;
    }

    /**
     * A relationship value is a single id or a list of ids; anything else holds none.
     */
    static List<String> extractIds(Object value) {
        List<String> ids = new ArrayList<>();
        if (value instanceof String) {
            if (!((String) value).isEmpty()) {
                ids.add((String) value);
            }
        } else if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                if (item instanceof String && !((String) item).isEmpty()) {
                    ids.add((String) item);
                }
            }
        }
        return ids;
    }
}
