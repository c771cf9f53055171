package com.campaignkeeper;

import com.campaignkeeper.models.CampaignConfig;
import com.campaignkeeper.models.Entity;
import com.campaignkeeper.models.EntityInput;
import com.campaignkeeper.models.EntityMetadata;
import com.campaignkeeper.models.EntityUpdate;
import com.campaignkeeper.modules.ModuleDefinition;
import com.campaignkeeper.modules.ModuleRegistry;
import com.campaignkeeper.validation.ContentValidationException;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * DM-side CRUD against the active campaign. Every mutation is validated (module
 * schema, then parent link for hierarchical modules) before the store writes anything.
 */
public class ModuleContentService {

    private final CampaignManager campaigns;
    private final ContentStore store;
    private final ModuleRegistry modules;

    public ModuleContentService(CampaignManager campaigns, ContentStore store, ModuleRegistry modules) {
        this.campaigns = campaigns;
        this.store = store;
        this.modules = modules;
    }

    public List<EntityMetadata> list(String moduleId) throws IOException {
        CampaignConfig campaign = campaigns.requireActive();
        return store.list(campaign.getId(), modules.require(moduleId).getId());
    }

    public Entity get(String moduleId, String id) throws IOException {
        CampaignConfig campaign = campaigns.requireActive();
        return store.get(campaign.getId(), modules.require(moduleId).getId(), id);
    }

    public Entity create(String moduleId, EntityInput input) throws IOException {
        CampaignConfig campaign = campaigns.requireActive();
        ModuleDefinition module = modules.require(moduleId);
        if (input == null) {
            throw new ContentValidationException("Name is required");
        }

        Map<String, Object> candidate = new LinkedHashMap<>(input.getFrontmatter());
        candidate.put("name", input.getName());
        module.getSchema().validate(candidate).throwIfInvalid();

        if (module.hasHierarchy()) {
            String proposedParent = asId(candidate.get(module.getParentField()));
            Object explicitId = candidate.get("id");
            checkParent(campaign, module, explicitId != null ? String.valueOf(explicitId) : null, proposedParent);
        }

        return store.create(campaign.getId(), module.getId(), input);
    }

    /**
     * @return the updated entity, or {@code null} if it does not exist
     */
    public Entity update(String moduleId, String id, EntityUpdate update) throws IOException {
        CampaignConfig campaign = campaigns.requireActive();
        ModuleDefinition module = modules.require(moduleId);
        EntityUpdate changes = update != null ? update : new EntityUpdate();

        Entity existing = store.get(campaign.getId(), module.getId(), id);
        if (existing == null) {
            return null;
        }

        Map<String, Object> merged = ContentStore.mergeFrontmatter(existing.getFrontmatter(), id, changes);
        module.getSchema().validate(merged).throwIfInvalid();

        if (module.hasHierarchy() && changes.touchesField(module.getParentField())) {
            checkParent(campaign, module, id, asId(changes.getFrontmatter().get(module.getParentField())));
        }

        return store.update(campaign.getId(), module.getId(), id, changes);
    }

    public boolean delete(String moduleId, String id) throws IOException {
        CampaignConfig campaign = campaigns.requireActive();
        return store.delete(campaign.getId(), modules.require(moduleId).getId(), id);
    }

    private void checkParent(CampaignConfig campaign, ModuleDefinition module, String childId, String proposedParent)
            throws IOException {
        if (proposedParent == null) {
            return;
        }
        CycleDetector detector = new CycleDetector(module.getParentField(), module.getEntityLabel());
        List<EntityMetadata> entities = store.list(campaign.getId(), module.getId());
        String error = detector.validateParentAssignment(entities, childId, proposedParent);
        if (error != null) {
            throw new ContentValidationException(error);
        }
    }

    private static String asId(Object value) {
        if (value == null) {
            return null;
        }
        String id = String.valueOf(value);
        return id.isEmpty() ? null : id;
    }
}
