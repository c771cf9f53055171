package com.campaignkeeper.modules;

import com.campaignkeeper.RelationshipIndex;
import com.campaignkeeper.validation.FrontmatterSchema;
import com.campaignkeeper.validation.FrontmatterSchema.FieldType;

import java.util.List;

/**
 * The content modules shipped with the application.
 */
public final class CampaignModules {

    public static final String PLAYER_MAP_ARTIFACT = "player-system-map.html";

    private CampaignModules() {
    }

    public static List<ModuleDefinition> builtIn() {
        return List.of(
            new ModuleDefinition("npcs", "NPCs", "npcs")
                .entityLabel("NPC")
                .relationships("relatedCharacters")
                .schema(named()
                    .field("occupation", FieldType.STRING)
                    .field("location", FieldType.STRING)
                    .field("appearance", FieldType.STRING)
                    .field("personality", FieldType.STRING)
                    .field("goals", FieldType.STRING)
                    .field("relatedCharacters", FieldType.STRING_LIST)
                    .field("tags", FieldType.STRING_LIST)),

            new ModuleDefinition("locations", "Locations", "locations")
                .entityLabel("location")
                .parentField("parent")
                .derivedArtifact(PLAYER_MAP_ARTIFACT)
                .schema(named()
                    .field("type", FieldType.STRING)
                    .field("parent", FieldType.STRING)
                    .field("description", FieldType.STRING)
                    .field("hidden", FieldType.BOOLEAN)
                    .field("treeRoot", FieldType.BOOLEAN)
                    .field("tags", FieldType.STRING_LIST)),

            new ModuleDefinition("ships", "Ships", "ships")
                .entityLabel("ship")
                .relationships("affiliations")
                .schema(named()
                    .field("type", FieldType.STRING)
                    .field("class", FieldType.STRING)
                    .field("owner", FieldType.STRING)
                    .field("isCrewShip", FieldType.BOOLEAN)
                    .field("affiliations", FieldType.STRING_LIST)
                    .field("hidden", FieldType.BOOLEAN)),

            new ModuleDefinition("lore", "Lore", "lore")
                .entityLabel("lore entry")
                .schema(named()
                    .required("type")
                    .oneOf("type", "world", "faction", "history", "religion", "magic", "other")
                    .field("hidden", FieldType.BOOLEAN)
                    .field("tags", FieldType.STRING_LIST)),

            new ModuleDefinition("factions", "Factions", "factions")
                .entityLabel("faction")
                .schema(named()
                    .oneOf("type", "institutional", "belief-driven", "commercial", "frontier",
                        "security", "political", "criminal", "other")
                    .field("hidden", FieldType.BOOLEAN)),

            new ModuleDefinition("rules", "Rules", "rules")
                .entityLabel("rule")
                .schema(named().field("playerVisible", FieldType.BOOLEAN)),

            new ModuleDefinition("player-characters", "Player Characters", "player-characters")
                .entityLabel("player character")
                .schema(named().field("playerVisible", FieldType.BOOLEAN)),

            new ModuleDefinition("session-notes", "Session Notes", "session-notes")
                .entityLabel("session note")
                .schema(named()),

            new ModuleDefinition("projects", "Projects", "projects")
                .entityLabel("project")
                .schema(named().field("hidden", FieldType.BOOLEAN)),

            new ModuleDefinition("story-artefacts", "Story Artefacts", "story-artefacts")
                .entityLabel("story artefact")
                .schema(named().field("hidden", FieldType.BOOLEAN))
        );
    }

    /**
     * Registers every built-in module and its relationship fields. Call once at startup.
     */
    public static void registerAll(ModuleRegistry registry, RelationshipIndex relationships) {
        for (ModuleDefinition module : builtIn()) {
            register(module, registry, relationships);
        }
    }

    public static void register(ModuleDefinition module, ModuleRegistry registry, RelationshipIndex relationships) {
        registry.register(module);
        relationships.registerFields(module.getId(), module.getRelationshipFields());
    }

    private static FrontmatterSchema named() {
        return new FrontmatterSchema()
            .required("name")
            .field("name", FieldType.STRING);
    }
}
