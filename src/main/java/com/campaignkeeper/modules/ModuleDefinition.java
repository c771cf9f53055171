package com.campaignkeeper.modules;

import com.campaignkeeper.validation.FrontmatterSchema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A content category: where its files live, how its frontmatter is validated,
 * which fields link to other entities and which one forms a hierarchy.
 */
public class ModuleDefinition {

    private final String id;
    private final String name;
    private final String dataFolder;
    private String entityLabel;
    private String parentField;
    private final List<String> relationshipFields = new ArrayList<>();
    private final List<String> derivedArtifacts = new ArrayList<>();
    private FrontmatterSchema schema = FrontmatterSchema.permissive();

    public ModuleDefinition(String id, String name, String dataFolder) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Module id is required");
        }
        this.id = id;
        this.name = name != null ? name : id;
        this.dataFolder = dataFolder != null && !dataFolder.isBlank() ? dataFolder : id;
        this.entityLabel = "entity";
    }

    public ModuleDefinition entityLabel(String label) {
        this.entityLabel = label;
        return this;
    }

    /**
     * Declares a hierarchy: {@code field} names the parent entity in this module.
     * The field also counts as a relationship field.
     */
    public ModuleDefinition parentField(String field) {
        this.parentField = field;
        relationships(field);
        return this;
    }

    public ModuleDefinition relationships(String... fields) {
        for (String field : fields) {
            if (field != null && !field.isBlank() && !relationshipFields.contains(field)) {
                relationshipFields.add(field);
            }
        }
        return this;
    }

    /**
     * Campaign-relative files generated from this module's entities; deleted whenever
     * an entity of the module changes.
     */
    public ModuleDefinition derivedArtifact(String campaignRelativePath) {
        derivedArtifacts.add(campaignRelativePath);
        return this;
    }

    public ModuleDefinition schema(FrontmatterSchema schema) {
        this.schema = schema != null ? schema : FrontmatterSchema.permissive();
        return this;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDataFolder() {
        return dataFolder;
    }

    public String getEntityLabel() {
        return entityLabel;
    }

    public String getParentField() {
        return parentField;
    }

    public boolean hasHierarchy() {
        return parentField != null;
    }

    public List<String> getRelationshipFields() {
        return Collections.unmodifiableList(relationshipFields);
    }

    public List<String> getDerivedArtifacts() {
        return Collections.unmodifiableList(derivedArtifacts);
    }

    public FrontmatterSchema getSchema() {
        return schema;
    }
}
