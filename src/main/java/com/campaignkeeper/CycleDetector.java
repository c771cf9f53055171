package com.campaignkeeper;

import com.campaignkeeper.models.EntityMetadata;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Guards a module's child-to-parent graph against cycles before a parent link is written.
 */
public class CycleDetector {

    public static final String CIRCULAR_REFERENCE = "Cannot set parent: would create a circular reference";

    private final String parentField;
    private final String entityLabel;

    public CycleDetector(String parentField, String entityLabel) {
        if (parentField == null || parentField.isBlank()) {
            throw new IllegalArgumentException("Parent field is required");
        }
        this.parentField = parentField;
        this.entityLabel = entityLabel != null && !entityLabel.isBlank() ? entityLabel : "entity";
    }

    public String getParentField() {
        return parentField;
    }

    /**
     * True if making {@code proposedParentId} the parent of {@code childId} would make
     * {@code childId} its own ancestor. A cycle already present in the ancestor chain
     * of the proposed parent also counts.
     */
    public boolean wouldCreateCycle(List<EntityMetadata> entities, String childId, String proposedParentId) {
        if (childId != null && childId.equals(proposedParentId)) {
            return true;
        }

        Map<String, EntityMetadata> byId = new HashMap<>();
        for (EntityMetadata entity : entities) {
            if (entity.getId() != null) {
                byId.put(entity.getId(), entity);
            }
        }

        Set<String> visited = new HashSet<>();
        String current = proposedParentId;
        while (current != null && !current.isEmpty()) {
            if (current.equals(childId)) {
                return true;
            }
            if (!visited.add(current)) {
                return true;
            }
            EntityMetadata entity = byId.get(current);
            current = entity != null ? parentOf(entity) : null;
        }
        return false;
    }

    /**
     * @return {@code null} when the assignment is acceptable, otherwise a message for the user
     */
    public String validateParentAssignment(List<EntityMetadata> entities, String childId, String proposedParentId) {
        if (proposedParentId == null || proposedParentId.isEmpty()) {
            return null;
        }

        boolean parentExists = entities.stream().anyMatch(e -> proposedParentId.equals(e.getId()));
        if (!parentExists) {
            return "Parent " + entityLabel + " not found";
        }

        if (wouldCreateCycle(entities, childId, proposedParentId)) {
            return CIRCULAR_REFERENCE;
        }
        return null;
    }

    private String parentOf(EntityMetadata entity) {
        Object parent = entity.get(parentField);
        return parent instanceof String ? (String) parent : null;
    }
}
