package com.campaignkeeper.models;

import java.util.ArrayList;
import java.util.List;

public class RelatedEntities {

    private final List<EntityMetadata> references;
    private final List<EntityMetadata> referencedBy;

    public RelatedEntities(List<EntityMetadata> references, List<EntityMetadata> referencedBy) {
        this.references = references != null ? references : new ArrayList<>();
        this.referencedBy = referencedBy != null ? referencedBy : new ArrayList<>();
    }

    public List<EntityMetadata> getReferences() {
        return references;
    }

    public List<EntityMetadata> getReferencedBy() {
        return referencedBy;
    }
}
