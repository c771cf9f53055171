package com.campaignkeeper.models;

import java.util.Objects;

/**
 * One incoming link: {@code sourceEntityId} in {@code sourceModule} names the
 * target through {@code field}.
 */
public class ReverseReference {

    private final String sourceModule;
    private final String sourceEntityId;
    private final String field;

    public ReverseReference(String sourceModule, String sourceEntityId, String field) {
        this.sourceModule = sourceModule;
        this.sourceEntityId = sourceEntityId;
        this.field = field;
    }

    public String getSourceModule() {
        return sourceModule;
    }

    public String getSourceEntityId() {
        return sourceEntityId;
    }

    public String getField() {
        return field;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReverseReference)) return false;
        ReverseReference that = (ReverseReference) o;
        return Objects.equals(sourceModule, that.sourceModule)
            && Objects.equals(sourceEntityId, that.sourceEntityId)
            && Objects.equals(field, that.field);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceModule, sourceEntityId, field);
    }

    @Override
    public String toString() {
        return sourceModule + "/" + sourceEntityId + "#" + field;
    }
}
