package com.campaignkeeper.models;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Listing view of an entity: every frontmatter field plus where and when it was
 * stored. Never carries the body text. Serializes flat, frontmatter fields first.
 */
public class EntityMetadata {

    private final Map<String, Object> fields;
    private final String filePath;
    private final String modified;

    public EntityMetadata(Map<String, Object> fields, String filePath, String modified) {
        this.fields = fields != null ? new LinkedHashMap<>(fields) : new LinkedHashMap<>();
        this.filePath = filePath;
        this.modified = modified;
    }

    @JsonIgnore
    public String getId() {
        Object id = fields.get("id");
        return id instanceof String ? (String) id : null;
    }

    @JsonIgnore
    public String getName() {
        Object name = fields.get("name");
        return name instanceof String ? (String) name : null;
    }

    public Object get(String field) {
        return fields.get(field);
    }

    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public String getFilePath() {
        return filePath;
    }

    public String getModified() {
        return modified;
    }

    @Override
    public String toString() {
        return "EntityMetadata{" +
            "fields=" + fields +
            ", filePath='" + filePath + '\'' +
            '}';
    }
}
