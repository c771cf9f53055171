package com.campaignkeeper.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One persisted campaign record: frontmatter header plus free-text body.
 * {@code filePath} is campaign-relative with forward slashes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Entity {

    private Map<String, Object> frontmatter;
    private String content;
    private String filePath;
    private String modified;

    public Entity() {
        this.frontmatter = new LinkedHashMap<>();
        this.content = "";
    }

    public Entity(Map<String, Object> frontmatter, String content, String filePath, String modified) {
        this.frontmatter = frontmatter != null ? new LinkedHashMap<>(frontmatter) : new LinkedHashMap<>();
        this.content = content != null ? content : "";
        this.filePath = filePath;
        this.modified = modified;
    }

    @JsonIgnore
    public String getId() {
        Object id = frontmatter.get("id");
        return id instanceof String ? (String) id : null;
    }

    @JsonIgnore
    public String getName() {
        Object name = frontmatter.get("name");
        return name instanceof String ? (String) name : null;
    }

    public Map<String, Object> getFrontmatter() {
        return frontmatter;
    }

    public void setFrontmatter(Map<String, Object> frontmatter) {
        this.frontmatter = frontmatter != null ? frontmatter : new LinkedHashMap<>();
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content != null ? content : "";
    }

    public String getFilePath() {
        return filePath;
    }

    public void setFilePath(String filePath) {
        this.filePath = filePath;
    }

    public String getModified() {
        return modified;
    }

    public void setModified(String modified) {
        this.modified = modified;
    }

    @Override
    public String toString() {
        return "Entity{" +
            "id='" + getId() + '\'' +
            ", filePath='" + filePath + '\'' +
            ", modified='" + modified + '\'' +
            '}';
    }
}
