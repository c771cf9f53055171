package com.campaignkeeper.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Partial update. Unset properties keep their stored value; a frontmatter key
 * mapped to {@code null} removes that field.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EntityUpdate {

    private String name;
    private String content;
    private Map<String, Object> frontmatter;

    public EntityUpdate() {
    }

    public EntityUpdate(String name, String content, Map<String, Object> frontmatter) {
        this.name = name;
        this.content = content;
        this.frontmatter = frontmatter;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public Map<String, Object> getFrontmatter() {
        return frontmatter;
    }

    public void setFrontmatter(Map<String, Object> frontmatter) {
        this.frontmatter = frontmatter;
    }

    public boolean touchesField(String field) {
        return frontmatter != null && frontmatter.containsKey(field);
    }
}
