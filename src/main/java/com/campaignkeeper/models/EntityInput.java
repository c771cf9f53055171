package com.campaignkeeper.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payload for creating an entity. {@code frontmatter} may carry an explicit {@code id}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EntityInput {

    private String name;
    private String content;
    private Map<String, Object> frontmatter;

    public EntityInput() {
    }

    public EntityInput(String name, String content, Map<String, Object> frontmatter) {
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
        return frontmatter != null ? frontmatter : new LinkedHashMap<>();
    }

    public void setFrontmatter(Map<String, Object> frontmatter) {
        this.frontmatter = frontmatter;
    }
}
