package com.campaignkeeper.models;

public class SearchResult {
    private String moduleId;
    private String id;
    private String name;
    private String snippet;
    private String type;

    public SearchResult(String moduleId, String id, String name, String snippet, String type) {
        this.moduleId = moduleId;
        this.id = id;
        this.name = name;
        this.snippet = snippet;
        this.type = type;
    }

    public String getModuleId() { return moduleId; }
    public void setModuleId(String moduleId) { this.moduleId = moduleId; }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getSnippet() { return snippet; }
    public void setSnippet(String snippet) { this.snippet = snippet; }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }
}
