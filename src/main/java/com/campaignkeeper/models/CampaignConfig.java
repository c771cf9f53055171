package com.campaignkeeper.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Contents of a campaign's {@code campaign.yaml}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CampaignConfig {

    private String id;
    private String name;
    private String description;
    private String created;
    private String lastAccessed;
    private List<String> modules;
    private Map<String, Map<String, Object>> moduleSettings;

    public CampaignConfig() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getCreated() {
        return created;
    }

    public void setCreated(String created) {
        this.created = created;
    }

    public String getLastAccessed() {
        return lastAccessed;
    }

    public void setLastAccessed(String lastAccessed) {
        this.lastAccessed = lastAccessed;
    }

    public List<String> getModules() {
        return modules != null ? modules : new ArrayList<>();
    }

    public void setModules(List<String> modules) {
        this.modules = modules;
    }

    public Map<String, Map<String, Object>> getModuleSettings() {
        return moduleSettings != null ? moduleSettings : new LinkedHashMap<>();
    }

    public void setModuleSettings(Map<String, Map<String, Object>> moduleSettings) {
        this.moduleSettings = moduleSettings;
    }
}
