package com.campaignkeeper.models;

/**
 * Public description of a content module, safe to hand to players.
 */
public class ModuleInfo {
    private final String id;
    private final String name;
    private final String dataFolder;
    private final String entityLabel;
    private final boolean hierarchical;

    public ModuleInfo(String id, String name, String dataFolder, String entityLabel, boolean hierarchical) {
        this.id = id;
        this.name = name;
        this.dataFolder = dataFolder;
        this.entityLabel = entityLabel;
        this.hierarchical = hierarchical;
    }

    public String getId() { return id; }

    public String getName() { return name; }

    public String getDataFolder() { return dataFolder; }

    public String getEntityLabel() { return entityLabel; }

    public boolean isHierarchical() { return hierarchical; }
}
