package com.campaignkeeper.modules;

import com.campaignkeeper.AppLogger;
import com.campaignkeeper.models.ModuleInfo;
import com.campaignkeeper.validation.ContentValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

public class ModuleRegistry {

    private final Map<String, ModuleDefinition> modules = new ConcurrentHashMap<>();
    private final List<String> order = new CopyOnWriteArrayList<>();
    private final AppLogger logger = AppLogger.get();

    public ModuleRegistry register(ModuleDefinition module) {
        if (modules.put(module.getId(), module) != null) {
            logger.warn("[ModuleRegistry] Module " + module.getId() + " is already registered. Overwriting.");
        } else {
            order.add(module.getId());
        }
        logger.info("[ModuleRegistry] Module registered: " + module.getId());
        return this;
    }

    public ModuleDefinition get(String moduleId) {
        return moduleId != null ? modules.get(moduleId) : null;
    }

    /**
     * @throws ContentValidationException if no module is registered under {@code moduleId}
     */
    public ModuleDefinition require(String moduleId) {
        ModuleDefinition module = get(moduleId);
        if (module == null) {
            throw new ContentValidationException("Unknown module: " + moduleId);
        }
        return module;
    }

    public List<ModuleDefinition> getAll() {
        List<ModuleDefinition> result = new ArrayList<>();
        for (String id : order) {
            ModuleDefinition module = modules.get(id);
            if (module != null) {
                result.add(module);
            }
        }
        return result;
    }

    public List<ModuleInfo> getAllInfo() {
        List<ModuleInfo> result = new ArrayList<>();
        for (ModuleDefinition module : getAll()) {
            result.add(new ModuleInfo(module.getId(), module.getName(), module.getDataFolder(),
                module.getEntityLabel(), module.hasHierarchy()));
        }
        return result;
    }
}
