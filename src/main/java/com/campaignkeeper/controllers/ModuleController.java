package com.campaignkeeper.controllers;

import com.campaignkeeper.AppLogger;
import com.campaignkeeper.ModuleContentService;
import com.campaignkeeper.RelationshipIndex;
import com.campaignkeeper.models.Entity;
import com.campaignkeeper.models.EntityInput;
import com.campaignkeeper.models.EntityUpdate;
import com.campaignkeeper.validation.ContentValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.io.IOException;
import java.util.Map;

/**
 * DM-facing entity CRUD for the active campaign, plus relationship lookups.
 */
public class ModuleController implements Controller {

    private final ModuleContentService contentService;
    private final RelationshipIndex relationshipIndex;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public ModuleController(ModuleContentService contentService, RelationshipIndex relationshipIndex,
                            ObjectMapper objectMapper) {
        this.contentService = contentService;
        this.relationshipIndex = relationshipIndex;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/modules/{moduleId}", this::listEntities);
        app.post("/api/modules/{moduleId}", this::createEntity);
        app.get("/api/modules/{moduleId}/{entityId}", this::getEntity);
        app.put("/api/modules/{moduleId}/{entityId}", this::updateEntity);
        app.delete("/api/modules/{moduleId}/{entityId}", this::deleteEntity);
        app.get("/api/campaigns/{campaignId}/relationships/{entityId}", this::getRelationships);
    }

    private void listEntities(Context ctx) {
        String moduleId = ctx.pathParam("moduleId");
        try {
            ctx.json(Controller.ok(contentService.list(moduleId)));
        } catch (Exception e) {
            Controller.fail(ctx, logger, "listing " + moduleId, e);
        }
    }

    private void getEntity(Context ctx) {
        String moduleId = ctx.pathParam("moduleId");
        String entityId = ctx.pathParam("entityId");
        try {
            Entity entity = contentService.get(moduleId, entityId);
            if (entity == null) {
                ctx.status(404).json(Controller.errorBody("Entity not found: " + entityId));
                return;
            }
            ctx.json(Controller.ok(entity));
        } catch (Exception e) {
            Controller.fail(ctx, logger, "reading " + moduleId + "/" + entityId, e);
        }
    }

    private void createEntity(Context ctx) {
        String moduleId = ctx.pathParam("moduleId");
        try {
            EntityInput input = readBody(ctx, EntityInput.class);
            Entity created = contentService.create(moduleId, input);
            logger.info("Created " + moduleId + "/" + created.getId());
            ctx.status(201).json(Controller.ok(created));
        } catch (Exception e) {
            Controller.fail(ctx, logger, "creating in " + moduleId, e);
        }
    }

    private void updateEntity(Context ctx) {
        String moduleId = ctx.pathParam("moduleId");
        String entityId = ctx.pathParam("entityId");
        try {
            EntityUpdate update = readBody(ctx, EntityUpdate.class);
            Entity updated = contentService.update(moduleId, entityId, update);
            if (updated == null) {
                ctx.status(404).json(Controller.errorBody("Entity not found: " + entityId));
                return;
            }
            ctx.json(Controller.ok(updated));
        } catch (Exception e) {
            Controller.fail(ctx, logger, "updating " + moduleId + "/" + entityId, e);
        }
    }

    private void deleteEntity(Context ctx) {
        String moduleId = ctx.pathParam("moduleId");
        String entityId = ctx.pathParam("entityId");
        try {
            if (!contentService.delete(moduleId, entityId)) {
                ctx.status(404).json(Controller.errorBody("Entity not found: " + entityId));
                return;
            }
            logger.info("Deleted " + moduleId + "/" + entityId);
            ctx.json(Controller.ok(Map.of("deleted", entityId)));
        } catch (Exception e) {
            Controller.fail(ctx, logger, "deleting " + moduleId + "/" + entityId, e);
        }
    }

    private void getRelationships(Context ctx) {
        String campaignId = ctx.pathParam("campaignId");
        String entityId = ctx.pathParam("entityId");
        try {
            ctx.json(Controller.ok(relationshipIndex.getRelated(campaignId, entityId)));
        } catch (Exception e) {
            Controller.fail(ctx, logger, "resolving relationships of " + entityId, e);
        }
    }

    private <T> T readBody(Context ctx, Class<T> type) throws IOException {
        String body = ctx.body();
        if (body == null || body.isBlank()) {
            throw new ContentValidationException("Request body is required");
        }
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new ContentValidationException("Invalid JSON: " + e.getOriginalMessage());
        }
    }
}
