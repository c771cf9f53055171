package com.campaignkeeper.controllers;

import com.campaignkeeper.AppLogger;
import com.campaignkeeper.CampaignManager;
import com.campaignkeeper.PlayerContentService;
import com.campaignkeeper.models.CampaignConfig;
import com.campaignkeeper.models.Entity;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only player view. Hidden entities answer 404 exactly like missing ones.
 */
public class PlayerController implements Controller {

    private final PlayerContentService playerContent;
    private final CampaignManager campaignManager;
    private final AppLogger logger;

    public PlayerController(PlayerContentService playerContent, CampaignManager campaignManager) {
        this.playerContent = playerContent;
        this.campaignManager = campaignManager;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/player/active-campaign", this::getActiveCampaign);
        app.get("/api/player/modules", this::listModules);
        app.get("/api/player/campaigns/{campaignId}/files/{moduleId}", this::listFiles);
        app.get("/api/player/campaigns/{campaignId}/files/{moduleId}/{entityId}", this::getFile);
        app.get("/api/player/campaigns/{campaignId}/relationships/{entityId}", this::getRelationships);
        app.get("/api/player/campaigns/{campaignId}/search", this::search);
    }

    private void getActiveCampaign(Context ctx) {
        // null when nothing is active; players poll this before loading content
        CampaignConfig active = campaignManager.getActive();
        ctx.json(Controller.ok(active));
    }

    private void listModules(Context ctx) {
        ctx.json(Controller.ok(playerContent.listModules()));
    }

    private void listFiles(Context ctx) {
        String campaignId = ctx.pathParam("campaignId");
        String moduleId = ctx.pathParam("moduleId");
        try {
            ctx.json(Controller.ok(playerContent.list(campaignId, moduleId)));
        } catch (Exception e) {
            Controller.fail(ctx, logger, "listing player " + moduleId, e);
        }
    }

    private void getFile(Context ctx) {
        String campaignId = ctx.pathParam("campaignId");
        String moduleId = ctx.pathParam("moduleId");
        String entityId = ctx.pathParam("entityId");
        try {
            Entity entity = playerContent.get(campaignId, moduleId, entityId);
            if (entity == null) {
                ctx.status(404).json(Controller.errorBody("Entity not found: " + entityId));
                return;
            }
            ctx.json(Controller.ok(entity));
        } catch (Exception e) {
            Controller.fail(ctx, logger, "reading player " + moduleId + "/" + entityId, e);
        }
    }

    private void getRelationships(Context ctx) {
        String campaignId = ctx.pathParam("campaignId");
        String entityId = ctx.pathParam("entityId");
        try {
            ctx.json(Controller.ok(playerContent.related(campaignId, entityId)));
        } catch (Exception e) {
            Controller.fail(ctx, logger, "resolving player relationships of " + entityId, e);
        }
    }

    private void search(Context ctx) {
        String campaignId = ctx.pathParam("campaignId");
        String query = ctx.queryParam("q");
        String modulesParam = ctx.queryParam("modules");
        try {
            List<String> modules = new ArrayList<>();
            if (modulesParam != null && !modulesParam.isBlank()) {
                for (String m : modulesParam.split(",")) {
                    if (!m.isBlank()) {
                        modules.add(m.trim());
                    }
                }
            }
            ctx.json(Controller.ok(playerContent.search(campaignId, query, modules)));
        } catch (Exception e) {
            Controller.fail(ctx, logger, "searching " + campaignId, e);
        }
    }
}
