package com.campaignkeeper.controllers;

import com.campaignkeeper.AppLogger;
import com.campaignkeeper.CampaignManager;
import com.campaignkeeper.models.CampaignConfig;
import io.javalin.Javalin;
import io.javalin.http.Context;

/**
 * Campaign listing and activation.
 */
public class CampaignController implements Controller {

    private final CampaignManager campaignManager;
    private final AppLogger logger;

    public CampaignController(CampaignManager campaignManager) {
        this.campaignManager = campaignManager;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/campaigns", this::listCampaigns);
        app.get("/api/campaigns/active", this::getActiveCampaign);
        app.post("/api/campaigns/{id}/activate", this::activateCampaign);
    }

    private void listCampaigns(Context ctx) {
        try {
            ctx.json(Controller.ok(campaignManager.list()));
        } catch (Exception e) {
            Controller.fail(ctx, logger, "listing campaigns", e);
        }
    }

    private void getActiveCampaign(Context ctx) {
        CampaignConfig active = campaignManager.getActive();
        if (active == null) {
            ctx.status(404).json(Controller.errorBody("No active campaign"));
            return;
        }
        ctx.json(Controller.ok(active));
    }

    private void activateCampaign(Context ctx) {
        String id = ctx.pathParam("id");
        try {
            CampaignConfig campaign = campaignManager.setActive(id);
            if (campaign == null) {
                ctx.status(404).json(Controller.errorBody("Campaign not found: " + id));
                return;
            }
            ctx.json(Controller.ok(campaign));
        } catch (Exception e) {
            Controller.fail(ctx, logger, "activating campaign " + id, e);
        }
    }
}
