package com.campaignkeeper.controllers;

import com.campaignkeeper.AppLogger;
import com.campaignkeeper.validation.ContentValidationException;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Interface for API controllers.
 * Each controller registers its routes with the Javalin app.
 */
public interface Controller {

    /**
     * Register this controller's routes with the Javalin app.
     */
    void registerRoutes(Javalin app);

    /**
     * Success envelope: {@code {"success": true, "data": ...}}.
     */
    static Map<String, Object> ok(Object data) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("data", data);
        return body;
    }

    static Map<String, Object> errorBody(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", message);
        return body;
    }

    /**
     * Safe error body helper that handles null exception messages.
     * Validation failures also carry their individual violations.
     */
    static Map<String, Object> errorBody(Exception e) {
        String m = e.getMessage();
        if (m == null || m.isBlank()) {
            m = e.getClass().getSimpleName();
        }
        Map<String, Object> body = errorBody(m);
        if (e instanceof ContentValidationException) {
            ContentValidationException invalid = (ContentValidationException) e;
            if (invalid.getDetails().size() > 1) {
                body.put("details", invalid.getDetails());
            }
        }
        return body;
    }

    /**
     * Maps a failed request onto a status: 400 for validation, 403 for path escapes,
     * 500 for everything else.
     */
    static void fail(Context ctx, AppLogger logger, String action, Exception e) {
        if (e instanceof ContentValidationException) {
            ctx.status(400).json(errorBody(e));
        } else if (e instanceof SecurityException) {
            logger.warn("Security violation while " + action + ": " + e.getMessage());
            ctx.status(403).json(errorBody(e));
        } else {
            logger.error("Error " + action + ": " + e.getMessage(), e);
            ctx.status(500).json(errorBody(e));
        }
    }
}
