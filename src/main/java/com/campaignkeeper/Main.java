package com.campaignkeeper;

import com.campaignkeeper.controllers.CampaignController;
import com.campaignkeeper.controllers.Controller;
import com.campaignkeeper.controllers.ModuleController;
import com.campaignkeeper.controllers.PlayerController;
import com.campaignkeeper.modules.CampaignModules;
import com.campaignkeeper.modules.ModuleRegistry;
import com.campaignkeeper.storage.FrontmatterCodec;
import com.campaignkeeper.validation.ContentValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.util.List;

public class Main {

    private static final String VERSION = "1.0.0";
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static AppLogger logger;

    public static void main(String[] args) {
        try {
            // Environment first so command-line arguments win
            AppConfig config = new AppConfig.Builder()
                    .fromEnvironment()
                    .parseArgs(args)
                    .build();

            AppLogger.initialize(config.getLogPath(), config.isDevMode());
            logger = AppLogger.get();

            printBanner(config);

            FileLock fileLock = new FileLock(config.getLockStallMillis());
            FrontmatterCodec codec = new FrontmatterCodec();
            ModuleRegistry modules = new ModuleRegistry();

            ContentStore contentStore = new ContentStore(config.getCampaignsPath(), modules, fileLock, codec);
            contentStore.addListener(new DerivedArtifactCleaner(config.getCampaignsPath(), modules));

            RelationshipIndex relationshipIndex = new RelationshipIndex(contentStore, modules);
            CampaignModules.registerAll(modules, relationshipIndex);
            logger.info("Registered " + modules.getAll().size() + " content modules");

            CampaignManager campaignManager = new CampaignManager(config.getCampaignsPath(), codec.yamlMapper(), fileLock);
            ModuleContentService moduleContent = new ModuleContentService(campaignManager, contentStore, modules);
            PlayerContentService playerContent = new PlayerContentService(contentStore, relationshipIndex, modules);
            logger.info("Campaigns directory: " + config.getCampaignsPath());

            Javalin app = Javalin.create(cfg -> {
                cfg.jsonMapper(new JavalinJackson(objectMapper, false));
                cfg.http.defaultContentType = "application/json";
            });

            List<Controller> controllers = List.of(
                new CampaignController(campaignManager),
                new ModuleController(moduleContent, relationshipIndex, objectMapper),
                new PlayerController(playerContent, campaignManager)
            );
            for (Controller controller : controllers) {
                controller.registerRoutes(app);
            }

            registerExceptionHandlers(app);

            app.start(config.getPort());

            String url = "http://localhost:" + config.getPort() + "/";
            logger.info("Server started on " + url);
            logger.console("");
            logger.console("  Listening on " + url);
            logger.console("  Campaigns: " + config.getCampaignsPath());
            logger.console("  Log file: " + config.getLogPath());
            logger.console("");
            logger.console("========================================");
            logger.console("  Press Ctrl+C to stop");
            logger.console("========================================");

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                app.stop();
                fileLock.close();
                logger.close();
            }));

        } catch (Exception e) {
            System.err.println("Failed to start Campaign Keeper: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  Campaign Keeper v" + VERSION);
        logger.console("========================================");
        logger.console("  Starting server...");
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
    }

    private static void registerExceptionHandlers(Javalin app) {
        app.exception(ContentValidationException.class, (e, ctx) -> {
            ctx.status(400).json(Controller.errorBody(e));
        });

        app.exception(SecurityException.class, (e, ctx) -> {
            logger.warn("Security violation: " + e.getMessage());
            ctx.status(403).json(Controller.errorBody(e));
        });

        app.exception(Exception.class, (e, ctx) -> {
            logger.error("Unhandled exception: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        });
    }
}
