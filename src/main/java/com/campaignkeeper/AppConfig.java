package com.campaignkeeper;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Application configuration: campaigns directory, log location, port and lock diagnostics.
 */
public class AppConfig {

    private static final String APP_NAME = "Campaign-Keeper";
    private static final long DEFAULT_LOCK_STALL_MILLIS = 10_000L;

    private final Path campaignsPath;
    private final Path logPath;
    private final int port;
    private final boolean devMode;
    private final long lockStallMillis;

    private AppConfig(Path campaignsPath, Path logPath, int port, boolean devMode, long lockStallMillis) {
        this.campaignsPath = campaignsPath;
        this.logPath = logPath;
        this.port = port;
        this.devMode = devMode;
        this.lockStallMillis = lockStallMillis;
    }

    public Path getCampaignsPath() {
        return campaignsPath;
    }

    public Path getLogPath() {
        return logPath;
    }

    public int getPort() {
        return port;
    }

    public boolean isDevMode() {
        return devMode;
    }

    public long getLockStallMillis() {
        return lockStallMillis;
    }

    /**
     * Default campaigns directory.
     * Windows: %USERPROFILE%\Documents\Campaign-Keeper\campaigns
     * macOS: ~/Documents/Campaign-Keeper/campaigns
     * Linux: ~/Campaign-Keeper/campaigns
     */
    public static Path getDefaultCampaignsPath() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String documents = System.getenv("USERPROFILE");
            if (documents == null) {
                documents = userHome;
            }
            return Paths.get(documents, "Documents", APP_NAME, "campaigns");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Documents", APP_NAME, "campaigns");
        } else {
            return Paths.get(userHome, APP_NAME, "campaigns");
        }
    }

    /**
     * Log directory.
     * Windows: %APPDATA%\Campaign-Keeper\logs
     * macOS: ~/Library/Logs/Campaign-Keeper
     * Linux: ~/.local/share/Campaign-Keeper/logs
     */
    public static Path getLogDirectory() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData == null) {
                appData = Paths.get(userHome, "AppData", "Roaming").toString();
            }
            return Paths.get(appData, APP_NAME, "logs");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Logs", APP_NAME);
        } else {
            return Paths.get(userHome, ".local", "share", APP_NAME, "logs");
        }
    }

    public static Path getLogFilePath() {
        return getLogDirectory().resolve("campaign-keeper.log");
    }

    /**
     * Find an available port, starting with the preferred port.
     */
    public static int findAvailablePort(int preferredPort) {
        if (isPortAvailable(preferredPort)) {
            return preferredPort;
        }
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            for (int port = preferredPort + 1; port < preferredPort + 100; port++) {
                if (isPortAvailable(port)) {
                    return port;
                }
            }
        }
        return preferredPort;
    }

    public static boolean isPortAvailable(int port) {
        try (ServerSocket socket = new ServerSocket(port)) {
            socket.setReuseAddress(true);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    public static Path ensureLogDirectory() throws IOException {
        Files.createDirectories(getLogDirectory());
        return getLogFilePath();
    }

    /**
     * Builder for AppConfig. Command-line arguments win over the
     * {@code CAMPAIGNS_DIR} and {@code PORT} environment variables.
     */
    public static class Builder {
        private Path campaignsPath = null;
        private int preferredPort = 3001;
        private boolean devMode = false;
        private long lockStallMillis = DEFAULT_LOCK_STALL_MILLIS;

        public Builder campaignsPath(String path) {
            if (path != null && !path.isEmpty()) {
                this.campaignsPath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder port(int port) {
            this.preferredPort = port;
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            return this;
        }

        public Builder lockStallMillis(long lockStallMillis) {
            if (lockStallMillis > 0) {
                this.lockStallMillis = lockStallMillis;
            }
            return this;
        }

        public Builder fromEnvironment() {
            campaignsPath(System.getenv("CAMPAIGNS_DIR"));
            String envPort = System.getenv("PORT");
            if (envPort != null && !envPort.isBlank()) {
                port((int) parseNumber("PORT", envPort, preferredPort));
            }
            return this;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];

                if (arg.startsWith("--campaigns=")) {
                    campaignsPath(arg.substring("--campaigns=".length()));
                } else if ("--campaigns".equals(arg) && i + 1 < args.length) {
                    campaignsPath(args[++i]);
                }

                else if (arg.startsWith("--port=")) {
                    port((int) parseNumber("--port", arg.substring("--port=".length()), preferredPort));
                } else if ("--port".equals(arg) && i + 1 < args.length) {
                    port((int) parseNumber("--port", args[++i], preferredPort));
                }

                else if (arg.startsWith("--lock-stall-ms=")) {
                    lockStallMillis(parseNumber("--lock-stall-ms", arg.substring("--lock-stall-ms=".length()), lockStallMillis));
                } else if ("--lock-stall-ms".equals(arg) && i + 1 < args.length) {
                    lockStallMillis(parseNumber("--lock-stall-ms", args[++i], lockStallMillis));
                }

                else if ("--dev".equals(arg)) {
                    this.devMode = true;
                }
            }
            return this;
        }

        private static long parseNumber(String option, String value, long fallback) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                AppLogger.get().warn("[AppConfig] Ignoring " + option + "=" + value + ", not a number");
                return fallback;
            }
        }

        public AppConfig build() throws IOException {
            Path campaigns = campaignsPath != null ? campaignsPath : getDefaultCampaignsPath();
            Files.createDirectories(campaigns);
            int port = findAvailablePort(preferredPort);
            Path logPath = ensureLogDirectory();
            return new AppConfig(campaigns, logPath, port, devMode, lockStallMillis);
        }
    }
}
