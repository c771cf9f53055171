package com.campaignkeeper;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Process-wide log. Lines go to the log file opened by {@link #initialize} and,
 * in dev mode, to stdout. Until then every component shares a stdout-only instance.
 */
public class AppLogger {

    enum Level { INFO, WARN, ERROR }

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static AppLogger shared;
    private static AppLogger stdoutOnly;

    private final PrintStream file;
    private final PrintStream stdout = System.out;
    private final boolean echo;

    private AppLogger(PrintStream file, boolean echo) {
        this.file = file;
        this.echo = echo;
    }

    public static synchronized void initialize(Path logFile, boolean echoToConsole) throws IOException {
        if (shared != null) {
            return;
        }
        PrintStream out = new PrintStream(
            Files.newOutputStream(logFile, StandardOpenOption.CREATE, StandardOpenOption.APPEND),
            true, StandardCharsets.UTF_8);
        out.println();
        out.println("---- campaign-keeper session " + LocalDateTime.now().format(STAMP) + " ----");
        shared = new AppLogger(out, echoToConsole);
    }

    public static synchronized AppLogger get() {
        if (shared != null) {
            return shared;
        }
        if (stdoutOnly == null) {
            stdoutOnly = new AppLogger(null, true);
        }
        return stdoutOnly;
    }

    public void info(String message) {
        write(Level.INFO, message, null);
    }

    public void warn(String message) {
        write(Level.WARN, message, null);
    }

    public void error(String message) {
        write(Level.ERROR, message, null);
    }

    public void error(String message, Throwable cause) {
        write(Level.ERROR, message, cause);
    }

    /**
     * Unformatted line, used for the startup banner.
     */
    public void console(String message) {
        emit(message, null);
    }

    public void close() {
        if (file != null) {
            file.close();
        }
    }

    private void write(Level level, String message, Throwable cause) {
        emit(LocalDateTime.now().format(STAMP) + " " + level + " " + message, cause);
    }

    private synchronized void emit(String line, Throwable cause) {
        if (file != null) {
            file.println(line);
            if (cause != null) {
                cause.printStackTrace(file);
            }
        }
        if (echo) {
            stdout.println(line);
            if (cause != null) {
                cause.printStackTrace(stdout);
            }
        }
    }
}
