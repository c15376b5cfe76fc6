package org.pixelforge.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Loads the YAML application configuration and installs the process log handlers.
 */
public class ConfigManager {
    private static final Logger APP_LOGGER = Logger.getLogger(ConfigManager.class.getName());

    public static final Path DEFAULT_CONFIG_PATH = Path.of("conf", "config.yaml");
    static final String BUNDLED_CONFIG = "/config.yaml";
    static final String LOG_FORMAT = "[%1$tF %1$tT] [%4$-7s] %3$s - %5$s %6$s%n";

    private ConfigManager() {
    }

    /**
     * Explicit path first, then {@code conf/config.yaml}, then the bundled defaults.
     */
    public static AppConfig getConfig(final Path explicitPath) throws IOException {
        if (explicitPath != null) return load(explicitPath);
        if (Files.isRegularFile(DEFAULT_CONFIG_PATH)) return load(DEFAULT_CONFIG_PATH);
        try (InputStream in = ConfigManager.class.getResourceAsStream(BUNDLED_CONFIG)) {
            if (in == null) {
                APP_LOGGER.warning("No configuration found, using built-in defaults.");
                return new AppConfig(null, null, null, null, null, null, null, null);
            }
            APP_LOGGER.fine("Loading bundled configuration " + BUNDLED_CONFIG);
            return yamlMapper().readValue(in, AppConfig.class);
        }
    }

    public static AppConfig load(final Path configPath) throws IOException {
        if (!Files.isRegularFile(configPath))
            throw new IOException("Configuration file not found: " + configPath.toAbsolutePath());
        APP_LOGGER.info("Loading configuration from " + configPath.toAbsolutePath());
        final AppConfig config = yamlMapper().readValue(configPath.toFile(), AppConfig.class);
        return config != null ? config : new AppConfig(null, null, null, null, null, null, null, null);
    }

    /**
     * Replaces the root logger's handlers with a one-line console handler and, when
     * {@code logFile} is set, a file handler using the same format.
     */
    public static void configureLogging(final String levelName, final Path logFile) throws IOException {
        final Level level = parseLevel(levelName);
        System.setProperty("java.util.logging.SimpleFormatter.format", LOG_FORMAT);

        final Logger rootLogger = Logger.getLogger("");
        for (Handler h : rootLogger.getHandlers()) {
            rootLogger.removeHandler(h);
            h.close();
        }

        final ConsoleHandler console = new ConsoleHandler();
        console.setFormatter(new SimpleFormatter());
        console.setLevel(level);
        rootLogger.addHandler(console);

        if (logFile != null) {
            final Path parent = logFile.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            final FileHandler file = new FileHandler(logFile.toString(), true);
            file.setFormatter(new SimpleFormatter());
            file.setLevel(level);
            rootLogger.addHandler(file);
        }
        rootLogger.setLevel(level);
    }

    /**
     * Accepts DEBUG/INFO/WARNING/ERROR/CRITICAL as well as the {@link Level} names.
     */
    public static Level parseLevel(final String levelName) {
        if (levelName == null || levelName.isBlank()) return Level.INFO;
        final String name = levelName.trim().toUpperCase(Locale.ROOT);
        switch (name) {
            case "DEBUG":
                return Level.FINE;
            case "ERROR":
            case "CRITICAL":
                return Level.SEVERE;
            default:
                try {
                    return Level.parse(name);
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Invalid log level: " + levelName, e);
                }
        }
    }

    static ObjectMapper yamlMapper() {
        final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }
}
