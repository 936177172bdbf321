package com.codev.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the tower configuration file.
 */
@Slf4j
public class ConfigService {

    public static final Path DEFAULT_CONFIG_PATH = Path.of("~", ".codev", "tower.json");

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, TowerConfig> cache;
    private final Path configPath;
    private final Function<String, String> env;

    public ConfigService() {
        this(DEFAULT_CONFIG_PATH);
    }

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System::getenv);
    }

    ConfigService(Path configPath, Duration cacheTtl, Function<String, String> env) {
        // Expand ~ to user home directory
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            pathStr = System.getProperty("user.home") + pathStr.substring(1);
            configPath = Path.of(pathStr);
        }
        this.configPath = configPath;
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public TowerConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public TowerConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    /**
     * Get the config file path.
     */
    public Path getConfigPath() {
        return configPath;
    }

    private TowerConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return applyDefaults(new TowerConfig());
        }
        try {
            String raw = Files.readString(configPath);

            // Environment variable substitution
            raw = substituteEnvVars(raw);

            TowerConfig config = applyDefaults(objectMapper.readValue(raw, TowerConfig.class));
            log.info("Config loaded from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return applyDefaults(new TowerConfig());
        }
    }

    private TowerConfig applyDefaults(TowerConfig config) {
        if (config.getTunnel() == null) {
            config.setTunnel(new TowerConfig.TunnelConfig());
        }
        TowerConfig.TunnelConfig tunnel = config.getTunnel();
        if (tunnel.getLocalHost() == null || tunnel.getLocalHost().isBlank()) {
            tunnel.setLocalHost("127.0.0.1");
        }
        if (tunnel.getServerUrl() != null && tunnel.getServerUrl().isBlank()) {
            tunnel.setServerUrl(null);
        }
        return config;
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.apply(varName);
            if (value == null) {
                value = defaultValue != null ? defaultValue : "";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
