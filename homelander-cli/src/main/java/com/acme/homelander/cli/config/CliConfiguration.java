package com.acme.homelander.cli.config;

import com.acme.homelander.config.HomelanderConfig;
import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CliConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(CliConfiguration.class);
    private static CliConfiguration instance;
    private final Dotenv dotenv;

    private CliConfiguration() {
        try {
            this.dotenv = Dotenv.configure()
                    .ignoreIfMissing()
                    .load();
            logger.info("Configuration loaded successfully");
        } catch (Exception e) {
            logger.warn("Failed to load .env file", e);
            throw new RuntimeException("Failed to initialize configuration", e);
        }
    }

    public static synchronized CliConfiguration getInstance() {
        if (instance == null) {
            instance = new CliConfiguration();
        }
        return instance;
    }

    private String get(String key, String defaultValue) {
        String value = dotenv.get(key);
        return value != null && !value.isBlank() ? value : defaultValue;
    }

    private boolean getBoolean(String key, boolean defaultValue) {
        String value = dotenv.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        if ("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value)) {
            return Boolean.parseBoolean(value);
        }
        logger.warn("Invalid boolean value for {}: {}, using default: {}", key, value, defaultValue);
        return defaultValue;
    }

    // Fulfillment
    public String getAgentUserId() {
        return get("HOMELANDER_AGENT_USER_ID", "demo-user");
    }

    public String getSyncFailureCode() {
        return get("HOMELANDER_SYNC_FAILURE_CODE", "transientError");
    }

    // Output
    public boolean isPrettyOutput() {
        return getBoolean("HOMELANDER_PRETTY", true);
    }

    // Demo home
    public boolean isDemoLockJammed() {
        return getBoolean("HOMELANDER_DEMO_LOCK_JAMMED", false);
    }

    public HomelanderConfig toHomelanderConfig() {
        HomelanderConfig config = new HomelanderConfig(getAgentUserId());
        config.setSyncFailureErrorCode(getSyncFailureCode());
        return config;
    }
}
