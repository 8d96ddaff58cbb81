package com.dexsentinel.app;

import com.dexsentinel.core.alert.AlertSettings;
import com.dexsentinel.core.stream.ProcessorSettings;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Typed, immutable configuration of the Dex Sentinel pipeline application.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the application is configurable through Docker {@code -e} flags or a shell
 * environment.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class AppConfig {

    // ---------------------------------------------------------------
    // HTTP
    // ---------------------------------------------------------------
    private final int httpPort;

    // ---------------------------------------------------------------
    // Rules
    // ---------------------------------------------------------------
    private final String rulesConfigPath;

    // ---------------------------------------------------------------
    // Stream processor
    // ---------------------------------------------------------------
    private final int eventLogCapacity;
    private final int pollIntervalSeconds;

    // ---------------------------------------------------------------
    // Alerts
    // ---------------------------------------------------------------
    private final int alertHistoryCapacity;
    private final String alertsDir;
    private final int alertDuplicateWindowSeconds;
    private final int alertMaxPerMinute;

    // ---------------------------------------------------------------
    // Catalog
    // ---------------------------------------------------------------
    private final String seedRecordsPath;

    private AppConfig(Builder b) {
        this.httpPort = b.httpPort;
        this.rulesConfigPath = b.rulesConfigPath;
        this.eventLogCapacity = b.eventLogCapacity;
        this.pollIntervalSeconds = b.pollIntervalSeconds;
        this.alertHistoryCapacity = b.alertHistoryCapacity;
        this.alertsDir = b.alertsDir;
        this.alertDuplicateWindowSeconds = b.alertDuplicateWindowSeconds;
        this.alertMaxPerMinute = b.alertMaxPerMinute;
        this.seedRecordsPath = b.seedRecordsPath;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build an {@link AppConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static AppConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Build an {@link AppConfig} from the given variables.
     *
     * @param env variable name to value
     * @return fully populated configuration
     * @throws IllegalStateException    if a value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    static AppConfig fromEnvironment(Map<String, String> env) {
        try {
            return new Builder()
                    .httpPort(parseInt(env, "HTTP_PORT", "8080"))
                    .rulesConfigPath(value(env, "RULES_CONFIG_PATH", ""))
                    .eventLogCapacity(parseInt(env, "EVENT_LOG_CAPACITY", "1000"))
                    .pollIntervalSeconds(parseInt(env, "POLL_INTERVAL_SECONDS", "5"))
                    .alertHistoryCapacity(parseInt(env, "ALERT_HISTORY_CAPACITY", "1000"))
                    .alertsDir(value(env, "ALERTS_DIR", "data/alerts"))
                    .alertDuplicateWindowSeconds(parseInt(env, "ALERT_DUPLICATE_WINDOW_SECONDS", "0"))
                    .alertMaxPerMinute(parseInt(env, "ALERT_MAX_PER_MINUTE", "0"))
                    .seedRecordsPath(value(env, "SEED_RECORDS_PATH", ""))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Core settings
    // ---------------------------------------------------------------

    public ProcessorSettings processorSettings() {
        return ProcessorSettings.builder()
                .eventLogCapacity(eventLogCapacity)
                .pollInterval(Duration.ofSeconds(pollIntervalSeconds))
                .build();
    }

    public AlertSettings alertSettings() {
        return AlertSettings.builder()
                .historyCapacity(alertHistoryCapacity)
                .duplicateWindow(Duration.ofSeconds(alertDuplicateWindowSeconds))
                .maxAlertsPerMinute(alertMaxPerMinute)
                .build();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getHttpPort() {
        return httpPort;
    }

    public String getRulesConfigPath() {
        return rulesConfigPath;
    }

    public int getEventLogCapacity() {
        return eventLogCapacity;
    }

    public int getPollIntervalSeconds() {
        return pollIntervalSeconds;
    }

    public int getAlertHistoryCapacity() {
        return alertHistoryCapacity;
    }

    public String getAlertsDir() {
        return alertsDir;
    }

    public int getAlertDuplicateWindowSeconds() {
        return alertDuplicateWindowSeconds;
    }

    public int getAlertMaxPerMinute() {
        return alertMaxPerMinute;
    }

    public String getSeedRecordsPath() {
        return seedRecordsPath;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link AppConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (port in [0, 65535] where 0 picks a free port, capacities &gt; 0,
     * intervals and limits &gt;= 0, non-blank alerts directory).
     * </p>
     */
    public static class Builder {
        private int httpPort = 8080;
        private String rulesConfigPath = "";
        private int eventLogCapacity = 1000;
        private int pollIntervalSeconds = 5;
        private int alertHistoryCapacity = 1000;
        private String alertsDir = "data/alerts";
        private int alertDuplicateWindowSeconds;
        private int alertMaxPerMinute;
        private String seedRecordsPath = "";

        public Builder httpPort(int v) {
            this.httpPort = v;
            return this;
        }

        public Builder rulesConfigPath(String v) {
            this.rulesConfigPath = v;
            return this;
        }

        public Builder eventLogCapacity(int v) {
            this.eventLogCapacity = v;
            return this;
        }

        public Builder pollIntervalSeconds(int v) {
            this.pollIntervalSeconds = v;
            return this;
        }

        public Builder alertHistoryCapacity(int v) {
            this.alertHistoryCapacity = v;
            return this;
        }

        public Builder alertsDir(String v) {
            this.alertsDir = v;
            return this;
        }

        public Builder alertDuplicateWindowSeconds(int v) {
            this.alertDuplicateWindowSeconds = v;
            return this;
        }

        public Builder alertMaxPerMinute(int v) {
            this.alertMaxPerMinute = v;
            return this;
        }

        public Builder seedRecordsPath(String v) {
            this.seedRecordsPath = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link AppConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public AppConfig build() {
            Objects.requireNonNull(rulesConfigPath, "rulesConfigPath required");
            Objects.requireNonNull(seedRecordsPath, "seedRecordsPath required");
            requireNonBlank(alertsDir, "alertsDir");

            if (httpPort < 0 || httpPort > 65_535) {
                throw new IllegalArgumentException(
                        "httpPort must be in [0, 65535], got: " + httpPort);
            }
            if (eventLogCapacity < 1) {
                throw new IllegalArgumentException(
                        "eventLogCapacity must be >= 1, got: " + eventLogCapacity);
            }
            if (alertHistoryCapacity < 1) {
                throw new IllegalArgumentException(
                        "alertHistoryCapacity must be >= 1, got: " + alertHistoryCapacity);
            }
            if (pollIntervalSeconds < 0) {
                throw new IllegalArgumentException(
                        "pollIntervalSeconds must be >= 0, got: " + pollIntervalSeconds);
            }
            if (alertDuplicateWindowSeconds < 0 || alertMaxPerMinute < 0) {
                throw new IllegalArgumentException(
                        "alert duplicate window and rate limit must be >= 0");
            }

            return new AppConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String value(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseInt(Map<String, String> env, String name, String defaultValue) {
        return Integer.parseInt(value(env, name, defaultValue).trim());
    }

    @Override
    public String toString() {
        return "AppConfig{" +
                "httpPort=" + httpPort +
                ", rulesConfigPath='" + rulesConfigPath + '\'' +
                ", eventLogCapacity=" + eventLogCapacity +
                ", pollIntervalSeconds=" + pollIntervalSeconds +
                ", alertHistoryCapacity=" + alertHistoryCapacity +
                ", alertsDir='" + alertsDir + '\'' +
                ", alertDuplicateWindowSeconds=" + alertDuplicateWindowSeconds +
                ", alertMaxPerMinute=" + alertMaxPerMinute +
                ", seedRecordsPath='" + seedRecordsPath + '\'' +
                '}';
    }
}
