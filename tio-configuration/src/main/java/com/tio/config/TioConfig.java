package com.tio.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Configuration loaded from environment variables for the TIO dispatcher and worker.
 * <p>
 * Queues: TIO_QUEUES (comma-separated valid queue names), TIO_DEFAULT_QUEUE (fallback for plugins
 * whose configured queue is not valid), TIO_QUEUE_PREFIX (prepended to every queue name on submission).
 * <p>
 * Time limits: TIO_DEFAULT_SOFT_TIME_LIMIT (plugins without an explicit limit),
 * TIO_STAGE_TRANSITION_TIME_LIMIT (stage transition tasks).
 * <p>
 * Storage: TIO_PARAMETER_STORE ({@code memory} or {@code redis}), TIO_CACHE_HOST, TIO_CACHE_PORT,
 * TIO_REPORT_LEDGER (persist plugin reports to PostgreSQL), TIO_DB_HOST, TIO_DB_PORT, TIO_DB_NAME,
 * TIO_DB_USER, TIO_DB_PASSWORD.
 * <p>
 * Worker: TIO_MANIFEST_DIR, TIO_TEMPORAL_TARGET, TIO_TEMPORAL_NAMESPACE.
 */
public final class TioConfig {

    private static final String ENV_QUEUES = "TIO_QUEUES";
    private static final String ENV_DEFAULT_QUEUE = "TIO_DEFAULT_QUEUE";
    private static final String ENV_QUEUE_PREFIX = "TIO_QUEUE_PREFIX";
    private static final String ENV_DEFAULT_SOFT_TIME_LIMIT = "TIO_DEFAULT_SOFT_TIME_LIMIT";
    private static final String ENV_STAGE_TRANSITION_TIME_LIMIT = "TIO_STAGE_TRANSITION_TIME_LIMIT";
    private static final String ENV_PARAMETER_STORE = "TIO_PARAMETER_STORE";
    private static final String ENV_CACHE_HOST = "TIO_CACHE_HOST";
    private static final String ENV_CACHE_PORT = "TIO_CACHE_PORT";
    private static final String ENV_REPORT_LEDGER = "TIO_REPORT_LEDGER";
    private static final String ENV_DB_HOST = "TIO_DB_HOST";
    private static final String ENV_DB_PORT = "TIO_DB_PORT";
    private static final String ENV_DB_NAME = "TIO_DB_NAME";
    private static final String ENV_DB_USER = "TIO_DB_USER";
    private static final String ENV_DB_PASSWORD = "TIO_DB_PASSWORD";
    private static final String ENV_MANIFEST_DIR = "TIO_MANIFEST_DIR";
    private static final String ENV_TEMPORAL_TARGET = "TIO_TEMPORAL_TARGET";
    private static final String ENV_TEMPORAL_NAMESPACE = "TIO_TEMPORAL_NAMESPACE";

    public static final String DEFAULT_QUEUE = "default";
    public static final int DEFAULT_SOFT_TIME_LIMIT_SECONDS = 60;
    public static final int DEFAULT_STAGE_TRANSITION_TIME_LIMIT_SECONDS = 10;
    public static final String PARAMETER_STORE_MEMORY = "memory";
    public static final String PARAMETER_STORE_REDIS = "redis";

    private static final String DEFAULT_DB_NAME = "tio";
    private static final String DEFAULT_MANIFEST_DIR = "manifests";

    private final QueueSettings queueSettings;
    private final int defaultSoftTimeLimitSeconds;
    private final int stageTransitionTimeLimitSeconds;
    private final String parameterStore;
    private final String cacheHost;
    private final int cachePort;
    private final boolean reportLedgerEnabled;
    private final String dbHost;
    private final int dbPort;
    private final String dbName;
    private final String dbUser;
    private final String dbPassword;
    private final String manifestDir;
    private final String temporalTarget;
    private final String temporalNamespace;

    private TioConfig(Builder b) {
        this.queueSettings = new QueueSettings(b.queues, b.defaultQueue, b.queuePrefix);
        this.defaultSoftTimeLimitSeconds = b.defaultSoftTimeLimitSeconds > 0
                ? b.defaultSoftTimeLimitSeconds : DEFAULT_SOFT_TIME_LIMIT_SECONDS;
        this.stageTransitionTimeLimitSeconds = b.stageTransitionTimeLimitSeconds > 0
                ? b.stageTransitionTimeLimitSeconds : DEFAULT_STAGE_TRANSITION_TIME_LIMIT_SECONDS;
        this.parameterStore = b.parameterStore;
        this.cacheHost = b.cacheHost;
        this.cachePort = b.cachePort;
        this.reportLedgerEnabled = b.reportLedgerEnabled;
        this.dbHost = b.dbHost;
        this.dbPort = b.dbPort;
        this.dbName = b.dbName != null ? b.dbName : DEFAULT_DB_NAME;
        this.dbUser = b.dbUser != null ? b.dbUser : "tio";
        this.dbPassword = b.dbPassword != null ? b.dbPassword : "";
        this.manifestDir = b.manifestDir;
        this.temporalTarget = b.temporalTarget;
        this.temporalNamespace = b.temporalNamespace;
    }

    /** Valid queues, default queue and queue prefix. */
    public QueueSettings getQueueSettings() {
        return queueSettings;
    }

    /** Soft time limit (seconds) for plugins whose config does not declare one. Default 60. */
    public int getDefaultSoftTimeLimitSeconds() {
        return defaultSoftTimeLimitSeconds;
    }

    /** Soft time limit (seconds) of stage transition tasks. Default 10. */
    public int getStageTransitionTimeLimitSeconds() {
        return stageTransitionTimeLimitSeconds;
    }

    /** Parameter store backend: {@value #PARAMETER_STORE_MEMORY} or {@value #PARAMETER_STORE_REDIS}. */
    public String getParameterStore() {
        return parameterStore;
    }

    public String getCacheHost() {
        return cacheHost;
    }

    public int getCachePort() {
        return cachePort;
    }

    /** Whether plugin reports are persisted to PostgreSQL (TIO_REPORT_LEDGER). Default false. */
    public boolean isReportLedgerEnabled() {
        return reportLedgerEnabled;
    }

    public String getDbHost() {
        return dbHost;
    }

    public int getDbPort() {
        return dbPort;
    }

    public String getDbName() {
        return dbName;
    }

    public String getDbUser() {
        return dbUser;
    }

    public String getDbPassword() {
        return dbPassword;
    }

    /** Directory scanned for plugin manifests ({@code *.json}). Default {@code manifests}. */
    public String getManifestDir() {
        return manifestDir;
    }

    public String getTemporalTarget() {
        return temporalTarget;
    }

    public String getTemporalNamespace() {
        return temporalNamespace;
    }

    public static TioConfig fromEnvironment() {
        List<String> queues = parseCommaSeparated(System.getenv(ENV_QUEUES));
        if (queues.isEmpty()) {
            queues = List.of(DEFAULT_QUEUE);
        }
        return builder()
                .queues(queues)
                .defaultQueue(getEnv(ENV_DEFAULT_QUEUE, DEFAULT_QUEUE))
                .queuePrefix(getEnv(ENV_QUEUE_PREFIX, ""))
                .defaultSoftTimeLimitSeconds(parseInt(System.getenv(ENV_DEFAULT_SOFT_TIME_LIMIT), DEFAULT_SOFT_TIME_LIMIT_SECONDS))
                .stageTransitionTimeLimitSeconds(parseInt(System.getenv(ENV_STAGE_TRANSITION_TIME_LIMIT), DEFAULT_STAGE_TRANSITION_TIME_LIMIT_SECONDS))
                .parameterStore(getEnv(ENV_PARAMETER_STORE, PARAMETER_STORE_MEMORY))
                .cacheHost(getEnv(ENV_CACHE_HOST, "localhost"))
                .cachePort(parseInt(System.getenv(ENV_CACHE_PORT), 6379))
                .reportLedgerEnabled(parseBoolean(System.getenv(ENV_REPORT_LEDGER), false))
                .dbHost(getEnv(ENV_DB_HOST, "localhost"))
                .dbPort(parseInt(System.getenv(ENV_DB_PORT), 5432))
                .dbName(getEnv(ENV_DB_NAME, DEFAULT_DB_NAME))
                .dbUser(getEnv(ENV_DB_USER, "tio"))
                .dbPassword(getEnv(ENV_DB_PASSWORD, ""))
                .manifestDir(getEnv(ENV_MANIFEST_DIR, DEFAULT_MANIFEST_DIR))
                .temporalTarget(getEnv(ENV_TEMPORAL_TARGET, "localhost:7233"))
                .temporalNamespace(getEnv(ENV_TEMPORAL_NAMESPACE, "default"))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(String key, String defaultValue) {
        String v = System.getenv(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private List<String> queues = List.of(DEFAULT_QUEUE);
        private String defaultQueue = DEFAULT_QUEUE;
        private String queuePrefix = "";
        private int defaultSoftTimeLimitSeconds = DEFAULT_SOFT_TIME_LIMIT_SECONDS;
        private int stageTransitionTimeLimitSeconds = DEFAULT_STAGE_TRANSITION_TIME_LIMIT_SECONDS;
        private String parameterStore = PARAMETER_STORE_MEMORY;
        private String cacheHost = "localhost";
        private int cachePort = 6379;
        private boolean reportLedgerEnabled;
        private String dbHost = "localhost";
        private int dbPort = 5432;
        private String dbName = DEFAULT_DB_NAME;
        private String dbUser = "tio";
        private String dbPassword = "";
        private String manifestDir = DEFAULT_MANIFEST_DIR;
        private String temporalTarget = "localhost:7233";
        private String temporalNamespace = "default";

        public Builder queues(List<String> queues) {
            this.queues = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(queues, "queues")));
            return this;
        }

        public Builder defaultQueue(String defaultQueue) {
            this.defaultQueue = defaultQueue != null && !defaultQueue.isBlank() ? defaultQueue.trim() : DEFAULT_QUEUE;
            return this;
        }

        public Builder queuePrefix(String queuePrefix) {
            this.queuePrefix = queuePrefix != null ? queuePrefix.trim() : "";
            return this;
        }

        public Builder defaultSoftTimeLimitSeconds(int seconds) {
            this.defaultSoftTimeLimitSeconds = seconds;
            return this;
        }

        public Builder stageTransitionTimeLimitSeconds(int seconds) {
            this.stageTransitionTimeLimitSeconds = seconds;
            return this;
        }

        public Builder parameterStore(String parameterStore) {
            this.parameterStore = parameterStore != null ? parameterStore.trim().toLowerCase() : PARAMETER_STORE_MEMORY;
            return this;
        }

        public Builder cacheHost(String cacheHost) {
            this.cacheHost = cacheHost;
            return this;
        }

        public Builder cachePort(int cachePort) {
            this.cachePort = cachePort;
            return this;
        }

        public Builder reportLedgerEnabled(boolean reportLedgerEnabled) {
            this.reportLedgerEnabled = reportLedgerEnabled;
            return this;
        }

        public Builder dbHost(String dbHost) {
            this.dbHost = dbHost;
            return this;
        }

        public Builder dbPort(int dbPort) {
            this.dbPort = dbPort;
            return this;
        }

        public Builder dbName(String dbName) {
            this.dbName = dbName;
            return this;
        }

        public Builder dbUser(String dbUser) {
            this.dbUser = dbUser;
            return this;
        }

        public Builder dbPassword(String dbPassword) {
            this.dbPassword = dbPassword;
            return this;
        }

        public Builder manifestDir(String manifestDir) {
            this.manifestDir = manifestDir != null ? manifestDir : DEFAULT_MANIFEST_DIR;
            return this;
        }

        public Builder temporalTarget(String temporalTarget) {
            this.temporalTarget = temporalTarget;
            return this;
        }

        public Builder temporalNamespace(String temporalNamespace) {
            this.temporalNamespace = temporalNamespace;
            return this;
        }

        public TioConfig build() {
            return new TioConfig(this);
        }
    }
}
