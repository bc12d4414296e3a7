package com.roundgrader.utils;

import com.typesafe.config.Config;

import java.time.Duration;
import java.util.List;

/**
 * Settings for the whole pipeline, read once from the {@code roundgrader} block of the
 * application configuration and passed down explicitly.
 * Values can be overridden with -D system properties or the environment variables referenced
 * in application.conf.
 */
public class PipelineSettings {
    private final String jdbcUrl;
    private final String evaluationUrl;
    private final String templatesResource;

    private final Duration dispatchTimeout;
    private final int dispatchMaxAttempts;
    private final List<Duration> dispatchRetryDelays;
    private final Duration pauseBetweenParticipants;

    private final Duration notifierTimeout;
    private final int notifierMaxRetries;
    private final Duration notifierBaseDelay;

    private final boolean interactiveEnabled;
    private final Duration pageLoadTimeout;
    private final Duration settleDelay;
    private final Duration staticFetchTimeout;
    private final boolean licenseCheckEnabled;
    private final String rawContentBaseUrl;
    private final boolean repositoryQualityChecksEnabled;
    private final String repoApiBaseUrl;

    private final List<String> criticalChecks;

    private final String serverHost;
    private final int serverPort;
    private final Duration batchAwaitTimeout;

    public PipelineSettings(Config config) {
        Config root = config.getConfig("roundgrader");
        this.jdbcUrl = root.getString("ledger.jdbc-url");
        this.evaluationUrl = root.getString("evaluation-url");
        this.templatesResource = root.getString("templates-resource");

        this.dispatchTimeout = root.getDuration("dispatch.timeout");
        this.dispatchMaxAttempts = root.getInt("dispatch.max-attempts");
        this.dispatchRetryDelays = List.copyOf(root.getDurationList("dispatch.retry-delays"));
        this.pauseBetweenParticipants = root.getDuration("dispatch.pause-between-participants");

        this.notifierTimeout = root.getDuration("notifier.timeout");
        this.notifierMaxRetries = root.getInt("notifier.max-retries");
        this.notifierBaseDelay = root.getDuration("notifier.base-delay");

        this.interactiveEnabled = root.getBoolean("checks.interactive-enabled");
        this.pageLoadTimeout = root.getDuration("checks.page-load-timeout");
        this.settleDelay = root.getDuration("checks.settle-delay");
        this.staticFetchTimeout = root.getDuration("checks.static-fetch-timeout");
        this.licenseCheckEnabled = root.getBoolean("checks.license-check-enabled");
        this.rawContentBaseUrl = root.getString("checks.raw-content-base-url");
        this.repositoryQualityChecksEnabled = root.getBoolean("checks.repository-quality-checks-enabled");
        this.repoApiBaseUrl = root.getString("checks.repo-api-base-url");

        this.criticalChecks = List.copyOf(root.getStringList("round2.critical-checks"));

        this.serverHost = root.getString("server.host");
        this.serverPort = root.getInt("server.port");
        this.batchAwaitTimeout = root.getDuration("batch.await-timeout");

        if (dispatchMaxAttempts < 1) {
            throw new IllegalArgumentException("roundgrader.dispatch.max-attempts must be at least 1");
        }
        if (dispatchRetryDelays.size() < dispatchMaxAttempts - 1) {
            throw new IllegalArgumentException("roundgrader.dispatch.retry-delays needs an entry between every two attempts");
        }
    }

    public String getJdbcUrl() { return jdbcUrl; }
    public String getEvaluationUrl() { return evaluationUrl; }
    public String getTemplatesResource() { return templatesResource; }

    public Duration getDispatchTimeout() { return dispatchTimeout; }
    public int getDispatchMaxAttempts() { return dispatchMaxAttempts; }
    public List<Duration> getDispatchRetryDelays() { return dispatchRetryDelays; }
    public Duration getPauseBetweenParticipants() { return pauseBetweenParticipants; }

    public Duration getNotifierTimeout() { return notifierTimeout; }
    public int getNotifierMaxRetries() { return notifierMaxRetries; }
    public Duration getNotifierBaseDelay() { return notifierBaseDelay; }

    public boolean isInteractiveEnabled() { return interactiveEnabled; }
    public Duration getPageLoadTimeout() { return pageLoadTimeout; }
    public Duration getSettleDelay() { return settleDelay; }
    public Duration getStaticFetchTimeout() { return staticFetchTimeout; }
    public boolean isLicenseCheckEnabled() { return licenseCheckEnabled; }
    public String getRawContentBaseUrl() { return rawContentBaseUrl; }
    public boolean isRepositoryQualityChecksEnabled() { return repositoryQualityChecksEnabled; }
    public String getRepoApiBaseUrl() { return repoApiBaseUrl; }

    public List<String> getCriticalChecks() { return criticalChecks; }

    public String getServerHost() { return serverHost; }
    public int getServerPort() { return serverPort; }
    public Duration getBatchAwaitTimeout() { return batchAwaitTimeout; }
}
