package com.starscape.bracketflow.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings for the external compute provider and its admission gate.
 * Binds to app.dispatch.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.dispatch")
public class DispatchProperties {

    private String providerUrl = "http://localhost:8090";
    private String providerApiKey;
    private Duration requestTimeout = Duration.ofSeconds(30);
    private Duration connectTimeout = Duration.ofSeconds(5);
    private int maxConcurrency = 4;
    private int estimatedRunSeconds = 180;
    private int minEstimatedRunSeconds = 30;
    private int queueAlertThreshold = 100;
    private int etaAlertSeconds = 600;
    private String callbackUrl;
    private String callbackSecret;
    private String manifestPrefix = "jobs";
    private Duration submissionTimeout = Duration.ofMinutes(10);

    public String getProviderUrl() {
        return providerUrl;
    }

    public void setProviderUrl(String providerUrl) {
        this.providerUrl = providerUrl;
    }

    public String getProviderApiKey() {
        return providerApiKey;
    }

    public void setProviderApiKey(String providerApiKey) {
        this.providerApiKey = providerApiKey;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public int getEstimatedRunSeconds() {
        return estimatedRunSeconds;
    }

    public void setEstimatedRunSeconds(int estimatedRunSeconds) {
        this.estimatedRunSeconds = estimatedRunSeconds;
    }

    public int getMinEstimatedRunSeconds() {
        return minEstimatedRunSeconds;
    }

    public void setMinEstimatedRunSeconds(int minEstimatedRunSeconds) {
        this.minEstimatedRunSeconds = minEstimatedRunSeconds;
    }

    public int getQueueAlertThreshold() {
        return queueAlertThreshold;
    }

    public void setQueueAlertThreshold(int queueAlertThreshold) {
        this.queueAlertThreshold = queueAlertThreshold;
    }

    public int getEtaAlertSeconds() {
        return etaAlertSeconds;
    }

    public void setEtaAlertSeconds(int etaAlertSeconds) {
        this.etaAlertSeconds = etaAlertSeconds;
    }

    public String getCallbackUrl() {
        return callbackUrl;
    }

    public void setCallbackUrl(String callbackUrl) {
        this.callbackUrl = callbackUrl;
    }

    public String getCallbackSecret() {
        return callbackSecret;
    }

    public void setCallbackSecret(String callbackSecret) {
        this.callbackSecret = callbackSecret;
    }

    public String getManifestPrefix() {
        return manifestPrefix;
    }

    public void setManifestPrefix(String manifestPrefix) {
        this.manifestPrefix = manifestPrefix;
    }

    /**
     * How long a recorded manifest without an execution handle blocks a repeat submission.
     */
    public Duration getSubmissionTimeout() {
        return submissionTimeout;
    }

    public void setSubmissionTimeout(Duration submissionTimeout) {
        this.submissionTimeout = submissionTimeout;
    }
}
