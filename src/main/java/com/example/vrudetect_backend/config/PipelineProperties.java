package com.example.vrudetect_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Defaults and tuning for detection jobs. Request fields left empty fall back to these values.
 */
@ConfigurationProperties(prefix = "detection.job")
public class PipelineProperties {

    private int defaultStride = 5;
    private long perFrameTimeoutMs = 15_000;
    private long totalTimeoutMs = 300_000;
    private double confidenceThreshold = 0.5;
    private int maxConcurrency = 4;
    private int maxConcurrencyLimit = 32;
    private int maxRetries = 2;
    private long retryBackoffMs = 200;
    private long gracePeriodMs = 2_000;
    private boolean fallbackEnabled = true;
    private int syntheticCount = 3;
    private double minIou = 0.3;
    private int maxGap = 3;
    private double emaAlpha = 0.5;
    private double nmsIou = 0.45;
    private Map<String, Double> classMinConfidence = new LinkedHashMap<>();
    private long resultRetentionMinutes = 60;

    public int getDefaultStride() {
        return defaultStride;
    }

    public void setDefaultStride(int defaultStride) {
        this.defaultStride = defaultStride;
    }

    public long getPerFrameTimeoutMs() {
        return perFrameTimeoutMs;
    }

    public void setPerFrameTimeoutMs(long perFrameTimeoutMs) {
        this.perFrameTimeoutMs = perFrameTimeoutMs;
    }

    public long getTotalTimeoutMs() {
        return totalTimeoutMs;
    }

    public void setTotalTimeoutMs(long totalTimeoutMs) {
        this.totalTimeoutMs = totalTimeoutMs;
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public void setConfidenceThreshold(double confidenceThreshold) {
        this.confidenceThreshold = confidenceThreshold;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public int getMaxConcurrencyLimit() {
        return maxConcurrencyLimit;
    }

    public void setMaxConcurrencyLimit(int maxConcurrencyLimit) {
        this.maxConcurrencyLimit = maxConcurrencyLimit;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public long getRetryBackoffMs() {
        return retryBackoffMs;
    }

    public void setRetryBackoffMs(long retryBackoffMs) {
        this.retryBackoffMs = retryBackoffMs;
    }

    public long getGracePeriodMs() {
        return gracePeriodMs;
    }

    public void setGracePeriodMs(long gracePeriodMs) {
        this.gracePeriodMs = gracePeriodMs;
    }

    public boolean isFallbackEnabled() {
        return fallbackEnabled;
    }

    public void setFallbackEnabled(boolean fallbackEnabled) {
        this.fallbackEnabled = fallbackEnabled;
    }

    public int getSyntheticCount() {
        return syntheticCount;
    }

    public void setSyntheticCount(int syntheticCount) {
        this.syntheticCount = syntheticCount;
    }

    public double getMinIou() {
        return minIou;
    }

    public void setMinIou(double minIou) {
        this.minIou = minIou;
    }

    public int getMaxGap() {
        return maxGap;
    }

    public void setMaxGap(int maxGap) {
        this.maxGap = maxGap;
    }

    public double getEmaAlpha() {
        return emaAlpha;
    }

    public void setEmaAlpha(double emaAlpha) {
        this.emaAlpha = emaAlpha;
    }

    public double getNmsIou() {
        return nmsIou;
    }

    public void setNmsIou(double nmsIou) {
        this.nmsIou = nmsIou;
    }

    public Map<String, Double> getClassMinConfidence() {
        return classMinConfidence;
    }

    public void setClassMinConfidence(Map<String, Double> classMinConfidence) {
        this.classMinConfidence = classMinConfidence;
    }

    public long getResultRetentionMinutes() {
        return resultRetentionMinutes;
    }

    public void setResultRetentionMinutes(long resultRetentionMinutes) {
        this.resultRetentionMinutes = resultRetentionMinutes;
    }
}
