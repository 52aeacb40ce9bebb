package com.ideia.contentgen.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection and retry settings for the Gemini generateContent API.
 */
@Validated
@ConfigurationProperties(prefix = "gemini")
public class GeminiProperties {
    private String apiKey;
    @NotBlank
    private String baseUrl = "https://generativelanguage.googleapis.com/v1beta";
    @NotBlank
    private String model = "gemini-1.5-flash";
    /**
     * Model used for the second half of the attempts of a failing call. Blank disables the swap.
     */
    private String fallbackModel = "gemini-1.5-pro";
    @Min(1)
    private int maxAttempts = 5;
    @Min(0)
    private long baseRetryDelayMs = 1000;
    @Min(1)
    private int requestTimeoutSec = 120;
    private double temperature = 0.9;
    /** Requests per minute across all workers. */
    @Min(1)
    private int rpm = 60;

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getFallbackModel() {
        return fallbackModel;
    }

    public void setFallbackModel(String fallbackModel) {
        this.fallbackModel = fallbackModel;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public long getBaseRetryDelayMs() {
        return baseRetryDelayMs;
    }

    public void setBaseRetryDelayMs(long baseRetryDelayMs) {
        this.baseRetryDelayMs = baseRetryDelayMs;
    }

    public int getRequestTimeoutSec() {
        return requestTimeoutSec;
    }

    public void setRequestTimeoutSec(int requestTimeoutSec) {
        this.requestTimeoutSec = requestTimeoutSec;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public int getRpm() {
        return rpm;
    }

    public void setRpm(int rpm) {
        this.rpm = rpm;
    }
}
