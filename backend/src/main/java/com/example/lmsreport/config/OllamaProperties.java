package com.example.lmsreport.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * ollama.* の設定値。ローカルLLMを使わない場合は enabled=false のままにする。
 */
@ConfigurationProperties(prefix = "ollama")
public class OllamaProperties {

    private boolean enabled = false;
    private String baseUrl = "http://localhost:11434";
    private String modelName = "glm-4.7-flash:q4_K_M";
    private double temperature = 0.1;
    private int numPredict = 2048;
    private int timeoutSeconds = 120;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
    public String getModelName() { return modelName; }
    public void setModelName(String modelName) { this.modelName = modelName; }
    public double getTemperature() { return temperature; }
    public void setTemperature(double temperature) { this.temperature = temperature; }
    public int getNumPredict() { return numPredict; }
    public void setNumPredict(int numPredict) { this.numPredict = numPredict; }
    public int getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
}
