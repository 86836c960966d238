package com.otcdesk.integration.ledger.signer;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "desk.signer")
public class SignerRelayProperties {
  private String baseUrl = "http://localhost:8090";
  private String apiKey = "";
  private String apiSecret = "";
  private String apiKeyFile = "";
  private String apiSecretFile = "";
  private long recvWindowMs = 5000L;
  private long timeoutMs = 15000L;

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public String getApiKey() {
    return apiKey;
  }

  public void setApiKey(String apiKey) {
    this.apiKey = apiKey;
  }

  public String getApiSecret() {
    return apiSecret;
  }

  public void setApiSecret(String apiSecret) {
    this.apiSecret = apiSecret;
  }

  public String getApiKeyFile() {
    return apiKeyFile;
  }

  public void setApiKeyFile(String apiKeyFile) {
    this.apiKeyFile = apiKeyFile;
  }

  public String getApiSecretFile() {
    return apiSecretFile;
  }

  public void setApiSecretFile(String apiSecretFile) {
    this.apiSecretFile = apiSecretFile;
  }

  public long getRecvWindowMs() {
    return recvWindowMs;
  }

  public void setRecvWindowMs(long recvWindowMs) {
    this.recvWindowMs = recvWindowMs;
  }

  public long getTimeoutMs() {
    return timeoutMs;
  }

  public void setTimeoutMs(long timeoutMs) {
    this.timeoutMs = timeoutMs;
  }
}
