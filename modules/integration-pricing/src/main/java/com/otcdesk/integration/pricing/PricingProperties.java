package com.otcdesk.integration.pricing;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "desk.pricing")
public class PricingProperties {
  private Oracle oracle = new Oracle();
  private Pools pools = new Pools();
  private Protection protection = new Protection();

  public Oracle getOracle() {
    return oracle;
  }

  public void setOracle(Oracle oracle) {
    this.oracle = oracle;
  }

  public Pools getPools() {
    return pools;
  }

  public void setPools(Pools pools) {
    this.pools = pools;
  }

  public Protection getProtection() {
    return protection;
  }

  public void setProtection(Protection protection) {
    this.protection = protection;
  }

  public static class Oracle {
    private String baseUrl = "https://api.coingecko.com/api/v3";
    private String apiKey = "";
    private String apiKeyFile = "";
    private long timeoutMs = 5000L;
    private long cacheTtlMs = 30000L;
    private Retry retry = new Retry();

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

    public String getApiKeyFile() {
      return apiKeyFile;
    }

    public void setApiKeyFile(String apiKeyFile) {
      this.apiKeyFile = apiKeyFile;
    }

    public long getTimeoutMs() {
      return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
      this.timeoutMs = timeoutMs;
    }

    public long getCacheTtlMs() {
      return cacheTtlMs;
    }

    public void setCacheTtlMs(long cacheTtlMs) {
      this.cacheTtlMs = cacheTtlMs;
    }

    public Retry getRetry() {
      return retry;
    }

    public void setRetry(Retry retry) {
      this.retry = retry;
    }
  }

  public static class Retry {
    private int maxAttempts = 3;
    private long baseBackoffMs = 250L;
    private long maxBackoffMs = 2000L;
    private boolean jitterEnabled = true;

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public long getBaseBackoffMs() {
      return baseBackoffMs;
    }

    public void setBaseBackoffMs(long baseBackoffMs) {
      this.baseBackoffMs = baseBackoffMs;
    }

    public long getMaxBackoffMs() {
      return maxBackoffMs;
    }

    public void setMaxBackoffMs(long maxBackoffMs) {
      this.maxBackoffMs = maxBackoffMs;
    }

    public boolean isJitterEnabled() {
      return jitterEnabled;
    }

    public void setJitterEnabled(boolean jitterEnabled) {
      this.jitterEnabled = jitterEnabled;
    }
  }

  public static class Pools {
    private BigDecimal minTvlUsd = new BigDecimal("10000");
    private long cacheTtlMs = 30000L;
    private GeckoTerminal geckoTerminal = new GeckoTerminal();
    private Map<String, EvmVenues> evm = new LinkedHashMap<>();

    public BigDecimal getMinTvlUsd() {
      return minTvlUsd;
    }

    public void setMinTvlUsd(BigDecimal minTvlUsd) {
      this.minTvlUsd = minTvlUsd;
    }

    public long getCacheTtlMs() {
      return cacheTtlMs;
    }

    public void setCacheTtlMs(long cacheTtlMs) {
      this.cacheTtlMs = cacheTtlMs;
    }

    public GeckoTerminal getGeckoTerminal() {
      return geckoTerminal;
    }

    public void setGeckoTerminal(GeckoTerminal geckoTerminal) {
      this.geckoTerminal = geckoTerminal;
    }

    public Map<String, EvmVenues> getEvm() {
      return evm;
    }

    public void setEvm(Map<String, EvmVenues> evm) {
      this.evm = evm;
    }
  }

  public static class GeckoTerminal {
    private boolean enabled = true;
    private String baseUrl = "https://api.geckoterminal.com/api/v2";
    private long timeoutMs = 5000L;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public long getTimeoutMs() {
      return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
      this.timeoutMs = timeoutMs;
    }
  }

  public static class EvmVenues {
    private String v3Factory = "";
    private List<Integer> v3FeeTiers = new ArrayList<>(List.of(100, 500, 3000, 10000));
    private String v2Factory = "";
    private String stableToken = "";
    private int stableDecimals = 6;
    private String wrappedNative = "";

    public String getV3Factory() {
      return v3Factory;
    }

    public void setV3Factory(String v3Factory) {
      this.v3Factory = v3Factory;
    }

    public List<Integer> getV3FeeTiers() {
      return v3FeeTiers;
    }

    public void setV3FeeTiers(List<Integer> v3FeeTiers) {
      this.v3FeeTiers = v3FeeTiers;
    }

    public String getV2Factory() {
      return v2Factory;
    }

    public void setV2Factory(String v2Factory) {
      this.v2Factory = v2Factory;
    }

    public String getStableToken() {
      return stableToken;
    }

    public void setStableToken(String stableToken) {
      this.stableToken = stableToken;
    }

    public int getStableDecimals() {
      return stableDecimals;
    }

    public void setStableDecimals(int stableDecimals) {
      this.stableDecimals = stableDecimals;
    }

    public String getWrappedNative() {
      return wrappedNative;
    }

    public void setWrappedNative(String wrappedNative) {
      this.wrappedNative = wrappedNative;
    }
  }

  public static class Protection {
    private BigDecimal defaultThresholdPercent = BigDecimal.TEN;
    private PriceProtectionPolicy policy = PriceProtectionPolicy.FAIL_OPEN;

    public BigDecimal getDefaultThresholdPercent() {
      return defaultThresholdPercent;
    }

    public void setDefaultThresholdPercent(BigDecimal defaultThresholdPercent) {
      this.defaultThresholdPercent = defaultThresholdPercent;
    }

    public PriceProtectionPolicy getPolicy() {
      return policy;
    }

    public void setPolicy(PriceProtectionPolicy policy) {
      this.policy = policy;
    }
  }
}
