package com.otcdesk.integration.ledger;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "desk.ledger")
public class LedgerProperties {
  private long timeoutMs = 5000L;
  private Confirmation confirmation = new Confirmation();
  private Map<String, EvmChain> evm = new LinkedHashMap<>();
  private AltLedger alt = new AltLedger();

  public long getTimeoutMs() {
    return timeoutMs;
  }

  public void setTimeoutMs(long timeoutMs) {
    this.timeoutMs = timeoutMs;
  }

  public Confirmation getConfirmation() {
    return confirmation;
  }

  public void setConfirmation(Confirmation confirmation) {
    this.confirmation = confirmation;
  }

  public Map<String, EvmChain> getEvm() {
    return evm;
  }

  public void setEvm(Map<String, EvmChain> evm) {
    this.evm = evm;
  }

  public AltLedger getAlt() {
    return alt;
  }

  public void setAlt(AltLedger alt) {
    this.alt = alt;
  }

  public static class Confirmation {
    private long pollIntervalMs = 2000L;
    private long timeoutMs = 90000L;

    public long getPollIntervalMs() {
      return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
      this.pollIntervalMs = pollIntervalMs;
    }

    public long getTimeoutMs() {
      return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
      this.timeoutMs = timeoutMs;
    }
  }

  public static class EvmChain {
    private String rpcUrl = "";
    private String deskContract = "";
    private String signerAddress = "";
    private int stableDecimals = 6;

    public String getRpcUrl() {
      return rpcUrl;
    }

    public void setRpcUrl(String rpcUrl) {
      this.rpcUrl = rpcUrl;
    }

    public String getDeskContract() {
      return deskContract;
    }

    public void setDeskContract(String deskContract) {
      this.deskContract = deskContract;
    }

    public String getSignerAddress() {
      return signerAddress;
    }

    public void setSignerAddress(String signerAddress) {
      this.signerAddress = signerAddress;
    }

    public int getStableDecimals() {
      return stableDecimals;
    }

    public void setStableDecimals(int stableDecimals) {
      this.stableDecimals = stableDecimals;
    }
  }

  public static class AltLedger {
    private boolean enabled = false;
    private String rpcUrl = "https://api.mainnet-beta.solana.com";
    private String programId = "";
    private String deskAddress = "";
    private String signerAddress = "";
    private String commitment = "confirmed";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getRpcUrl() {
      return rpcUrl;
    }

    public void setRpcUrl(String rpcUrl) {
      this.rpcUrl = rpcUrl;
    }

    public String getProgramId() {
      return programId;
    }

    public void setProgramId(String programId) {
      this.programId = programId;
    }

    public String getDeskAddress() {
      return deskAddress;
    }

    public void setDeskAddress(String deskAddress) {
      this.deskAddress = deskAddress;
    }

    public String getSignerAddress() {
      return signerAddress;
    }

    public void setSignerAddress(String signerAddress) {
      this.signerAddress = signerAddress;
    }

    public String getCommitment() {
      return commitment;
    }

    public void setCommitment(String commitment) {
      this.commitment = commitment;
    }
  }
}
