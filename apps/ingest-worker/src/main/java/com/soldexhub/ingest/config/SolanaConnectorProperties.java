package com.soldexhub.ingest.config;

import com.soldexhub.domain.trades.DexKind;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "solana")
public class SolanaConnectorProperties {
  private Rpc rpc = new Rpc();
  private Stream stream = new Stream();

  public Rpc getRpc() {
    return rpc;
  }

  public void setRpc(Rpc rpc) {
    this.rpc = rpc;
  }

  public Stream getStream() {
    return stream;
  }

  public void setStream(Stream stream) {
    this.stream = stream;
  }

  public static class Rpc {
    private String url = "https://api.mainnet-beta.solana.com";
    private String commitment = "confirmed";
    private Duration timeout = Duration.ofSeconds(10);
    private int maxAttempts = 4;
    private Duration retryBaseBackoff = Duration.ofMillis(250);
    private Duration retryMaxBackoff = Duration.ofSeconds(5);

    public String getUrl() {
      return url;
    }

    public void setUrl(String url) {
      this.url = url;
    }

    public String getCommitment() {
      return commitment;
    }

    public void setCommitment(String commitment) {
      this.commitment = commitment;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getRetryBaseBackoff() {
      return retryBaseBackoff;
    }

    public void setRetryBaseBackoff(Duration retryBaseBackoff) {
      this.retryBaseBackoff = retryBaseBackoff;
    }

    public Duration getRetryMaxBackoff() {
      return retryMaxBackoff;
    }

    public void setRetryMaxBackoff(Duration retryMaxBackoff) {
      this.retryMaxBackoff = retryMaxBackoff;
    }
  }

  public static class Stream {
    private boolean enabled = true;
    private String url = "wss://api.mainnet-beta.solana.com";
    private List<DexKind> programs = new ArrayList<>(List.of(DexKind.values()));
    private String commitment = "confirmed";
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration pingInterval = Duration.ofSeconds(30);
    private Duration reconnectBaseBackoff = Duration.ofSeconds(1);
    private Duration reconnectMaxBackoff = Duration.ofSeconds(30);
    private Duration stableConnectionReset = Duration.ofMinutes(1);
    private int maxConsecutiveFailures = 10;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getUrl() {
      return url;
    }

    public void setUrl(String url) {
      this.url = url;
    }

    public List<DexKind> getPrograms() {
      return programs;
    }

    public void setPrograms(List<DexKind> programs) {
      this.programs = programs;
    }

    public String getCommitment() {
      return commitment;
    }

    public void setCommitment(String commitment) {
      this.commitment = commitment;
    }

    public Duration getConnectTimeout() {
      return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
    }

    public Duration getPingInterval() {
      return pingInterval;
    }

    public void setPingInterval(Duration pingInterval) {
      this.pingInterval = pingInterval;
    }

    public Duration getReconnectBaseBackoff() {
      return reconnectBaseBackoff;
    }

    public void setReconnectBaseBackoff(Duration reconnectBaseBackoff) {
      this.reconnectBaseBackoff = reconnectBaseBackoff;
    }

    public Duration getReconnectMaxBackoff() {
      return reconnectMaxBackoff;
    }

    public void setReconnectMaxBackoff(Duration reconnectMaxBackoff) {
      this.reconnectMaxBackoff = reconnectMaxBackoff;
    }

    public Duration getStableConnectionReset() {
      return stableConnectionReset;
    }

    public void setStableConnectionReset(Duration stableConnectionReset) {
      this.stableConnectionReset = stableConnectionReset;
    }

    public int getMaxConsecutiveFailures() {
      return maxConsecutiveFailures;
    }

    public void setMaxConsecutiveFailures(int maxConsecutiveFailures) {
      this.maxConsecutiveFailures = maxConsecutiveFailures;
    }
  }
}
