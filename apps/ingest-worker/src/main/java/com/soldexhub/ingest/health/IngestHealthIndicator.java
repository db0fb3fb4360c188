package com.soldexhub.ingest.health;

import com.soldexhub.ingest.pipeline.IngestStatus;
import com.soldexhub.integration.solana.stream.SolanaStreamClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/** DOWN after a fatal ingest error, OUT_OF_SERVICE while the running pipeline has no live stream. */
public class IngestHealthIndicator implements HealthIndicator {
  private final IngestStatus status;
  private final ObjectProvider<SolanaStreamClient> streamClient;

  public IngestHealthIndicator(IngestStatus status, ObjectProvider<SolanaStreamClient> streamClient) {
    this.status = status;
    this.streamClient = streamClient;
  }

  @Override
  public Health health() {
    IngestStatus.State state = status.state();
    if (state == IngestStatus.State.FAILED) {
      return Health.down()
          .withDetail("state", state.name())
          .withDetail("reason", status.failureReason().orElse("unknown"))
          .build();
    }
    SolanaStreamClient client = streamClient.getIfAvailable();
    if (client == null) {
      return Health.up().withDetail("state", state.name()).withDetail("stream", "disabled").build();
    }
    Health.Builder builder =
        state == IngestStatus.State.RUNNING && !client.isConnected() ? Health.outOfService() : Health.up();
    return builder
        .withDetail("state", state.name())
        .withDetail("streamConnected", client.isConnected())
        .withDetail("reconnectAttempts", client.reconnectAttempts())
        .build();
  }
}
