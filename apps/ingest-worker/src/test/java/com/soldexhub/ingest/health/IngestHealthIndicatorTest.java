package com.soldexhub.ingest.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.soldexhub.ingest.pipeline.IngestStatus;
import com.soldexhub.integration.solana.stream.SolanaStreamClient;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.StaticListableBeanFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

class IngestHealthIndicatorTest {
  private final IngestStatus status = mock(IngestStatus.class);
  private final SolanaStreamClient streamClient = mock(SolanaStreamClient.class);

  @Test
  void shouldReportDownWithReasonAfterFatalError() {
    when(status.state()).thenReturn(IngestStatus.State.FAILED);
    when(status.failureReason()).thenReturn(Optional.of("Store access to trades failed after 5 attempts"));

    Health health = new IngestHealthIndicator(status, provider(streamClient)).health();

    assertEquals(Status.DOWN, health.getStatus());
    assertEquals("Store access to trades failed after 5 attempts", health.getDetails().get("reason"));
  }

  @Test
  void shouldReportOutOfServiceWhileRunningWithoutStream() {
    when(status.state()).thenReturn(IngestStatus.State.RUNNING);
    when(streamClient.isConnected()).thenReturn(false);
    when(streamClient.reconnectAttempts()).thenReturn(3L);

    Health health = new IngestHealthIndicator(status, provider(streamClient)).health();

    assertEquals(Status.OUT_OF_SERVICE, health.getStatus());
    assertEquals(false, health.getDetails().get("streamConnected"));
    assertEquals(3L, health.getDetails().get("reconnectAttempts"));
  }

  @Test
  void shouldReportUpWhenConnected() {
    when(status.state()).thenReturn(IngestStatus.State.RUNNING);
    when(streamClient.isConnected()).thenReturn(true);

    Health health = new IngestHealthIndicator(status, provider(streamClient)).health();

    assertEquals(Status.UP, health.getStatus());
    assertEquals("RUNNING", health.getDetails().get("state"));
  }

  @Test
  void shouldReportUpWhenStreamDisabled() {
    when(status.state()).thenReturn(IngestStatus.State.RUNNING);

    Health health = new IngestHealthIndicator(status, provider(null)).health();

    assertEquals(Status.UP, health.getStatus());
    assertEquals("disabled", health.getDetails().get("stream"));
  }

  private static ObjectProvider<SolanaStreamClient> provider(SolanaStreamClient client) {
    StaticListableBeanFactory beanFactory = new StaticListableBeanFactory();
    if (client != null) {
      beanFactory.addBean("solanaStreamClient", client);
    }
    return beanFactory.getBeanProvider(SolanaStreamClient.class);
  }
}
