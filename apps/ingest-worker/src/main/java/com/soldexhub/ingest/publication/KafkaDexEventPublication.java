package com.soldexhub.ingest.publication;

import com.soldexhub.domain.trades.CurveCompletedEvent;
import com.soldexhub.domain.trades.PoolMetadata;
import com.soldexhub.domain.trades.Trade;
import com.soldexhub.infra.kafka.contract.payload.CurveCompletedV1;
import com.soldexhub.infra.kafka.contract.payload.PoolCreatedV1;
import com.soldexhub.infra.kafka.contract.payload.TradeRecordedV1;
import com.soldexhub.infra.kafka.producer.DexEventProducer;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes committed rows to Kafka without waiting for acknowledgements. A failed send is logged and
 * counted; the ledger is already durable, so nothing is retried here.
 */
public class KafkaDexEventPublication implements DexEventPublication {
  private static final Logger log = LoggerFactory.getLogger(KafkaDexEventPublication.class);
  private static final String PUBLISH_COUNTER = "ingest.publication.total";

  private final DexEventProducer producer;
  private final MeterRegistry meterRegistry;

  public KafkaDexEventPublication(DexEventProducer producer, MeterRegistry meterRegistry) {
    this.producer = Objects.requireNonNull(producer, "producer must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
  }

  @Override
  public void tradesRecorded(List<Trade> trades) {
    for (Trade trade : trades) {
      send("trade", trade.txid(), () -> producer.publishTradeRecorded(toPayload(trade)));
    }
  }

  @Override
  public void poolCreated(PoolMetadata pool) {
    send(
        "pool",
        pool.address(),
        () ->
            producer.publishPoolCreated(
                new PoolCreatedV1(
                    pool.address(),
                    pool.dexKind().storageName(),
                    pool.mintA(),
                    pool.mintB(),
                    pool.decimalsA(),
                    pool.decimalsB())));
  }

  @Override
  public void curveCompleted(CurveCompletedEvent event) {
    send(
        "curve",
        event.mint(),
        () ->
            producer.publishCurveCompleted(
                new CurveCompletedV1(
                    event.mint(),
                    event.bondingCurve(),
                    event.trader(),
                    event.slot(),
                    event.txid(),
                    event.blockTime())));
  }

  static TradeRecordedV1 toPayload(Trade trade) {
    return new TradeRecordedV1(
        trade.txid(),
        trade.idx(),
        trade.slot(),
        trade.blockTime(),
        trade.dexKind().storageName(),
        trade.poolAddress(),
        trade.mint(),
        trade.decimals(),
        trade.trader(),
        trade.buy(),
        trade.solAmount(),
        trade.tokenAmount(),
        trade.priceSol());
  }

  private void send(String kind, String reference, Supplier<CompletableFuture<?>> publish) {
    CompletableFuture<?> future;
    try {
      future = publish.get();
    } catch (RuntimeException ex) {
      onFailure(kind, reference, ex);
      return;
    }
    future.whenComplete(
        (ignored, error) -> {
          if (error == null) {
            meterRegistry.counter(PUBLISH_COUNTER, "kind", kind, "outcome", "success").increment();
          } else {
            onFailure(kind, reference, error);
          }
        });
  }

  private void onFailure(String kind, String reference, Throwable error) {
    Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    meterRegistry.counter(PUBLISH_COUNTER, "kind", kind, "outcome", "failure").increment();
    log.warn(
        "Event publication failed kind={} ref={} error={}",
        kind,
        reference,
        cause.getClass().getSimpleName());
  }
}
