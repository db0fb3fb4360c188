package com.soldexhub.ingest.pipeline;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/** Lifecycle of the ingest pipeline as seen by health checks. FAILED is terminal. */
public class IngestStatus {
  public enum State {
    STARTING,
    RUNNING,
    DRAINING,
    STOPPED,
    FAILED
  }

  private final AtomicReference<State> state = new AtomicReference<>(State.STARTING);
  private final AtomicReference<String> failureReason = new AtomicReference<>();

  public State state() {
    return state.get();
  }

  public Optional<String> failureReason() {
    return Optional.ofNullable(failureReason.get());
  }

  public boolean isFailed() {
    return state.get() == State.FAILED;
  }

  boolean transition(State expected, State next) {
    return state.compareAndSet(expected, next);
  }

  /** @return {@code true} for the first failure only */
  boolean markFailed(String reason) {
    while (true) {
      State current = state.get();
      if (current == State.FAILED) {
        return false;
      }
      if (state.compareAndSet(current, State.FAILED)) {
        failureReason.set(reason);
        return true;
      }
    }
  }
}
