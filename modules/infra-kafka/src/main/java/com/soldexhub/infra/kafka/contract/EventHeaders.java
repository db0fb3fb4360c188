package com.soldexhub.infra.kafka.contract;

/** Record headers set on every published event, so consumers can route without parsing the body. */
public final class EventHeaders {
  public static final String EVENT_TYPE = "dex-event-type";
  public static final String EVENT_VERSION = "dex-event-version";
  public static final String EVENT_ID = "dex-event-id";
  public static final String SOURCE = "dex-source";
  public static final String CONTENT_TYPE = "content-type";
  public static final String JSON = "application/json";

  private EventHeaders() {}
}
