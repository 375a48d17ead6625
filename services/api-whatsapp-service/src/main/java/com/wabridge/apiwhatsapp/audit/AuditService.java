package com.wabridge.apiwhatsapp.audit;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;

/**
 * Fire-and-forget audit trail. {@link #record} returns immediately; the sink runs on the audit
 * executor and its failures end up in the log only.
 */
@Slf4j
public class AuditService {

  private final AuditSink sink;
  private final Executor executor;
  private final Clock clock;

  public AuditService(AuditSink sink, Executor executor, Clock clock) {
    this.sink = sink;
    this.executor = executor;
    this.clock = clock;
  }

  public void record(String eventType, Map<String, Object> metadata) {
    AuditEvent event = AuditEvent.of(eventType, new LinkedHashMap<>(metadata), clock.instant());
    try {
      executor.execute(() -> write(event));
    } catch (RejectedExecutionException e) {
      log.warn("Audit event {} dropped: {}", eventType, e.getMessage());
    }
  }

  private void write(AuditEvent event) {
    try {
      sink.write(event);
    } catch (Exception e) {
      log.error("Failed to write audit event {}: {}", event.eventType(), e.getMessage());
    }
  }
}
