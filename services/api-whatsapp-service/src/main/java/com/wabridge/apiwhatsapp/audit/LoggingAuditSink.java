package com.wabridge.apiwhatsapp.audit;

import lombok.extern.slf4j.Slf4j;

/** Used when no audit store is configured: events only reach the debug log. */
@Slf4j
public class LoggingAuditSink implements AuditSink {

  public LoggingAuditSink() {
    log.warn("Audit persistence disabled: bridge.audit.url or bridge.audit.service-key not set");
  }

  @Override
  public void write(AuditEvent event) {
    log.debug(
        "Audit event: type={}, success={}, metadata={}",
        event.eventType(),
        event.success(),
        event.metadata());
  }
}
