package com.wabridge.apiwhatsapp.audit;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Map;

/** Row written to the audit store ({@code message_events}). */
public record AuditEvent(
    @JsonProperty("event_type") String eventType,
    Map<String, Object> metadata,
    boolean success,
    @JsonFormat(shape = JsonFormat.Shape.STRING) Instant timestamp) {

  public static AuditEvent of(String eventType, Map<String, Object> metadata, Instant timestamp) {
    boolean success = !Boolean.FALSE.equals(metadata.get("success"));
    return new AuditEvent(eventType, metadata, success, timestamp);
  }
}
