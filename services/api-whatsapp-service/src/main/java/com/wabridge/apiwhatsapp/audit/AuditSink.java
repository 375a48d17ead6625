package com.wabridge.apiwhatsapp.audit;

/**
 * Destination of audit events.
 *
 * <p>Implementations may block and may throw; {@link AuditService} runs them off the caller's
 * thread and logs their failures.
 */
public interface AuditSink {
  void write(AuditEvent event);
}
