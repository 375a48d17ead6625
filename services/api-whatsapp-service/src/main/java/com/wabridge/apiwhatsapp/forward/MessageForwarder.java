package com.wabridge.apiwhatsapp.forward;

import com.wabridge.apiwhatsapp.audit.AuditService;
import com.wabridge.apiwhatsapp.client.WebhookClient;
import com.wabridge.apiwhatsapp.dedup.DedupCache;
import com.wabridge.apiwhatsapp.model.ChatEvent;
import com.wabridge.apiwhatsapp.webhook.WebhookResolver;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Mirrors chat messages of one direction into the CRM.
 *
 * <p>Per message: skip groups and broadcasts, drop ids already seen, normalize the counterpart
 * number, resolve the webhook, post once and write one audit record. Nothing is retried and nothing
 * escapes {@link #handle}, so one failing message never stalls the session's event stream.
 */
@Slf4j
public abstract class MessageForwarder implements AutoCloseable {

  static final String NOT_CONFIGURED = "Webhook URL not configured";

  private final DedupCache dedup;
  private final WebhookResolver resolver;
  private final WebhookClient webhooks;
  private final AuditService audit;
  private final Clock clock;

  protected MessageForwarder(
      DedupCache dedup,
      WebhookResolver resolver,
      WebhookClient webhooks,
      AuditService audit,
      Clock clock) {
    this.dedup = dedup;
    this.resolver = resolver;
    this.webhooks = webhooks;
    this.audit = audit;
    this.clock = clock;
  }

  public final void handle(ChatEvent event) {
    try {
      forward(event);
    } catch (Exception e) {
      log.error("Unexpected failure handling {} message {}", label(), event.id(), e);
    }
  }

  public WebhookResolver resolver() {
    return resolver;
  }

  public int dedupSize() {
    return dedup.size();
  }

  @Override
  public void close() {
    dedup.close();
  }

  /** Audit event type and log label. */
  protected String label() {
    return resolver.direction().label();
  }

  /** Metadata key naming the counterpart number in audit records. */
  protected abstract String counterpartKey();

  protected abstract CrmMessage webhookPayload(Normalized message);

  /** Runs after the webhook address is resolved and before the webhook is called. */
  protected void beforeForward(Normalized message) {}

  private void forward(ChatEvent event) {
    if (event.isGroupOrBroadcast()) {
      return;
    }
    if (!dedup.addIfAbsent(event.id())) {
      log.debug("Duplicate {} message {} ignored", label(), event.id());
      return;
    }

    Normalized message =
        new Normalized(
            event.id(),
            PhoneNumbers.toE164(event.remoteJid()),
            event.text(),
            event.sentAt(clock.instant()).toString());
    log.info("Processing {} message {} ({})", label(), message.id(), message.phone());

    Optional<String> url = resolver.getAddress();
    beforeForward(message);

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("messageId", message.id());
    metadata.put(counterpartKey(), message.phone());

    if (url.isEmpty()) {
      log.warn("{} webhook not configured, message {} not forwarded", label(), message.id());
      metadata.put("success", false);
      metadata.put("error", NOT_CONFIGURED);
      audit.record(label(), metadata);
      return;
    }

    try {
      int status = webhooks.post(url.get(), webhookPayload(message));
      boolean ok = status >= 200 && status < 300;
      if (ok) {
        log.info("{} message {} forwarded to {}", label(), message.id(), url.get());
      } else {
        log.error(
            "{} webhook rejected message {} with status {}", label(), message.id(), status);
      }
      metadata.put("success", ok);
      metadata.put("status", status);
    } catch (Exception e) {
      log.error("Error forwarding {} message {}: {}", label(), message.id(), e.getMessage());
      metadata.put("success", false);
      metadata.put("error", String.valueOf(e.getMessage()));
    }
    audit.record(label(), metadata);
  }

  /** A chat event reduced to what the CRM receives. */
  protected record Normalized(String id, String phone, String text, String timestamp) {}
}
