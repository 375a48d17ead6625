package com.wabridge.apiwhatsapp.forward;

import com.wabridge.apiwhatsapp.audit.AuditService;
import com.wabridge.apiwhatsapp.client.CrmClient;
import com.wabridge.apiwhatsapp.client.WebhookClient;
import com.wabridge.apiwhatsapp.dedup.DedupCache;
import com.wabridge.apiwhatsapp.webhook.WebhookResolver;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;

/**
 * Mirrors messages typed on the paired phone itself. The CRM has no other record of them, so each
 * one is first stored through the CRM API; a failed store is logged and forwarding goes on.
 */
@Slf4j
public class OutboundForwarder extends MessageForwarder {

  private final CrmClient crm;

  public OutboundForwarder(
      DedupCache dedup,
      WebhookResolver resolver,
      WebhookClient webhooks,
      CrmClient crm,
      AuditService audit,
      Clock clock) {
    super(dedup, resolver, webhooks, audit, clock);
    this.crm = crm;
  }

  @Override
  protected String counterpartKey() {
    return "to";
  }

  @Override
  protected void beforeForward(Normalized message) {
    try {
      int status =
          crm.saveOutboundMessage(
              CrmMessage.outboundRecord(
                  message.id(), message.phone(), message.text(), message.timestamp()));
      if (status >= 200 && status < 300) {
        log.info("Outbound message {} saved to CRM", message.id());
      } else {
        log.warn("CRM refused outbound message {} with status {}", message.id(), status);
      }
    } catch (Exception e) {
      log.error("Error saving outbound message {} to CRM: {}", message.id(), e.getMessage());
    }
  }

  @Override
  protected CrmMessage webhookPayload(Normalized message) {
    return CrmMessage.outboundWebhook(
        message.id(), message.phone(), message.text(), message.timestamp());
  }
}
