package com.wabridge.apiwhatsapp.forward;

import com.wabridge.apiwhatsapp.audit.AuditService;
import com.wabridge.apiwhatsapp.client.WebhookClient;
import com.wabridge.apiwhatsapp.dedup.DedupCache;
import com.wabridge.apiwhatsapp.webhook.WebhookResolver;
import java.time.Clock;

/** Forwards messages received on the paired phone to the CRM inbound webhook. */
public class InboundForwarder extends MessageForwarder {

  public InboundForwarder(
      DedupCache dedup,
      WebhookResolver resolver,
      WebhookClient webhooks,
      AuditService audit,
      Clock clock) {
    super(dedup, resolver, webhooks, audit, clock);
  }

  @Override
  protected String counterpartKey() {
    return "from";
  }

  @Override
  protected CrmMessage webhookPayload(Normalized message) {
    return CrmMessage.inbound(message.id(), message.phone(), message.text(), message.timestamp());
  }
}
