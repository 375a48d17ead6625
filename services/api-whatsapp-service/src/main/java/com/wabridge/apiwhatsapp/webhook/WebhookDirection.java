package com.wabridge.apiwhatsapp.webhook;

/** Forwarding direction with the CRM settings field that holds its webhook address. */
public enum WebhookDirection {
  INBOUND("inbound", "n8n_webhook_inbound_url"),
  OUTBOUND("outbound", "n8n_webhook_url");

  private final String label;
  private final String settingsField;

  WebhookDirection(String label, String settingsField) {
    this.label = label;
    this.settingsField = settingsField;
  }

  public String label() {
    return label;
  }

  public String settingsField() {
    return settingsField;
  }
}
