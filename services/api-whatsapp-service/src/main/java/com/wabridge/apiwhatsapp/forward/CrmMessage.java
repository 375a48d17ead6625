package com.wabridge.apiwhatsapp.forward;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Message body the CRM understands, both for webhooks and for its own message store.
 *
 * <p>{@code from} always carries the counterpart number, also for messages typed on the phone.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CrmMessage(
    String action,
    String direction,
    String provider,
    String from,
    String body,
    String message,
    @JsonProperty("message_id") String messageId,
    String timestamp,
    String type,
    @JsonProperty("phone_e164") String phoneE164) {

  static final String INBOUND_PROVIDER = "baileys";
  static final String MOBILE_PROVIDER = "wa-bridge-mobile";

  public static CrmMessage inbound(String messageId, String phone, String text, String timestamp) {
    return new CrmMessage(
        null, null, INBOUND_PROVIDER, phone, text, text, messageId, timestamp, "text", phone);
  }

  public static CrmMessage outboundRecord(
      String messageId, String phone, String text, String timestamp) {
    return new CrmMessage(
        null, "out", null, phone, text, text, messageId, timestamp, "text", phone);
  }

  public static CrmMessage outboundWebhook(
      String messageId, String phone, String text, String timestamp) {
    return new CrmMessage(
        "message_sent",
        "out",
        MOBILE_PROVIDER,
        phone,
        text,
        text,
        messageId,
        timestamp,
        "text",
        phone);
  }
}
