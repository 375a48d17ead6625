package com.wabridge.apiwhatsapp.audit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

/** Inserts audit events through the Supabase REST interface of the audit table. */
@Slf4j
public class SupabaseAuditSink implements AuditSink {

  private final RestClient rest;
  private final String serviceKey;
  private final String table;

  public SupabaseAuditSink(
      RestClient.Builder builder, String url, String serviceKey, String table) {
    this.rest = builder.baseUrl(url).build();
    this.serviceKey = serviceKey;
    this.table = table;
    log.info("Audit persistence enabled (table {})", table);
  }

  @Override
  public void write(AuditEvent event) {
    rest.post()
        .uri("/rest/v1/{table}", table)
        .header("apikey", serviceKey)
        .header("Authorization", "Bearer " + serviceKey)
        .header("Prefer", "return=minimal")
        .contentType(MediaType.APPLICATION_JSON)
        .body(event)
        .retrieve()
        .toBodilessEntity();
    log.debug("Audit event {} stored", event.eventType());
  }
}
