package com.wabridge.apiwhatsapp.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;

/**
 * Settings of the bridge, bound once at startup from {@code bridge.*}.
 *
 * <p>Each component receives the nested record it needs; nothing else reads the environment.
 */
@ConfigurationProperties(prefix = "bridge")
public record BridgeProperties(
    @DefaultValue Api api,
    @DefaultValue Crm crm,
    @DefaultValue Webhooks webhooks,
    @DefaultValue Queue queue,
    @DefaultValue Dedup dedup,
    @DefaultValue Media media,
    @DefaultValue Session session,
    @DefaultValue Audit audit) {

  public record Api(@DefaultValue("") String key, @DefaultValue RateLimit rateLimit) {}

  public record RateLimit(
      @DefaultValue("PT60S") Duration window, @DefaultValue("20") int maxRequests) {}

  /**
   * @param timeout applies to the settings lookup
   * @param requestTimeout applies to message persistence and template lookups
   */
  public record Crm(
      @DefaultValue("http://localhost:3000") String baseUrl,
      @DefaultValue("") String apiKey,
      @DefaultValue("PT5S") Duration timeout,
      @DefaultValue("PT10S") Duration requestTimeout) {}

  public record Webhooks(
      @DefaultValue("") String inboundUrl,
      @DefaultValue("") String outboundUrl,
      @DefaultValue("PT5M") Duration refreshInterval,
      @DefaultValue("PT10S") Duration forwardTimeout) {}

  public record Queue(
      @DefaultValue("3") int maxRetries, @DefaultValue("PT1S") Duration retryDelay) {}

  public record Dedup(
      @DefaultValue("1000") int maxSize,
      @DefaultValue("PT1H") Duration ttl,
      @DefaultValue("PT5M") Duration sweepInterval) {}

  public record Media(
      @DefaultValue("100MB") DataSize maxSize,
      @DefaultValue("PT1H") Duration ttl,
      @DefaultValue("PT30S") Duration timeout) {}

  public record Session(
      @DefaultValue("PT30S") Duration qrTimeout,
      @DefaultValue("PT2M") Duration qrValidity,
      @DefaultValue("") String phoneNumber) {}

  /**
   * @param timeout applies to each insert into the audit store
   * @param queueCapacity audit records allowed to wait for the audit thread; more are dropped
   */
  public record Audit(
      @DefaultValue("") String url,
      @DefaultValue("") String serviceKey,
      @DefaultValue("message_events") String table,
      @DefaultValue("PT10S") Duration timeout,
      @DefaultValue("1000") int queueCapacity) {

    public boolean isConfigured() {
      return url != null && !url.isBlank() && serviceKey != null && !serviceKey.isBlank();
    }
  }
}
