package com.wabridge.apiwhatsapp.config;

import com.github.benmanes.caffeine.cache.Ticker;
import com.wabridge.apiwhatsapp.audit.AuditService;
import com.wabridge.apiwhatsapp.audit.AuditSink;
import com.wabridge.apiwhatsapp.audit.LoggingAuditSink;
import com.wabridge.apiwhatsapp.audit.SupabaseAuditSink;
import com.wabridge.apiwhatsapp.client.CrmClient;
import com.wabridge.apiwhatsapp.client.WebhookClient;
import com.wabridge.apiwhatsapp.dedup.DedupCache;
import com.wabridge.apiwhatsapp.forward.InboundForwarder;
import com.wabridge.apiwhatsapp.forward.OutboundForwarder;
import com.wabridge.apiwhatsapp.media.MediaCache;
import com.wabridge.apiwhatsapp.queue.SendQueue;
import com.wabridge.apiwhatsapp.session.ChatSession;
import com.wabridge.apiwhatsapp.session.LoopbackChatSession;
import com.wabridge.apiwhatsapp.webhook.WebhookDirection;
import com.wabridge.apiwhatsapp.webhook.WebhookResolver;
import com.wabridge.apiwhatsapp.whatsapp.WhatsAppClient;
import java.time.Clock;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.client.RestClient;

/**
 * Builds the delivery pipeline. The send queue and both forwarders, each with its own dedup cache
 * and webhook resolver, are created here for the {@link WhatsAppClient} alone and closed by it.
 */
@Configuration
public class BridgeConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean(ChatSession.class)
  public LoopbackChatSession loopbackChatSession(BridgeProperties properties) {
    return new LoopbackChatSession(properties.session().phoneNumber());
  }

  @Bean(destroyMethod = "shutdown")
  public ExecutorService auditExecutor(BridgeProperties properties) {
    return boundedAuditExecutor(properties.audit().queueCapacity());
  }

  @Bean
  public AuditService auditService(
      BridgeProperties properties,
      RestClient.Builder builder,
      @Qualifier("auditExecutor") ExecutorService auditExecutor,
      Clock clock) {
    return new AuditService(auditSink(properties.audit(), builder), auditExecutor, clock);
  }

  /** One audit thread; records beyond {@code capacity} waiting ones are rejected. */
  static ExecutorService boundedAuditExecutor(int capacity) {
    return new ThreadPoolExecutor(
        1,
        1,
        0L,
        TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(capacity),
        r -> {
          Thread t = new Thread(r, "audit");
          t.setDaemon(true);
          return t;
        },
        new ThreadPoolExecutor.AbortPolicy());
  }

  static AuditSink auditSink(BridgeProperties.Audit audit, RestClient.Builder builder) {
    if (!audit.isConfigured()) {
      return new LoggingAuditSink();
    }
    return new SupabaseAuditSink(
        builder.requestFactory(BridgeClientConfig.requestFactory(audit.timeout())),
        audit.url(),
        audit.serviceKey(),
        audit.table());
  }

  @Bean
  public MediaCache mediaCache(
      @Qualifier("mediaRestClient") RestClient mediaRestClient, BridgeProperties properties) {
    BridgeProperties.Media media = properties.media();
    return new MediaCache(
        mediaRestClient, media.maxSize().toBytes(), media.ttl(), Ticker.systemTicker());
  }

  @Bean(initMethod = "initialize", destroyMethod = "shutdown")
  public WhatsAppClient whatsAppClient(
      ChatSession session,
      CrmClient crm,
      WebhookClient webhooks,
      MediaCache media,
      AuditService audit,
      TaskScheduler taskScheduler,
      BridgeProperties properties,
      Clock clock) {
    BridgeProperties.Queue queue = properties.queue();
    BridgeProperties.Webhooks hooks = properties.webhooks();

    InboundForwarder inbound =
        new InboundForwarder(
            dedupCache(properties.dedup(), taskScheduler, clock),
            new WebhookResolver(
                WebhookDirection.INBOUND,
                hooks.inboundUrl(),
                crm,
                hooks.refreshInterval(),
                clock),
            webhooks,
            audit,
            clock);
    OutboundForwarder outbound =
        new OutboundForwarder(
            dedupCache(properties.dedup(), taskScheduler, clock),
            new WebhookResolver(
                WebhookDirection.OUTBOUND,
                hooks.outboundUrl(),
                crm,
                hooks.refreshInterval(),
                clock),
            webhooks,
            crm,
            audit,
            clock);

    return new WhatsAppClient(
        session,
        new SendQueue(queue.maxRetries(), queue.retryDelay()),
        inbound,
        outbound,
        crm,
        media,
        audit,
        properties.session().qrTimeout(),
        properties.session().qrValidity(),
        clock);
  }

  private static DedupCache dedupCache(
      BridgeProperties.Dedup dedup, TaskScheduler scheduler, Clock clock) {
    DedupCache cache = new DedupCache(dedup.maxSize(), dedup.ttl(), clock);
    cache.scheduleSweep(scheduler, dedup.sweepInterval());
    return cache;
  }
}
