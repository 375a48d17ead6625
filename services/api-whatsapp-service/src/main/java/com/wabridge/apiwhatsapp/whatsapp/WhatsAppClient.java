package com.wabridge.apiwhatsapp.whatsapp;

import com.fasterxml.jackson.databind.JsonNode;
import com.wabridge.apiwhatsapp.audit.AuditService;
import com.wabridge.apiwhatsapp.client.CrmClient;
import com.wabridge.apiwhatsapp.forward.InboundForwarder;
import com.wabridge.apiwhatsapp.forward.OutboundForwarder;
import com.wabridge.apiwhatsapp.forward.PhoneNumbers;
import com.wabridge.apiwhatsapp.media.MediaCache;
import com.wabridge.apiwhatsapp.model.ChatEvent;
import com.wabridge.apiwhatsapp.model.ConnectionState;
import com.wabridge.apiwhatsapp.model.ConnectionUpdate;
import com.wabridge.apiwhatsapp.model.OutgoingContent;
import com.wabridge.apiwhatsapp.model.SendMessageOptions;
import com.wabridge.apiwhatsapp.queue.SendQueue;
import com.wabridge.apiwhatsapp.session.ChatSession;
import com.wabridge.apiwhatsapp.session.ChatSessionListener;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point of the HTTP layer into the chat session.
 *
 * <p>Owns the send queue and both forwarders: session messages go to the inbound or outbound
 * forwarder, API sends go through the queue one at a time. Closing the session for any reason other
 * than a logout starts a new connection.
 */
@Slf4j
public class WhatsAppClient implements ChatSessionListener {

  private final ChatSession session;
  private final SendQueue queue;
  private final InboundForwarder inbound;
  private final OutboundForwarder outbound;
  private final CrmClient crm;
  private final MediaCache media;
  private final AuditService audit;
  private final Duration qrTimeout;
  private final Duration qrValidity;
  private final Clock clock;

  private final List<Consumer<ConnectionUpdate>> connectionWatchers =
      new CopyOnWriteArrayList<>();

  private volatile boolean initialized;
  private volatile boolean connected;
  private volatile String phoneNumber;
  private volatile QrCode qrCode;

  public WhatsAppClient(
      ChatSession session,
      SendQueue queue,
      InboundForwarder inbound,
      OutboundForwarder outbound,
      CrmClient crm,
      MediaCache media,
      AuditService audit,
      Duration qrTimeout,
      Duration qrValidity,
      Clock clock) {
    this.session = session;
    this.queue = queue;
    this.inbound = inbound;
    this.outbound = outbound;
    this.crm = crm;
    this.media = media;
    this.audit = audit;
    this.qrTimeout = qrTimeout;
    this.qrValidity = qrValidity;
    this.clock = clock;
  }

  /** Connects the session. A failure is logged and leaves the client unusable until retried. */
  public synchronized void initialize() {
    try {
      session.connect(this);
      initialized = true;
    } catch (Exception e) {
      initialized = false;
      log.error("Failed to initialize chat session", e);
    }
  }

  @Override
  public void onConnectionUpdate(ConnectionUpdate update) {
    if (update.hasQr()) {
      log.info("QR code generated");
      qrCode = new QrCode(update.qr(), clock.instant().plus(qrValidity));
    }

    ConnectionState state = update.state();
    if (state == ConnectionState.OPEN) {
      connected = true;
      qrCode = null;
      phoneNumber = session.selfId().map(WhatsAppClient::phoneOf).orElse(null);
      log.info("WhatsApp connected as {}", phoneNumber);
    } else if (state == ConnectionState.CONNECTING) {
      log.info("Connecting to WhatsApp...");
      connected = false;
    } else if (state == ConnectionState.CLOSED) {
      boolean reconnect = !update.loggedOut();
      log.warn(
          "Connection closed (status={}, reconnect={})", update.statusCode(), reconnect);
      resetConnectionState();
      if (reconnect) {
        log.info("Reconnecting...");
        initialize();
      }
    }

    connectionWatchers.forEach(watcher -> watcher.accept(update));
  }

  @Override
  public void onMessages(List<ChatEvent> events) {
    for (ChatEvent event : events) {
      try {
        if (event.fromMe()) {
          outbound.handle(event);
        } else {
          inbound.handle(event);
        }
      } catch (Exception e) {
        log.error(
            "Failed to handle {} message {}",
            event.fromMe() ? "outbound" : "inbound",
            event.id(),
            e);
      }
    }
  }

  /**
   * Queues a send and waits for its outcome.
   *
   * @return the message id assigned by the network
   * @throws SessionUnavailableException when the session is not initialized or not connected
   * @throws IllegalArgumentException when the options carry no text, image or template
   * @throws SendFailedException when every attempt failed
   */
  public String sendMessage(SendMessageOptions options) {
    if (!initialized) {
      throw new SessionUnavailableException("WhatsApp client not initialized");
    }
    if (!connected) {
      throw new SessionUnavailableException("WhatsApp not connected. Please connect first.");
    }
    if (!options.hasContent()) {
      throw new IllegalArgumentException("Either text, image, or template is required");
    }

    String messageId;
    try {
      messageId = queue.enqueue(options, this::executeSend).join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause() == null ? e : e.getCause();
      Map<String, Object> failure = new LinkedHashMap<>();
      failure.put("success", false);
      failure.put("error", String.valueOf(cause.getMessage()));
      failure.put("to", options.to());
      audit.record("send", failure);
      throw new SendFailedException(String.valueOf(cause.getMessage()), cause);
    }

    Map<String, Object> sent = new LinkedHashMap<>();
    sent.put("to", options.to());
    sent.put("messageId", messageId);
    sent.put("hasText", options.text() != null && !options.text().isBlank());
    sent.put("hasTemplate", options.hasTemplate());
    audit.record("send", sent);
    return messageId;
  }

  public ConnectionStatus getStatus() {
    return new ConnectionStatus(connected, phoneNumber);
  }

  public int pendingSends() {
    return queue.pendingCount();
  }

  /**
   * Returns a valid QR code, waiting up to the QR timeout for the session to publish one.
   *
   * @throws QrUnavailableException when already connected, when the session connects while
   *     waiting, or when no QR code arrives in time
   */
  public QrCode getQr() {
    Optional<QrCode> current = currentQr();
    if (current.isPresent()) {
      return current.get();
    }
    if (connected) {
      throw new QrUnavailableException("Already connected. Disconnect first to generate new QR.");
    }
    if (!initialized) {
      initialize();
    }

    CompletableFuture<QrCode> next = new CompletableFuture<>();
    Consumer<ConnectionUpdate> watcher =
        update -> {
          if (update.hasQr()) {
            next.complete(currentQr().orElse(new QrCode(update.qr(), null)));
          } else if (update.state() == ConnectionState.OPEN) {
            next.completeExceptionally(new QrUnavailableException("Already connected"));
          }
        };
    connectionWatchers.add(watcher);
    try {
      currentQr().ifPresent(next::complete);
      return next.orTimeout(qrTimeout.toMillis(), TimeUnit.MILLISECONDS).join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof QrUnavailableException) {
        throw (QrUnavailableException) e.getCause();
      }
      if (e.getCause() instanceof TimeoutException) {
        throw new QrUnavailableException("QR code generation timeout");
      }
      throw e;
    } finally {
      connectionWatchers.remove(watcher);
    }
  }

  /** Logs out, forgets the credentials and starts a fresh pairing. */
  public void disconnect() {
    try {
      session.logout();
    } catch (Exception e) {
      log.error("Error during logout: {}", e.getMessage());
    }
    resetConnectionState();
    initialized = false;

    try {
      session.clearCredentials();
      log.info("Auth state cleared");
    } catch (Exception e) {
      log.error("Error clearing auth state: {}", e.getMessage());
    }
    audit.record("disconnect", Map.of("success", true));

    initialize();
  }

  /** Re-reads both webhook addresses from the CRM now. */
  public void refreshWebhooks() {
    inbound.resolver().refresh();
    outbound.resolver().refresh();
  }

  public Optional<String> inboundWebhook() {
    return inbound.resolver().currentAddress();
  }

  public Optional<String> outboundWebhook() {
    return outbound.resolver().currentAddress();
  }

  public void shutdown() {
    queue.close();
    inbound.close();
    outbound.close();
    session.close();
  }

  private String executeSend(SendMessageOptions options) throws Exception {
    if (!initialized) {
      throw new SessionUnavailableException("WhatsApp client not initialized");
    }
    String jid = PhoneNumbers.toJid(options.to());
    String messageId;
    try {
      if (options.hasTemplate()) {
        messageId = sendTemplate(jid, options.template());
      } else if (options.hasImage()) {
        byte[] image =
            media
                .fetch(options.image().url())
                .orElseThrow(() -> new SendFailedException("Failed to download image"));
        String caption = options.caption() != null ? options.caption() : options.text();
        messageId = session.send(jid, OutgoingContent.image(image, caption));
      } else {
        messageId = session.send(jid, OutgoingContent.text(options.text()));
      }
    } catch (Exception e) {
      log.error("Failed to execute send to {} ({}): {}", options.to(), jid, e.getMessage());
      throw e;
    }
    return messageId == null || messageId.isBlank() ? generatedId() : messageId;
  }

  private String sendTemplate(String jid, SendMessageOptions.TemplateRef ref) throws Exception {
    JsonNode template =
        crm.findTemplate(ref.name(), ref.language())
            .orElseThrow(
                () ->
                    new SendFailedException(
                        "Template " + ref.name() + " (" + ref.language() + ") not found"));
    TemplateMessage message = TemplateMessage.from(template, ref.variablesOrEmpty());

    if (!message.images().isEmpty()) {
      Optional<byte[]> first = media.fetch(message.images().get(0));
      if (first.isPresent()) {
        String caption = message.text().isBlank() ? null : message.text();
        String messageId = session.send(jid, OutgoingContent.image(first.get(), caption));
        for (String url : message.images().subList(1, message.images().size())) {
          Optional<byte[]> more = media.fetch(url);
          if (more.isPresent()) {
            session.send(jid, OutgoingContent.image(more.get(), null));
          }
        }
        return messageId;
      }
    }

    if (message.text().isBlank()) {
      throw new SendFailedException("Template " + ref.name() + " has no content to send");
    }
    return session.send(jid, OutgoingContent.text(message.text()));
  }

  private Optional<QrCode> currentQr() {
    QrCode current = qrCode;
    if (current == null || current.expiresAt() == null) {
      return Optional.ofNullable(current);
    }
    return current.expiresAt().isAfter(clock.instant()) ? Optional.of(current) : Optional.empty();
  }

  private void resetConnectionState() {
    connected = false;
    phoneNumber = null;
    qrCode = null;
  }

  private String generatedId() {
    return Instant.now(clock).toEpochMilli() + "-" + UUID.randomUUID();
  }

  private static String phoneOf(String selfJid) {
    String user = selfJid;
    int at = user.indexOf('@');
    if (at >= 0) {
      user = user.substring(0, at);
    }
    int device = user.indexOf(':');
    return device >= 0 ? user.substring(0, device) : user;
  }
}
