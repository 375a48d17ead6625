package com.wabridge.apiwhatsapp.session;

import com.wabridge.apiwhatsapp.model.ChatEvent;
import com.wabridge.apiwhatsapp.model.ConnectionUpdate;
import com.wabridge.apiwhatsapp.model.OutgoingContent;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * In-process session for local development and tests: nothing leaves the JVM.
 *
 * <p>With a configured phone number it pairs right away; without one it publishes a QR code and
 * waits for {@link #pair}. Messages are injected with {@link #inject}.
 */
@Slf4j
public class LoopbackChatSession implements ChatSession {

  private static final int LOGGED_OUT = 401;

  private final String configuredPhone;
  private final AtomicLong ids = new AtomicLong();
  private final List<SentMessage> sent = new CopyOnWriteArrayList<>();

  private volatile ChatSessionListener listener;
  private volatile String selfJid;
  private volatile boolean open;

  public LoopbackChatSession(String phoneNumber) {
    this.configuredPhone = phoneNumber == null ? "" : phoneNumber.trim();
  }

  @Override
  public void connect(ChatSessionListener listener) {
    this.listener = listener;
    listener.onConnectionUpdate(ConnectionUpdate.connecting());
    if (configuredPhone.isBlank()) {
      listener.onConnectionUpdate(ConnectionUpdate.qr("loopback-" + UUID.randomUUID()));
      return;
    }
    pair(configuredPhone);
  }

  /** Simulates scanning the QR code with the phone {@code phoneNumber}. */
  public void pair(String phoneNumber) {
    ChatSessionListener current = requireListener();
    selfJid = phoneNumber.replaceAll("\\D", "") + ":1@s.whatsapp.net";
    open = true;
    log.info("Loopback session paired as {}", selfJid);
    current.onConnectionUpdate(ConnectionUpdate.open());
  }

  public void inject(ChatEvent event) {
    requireListener().onMessages(List.of(event));
  }

  @Override
  public String send(String jid, OutgoingContent content) throws IOException {
    if (!open) {
      throw new IOException("Loopback session is not open");
    }
    String id = "LOOP" + ids.incrementAndGet();
    sent.add(new SentMessage(id, jid, content));
    log.info("Loopback send {} to {} (image={})", id, jid, content.isImage());
    return id;
  }

  @Override
  public void logout() {
    open = false;
    selfJid = null;
    ChatSessionListener current = listener;
    if (current != null) {
      current.onConnectionUpdate(ConnectionUpdate.closed(LOGGED_OUT, true));
    }
  }

  @Override
  public void clearCredentials() {
    log.debug("Loopback session keeps no credentials");
  }

  @Override
  public Optional<String> selfId() {
    return Optional.ofNullable(selfJid);
  }

  public List<SentMessage> sent() {
    return List.copyOf(sent);
  }

  private ChatSessionListener requireListener() {
    ChatSessionListener current = listener;
    if (current == null) {
      throw new IllegalStateException("Loopback session is not connected");
    }
    return current;
  }

  public record SentMessage(String id, String jid, OutgoingContent content) {}
}
