package com.wabridge.apiwhatsapp.session;

import com.wabridge.apiwhatsapp.model.OutgoingContent;
import java.io.IOException;
import java.util.Optional;

/**
 * Live connection to the messaging network: pairing, credentials, encryption and transport live
 * behind this interface.
 */
public interface ChatSession {

  /**
   * Starts (or restarts) the connection. Progress, QR codes and messages are reported to
   * {@code listener}.
   */
  void connect(ChatSessionListener listener) throws IOException;

  /**
   * Delivers {@code content} to {@code jid}.
   *
   * @return the id the network assigned to the message, or {@code null} when none was reported
   */
  String send(String jid, OutgoingContent content) throws IOException;

  /** Unpairs the device. The session reports a logged-out close afterwards. */
  void logout() throws IOException;

  /** Removes the stored credentials so the next {@link #connect} starts a new pairing. */
  void clearCredentials() throws IOException;

  /** JID of the paired account, e.g. {@code 85291234567:12@s.whatsapp.net}. */
  Optional<String> selfId();

  default void close() {}
}
