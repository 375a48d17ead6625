package com.wabridge.apiwhatsapp.model;

/**
 * Connection notification from the chat session. A pure QR refresh carries a {@code qr} and no
 * state.
 *
 * @param statusCode close reason reported by the transport, if any
 * @param loggedOut true when the close was caused by an explicit logout (no reconnect wanted)
 */
public record ConnectionUpdate(
    ConnectionState state, String qr, Integer statusCode, boolean loggedOut) {

  public static ConnectionUpdate qr(String qr) {
    return new ConnectionUpdate(null, qr, null, false);
  }

  public static ConnectionUpdate connecting() {
    return new ConnectionUpdate(ConnectionState.CONNECTING, null, null, false);
  }

  public static ConnectionUpdate open() {
    return new ConnectionUpdate(ConnectionState.OPEN, null, null, false);
  }

  public static ConnectionUpdate closed(Integer statusCode, boolean loggedOut) {
    return new ConnectionUpdate(ConnectionState.CLOSED, null, statusCode, loggedOut);
  }

  public boolean hasQr() {
    return qr != null && !qr.isBlank();
  }
}
