package com.wabridge.apiwhatsapp.whatsapp;

/** The chat session is not initialized or not connected. */
public class SessionUnavailableException extends RuntimeException {
  public SessionUnavailableException(String message) {
    super(message);
  }
}
