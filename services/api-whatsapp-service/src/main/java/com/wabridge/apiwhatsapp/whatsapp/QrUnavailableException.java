package com.wabridge.apiwhatsapp.whatsapp;

public class QrUnavailableException extends RuntimeException {
  public QrUnavailableException(String message) {
    super(message);
  }
}
