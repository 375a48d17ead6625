package com.wabridge.apiwhatsapp.whatsapp;

/** A send that failed for good, after the queue used up its retries. */
public class SendFailedException extends RuntimeException {
  public SendFailedException(String message) {
    super(message);
  }

  public SendFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
