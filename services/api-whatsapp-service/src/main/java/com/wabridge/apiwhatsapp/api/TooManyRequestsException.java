package com.wabridge.apiwhatsapp.api;

/** Semantic HTTP 429 for callers over their request budget. */
public class TooManyRequestsException extends RuntimeException {
  public TooManyRequestsException(String message) {
    super(message);
  }
}
