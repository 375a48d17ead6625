package com.wabridge.apiwhatsapp.client;

public class CrmClientException extends RuntimeException {
  public CrmClientException(String message) {
    super(message);
  }

  public CrmClientException(String message, Throwable cause) {
    super(message, cause);
  }
}
