package com.wabridge.apiwhatsapp.model;

public enum ConnectionState {
  CONNECTING,
  OPEN,
  CLOSED
}
