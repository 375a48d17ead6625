package com.wabridge.apiwhatsapp.model;

import java.time.Instant;

/**
 * One message seen by the chat session.
 *
 * <p>{@code remoteJid} is the counterpart of the conversation: the sender for received messages and
 * the recipient for messages typed on the paired phone ({@code fromMe == true}). The session has
 * already flattened plain and extended text into {@code text}; it is empty for media-only messages.
 */
public record ChatEvent(
    String id, String remoteJid, String text, Long timestampSeconds, boolean fromMe) {

  private static final String GROUP_SUFFIX = "@g.us";
  private static final String BROADCAST_SUFFIX = "@broadcast";

  public ChatEvent {
    id = id == null ? "" : id;
    remoteJid = remoteJid == null ? "" : remoteJid;
    text = text == null ? "" : text;
  }

  public boolean isGroupOrBroadcast() {
    return remoteJid.contains(GROUP_SUFFIX) || remoteJid.contains(BROADCAST_SUFFIX);
  }

  public Instant sentAt(Instant fallback) {
    return timestampSeconds == null ? fallback : Instant.ofEpochSecond(timestampSeconds);
  }
}
