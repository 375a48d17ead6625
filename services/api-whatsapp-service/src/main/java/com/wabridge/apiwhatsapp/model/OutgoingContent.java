package com.wabridge.apiwhatsapp.model;

/** What the session is asked to deliver: either plain text or an image with optional caption. */
public record OutgoingContent(String text, byte[] image, String caption) {

  public static OutgoingContent text(String text) {
    return new OutgoingContent(text, null, null);
  }

  public static OutgoingContent image(byte[] image, String caption) {
    return new OutgoingContent(null, image, caption);
  }

  public boolean isImage() {
    return image != null;
  }
}
