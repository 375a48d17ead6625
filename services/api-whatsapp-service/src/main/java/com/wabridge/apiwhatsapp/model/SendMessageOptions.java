package com.wabridge.apiwhatsapp.model;

import java.util.List;

/**
 * Send request accepted by {@code POST /send}. Exactly one content kind is used: template first,
 * then image, then text.
 */
public record SendMessageOptions(
    String to, String text, ImageRef image, String caption, TemplateRef template) {

  public static SendMessageOptions text(String to, String text) {
    return new SendMessageOptions(to, text, null, null, null);
  }

  public boolean hasContent() {
    return hasTemplate() || hasImage() || (text != null && !text.isBlank());
  }

  public boolean hasTemplate() {
    return template != null && template.name() != null && !template.name().isBlank();
  }

  public boolean hasImage() {
    return image != null && image.url() != null && !image.url().isBlank();
  }

  public record ImageRef(String url) {}

  public record TemplateRef(String name, String language, List<String> variables) {

    public List<String> variablesOrEmpty() {
      return variables == null ? List.of() : variables;
    }
  }
}
