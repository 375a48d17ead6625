package com.wabridge.apiwhatsapp.whatsapp;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A CRM template reduced to what is sent: one text (header and body separated by a blank line,
 * {@code {{n}}} replaced by the n-th variable) and the image URLs of an image body.
 */
record TemplateMessage(String text, List<String> images) {

  private static final int IMAGE_COLUMNS = 8;

  static TemplateMessage from(JsonNode template, List<String> variables) {
    String header = "";
    String body = "";
    List<String> images = new ArrayList<>();
    for (JsonNode component : template.path("components")) {
      String type = component.path("type").asText("");
      if ("HEADER".equals(type)) {
        header = substitute(component.path("text").asText(""), variables);
      } else if ("BODY".equals(type)) {
        body = substitute(component.path("text").asText(""), variables);
        if ("IMAGE".equals(component.path("format").asText(""))) {
          images.addAll(imagesOf(template, component));
        }
      }
    }
    String text =
        Stream.of(header, body).filter(s -> !s.isBlank()).collect(Collectors.joining("\n\n"));
    return new TemplateMessage(text, List.copyOf(images));
  }

  static String substitute(String text, List<String> variables) {
    String result = text;
    for (int i = 0; i < variables.size(); i++) {
      String value = variables.get(i) == null ? "" : variables.get(i);
      result = result.replace("{{" + (i + 1) + "}}", value);
    }
    return result;
  }

  private static List<String> imagesOf(JsonNode template, JsonNode component) {
    List<String> urls = new ArrayList<>();
    JsonNode listed = component.path("images");
    if (listed.isArray() && !listed.isEmpty()) {
      listed.forEach(node -> urls.add(node.asText()));
      return urls;
    }
    for (int i = 1; i <= IMAGE_COLUMNS; i++) {
      String url = template.path("image" + i).asText("");
      if (!url.isBlank()) {
        urls.add(url);
      }
    }
    return urls;
  }
}
