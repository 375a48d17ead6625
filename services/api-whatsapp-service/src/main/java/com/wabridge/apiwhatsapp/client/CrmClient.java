package com.wabridge.apiwhatsapp.client;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Calls into the CRM's own API. Both clients carry the CRM base URL and API key; the settings
 * client has the shorter timeout.
 */
@Service
@Slf4j
public class CrmClient {

  private final RestClient settingsRest;
  private final RestClient rest;

  public CrmClient(
      @Qualifier("crmSettingsRestClient") RestClient settingsRest,
      @Qualifier("crmRestClient") RestClient rest) {
    this.settingsRest = settingsRest;
    this.rest = rest;
  }

  /**
   * @return the {@code settings} object of {@code GET /api/settings}; a missing node when the body
   *     has none
   * @throws CrmClientException on a non-2xx answer, an empty body or a transport failure
   */
  public JsonNode fetchSettings() {
    JsonNode body;
    try {
      body =
          settingsRest
              .get()
              .uri("/api/settings")
              .accept(MediaType.APPLICATION_JSON)
              .retrieve()
              .body(JsonNode.class);
    } catch (RestClientResponseException e) {
      throw new CrmClientException(
          "CRM settings request failed with status " + e.getStatusCode().value(), e);
    } catch (RestClientException e) {
      throw new CrmClientException("CRM settings request failed: " + e.getMessage(), e);
    }
    if (body == null) {
      throw new CrmClientException("CRM settings response was empty");
    }
    return body.path("settings");
  }

  /**
   * Stores a message typed on the paired phone in the CRM message store.
   *
   * @return the HTTP status code of the CRM answer
   * @throws CrmClientException when no answer was received
   */
  public int saveOutboundMessage(Object message) {
    try {
      return rest.post()
          .uri("/api/whatsapp/outbound")
          .contentType(MediaType.APPLICATION_JSON)
          .body(message)
          .retrieve()
          .onStatus(HttpStatusCode::isError, (request, response) -> {})
          .toBodilessEntity()
          .getStatusCode()
          .value();
    } catch (RestClientException e) {
      throw new CrmClientException("CRM outbound save failed: " + e.getMessage(), e);
    }
  }

  /** Looks up a custom template by exact name and language. */
  public Optional<JsonNode> findTemplate(String name, String language) {
    JsonNode body;
    try {
      body =
          rest.get()
              .uri(
                  uriBuilder ->
                      uriBuilder
                          .path("/api/whatsapp/templates")
                          .queryParam("name", name)
                          .queryParam("language", language)
                          .queryParam("is_custom", true)
                          .build())
              .accept(MediaType.APPLICATION_JSON)
              .retrieve()
              .body(JsonNode.class);
    } catch (RestClientException e) {
      log.warn("Failed to fetch template {} ({}) from CRM: {}", name, language, e.getMessage());
      return Optional.empty();
    }
    if (body == null) {
      return Optional.empty();
    }
    for (JsonNode template : body.path("templates")) {
      if (name.equals(template.path("name").asText(null))
          && language.equals(template.path("language").asText(null))) {
        return Optional.of(template);
      }
    }
    log.warn("Template {} ({}) not found in CRM", name, language);
    return Optional.empty();
  }
}
