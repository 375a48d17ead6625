package com.wabridge.apiwhatsapp.client;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/** Posts forwarding payloads to whatever address the CRM configured. */
@Service
public class WebhookClient {

  private final RestClient rest;

  public WebhookClient(@Qualifier("webhookRestClient") RestClient rest) {
    this.rest = rest;
  }

  /**
   * @return the HTTP status code of the answer; non-2xx answers are returned, not thrown
   * @throws CrmClientException when no answer was received (connect failure, timeout)
   */
  public int post(String url, Object payload) {
    try {
      return rest.post()
          .uri(url)
          .contentType(MediaType.APPLICATION_JSON)
          .body(payload)
          .retrieve()
          .onStatus(HttpStatusCode::isError, (request, response) -> {})
          .toBodilessEntity()
          .getStatusCode()
          .value();
    } catch (RestClientException e) {
      throw new CrmClientException("Webhook " + url + " unreachable: " + e.getMessage(), e);
    }
  }
}
