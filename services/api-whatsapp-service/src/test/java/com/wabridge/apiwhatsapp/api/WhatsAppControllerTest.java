package com.wabridge.apiwhatsapp.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.wabridge.apiwhatsapp.config.BridgeProperties;
import com.wabridge.apiwhatsapp.model.SendMessageOptions;
import com.wabridge.apiwhatsapp.whatsapp.ConnectionStatus;
import com.wabridge.apiwhatsapp.whatsapp.QrCode;
import com.wabridge.apiwhatsapp.whatsapp.QrUnavailableException;
import com.wabridge.apiwhatsapp.whatsapp.SendFailedException;
import com.wabridge.apiwhatsapp.whatsapp.SessionUnavailableException;
import com.wabridge.apiwhatsapp.whatsapp.WhatsAppClient;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = WhatsAppController.class, properties = "bridge.api.key=secret")
class WhatsAppControllerTest {

  private static final String KEY = "X-API-Key";

  @TestConfiguration
  @EnableConfigurationProperties(BridgeProperties.class)
  static class Config {
    @Bean
    Clock clock() {
      return Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
    }
  }

  @Autowired MockMvc mvc;

  @MockBean WhatsAppClient whatsApp;

  @MockBean SendRateLimiter rateLimiter;

  @Test
  void health_needs_no_key() throws Exception {
    mvc.perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ok"))
        .andExpect(jsonPath("$.timestamp").value("2024-05-01T10:00:00Z"));
  }

  @Test
  void missing_key_is_unauthorized() throws Exception {
    mvc.perform(get("/status"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.error").value("Missing API key"));
    verifyNoInteractions(whatsApp);
  }

  @Test
  void wrong_key_is_forbidden() throws Exception {
    mvc.perform(get("/status").header(KEY, "nope"))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.error").value("Invalid API key"));
  }

  @Test
  void status_reports_connection() throws Exception {
    when(whatsApp.getStatus()).thenReturn(new ConnectionStatus(true, "85290000000"));

    mvc.perform(get("/status").header(KEY, "secret"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.connected").value(true))
        .andExpect(jsonPath("$.phoneNumber").value("85290000000"));
  }

  @Test
  void qr_returns_code_and_expiry() throws Exception {
    when(whatsApp.getQr())
        .thenReturn(new QrCode("2@abc", Instant.parse("2024-05-01T10:02:00Z")));

    mvc.perform(get("/qr").header(KEY, "secret"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.qr").value("2@abc"))
        .andExpect(jsonPath("$.expiresAt").value("2024-05-01T10:02:00Z"));
  }

  @Test
  void qr_when_connected_is_conflict() throws Exception {
    when(whatsApp.getQr()).thenThrow(new QrUnavailableException("Already connected"));

    mvc.perform(get("/qr").header(KEY, "secret"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("QR_UNAVAILABLE"));
  }

  @Test
  void send_returns_message_id() throws Exception {
    when(whatsApp.sendMessage(any(SendMessageOptions.class))).thenReturn("3EB0ABC");

    mvc.perform(
            post("/send")
                .header(KEY, "secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"to\":\"+85291234567\",\"text\":\"hello\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.messageId").value("3EB0ABC"));
    verify(rateLimiter).check("127.0.0.1");
  }

  @Test
  void send_without_destination_is_bad_request() throws Exception {
    mvc.perform(
            post("/send")
                .header(KEY, "secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\":\"hello\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("Missing required field: to"));
  }

  @Test
  void send_over_rate_limit_is_refused() throws Exception {
    doThrow(new TooManyRequestsException("Maximum 20 requests per 60 seconds"))
        .when(rateLimiter)
        .check(anyString());

    mvc.perform(
            post("/send")
                .header(KEY, "secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"to\":\"+85291234567\",\"text\":\"hello\"}"))
        .andExpect(status().isTooManyRequests())
        .andExpect(jsonPath("$.code").value("RATE_LIMIT_EXCEEDED"));
    verifyNoInteractions(whatsApp);
  }

  @Test
  void send_while_disconnected_is_unavailable() throws Exception {
    when(whatsApp.sendMessage(any(SendMessageOptions.class)))
        .thenThrow(new SessionUnavailableException("WhatsApp not connected"));

    mvc.perform(
            post("/send")
                .header(KEY, "secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"to\":\"+85291234567\",\"text\":\"hello\"}"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("SESSION_UNAVAILABLE"));
  }

  @Test
  void send_failure_is_bad_gateway() throws Exception {
    when(whatsApp.sendMessage(any(SendMessageOptions.class)))
        .thenThrow(new SendFailedException("Connection Closed"));

    mvc.perform(
            post("/send")
                .header(KEY, "secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"to\":\"+85291234567\",\"text\":\"hello\"}"))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.message").value("Connection Closed"));
  }

  @Test
  void disconnect_confirms() throws Exception {
    mvc.perform(post("/disconnect").header(KEY, "secret"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true));
    verify(whatsApp).disconnect();
  }

  @Test
  void webhook_refresh_returns_current_addresses() throws Exception {
    when(whatsApp.inboundWebhook()).thenReturn(Optional.of("https://crm.example/in"));
    when(whatsApp.outboundWebhook()).thenReturn(Optional.empty());

    mvc.perform(post("/webhooks/refresh").header(KEY, "secret"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.inbound").value("https://crm.example/in"))
        .andExpect(jsonPath("$.outbound").doesNotExist());
    verify(whatsApp).refreshWebhooks();
  }
}
