package com.wabridge.apiwhatsapp.api;

import com.wabridge.apiwhatsapp.model.SendMessageOptions;
import com.wabridge.apiwhatsapp.whatsapp.ConnectionStatus;
import com.wabridge.apiwhatsapp.whatsapp.QrCode;
import com.wabridge.apiwhatsapp.whatsapp.WhatsAppClient;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@Slf4j
public class WhatsAppController {

  private final WhatsAppClient whatsApp;
  private final SendRateLimiter rateLimiter;
  private final Clock clock;

  public record HealthResponse(String status, Instant timestamp) {}

  public record SendResponse(boolean success, String messageId) {}

  public record DisconnectResponse(boolean success, String message) {}

  public record WebhookAddresses(String inbound, String outbound) {}

  @GetMapping("/health")
  public HealthResponse health() {
    return new HealthResponse("ok", clock.instant());
  }

  @GetMapping("/qr")
  public QrCode qr() {
    return whatsApp.getQr();
  }

  @GetMapping("/status")
  public ConnectionStatus status() {
    return whatsApp.getStatus();
  }

  @PostMapping("/disconnect")
  public DisconnectResponse disconnect() {
    whatsApp.disconnect();
    return new DisconnectResponse(true, "Disconnected successfully");
  }

  @PostMapping("/send")
  public SendResponse send(@RequestBody SendMessageOptions body, HttpServletRequest request) {
    rateLimiter.check(request.getRemoteAddr());
    if (body.to() == null || body.to().isBlank()) {
      throw new IllegalArgumentException("Missing required field: to");
    }
    String messageId = whatsApp.sendMessage(body);
    log.info("Sent message {} to {}", messageId, body.to());
    return new SendResponse(true, messageId);
  }

  @PostMapping("/webhooks/refresh")
  public WebhookAddresses refreshWebhooks() {
    whatsApp.refreshWebhooks();
    return new WebhookAddresses(
        whatsApp.inboundWebhook().orElse(null), whatsApp.outboundWebhook().orElse(null));
  }
}
