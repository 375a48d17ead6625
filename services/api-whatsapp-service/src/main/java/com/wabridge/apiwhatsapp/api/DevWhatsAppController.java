package com.wabridge.apiwhatsapp.api;

import com.wabridge.apiwhatsapp.forward.PhoneNumbers;
import com.wabridge.apiwhatsapp.model.ChatEvent;
import com.wabridge.apiwhatsapp.session.LoopbackChatSession;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Local training endpoints for the loopback session.
 *
 * <p>Allows feeding "fake" WhatsApp messages through the forwarders without a paired phone.
 */
@RestController
@RequestMapping("/dev/whatsapp")
@ConditionalOnProperty(prefix = "bridge.dev", name = "enabled", havingValue = "true")
public class DevWhatsAppController {

  private final LoopbackChatSession session;
  private final Clock clock;

  public DevWhatsAppController(LoopbackChatSession session, Clock clock) {
    this.session = session;
    this.clock = clock;
  }

  /**
   * @param from counterpart phone number or JID
   * @param fromMe true for a message typed on the paired phone
   */
  public record DevEventRequest(String id, @NotBlank String from, String text, boolean fromMe) {}

  public record DevPairRequest(@NotBlank String phoneNumber) {}

  public record DevEventResponse(String id) {}

  @PostMapping("/events")
  public DevEventResponse event(@Valid @RequestBody DevEventRequest req) {
    String id = req.id() == null || req.id().isBlank() ? devId() : req.id();
    String jid = req.from().contains("@") ? req.from() : PhoneNumbers.toJid(req.from());
    session.inject(
        new ChatEvent(id, jid, req.text(), clock.instant().getEpochSecond(), req.fromMe()));
    return new DevEventResponse(id);
  }

  @PostMapping("/pair")
  public void pair(@Valid @RequestBody DevPairRequest req) {
    session.pair(req.phoneNumber());
  }

  @GetMapping("/sent")
  public List<LoopbackChatSession.SentMessage> sent() {
    return session.sent();
  }

  private static String devId() {
    return "DEV" + UUID.randomUUID().toString().replace("-", "").substring(0, 16).toUpperCase();
  }
}
