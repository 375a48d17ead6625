package com.wabridge.apiwhatsapp.api;

import com.wabridge.apiwhatsapp.config.BridgeProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * In-memory fixed-window limiter for {@code POST /send}, keyed by client address.
 *
 * <p>A window opens on the first request of a client and admits {@code maxRequests} requests.
 */
@Service
@Slf4j
public class SendRateLimiter {

  private final ConcurrentMap<String, Window> map = new ConcurrentHashMap<>();
  private final Duration window;
  private final int maxRequests;
  private final Clock clock;

  public SendRateLimiter(BridgeProperties properties, Clock clock) {
    this.window = properties.api().rateLimit().window();
    this.maxRequests = properties.api().rateLimit().maxRequests();
    this.clock = clock;
  }

  /**
   * @throws TooManyRequestsException when {@code client} used up its window
   */
  public void check(String client) {
    String key = client == null || client.isBlank() ? "unknown" : client;
    Instant now = clock.instant();
    Window w =
        map.compute(
            key,
            (k, old) -> {
              if (old == null || !old.windowStart.plus(window).isAfter(now)) {
                return new Window(now, 1);
              }
              return new Window(old.windowStart, old.requests + 1);
            });

    if (map.size() > 10_000) {
      map.entrySet().removeIf(e -> !e.getValue().windowStart.plus(window).isAfter(now));
    }

    if (w.requests > maxRequests) {
      log.warn("Rate limit exceeded for {}", key);
      throw new TooManyRequestsException(
          "Maximum " + maxRequests + " requests per " + window.toSeconds() + " seconds");
    }
  }

  private record Window(Instant windowStart, int requests) {}
}
