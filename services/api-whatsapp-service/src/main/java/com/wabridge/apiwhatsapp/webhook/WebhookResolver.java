package com.wabridge.apiwhatsapp.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.wabridge.apiwhatsapp.client.CrmClient;
import com.wabridge.apiwhatsapp.client.CrmClientException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Current webhook address for one forwarding direction.
 *
 * <p>A configured override wins for the lifetime of the process and never touches the network.
 * Otherwise the address comes from the CRM settings endpoint. It is looked up when unset or older
 * than {@code refreshInterval}, so the CRM sees at most one settings call per interval under steady
 * traffic. Any failed lookup clears the address: forwarding stays off until the CRM answers with a
 * usable value again.
 */
@Slf4j
public class WebhookResolver {

  private final WebhookDirection direction;
  private final String override;
  private final CrmClient crm;
  private final Duration refreshInterval;
  private final Clock clock;

  // guarded by this
  private String address;
  private Instant lastFetchedAt;

  public WebhookResolver(
      WebhookDirection direction,
      String override,
      CrmClient crm,
      Duration refreshInterval,
      Clock clock) {
    this.direction = Objects.requireNonNull(direction, "direction");
    this.override = override == null || override.isBlank() ? null : override.trim();
    this.crm = Objects.requireNonNull(crm, "crm");
    this.refreshInterval = Objects.requireNonNull(refreshInterval, "refreshInterval");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (this.override != null) {
      this.address = this.override;
      log.info("{} webhook fixed by configuration: {}", direction.label(), this.override);
    }
  }

  public WebhookDirection direction() {
    return direction;
  }

  public boolean isOverridden() {
    return override != null;
  }

  /** Returns the address, looking it up first when it is unset or stale. */
  public synchronized Optional<String> getAddress() {
    if (override != null) {
      return Optional.of(override);
    }
    Instant now = clock.instant();
    if (address == null
        || lastFetchedAt == null
        || Duration.between(lastFetchedAt, now).compareTo(refreshInterval) > 0) {
      resolve();
      lastFetchedAt = now;
    }
    return Optional.ofNullable(address);
  }

  /** Returns the cached address without any lookup. */
  public synchronized Optional<String> currentAddress() {
    return Optional.ofNullable(address);
  }

  public synchronized Optional<Instant> lastFetchedAt() {
    return Optional.ofNullable(lastFetchedAt);
  }

  /** Looks the address up now, regardless of the refresh interval. */
  public synchronized void refresh() {
    if (override != null) {
      log.debug("{} webhook is fixed by configuration; refresh skipped", direction.label());
      return;
    }
    log.info("Refreshing {} webhook from CRM", direction.label());
    resolve();
    lastFetchedAt = clock.instant();
  }

  private void resolve() {
    JsonNode settings;
    try {
      settings = crm.fetchSettings();
    } catch (CrmClientException e) {
      log.warn("Failed to fetch {} webhook from CRM: {}", direction.label(), e.getMessage());
      clear();
      return;
    }

    JsonNode field = settings.path(direction.settingsField());
    String fetched = field.isTextual() ? field.asText().trim() : "";
    if (fetched.isEmpty()) {
      log.warn(
          "{} webhook not found in CRM settings ({})",
          direction.label(),
          direction.settingsField());
      clear();
      return;
    }

    if (!fetched.equals(address)) {
      log.info(
          "{} webhook updated from CRM: {} (was {})", direction.label(), fetched, address);
    } else {
      log.debug("{} webhook unchanged: {}", direction.label(), fetched);
    }
    address = fetched;
  }

  private void clear() {
    if (address != null) {
      log.info("Clearing cached {} webhook {}", direction.label(), address);
      address = null;
    }
  }
}
