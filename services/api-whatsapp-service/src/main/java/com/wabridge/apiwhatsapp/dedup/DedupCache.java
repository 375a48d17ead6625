package com.wabridge.apiwhatsapp.dedup;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

/**
 * Bounded, time-limited set of message ids already seen.
 *
 * <p>Entries are kept in insertion order, so the head is always the oldest. An entry older than
 * {@code ttl} counts as absent: {@link #has} drops it on lookup and the periodic sweep drops the
 * ones nobody asks about again.
 */
@Slf4j
public class DedupCache implements AutoCloseable {

  private final Map<String, Instant> entries = new LinkedHashMap<>();
  private final int maxSize;
  private final Duration ttl;
  private final Clock clock;

  private volatile ScheduledFuture<?> sweepTask;

  public DedupCache(int maxSize, Duration ttl, Clock clock) {
    if (maxSize <= 0) {
      throw new IllegalArgumentException("maxSize must be > 0");
    }
    this.maxSize = maxSize;
    this.ttl = Objects.requireNonNull(ttl, "ttl");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public synchronized boolean has(String messageId) {
    Instant insertedAt = entries.get(messageId);
    if (insertedAt == null) {
      return false;
    }
    if (isExpired(insertedAt, clock.instant())) {
      entries.remove(messageId);
      return false;
    }
    return true;
  }

  public synchronized void add(String messageId) {
    if (entries.remove(messageId) == null && entries.size() >= maxSize) {
      Iterator<String> oldest = entries.keySet().iterator();
      oldest.next();
      oldest.remove();
    }
    entries.put(messageId, clock.instant());
  }

  /**
   * Marks {@code messageId} as seen unless it already is. Returns {@code true} only for the caller
   * that marked it.
   */
  public synchronized boolean addIfAbsent(String messageId) {
    if (has(messageId)) {
      return false;
    }
    add(messageId);
    return true;
  }

  public synchronized int size() {
    return entries.size();
  }

  /** Removes every expired entry; returns how many were removed. */
  public synchronized int sweep() {
    Instant now = clock.instant();
    int before = entries.size();
    entries.values().removeIf(insertedAt -> isExpired(insertedAt, now));
    int removed = before - entries.size();
    if (removed > 0) {
      log.debug("Swept {} expired dedup entries, {} remaining", removed, entries.size());
    }
    return removed;
  }

  /** Starts the periodic sweep. Calling it again while a sweep is scheduled is a no-op. */
  public synchronized void scheduleSweep(TaskScheduler scheduler, Duration interval) {
    if (sweepTask != null) {
      return;
    }
    sweepTask = scheduler.scheduleWithFixedDelay(this::sweep, interval);
  }

  @Override
  public void close() {
    ScheduledFuture<?> task = sweepTask;
    if (task != null) {
      task.cancel(false);
      sweepTask = null;
    }
  }

  private boolean isExpired(Instant insertedAt, Instant now) {
    return Duration.between(insertedAt, now).compareTo(ttl) > 0;
  }
}
