package com.wabridge.apiwhatsapp.dedup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.wabridge.apiwhatsapp.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

class DedupCacheTest {

  private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));

  @Test
  void entry_expires_after_ttl() {
    DedupCache cache = new DedupCache(10, Duration.ofMillis(100), clock);
    cache.add("m1");

    clock.advance(Duration.ofMillis(50));
    assertThat(cache.has("m1")).isTrue();

    clock.advance(Duration.ofMillis(100));
    assertThat(cache.has("m1")).isFalse();
    assertThat(cache.size()).isZero();
  }

  @Test
  void oldest_entry_is_evicted_at_capacity() {
    DedupCache cache = new DedupCache(2, Duration.ofHours(1), clock);

    cache.add("a");
    cache.add("b");
    cache.add("c");

    assertThat(cache.size()).isEqualTo(2);
    assertThat(cache.has("a")).isFalse();
    assertThat(cache.has("b")).isTrue();
    assertThat(cache.has("c")).isTrue();
  }

  @Test
  void re_adding_refreshes_without_eviction() {
    DedupCache cache = new DedupCache(2, Duration.ofHours(1), clock);
    cache.add("a");
    cache.add("b");

    cache.add("a");
    assertThat(cache.size()).isEqualTo(2);

    cache.add("c");
    assertThat(cache.has("a")).isTrue();
    assertThat(cache.has("b")).isFalse();
  }

  @Test
  void sweep_removes_only_expired_entries() {
    DedupCache cache = new DedupCache(10, Duration.ofMinutes(1), clock);
    cache.add("old");
    clock.advance(Duration.ofSeconds(45));
    cache.add("fresh");
    clock.advance(Duration.ofSeconds(30));

    assertThat(cache.sweep()).isEqualTo(1);
    assertThat(cache.size()).isEqualTo(1);
    assertThat(cache.has("fresh")).isTrue();
  }

  @Test
  void close_cancels_scheduled_sweep() {
    TaskScheduler scheduler = mock(TaskScheduler.class);
    ScheduledFuture<?> task = mock(ScheduledFuture.class);
    doReturn(task)
        .when(scheduler)
        .scheduleWithFixedDelay(any(Runnable.class), eq(Duration.ofMinutes(5)));
    DedupCache cache = new DedupCache(10, Duration.ofHours(1), clock);

    cache.scheduleSweep(scheduler, Duration.ofMinutes(5));
    cache.close();

    verify(task).cancel(false);
  }

  @Test
  void add_if_absent_marks_once_until_expiry() {
    DedupCache cache = new DedupCache(10, Duration.ofMillis(100), clock);

    assertThat(cache.addIfAbsent("m1")).isTrue();
    assertThat(cache.addIfAbsent("m1")).isFalse();

    clock.advance(Duration.ofMillis(150));
    assertThat(cache.addIfAbsent("m1")).isTrue();
    assertThat(cache.size()).isEqualTo(1);
  }
}
