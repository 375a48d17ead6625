package com.wabridge.apiwhatsapp.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class SendQueueTest {

  private final List<Duration> sleeps = Collections.synchronizedList(new ArrayList<>());
  private final SendQueue queue =
      new SendQueue(3, Duration.ofSeconds(1), Executors.newSingleThreadExecutor(), sleeps::add);

  @AfterEach
  void tearDown() {
    queue.close();
  }

  @Test
  void items_start_in_submission_order() {
    List<String> started = Collections.synchronizedList(new ArrayList<>());
    List<CompletableFuture<String>> outcomes = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      outcomes.add(
          queue.enqueue(
              "m" + i,
              payload -> {
                started.add(payload);
                return payload;
              }));
    }

    CompletableFuture.allOf(outcomes.toArray(CompletableFuture[]::new)).join();

    assertThat(started).containsExactly("m0", "m1", "m2", "m3", "m4");
    assertThat(outcomes.get(3).join()).isEqualTo("m3");
  }

  @Test
  void at_most_one_send_runs_at_a_time() throws Exception {
    AtomicInteger active = new AtomicInteger();
    AtomicInteger maxActive = new AtomicInteger();
    SendExecutor<Integer> slowSend =
        payload -> {
          maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
          Thread.sleep(5);
          active.decrementAndGet();
          return "id-" + payload;
        };

    ExecutorService producers = Executors.newFixedThreadPool(4);
    List<CompletableFuture<String>> outcomes = Collections.synchronizedList(new ArrayList<>());
    for (int i = 0; i < 20; i++) {
      int n = i;
      producers.execute(() -> outcomes.add(queue.enqueue(n, slowSend)));
    }
    producers.shutdown();
    assertThat(producers.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

    CompletableFuture.allOf(outcomes.toArray(CompletableFuture[]::new)).get(10, TimeUnit.SECONDS);
    assertThat(outcomes).hasSize(20);
    assertThat(maxActive.get()).isEqualTo(1);
    assertThat(queue.pendingCount()).isZero();
  }

  @Test
  void retries_with_exponential_backoff_until_success() {
    AtomicInteger attempts = new AtomicInteger();
    CompletableFuture<String> outcome =
        queue.enqueue(
            "hello",
            payload -> {
              if (attempts.incrementAndGet() <= 3) {
                throw new IOException("socket closed");
              }
              return "WAMID-1";
            });

    assertThat(outcome.join()).isEqualTo("WAMID-1");
    assertThat(attempts.get()).isEqualTo(4);
    assertThat(sleeps)
        .containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4));
  }

  @Test
  void exhausted_item_fails_and_next_item_still_runs() {
    AtomicInteger attempts = new AtomicInteger();
    CompletableFuture<String> failing =
        queue.enqueue(
            "a",
            payload -> {
              attempts.incrementAndGet();
              throw new IOException("not connected");
            });
    CompletableFuture<String> next = queue.enqueue("b", payload -> "ok-" + payload);

    assertThatThrownBy(failing::join)
        .isInstanceOf(CompletionException.class)
        .hasCauseInstanceOf(IOException.class)
        .hasMessageContaining("not connected");
    assertThat(attempts.get()).isEqualTo(4);
    assertThat(next.join()).isEqualTo("ok-b");
  }

  @Test
  void error_thrown_by_a_send_does_not_stall_the_queue() throws Exception {
    CompletableFuture<String> broken =
        queue.enqueue(
            "a",
            payload -> {
              throw new AssertionError("session library bug");
            });
    CompletableFuture<String> next = queue.enqueue("b", payload -> "ok-" + payload);

    assertThat(next.get(1, TimeUnit.SECONDS)).isEqualTo("ok-b");
    assertThatThrownBy(broken::join)
        .isInstanceOf(CompletionException.class)
        .hasCauseInstanceOf(AssertionError.class);
    assertThat(queue.pendingCount()).isZero();

    CompletableFuture<String> later = queue.enqueue("c", payload -> "ok-" + payload);
    assertThat(later.get(1, TimeUnit.SECONDS)).isEqualTo("ok-c");
  }

  @Test
  void zero_retries_means_single_attempt() {
    SendQueue noRetry =
        new SendQueue(0, Duration.ofSeconds(1), Executors.newSingleThreadExecutor(), sleeps::add);
    AtomicInteger attempts = new AtomicInteger();
    try {
      CompletableFuture<String> outcome =
          noRetry.enqueue(
              "x",
              payload -> {
                attempts.incrementAndGet();
                throw new IllegalStateException("rejected");
              });

      assertThatThrownBy(outcome::join).hasCauseInstanceOf(IllegalStateException.class);
      assertThat(attempts.get()).isEqualTo(1);
      assertThat(sleeps).isEmpty();
    } finally {
      noRetry.close();
    }
  }

  @Test
  void backoff_doubles_per_retry() {
    assertThat(queue.backoff(1)).isEqualTo(Duration.ofSeconds(1));
    assertThat(queue.backoff(2)).isEqualTo(Duration.ofSeconds(2));
    assertThat(queue.backoff(3)).isEqualTo(Duration.ofSeconds(4));
  }

  @Test
  void closed_queue_rejects_new_items() {
    queue.close();

    CompletableFuture<String> outcome = queue.enqueue("late", payload -> "never");

    assertThatThrownBy(outcome::join).hasCauseInstanceOf(IllegalStateException.class);
  }
}
