package com.wabridge.apiwhatsapp.queue;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * Sequential send executor with bounded, exponentially backed-off retries.
 *
 * <p>Items start in submission order and at most one item executes at any instant: a single worker
 * drains the pending list and goes idle when it is empty; the next {@link #enqueue} wakes it. An
 * item that exhausts its retries fails its own future only, the worker then moves on.
 */
@Slf4j
public class SendQueue implements AutoCloseable {

  private final Deque<QueueItem<?>> pending = new ArrayDeque<>();
  private final AtomicLong sequence = new AtomicLong();
  private final int maxRetries;
  private final Duration retryDelay;
  private final ExecutorService worker;
  private final Sleeper sleeper;

  // guarded by pending
  private boolean processing;
  private boolean closed;

  public SendQueue(int maxRetries, Duration retryDelay) {
    this(
        maxRetries,
        retryDelay,
        Executors.newSingleThreadExecutor(
            r -> {
              Thread t = new Thread(r, "send-queue");
              t.setDaemon(true);
              return t;
            }),
        Sleeper.THREAD);
  }

  public SendQueue(int maxRetries, Duration retryDelay, ExecutorService worker, Sleeper sleeper) {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    this.maxRetries = maxRetries;
    this.retryDelay = Objects.requireNonNull(retryDelay, "retryDelay");
    this.worker = Objects.requireNonNull(worker, "worker");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  /**
   * Appends a send and returns its outcome: the message id, or the last error once every attempt
   * has failed.
   */
  public <T> CompletableFuture<String> enqueue(T payload, SendExecutor<T> executor) {
    QueueItem<T> item = new QueueItem<>(nextId(), payload, executor);
    boolean wakeWorker;
    synchronized (pending) {
      if (closed) {
        item.outcome().completeExceptionally(new IllegalStateException("Send queue is closed"));
        return item.outcome();
      }
      pending.addLast(item);
      wakeWorker = !processing;
      processing = true;
      log.debug("Send {} queued, pending={}", item.id(), pending.size());
    }
    if (wakeWorker) {
      startWorker();
    }
    return item.outcome();
  }

  public int pendingCount() {
    synchronized (pending) {
      return pending.size();
    }
  }

  /** Delay before retry number {@code retry} (1-based): {@code retryDelay * 2^(retry-1)}. */
  public Duration backoff(int retry) {
    return retryDelay.multipliedBy(1L << Math.min(retry - 1, 30));
  }

  @Override
  public void close() {
    synchronized (pending) {
      closed = true;
    }
    failPending(new IllegalStateException("Send queue is closed"));
    worker.shutdownNow();
  }

  private void drain() {
    boolean idle = false;
    try {
      while (true) {
        QueueItem<?> item;
        synchronized (pending) {
          item = pending.pollFirst();
          if (item == null) {
            processing = false;
            idle = true;
            return;
          }
        }
        settle(item);
        if (Thread.currentThread().isInterrupted()) {
          failPending(new IllegalStateException("Send queue worker interrupted"));
          idle = true;
          return;
        }
      }
    } finally {
      if (!idle) {
        resumeAfterAbort();
      }
    }
  }

  private void startWorker() {
    try {
      worker.execute(this::drain);
    } catch (RejectedExecutionException e) {
      failPending(new IllegalStateException("Send queue is closed", e));
    }
  }

  /** The worker left the drain loop abnormally: hand what is left to a fresh run. */
  private void resumeAfterAbort() {
    boolean restart;
    synchronized (pending) {
      restart = !closed && !pending.isEmpty();
      processing = restart;
    }
    if (restart) {
      log.warn("Send queue worker stopped unexpectedly, restarting");
      startWorker();
    }
  }

  private <T> void settle(QueueItem<T> item) {
    try {
      item.outcome().complete(executeWithRetry(item));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      item.outcome().completeExceptionally(e);
    } catch (Exception e) {
      log.error(
          "Send {} failed after {} attempts: {}", item.id(), item.retryCount(), e.getMessage());
      item.outcome().completeExceptionally(e);
    } catch (Throwable t) {
      log.error("Send {} aborted", item.id(), t);
      item.outcome().completeExceptionally(t);
    }
  }

  private <T> String executeWithRetry(QueueItem<T> item) throws Exception {
    while (true) {
      try {
        log.debug("Executing send {} attempt {}", item.id(), item.retryCount() + 1);
        String result = item.executor().execute(item.payload());
        log.info("Send {} delivered as {}", item.id(), result);
        return result;
      } catch (InterruptedException e) {
        throw e;
      } catch (Exception e) {
        int retry = item.incrementRetries();
        if (retry > maxRetries) {
          throw e;
        }
        Duration delay = backoff(retry);
        log.warn(
            "Send {} failed, retry {} of {} in {} ms: {}",
            item.id(),
            retry,
            maxRetries,
            delay.toMillis(),
            e.getMessage());
        sleeper.sleep(delay);
      }
    }
  }

  private void failPending(Exception cause) {
    Deque<QueueItem<?>> dropped;
    synchronized (pending) {
      dropped = new ArrayDeque<>(pending);
      pending.clear();
      processing = false;
    }
    dropped.forEach(item -> item.outcome().completeExceptionally(cause));
  }

  private String nextId() {
    return System.currentTimeMillis() + "-" + sequence.incrementAndGet();
  }
}
