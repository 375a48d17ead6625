package com.wabridge.apiwhatsapp.queue;

import java.util.concurrent.CompletableFuture;

/**
 * One pending send. Mutated only by the queue worker; retries happen in place while the item is
 * being executed, never by re-enqueueing.
 */
final class QueueItem<T> {

  private final String id;
  private final T payload;
  private final SendExecutor<T> executor;
  private final CompletableFuture<String> outcome = new CompletableFuture<>();
  private int retryCount;

  QueueItem(String id, T payload, SendExecutor<T> executor) {
    this.id = id;
    this.payload = payload;
    this.executor = executor;
  }

  String id() {
    return id;
  }

  T payload() {
    return payload;
  }

  SendExecutor<T> executor() {
    return executor;
  }

  CompletableFuture<String> outcome() {
    return outcome;
  }

  int retryCount() {
    return retryCount;
  }

  int incrementRetries() {
    return ++retryCount;
  }
}
