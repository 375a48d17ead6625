package com.wabridge.apiwhatsapp.queue;

import java.time.Duration;

/** Backoff wait between attempts. */
@FunctionalInterface
public interface Sleeper {

  Sleeper THREAD = delay -> Thread.sleep(delay.toMillis());

  void sleep(Duration delay) throws InterruptedException;
}
