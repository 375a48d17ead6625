package com.wabridge.apiwhatsapp.queue;

/** The send operation a queued item runs; returns the message id assigned by the session. */
@FunctionalInterface
public interface SendExecutor<T> {
  String execute(T payload) throws Exception;
}
