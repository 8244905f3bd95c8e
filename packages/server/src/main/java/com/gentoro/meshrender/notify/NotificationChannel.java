package com.gentoro.meshrender.notify;

import java.io.IOException;

/**
 * Transport-neutral view of a full-duplex text channel to one client.
 *
 * <p>Implementations report asynchronous send failures back to the owning {@link
 * NotificationSession} via {@link NotificationSession#onError(Throwable)}.
 */
public interface NotificationChannel {

  /** Identifier used in logs, typically the remote address. */
  String describe();

  boolean isOpen();

  /**
   * Send one text frame. Delivery is at-most-once and unacknowledged.
   *
   * @throws IOException if the channel is already closed or the frame cannot be queued
   */
  void send(String text) throws IOException;

  void close(int statusCode, String reason);
}
