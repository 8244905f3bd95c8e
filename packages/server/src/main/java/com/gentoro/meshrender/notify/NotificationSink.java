package com.gentoro.meshrender.notify;

/**
 * Fire-and-forget destination for job notifications.
 *
 * <p>Callers never learn whether a message arrived. {@link #NOOP} stands in when no client is
 * listening, so call sites do not special-case a missing channel.
 */
@FunctionalInterface
public interface NotificationSink {

  NotificationSink NOOP = notification -> {};

  void publish(JobNotification notification);
}
