package com.gentoro.meshrender.notify;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Live mapping from job id to the notification session following that job.
 *
 * <p>Every operation runs under one monitor. The registry only references sessions; closing the
 * underlying connection is the session's business, after which it unregisters itself.
 */
public final class CorrelationRegistry {
  private static final Logger log =
      com.gentoro.meshrender.logging.LoggingService.getLogger(CorrelationRegistry.class);

  private final Map<String, NotificationSession> sessions = new HashMap<>();

  /**
   * Bind {@code session} to {@code jobId}, replacing any previous binding.
   *
   * @return the session that was replaced, if it was a different one
   */
  public Optional<NotificationSession> register(String jobId, NotificationSession session) {
    Objects.requireNonNull(jobId, "jobId");
    Objects.requireNonNull(session, "session");
    NotificationSession previous;
    synchronized (sessions) {
      previous = sessions.put(jobId, session);
    }
    if (previous == null || previous == session) {
      return Optional.empty();
    }
    log.info("Job {} re-registered, replacing channel {}", jobId, previous.describe());
    return Optional.of(previous);
  }

  public Optional<NotificationSession> lookup(String jobId) {
    synchronized (sessions) {
      return Optional.ofNullable(sessions.get(jobId));
    }
  }

  /** Remove whatever is bound to {@code jobId}. */
  public void unregister(String jobId) {
    synchronized (sessions) {
      sessions.remove(jobId);
    }
  }

  /**
   * Remove the binding only if it still points at {@code session}. A channel that closes after
   * being replaced must not evict its successor.
   *
   * @return whether a binding was removed
   */
  public boolean unregister(String jobId, NotificationSession session) {
    synchronized (sessions) {
      return sessions.remove(jobId, session);
    }
  }

  /** Sink for {@code jobId}; {@link NotificationSink#NOOP} when nobody is listening. */
  public NotificationSink sinkFor(String jobId) {
    Optional<NotificationSession> session = lookup(jobId);
    if (session.isEmpty()) {
      log.debug("No channel registered for job {}, notification dropped", jobId);
      return NotificationSink.NOOP;
    }
    return session.get();
  }

  public int size() {
    synchronized (sessions) {
      return sessions.size();
    }
  }
}
