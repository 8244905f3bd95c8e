package com.gentoro.meshrender.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;

/**
 * Server side of one notification channel: drives the {@link ChannelState} machine, binds the
 * channel to a job in the {@link CorrelationRegistry} and releases the job onto the work queue.
 *
 * <p>The first valid inbound message names the job, either as the bare id or as {@code
 * {"jobId":"..."}}. The channel is registered before the job is activated, so by the time the worker
 * can dequeue the job a lookup already finds this session. Invalid messages are logged and the
 * session stays {@link ChannelState#OPENED}.
 *
 * <p>Transport callbacks ({@link #onText}, {@link #onClose}, {@link #onError}) and worker-driven
 * {@link #publish} calls may arrive on different threads; state changes are serialized on this
 * instance.
 */
public final class NotificationSession implements NotificationSink {
  private static final Logger log =
      com.gentoro.meshrender.logging.LoggingService.getLogger(NotificationSession.class);

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final Pattern JOB_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_-]{0,127}");

  public static final int NORMAL_CLOSURE = 1000;

  private final NotificationChannel channel;
  private final CorrelationRegistry registry;
  private final JobActivator activator;

  private ChannelState state = ChannelState.OPENED;
  private String jobId;

  public NotificationSession(
      NotificationChannel channel, CorrelationRegistry registry, JobActivator activator) {
    this.channel = Objects.requireNonNull(channel, "channel");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.activator = Objects.requireNonNull(activator, "activator");
  }

  /** Handle one inbound text frame. */
  public void onText(String text) {
    String candidate;
    Optional<NotificationSession> replaced;
    synchronized (this) {
      if (state != ChannelState.OPENED) {
        log.debug("Ignoring message on {} in state {}", describe(), state);
        return;
      }
      candidate = parseJobId(text);
      if (candidate == null) {
        log.warn("Malformed job registration from {}: {}", describe(), abbreviate(text));
        return;
      }
      jobId = candidate;
      transition(ChannelState.REGISTERED);
      replaced = registry.register(candidate, this);
    }
    // outside our own lock: the replaced session takes its lock and then the registry's
    replaced.ifPresent(NotificationSession::supersede);

    JobActivator.Activation activation;
    try {
      activation = activator.activate(candidate);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while queueing job {} for {}", candidate, describe());
      revertRegistration(candidate);
      return;
    } catch (RuntimeException e) {
      log.error("Failed to queue job {} for {}", candidate, describe(), e);
      revertRegistration(candidate);
      return;
    }

    if (activation == JobActivator.Activation.UNKNOWN) {
      log.warn("Unknown job id {} from {}", candidate, describe());
      revertRegistration(candidate);
      return;
    }
    log.info("Channel {} registered for job {} ({})", describe(), candidate, activation);
  }

  /** Deliver a worker notification. Drops it if the session can no longer accept it. */
  @Override
  public void publish(JobNotification notification) {
    boolean terminal = notification.status().isTerminal();
    synchronized (this) {
      if (!notification.jobId().equals(jobId)) {
        log.debug(
            "Dropping notification for {} on channel bound to {}", notification.jobId(), jobId);
        return;
      }
      ChannelState next = terminal ? ChannelState.TERMINAL : ChannelState.NOTIFIED;
      if (!state.canTransitionTo(next)) {
        log.debug(
            "Dropping {} for job {} on {} in state {}",
            notification.status(),
            jobId,
            describe(),
            state);
        return;
      }

      String payload;
      try {
        payload = MAPPER.writeValueAsString(notification);
      } catch (JsonProcessingException e) {
        log.error("Could not serialize notification for job {}", jobId, e);
        return;
      }

      try {
        channel.send(payload);
      } catch (IOException e) {
        log.warn("Failed to notify job {} on {}: {}", jobId, describe(), e.getMessage());
        closeLocked();
        channel.close(NORMAL_CLOSURE, "send failed");
        return;
      }
      // an asynchronous send failure may already have closed us on this thread
      if (state == ChannelState.CLOSED) return;
      transition(next);
      log.debug("Sent {} for job {} to {}", notification.status(), jobId, describe());
    }

    if (terminal) {
      channel.close(NORMAL_CLOSURE, "job finished");
    }
  }

  /** Transport reported the channel closed, by either side. */
  public void onClose(int statusCode, String reason) {
    synchronized (this) {
      if (state == ChannelState.CLOSED) return;
      closeLocked();
    }
    log.info("Channel {} closed for job {} ({} {})", describe(), jobId, statusCode, reason);
  }

  /** Transport or send failure. */
  public void onError(Throwable cause) {
    synchronized (this) {
      if (state == ChannelState.CLOSED) return;
      closeLocked();
    }
    log.warn("Channel {} failed for job {}: {}", describe(), jobId, String.valueOf(cause));
    channel.close(NORMAL_CLOSURE, "error");
  }

  /** Another channel took over this job; close without a terminal message. */
  void supersede() {
    synchronized (this) {
      if (state == ChannelState.CLOSED) return;
      closeLocked();
    }
    log.info("Channel {} superseded for job {}", describe(), jobId);
    channel.close(NORMAL_CLOSURE, "superseded");
  }

  public synchronized ChannelState state() {
    return state;
  }

  public synchronized String jobId() {
    return jobId;
  }

  public String describe() {
    return channel.describe();
  }

  private synchronized void revertRegistration(String candidate) {
    registry.unregister(candidate, this);
    if (state == ChannelState.REGISTERED) {
      transition(ChannelState.OPENED);
      jobId = null;
    }
  }

  private void closeLocked() {
    state = ChannelState.CLOSED;
    if (jobId != null) {
      registry.unregister(jobId, this);
    }
  }

  private void transition(ChannelState next) {
    if (!state.canTransitionTo(next)) {
      throw new IllegalStateException("Illegal channel transition " + state + " -> " + next);
    }
    state = next;
  }

  static String parseJobId(String text) {
    if (text == null) return null;
    String trimmed = text.trim();
    if (trimmed.startsWith("{")) {
      try {
        JsonNode node = MAPPER.readTree(trimmed);
        JsonNode id = node.get("jobId");
        trimmed = id != null && id.isTextual() ? id.asText().trim() : null;
      } catch (JsonProcessingException e) {
        return null;
      }
    }
    if (trimmed == null || !JOB_ID.matcher(trimmed).matches()) return null;
    return trimmed;
  }

  private static String abbreviate(String text) {
    if (text == null) return "null";
    return text.length() <= 80 ? text : text.substring(0, 77) + "...";
  }
}
