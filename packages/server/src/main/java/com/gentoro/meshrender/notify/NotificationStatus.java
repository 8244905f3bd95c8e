package com.gentoro.meshrender.notify;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Kind of message pushed to a client about its job. */
public enum NotificationStatus {
  /** The worker picked the job up. Best-effort, may never reach the client. */
  PROCESSING,

  /** Rendering succeeded; the message carries the output link. */
  COMPLETED,

  /** Rendering failed. The client has to resubmit. */
  FAILED;

  public boolean isTerminal() {
    return this != PROCESSING;
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
