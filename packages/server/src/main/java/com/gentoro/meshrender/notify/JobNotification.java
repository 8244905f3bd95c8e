package com.gentoro.meshrender.notify;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Objects;

/** Outbound message about a job; serialized as JSON on the wire. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobNotification(
    String jobId, NotificationStatus status, String message, String output) {

  public JobNotification {
    Objects.requireNonNull(jobId, "jobId");
    Objects.requireNonNull(status, "status");
  }

  public static JobNotification processing(String jobId) {
    return new JobNotification(
        jobId, NotificationStatus.PROCESSING, "Processing your file...", null);
  }

  public static JobNotification completed(String jobId, String outputLink) {
    return new JobNotification(
        jobId, NotificationStatus.COMPLETED, "Rendering complete!", outputLink);
  }

  public static JobNotification failed(String jobId, String reason) {
    String message = "Failed to render file. Please try again.";
    if (reason != null && !reason.isBlank()) {
      message = message + " (" + reason + ")";
    }
    return new JobNotification(jobId, NotificationStatus.FAILED, message, null);
  }
}
