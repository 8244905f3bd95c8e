package com.gentoro.meshrender.submission;

import com.gentoro.meshrender.fingerprint.Fingerprint;

/**
 * Answer to an upload.
 *
 * @param outcome whether a job was staged or a cached output was found
 * @param fingerprint digest of the uploaded content
 * @param jobId id to send over the notification channel; {@code null} when cached
 * @param outputLink where the image is (cached) or will be (accepted) served from
 */
public record SubmissionResult(
    Outcome outcome, Fingerprint fingerprint, String jobId, String outputLink) {

  public enum Outcome {
    ACCEPTED,
    CACHED
  }

  public static SubmissionResult accepted(Fingerprint fingerprint, String jobId, String link) {
    return new SubmissionResult(Outcome.ACCEPTED, fingerprint, jobId, link);
  }

  public static SubmissionResult cached(Fingerprint fingerprint, String link) {
    return new SubmissionResult(Outcome.CACHED, fingerprint, null, link);
  }

  public boolean isCached() {
    return outcome == Outcome.CACHED;
  }
}
