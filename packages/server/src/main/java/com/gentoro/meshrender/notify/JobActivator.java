package com.gentoro.meshrender.notify;

/** Hook through which a registered channel signals that its job may be queued. */
@FunctionalInterface
public interface JobActivator {

  /** Outcome of an activation request. */
  enum Activation {
    /** The staged job was moved onto the work queue. */
    ENQUEUED,
    /** The job was already queued or running; the channel simply follows it. */
    IN_FLIGHT,
    /** No such job: never issued, already finished, or expired. */
    UNKNOWN
  }

  /**
   * Enqueue the staged job with this id. May block while the work queue is full.
   *
   * @throws InterruptedException if interrupted while waiting for queue space; the job stays staged
   */
  Activation activate(String jobId) throws InterruptedException;
}
