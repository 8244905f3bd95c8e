package com.gentoro.meshrender.queue;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import org.slf4j.Logger;

/**
 * Bounded FIFO of jobs waiting for the render worker.
 *
 * <p>{@link #enqueue} blocks while the queue is full. There is no timeout and no rejection path:
 * a saturated queue holds the caller until the worker frees a slot.
 */
public final class WorkQueue {
  private static final Logger log =
      com.gentoro.meshrender.logging.LoggingService.getLogger(WorkQueue.class);

  public static final int DEFAULT_CAPACITY = 100;

  private final BlockingQueue<RenderJob> jobs;
  private final int capacity;

  public WorkQueue(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive: " + capacity);
    }
    this.capacity = capacity;
    // fair ordering so producers blocked on a full queue are released in arrival order
    this.jobs = new ArrayBlockingQueue<>(capacity, true);
  }

  public void enqueue(RenderJob job) throws InterruptedException {
    Objects.requireNonNull(job, "job");
    if (jobs.remainingCapacity() == 0) {
      log.warn("Work queue full ({} jobs), job {} waits for a free slot", capacity, job.id());
    }
    jobs.put(job);
    log.debug("Enqueued job {} (depth {})", job.id(), jobs.size());
  }

  /** Block until a job is available. */
  public RenderJob dequeue() throws InterruptedException {
    return jobs.take();
  }

  public int size() {
    return jobs.size();
  }

  public int remainingCapacity() {
    return jobs.remainingCapacity();
  }

  public int capacity() {
    return capacity;
  }
}
