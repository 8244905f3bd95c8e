package com.gentoro.meshrender.submission;

import com.gentoro.meshrender.cache.DedupCache;
import com.gentoro.meshrender.exception.IoException;
import com.gentoro.meshrender.fingerprint.ContentFingerprint;
import com.gentoro.meshrender.fingerprint.Fingerprint;
import com.gentoro.meshrender.notify.JobActivator;
import com.gentoro.meshrender.queue.RenderJob;
import com.gentoro.meshrender.queue.WorkQueue;
import com.gentoro.meshrender.storage.StorageLayout;
import com.gentoro.meshrender.worker.JobCompletionListener;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;

/**
 * Entry point for uploads.
 *
 * <p>A cache hit is answered straight away. A miss stores the upload under its fingerprint and
 * stages a {@link RenderJob}; the job only reaches the {@link WorkQueue} once a notification channel
 * registers its id and calls {@link #activate}. Staged jobs nobody claims are expired after the
 * configured time to live.
 */
public final class SubmissionService implements JobActivator, JobCompletionListener, AutoCloseable {
  private static final Logger log =
      com.gentoro.meshrender.logging.LoggingService.getLogger(SubmissionService.class);

  private final DedupCache cache;
  private final WorkQueue queue;
  private final StorageLayout storage;
  private final Duration pendingTtl;
  private final Clock clock;

  // guards staged and inFlight together so a job is always in exactly one of them
  private final Object tracking = new Object();
  private final Map<String, RenderJob> staged = new HashMap<>();
  private final Map<String, RenderJob> inFlight = new HashMap<>();

  private ScheduledExecutorService sweeper;

  public SubmissionService(
      DedupCache cache, WorkQueue queue, StorageLayout storage, Duration pendingTtl) {
    this(cache, queue, storage, pendingTtl, Clock.systemUTC());
  }

  SubmissionService(
      DedupCache cache, WorkQueue queue, StorageLayout storage, Duration pendingTtl, Clock clock) {
    this.cache = Objects.requireNonNull(cache, "cache");
    this.queue = Objects.requireNonNull(queue, "queue");
    this.storage = Objects.requireNonNull(storage, "storage");
    this.pendingTtl = Objects.requireNonNull(pendingTtl, "pendingTtl");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Fingerprint and store an upload.
   *
   * @throws IoException when the content cannot be read or written; nothing is staged in that case
   */
  public SubmissionResult submit(InputStream content) {
    Path partial;
    try {
      Files.createDirectories(storage.uploadsDir());
      partial = Files.createTempFile(storage.uploadsDir(), "upload-", ".part");
    } catch (IOException e) {
      throw new IoException("Failed to allocate upload file", e);
    }

    Fingerprint fingerprint;
    try {
      fingerprint = ContentFingerprint.copyAndDerive(content, partial);
    } catch (IOException e) {
      deleteQuietly(partial);
      throw new IoException("Failed to read uploaded content", e);
    }

    Optional<String> cached = cache.lookup(fingerprint);
    if (cached.isPresent()) {
      if (storage.outputExists(cached.get())) {
        deleteQuietly(partial);
        log.info("Cache hit for {} -> {}", fingerprint, cached.get());
        return SubmissionResult.cached(fingerprint, storage.linkFor(cached.get()));
      }
      log.warn(
          "Cache entry for {} points at missing {}, rendering again", fingerprint, cached.get());
    }

    Path input = storage.inputPathFor(fingerprint);
    RenderJob job =
        new RenderJob(
            UUID.randomUUID().toString(),
            fingerprint,
            input,
            storage.outputNameFor(fingerprint),
            clock.instant());
    // placing the file and staging the job under one lock keeps discardInput from racing us
    synchronized (tracking) {
      try {
        moveReplacing(partial, input);
      } catch (IOException e) {
        deleteQuietly(partial);
        throw new IoException("Failed to save uploaded content", e);
      }
      staged.put(job.id(), job);
    }
    log.info("Staged job {} for {}", job.id(), fingerprint);
    return SubmissionResult.accepted(fingerprint, job.id(), storage.linkFor(job.outputName()));
  }

  @Override
  public Activation activate(String jobId) throws InterruptedException {
    RenderJob job;
    synchronized (tracking) {
      job = staged.remove(jobId);
      if (job == null) {
        return inFlight.containsKey(jobId) ? Activation.IN_FLIGHT : Activation.UNKNOWN;
      }
      inFlight.put(jobId, job);
    }

    try {
      queue.enqueue(job);
    } catch (InterruptedException e) {
      synchronized (tracking) {
        inFlight.remove(jobId);
        staged.put(jobId, job);
      }
      throw e;
    }
    return Activation.ENQUEUED;
  }

  @Override
  public void onFinished(RenderJob job, boolean succeeded) {
    synchronized (tracking) {
      inFlight.remove(job.id());
    }
    if (!succeeded) {
      discardInput(job);
    }
  }

  /** Drop staged jobs older than the time to live. */
  public int sweepExpired() {
    Instant cutoff = clock.instant().minus(pendingTtl);
    List<RenderJob> expired = new ArrayList<>();
    synchronized (tracking) {
      var it = staged.values().iterator();
      while (it.hasNext()) {
        RenderJob job = it.next();
        if (!job.createdAt().isAfter(cutoff)) {
          it.remove();
          expired.add(job);
        }
      }
    }
    for (RenderJob job : expired) {
      log.info("Staged job {} was never claimed, expiring it", job.id());
      discardInput(job);
    }
    return expired.size();
  }

  /** Start periodic expiry of unclaimed jobs. */
  public void start() {
    synchronized (tracking) {
      if (sweeper != null) return;
      sweeper =
          Executors.newSingleThreadScheduledExecutor(
              r -> {
                Thread t = new Thread(r, "submission-sweeper");
                t.setDaemon(true);
                return t;
              });
    }
    long periodMillis = Math.max(1000L, Math.min(pendingTtl.toMillis() / 2, 60_000L));
    sweeper.scheduleWithFixedDelay(
        () -> {
          try {
            sweepExpired();
          } catch (RuntimeException e) {
            log.error("Sweeping staged jobs failed", e);
          }
        },
        periodMillis,
        periodMillis,
        TimeUnit.MILLISECONDS);
  }

  public int stagedCount() {
    synchronized (tracking) {
      return staged.size();
    }
  }

  public int inFlightCount() {
    synchronized (tracking) {
      return inFlight.size();
    }
  }

  public Optional<RenderJob> stagedJob(String jobId) {
    synchronized (tracking) {
      return Optional.ofNullable(staged.get(jobId));
    }
  }

  @Override
  public void close() {
    ScheduledExecutorService s;
    synchronized (tracking) {
      s = sweeper;
      sweeper = null;
    }
    if (s != null) s.shutdownNow();
  }

  /** Delete a job's input unless another tracked job still needs the same file. */
  private void discardInput(RenderJob job) {
    synchronized (tracking) {
      Fingerprint fp = job.fingerprint();
      boolean shared =
          staged.values().stream().anyMatch(j -> j.fingerprint().equals(fp))
              || inFlight.values().stream().anyMatch(j -> j.fingerprint().equals(fp));
      if (shared) return;
      deleteQuietly(job.inputPath());
    }
  }

  private static void moveReplacing(Path source, Path target) throws IOException {
    try {
      Files.move(
          source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      log.debug("Could not delete {}: {}", file, e.getMessage());
    }
  }
}
