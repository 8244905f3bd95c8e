package com.gentoro.meshrender.worker;

import com.gentoro.meshrender.cache.DedupCache;
import com.gentoro.meshrender.exception.CacheException;
import com.gentoro.meshrender.exception.ExceptionUtil;
import com.gentoro.meshrender.exception.RenderException;
import com.gentoro.meshrender.notify.CorrelationRegistry;
import com.gentoro.meshrender.notify.JobNotification;
import com.gentoro.meshrender.queue.RenderJob;
import com.gentoro.meshrender.queue.WorkQueue;
import com.gentoro.meshrender.render.MeshRenderer;
import com.gentoro.meshrender.storage.StorageLayout;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;

/**
 * The single consumer of the {@link WorkQueue}.
 *
 * <p>Jobs are rendered strictly one at a time in queue order, because {@link MeshRenderer}
 * implementations are not assumed reentrant. A failed job is reported and dropped, never retried.
 * Anything the renderer throws, errors such as {@link OutOfMemoryError} included, fails only that
 * job. Only successful renders reach the {@link DedupCache}.
 */
public final class RenderWorker implements AutoCloseable {
  private static final Logger log =
      com.gentoro.meshrender.logging.LoggingService.getLogger(RenderWorker.class);

  private final WorkQueue queue;
  private final DedupCache cache;
  private final CorrelationRegistry registry;
  private final MeshRenderer renderer;
  private final StorageLayout storage;
  private final JobCompletionListener listener;

  private final ExecutorService executor =
      Executors.newSingleThreadExecutor(r -> new Thread(r, "render-worker"));
  private final Object lifecycleLock = new Object();
  private boolean started;

  public RenderWorker(
      WorkQueue queue,
      DedupCache cache,
      CorrelationRegistry registry,
      MeshRenderer renderer,
      StorageLayout storage,
      JobCompletionListener listener) {
    this.queue = Objects.requireNonNull(queue, "queue");
    this.cache = Objects.requireNonNull(cache, "cache");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.renderer = Objects.requireNonNull(renderer, "renderer");
    this.storage = Objects.requireNonNull(storage, "storage");
    this.listener = listener == null ? JobCompletionListener.NONE : listener;
  }

  /** Start the consumer thread. Calling it twice is a no-op. */
  public void start() {
    synchronized (lifecycleLock) {
      if (started) return;
      started = true;
      executor.submit(this::loop);
      log.info("Render worker started");
    }
  }

  private void loop() {
    while (!Thread.currentThread().isInterrupted()) {
      RenderJob job;
      try {
        job = queue.dequeue();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      }
      try {
        process(job);
      } catch (Throwable t) {
        // keep the lane alive whatever a single job does
        log.error("Unexpected failure while handling job {}", job.id(), t);
      }
    }
    log.info("Render worker stopped");
  }

  /** Handle one job end to end. Visible for tests that drive the worker synchronously. */
  void process(RenderJob job) {
    Instant begin = Instant.now();
    boolean succeeded = false;
    try {
      Optional<String> cached = cache.lookup(job.fingerprint());
      if (cached.isPresent() && storage.outputExists(cached.get())) {
        log.info("Job {} matches already rendered {}, skipping render", job.id(), cached.get());
        registry
            .sinkFor(job.id())
            .publish(JobNotification.completed(job.id(), storage.linkFor(cached.get())));
        succeeded = true;
        return;
      }

      log.info("Processing job {} ({})", job.id(), job.fingerprint());
      registry.sinkFor(job.id()).publish(JobNotification.processing(job.id()));

      String outputName;
      try {
        outputName = render(job);
      } catch (RuntimeException | Error e) {
        log.error(
            "Failed to render job {}: {}",
            job.id(),
            ExceptionUtil.formatCompactStackTrace(e),
            e);
        registry
            .sinkFor(job.id())
            .publish(JobNotification.failed(job.id(), ExceptionUtil.extractErrorMessage(e)));
        return;
      }

      try {
        cache.record(job.fingerprint(), outputName);
      } catch (CacheException e) {
        log.warn("Rendered job {} but could not persist cache entry: {}", job.id(), e.getMessage());
      }

      registry
          .sinkFor(job.id())
          .publish(JobNotification.completed(job.id(), storage.linkFor(outputName)));
      succeeded = true;
      log.info(
          "Completed job {} in {} ms",
          job.id(),
          Duration.between(begin, Instant.now()).toMillis());
    } finally {
      listener.onFinished(job, succeeded);
    }
  }

  private String render(RenderJob job) {
    Path target = storage.resolveOutput(job.outputName());
    Path produced = renderer.render(job.inputPath(), target);
    if (produced == null || !Files.isRegularFile(produced)) {
      throw new RenderException("Renderer finished without producing " + job.outputName());
    }
    return storage.outputDir().relativize(produced.toAbsolutePath().normalize()).toString();
  }

  /** Stop the consumer thread; the job in progress, if any, is interrupted. */
  @Override
  public void close() {
    synchronized (lifecycleLock) {
      executor.shutdownNow();
    }
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Render worker did not stop within timeout");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
