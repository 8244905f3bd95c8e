package com.gentoro.meshrender;

import com.gentoro.meshrender.cache.DedupCache;
import com.gentoro.meshrender.cache.JsonFileCacheStore;
import com.gentoro.meshrender.exception.ConfigException;
import com.gentoro.meshrender.exception.NetworkException;
import com.gentoro.meshrender.exception.StateException;
import com.gentoro.meshrender.http.EmbeddedJettyServer;
import com.gentoro.meshrender.http.RenderEndpoints;
import com.gentoro.meshrender.notify.CorrelationRegistry;
import com.gentoro.meshrender.queue.WorkQueue;
import com.gentoro.meshrender.render.RenderOptions;
import com.gentoro.meshrender.render.StlRenderer;
import com.gentoro.meshrender.storage.StorageLayout;
import com.gentoro.meshrender.submission.SubmissionService;
import com.gentoro.meshrender.worker.RenderWorker;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.apache.commons.configuration2.Configuration;

/**
 * Process-wide service object. Owns the cache, queue, registry, worker and HTTP server, wires them
 * together once in {@link #initialize()} and tears them down once in {@link #shutdown()}.
 */
public class MeshRender {

  private static final org.slf4j.Logger log =
      com.gentoro.meshrender.logging.LoggingService.getLogger(MeshRender.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private StorageLayout storage;
  private DedupCache dedupCache;
  private WorkQueue workQueue;
  private CorrelationRegistry correlationRegistry;
  private SubmissionService submissions;
  private RenderWorker worker;
  private EmbeddedJettyServer httpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public MeshRender(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    // Disable java logging entirely.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    com.gentoro.meshrender.logging.LoggingService.applyConfiguration(configuration());

    Configuration config = configuration();
    this.storage =
        new StorageLayout(
            path(config, "storage.uploads-dir", "uploads"),
            path(config, "storage.output-dir", "output"));
    storage.ensureDirectories();

    Path cacheFile = path(config, "cache.file", "file_hashes.json");
    this.dedupCache = new DedupCache(new JsonFileCacheStore(cacheFile));
    dedupCache.loadFromDurableStore();
    log.info("Loaded {} cache entries from {}", dedupCache.size(), cacheFile);

    this.workQueue =
        new WorkQueue(positiveInt(config, "queue.capacity", WorkQueue.DEFAULT_CAPACITY));
    this.correlationRegistry = new CorrelationRegistry();
    this.submissions =
        new SubmissionService(
            dedupCache,
            workQueue,
            storage,
            Duration.ofSeconds(positiveInt(config, "submission.pending-ttl-seconds", 600)));
    submissions.start();

    RenderOptions renderOptions;
    try {
      renderOptions =
          new RenderOptions(
              positiveInt(config, "render.width", RenderOptions.DEFAULT.width()),
              positiveInt(config, "render.height", RenderOptions.DEFAULT.height()),
              config.getDouble("render.fov", RenderOptions.DEFAULT.fovDegrees()));
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Invalid render configuration: " + e.getMessage(), e);
    }
    this.worker =
        new RenderWorker(
            workQueue,
            dedupCache,
            correlationRegistry,
            new StlRenderer(renderOptions),
            storage,
            submissions);
    worker.start();

    this.httpServer = new EmbeddedJettyServer(config);
    httpServer.prepare();
    try {
      new RenderEndpoints(this).register();
      httpServer.start();
    } catch (Exception e) {
      shutdown();
      throw new NetworkException("Could not start http server", e);
    }
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   * When signaled, this method invokes {@link #shutdown()} to release resources before returning.
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "meshrender-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }

    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      log.info("Shutting down");
      try {
        closeQuietly(httpServer);
        closeQuietly(worker);
        closeQuietly(submissions);
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  private void closeQuietly(AutoCloseable closeable) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.warn("Failed to close {}: {}", closeable.getClass().getSimpleName(), e.getMessage());
      }
    }
  }

  private static Path path(Configuration config, String key, String defaultValue) {
    String value = config.getString(key, defaultValue);
    if (value == null || value.isBlank()) {
      throw new ConfigException("Missing " + key + " configuration");
    }
    try {
      return Paths.get(value.trim());
    } catch (RuntimeException e) {
      throw new ConfigException("Invalid path for " + key + ": " + value, e);
    }
  }

  private static int positiveInt(Configuration config, String key, int defaultValue) {
    int value;
    try {
      value = config.getInt(key, defaultValue);
    } catch (RuntimeException e) {
      throw new ConfigException("Failed to resolve " + key + " configuration", e);
    }
    if (value <= 0) {
      throw new ConfigException(key + " must be positive, got " + value);
    }
    return value;
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("MeshRender not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public StorageLayout storage() {
    return storage;
  }

  public DedupCache dedupCache() {
    return dedupCache;
  }

  public WorkQueue workQueue() {
    return workQueue;
  }

  public CorrelationRegistry correlationRegistry() {
    return correlationRegistry;
  }

  public SubmissionService submissions() {
    return submissions;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }
}
