package com.gentoro.meshrender.cache;

import com.gentoro.meshrender.exception.CacheException;
import com.gentoro.meshrender.exception.StateException;
import com.gentoro.meshrender.fingerprint.Fingerprint;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;

/**
 * Content-addressed cache mapping a {@link Fingerprint} to the output produced for it.
 *
 * <p>Write-through: {@link #record} updates the in-memory map and flushes a snapshot of it to the
 * {@link CacheStore} before returning. Writers are serialized on a flush lock so snapshots reach the
 * store in order. {@link #lookup} only reads the concurrent map and never waits for a flush. If the
 * flush fails the in-memory entry is kept and the failure is rethrown; the next successful flush
 * catches the store up.
 */
public final class DedupCache {
  private static final Logger log =
      com.gentoro.meshrender.logging.LoggingService.getLogger(DedupCache.class);

  private final CacheStore store;
  private final Map<String, String> entries = new ConcurrentHashMap<>();
  private final ReentrantLock flushLock = new ReentrantLock();
  private volatile boolean loaded;

  public DedupCache(CacheStore store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  /**
   * Populate the cache from durable storage. Intended to run once at startup.
   *
   * @throws CacheException if the stored data is corrupt
   */
  public void loadFromDurableStore() {
    flushLock.lock();
    try {
      if (loaded) {
        throw new StateException("Cache already loaded");
      }
      Map<String, String> persisted = store.load();
      int skipped = 0;
      for (Map.Entry<String, String> e : persisted.entrySet()) {
        if (e.getKey() == null || e.getValue() == null || e.getValue().isBlank()) {
          skipped++;
          continue;
        }
        entries.put(Fingerprint.of(e.getKey()).hex(), e.getValue());
      }
      loaded = true;
      log.info("Loaded {} cache entries ({} skipped)", entries.size(), skipped);
    } catch (IllegalArgumentException e) {
      throw new CacheException("Cache contains an invalid fingerprint", e);
    } finally {
      flushLock.unlock();
    }
  }

  public Optional<String> lookup(Fingerprint fingerprint) {
    return Optional.ofNullable(entries.get(fingerprint.hex()));
  }

  /**
   * Insert or replace the output reference for {@code fingerprint} and flush to storage.
   *
   * @throws CacheException when the flush fails; the in-memory entry stays in place
   */
  public void record(Fingerprint fingerprint, String outputReference) {
    Objects.requireNonNull(fingerprint, "fingerprint");
    if (outputReference == null || outputReference.isBlank()) {
      throw new IllegalArgumentException("outputReference must not be blank");
    }

    flushLock.lock();
    try {
      String previous = entries.put(fingerprint.hex(), outputReference);
      if (previous != null && !previous.equals(outputReference)) {
        log.debug("Replacing cache entry {}: {} -> {}", fingerprint, previous, outputReference);
      }
      store.save(new HashMap<>(entries));
    } finally {
      flushLock.unlock();
    }
    log.debug("Recorded {} -> {}", fingerprint, outputReference);
  }

  public int size() {
    return entries.size();
  }
}
