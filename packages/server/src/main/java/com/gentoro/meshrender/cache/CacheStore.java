package com.gentoro.meshrender.cache;

import java.util.Map;

/** Durable backing storage for {@link DedupCache}: whole-map load and whole-map overwrite. */
public interface CacheStore {

  /**
   * Load every persisted entry.
   *
   * @return the persisted map, empty when nothing was stored yet
   * @throws com.gentoro.meshrender.exception.CacheException when the stored data is unreadable
   */
  Map<String, String> load();

  /** Replace the persisted contents with {@code entries}. */
  void save(Map<String, String> entries);
}
