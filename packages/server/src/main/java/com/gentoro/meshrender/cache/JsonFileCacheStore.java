package com.gentoro.meshrender.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.meshrender.exception.CacheException;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;

/**
 * Stores the fingerprint map as a single JSON object, e.g. {@code {"<sha256>":"output-<sha256>.png"}}.
 *
 * <p>Writes go to a sibling temporary file which is then moved over the target, so a crash mid-write
 * leaves the previous file intact.
 */
public final class JsonFileCacheStore implements CacheStore {
  private static final Logger log =
      com.gentoro.meshrender.logging.LoggingService.getLogger(JsonFileCacheStore.class);

  private static final TypeReference<LinkedHashMap<String, String>> MAP_TYPE =
      new TypeReference<>() {};

  private final Path file;
  private final ObjectMapper mapper = new ObjectMapper();

  public JsonFileCacheStore(Path file) {
    this.file = file;
  }

  public Path file() {
    return file;
  }

  @Override
  public Map<String, String> load() {
    String content;
    try {
      content = Files.readString(file);
    } catch (NoSuchFileException e) {
      log.info("No cache file at {}, starting with an empty cache", file);
      return new LinkedHashMap<>();
    } catch (IOException e) {
      throw new CacheException("Failed to read cache file: " + file, e);
    }

    if (content.isBlank()) {
      return new LinkedHashMap<>();
    }
    try {
      Map<String, String> entries = mapper.readValue(content, MAP_TYPE);
      return entries == null ? new LinkedHashMap<>() : entries;
    } catch (IOException e) {
      throw new CacheException("Cache file is corrupt: " + file, e);
    }
  }

  @Override
  public void save(Map<String, String> entries) {
    Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
    try {
      if (file.getParent() != null) Files.createDirectories(file.getParent());
      Files.write(tmp, mapper.writeValueAsBytes(entries));
      try {
        Files.move(
            tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      throw new CacheException("Failed to write cache file: " + file, e);
    }
  }
}
