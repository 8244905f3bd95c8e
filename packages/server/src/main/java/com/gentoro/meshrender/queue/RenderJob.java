package com.gentoro.meshrender.queue;

import com.gentoro.meshrender.fingerprint.Fingerprint;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * One unit of render work.
 *
 * @param id correlation key handed to the client and used to find its notification channel
 * @param fingerprint digest of the uploaded content, the cache key for the result
 * @param inputPath where the uploaded mesh was stored
 * @param outputName file name of the image to produce, relative to the output directory
 * @param createdAt submission time
 */
public record RenderJob(
    String id, Fingerprint fingerprint, Path inputPath, String outputName, Instant createdAt) {

  public RenderJob {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(fingerprint, "fingerprint");
    Objects.requireNonNull(inputPath, "inputPath");
    Objects.requireNonNull(outputName, "outputName");
    Objects.requireNonNull(createdAt, "createdAt");
  }
}
