package com.gentoro.meshrender.storage;

import com.gentoro.meshrender.exception.IoException;
import com.gentoro.meshrender.fingerprint.Fingerprint;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * File naming for uploads and rendered images. Both are named after the content fingerprint, so a
 * given mesh always maps to the same input and output file.
 */
public final class StorageLayout {
  public static final String DEFAULT_OUTPUT_URL_PREFIX = "/output/";

  private final Path uploadsDir;
  private final Path outputDir;
  private final String outputUrlPrefix;

  public StorageLayout(Path uploadsDir, Path outputDir) {
    this(uploadsDir, outputDir, DEFAULT_OUTPUT_URL_PREFIX);
  }

  public StorageLayout(Path uploadsDir, Path outputDir, String outputUrlPrefix) {
    this.uploadsDir = Objects.requireNonNull(uploadsDir, "uploadsDir").toAbsolutePath().normalize();
    this.outputDir = Objects.requireNonNull(outputDir, "outputDir").toAbsolutePath().normalize();
    this.outputUrlPrefix =
        outputUrlPrefix.endsWith("/") ? outputUrlPrefix : outputUrlPrefix + "/";
  }

  /** Create the upload and output directories if missing. */
  public void ensureDirectories() {
    try {
      Files.createDirectories(uploadsDir);
      Files.createDirectories(outputDir);
    } catch (IOException e) {
      throw new IoException("Failed to create storage directories under " + uploadsDir, e);
    }
  }

  public Path uploadsDir() {
    return uploadsDir;
  }

  public Path outputDir() {
    return outputDir;
  }

  public Path inputPathFor(Fingerprint fingerprint) {
    return uploadsDir.resolve("input-" + fingerprint.hex() + ".stl");
  }

  public String outputNameFor(Fingerprint fingerprint) {
    return "output-" + fingerprint.hex() + ".png";
  }

  /** Resolve an output reference inside the output directory, refusing anything that escapes it. */
  public Path resolveOutput(String outputName) {
    if (!isInsideOutputDir(outputName)) {
      throw new IoException("Output reference escapes the output directory: " + outputName);
    }
    return outputDir.resolve(outputName).normalize();
  }

  public boolean isInsideOutputDir(String outputName) {
    Path resolved;
    try {
      resolved = outputDir.resolve(outputName).normalize();
    } catch (InvalidPathException e) {
      return false;
    }
    return resolved.startsWith(outputDir) && !resolved.equals(outputDir);
  }

  /** Whether the reference names a regular file in the output directory. Escaping names never do. */
  public boolean outputExists(String outputName) {
    return isInsideOutputDir(outputName) && Files.isRegularFile(resolveOutput(outputName));
  }

  /** Public download link for an output reference. */
  public String linkFor(String outputName) {
    return outputUrlPrefix + outputName;
  }
}
