package com.gentoro.meshrender.fingerprint;

import com.gentoro.meshrender.exception.StateException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Derives SHA-256 fingerprints from content.
 *
 * <p>All methods are deterministic and side-effect free apart from {@link #copyAndDerive}, which
 * writes the consumed bytes to a destination file while hashing them.
 */
public final class ContentFingerprint {

  private static final String ALGORITHM = "SHA-256";
  private static final int BUFFER_SIZE = 8192;

  private ContentFingerprint() {}

  public static Fingerprint derive(byte[] content) {
    MessageDigest md = newDigest();
    md.update(content);
    return toFingerprint(md);
  }

  /** Consume the stream fully and return its fingerprint. The stream is not closed. */
  public static Fingerprint derive(InputStream in) throws IOException {
    MessageDigest md = newDigest();
    byte[] buf = new byte[BUFFER_SIZE];

    int n;
    while ((n = in.read(buf)) != -1) md.update(buf, 0, n);

    return toFingerprint(md);
  }

  public static Fingerprint derive(Path file) throws IOException {
    try (InputStream in = Files.newInputStream(file)) {
      return derive(in);
    }
  }

  /**
   * Copy {@code in} to {@code dest} and fingerprint the bytes in the same pass.
   *
   * <p>On failure the partially written destination is left for the caller to clean up.
   */
  public static Fingerprint copyAndDerive(InputStream in, Path dest) throws IOException {
    MessageDigest md = newDigest();
    if (dest.getParent() != null) Files.createDirectories(dest.getParent());

    try (DigestInputStream digesting = new DigestInputStream(in, md);
        OutputStream out = Files.newOutputStream(dest)) {
      digesting.transferTo(out);
    }
    return toFingerprint(md);
  }

  private static Fingerprint toFingerprint(MessageDigest md) {
    return new Fingerprint(HexFormat.of().formatHex(md.digest()));
  }

  private static MessageDigest newDigest() {
    try {
      return MessageDigest.getInstance(ALGORITHM);
    } catch (NoSuchAlgorithmException e) {
      // every JRE is required to ship SHA-256
      throw new StateException("SHA-256 digest unavailable", e);
    }
  }
}
