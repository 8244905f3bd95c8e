package com.gentoro.meshrender.fingerprint;

import java.util.Objects;
import java.util.regex.Pattern;

/** Lowercase hex SHA-256 digest identifying a piece of content. */
public record Fingerprint(String hex) {
  private static final Pattern SHA256_HEX = Pattern.compile("[0-9a-f]{64}");

  public Fingerprint {
    Objects.requireNonNull(hex, "hex");
    if (!SHA256_HEX.matcher(hex).matches()) {
      throw new IllegalArgumentException("Not a SHA-256 hex digest: " + hex);
    }
  }

  /** Parse a digest, tolerating surrounding whitespace and upper case. */
  public static Fingerprint of(String value) {
    Objects.requireNonNull(value, "value");
    return new Fingerprint(value.trim().toLowerCase(java.util.Locale.ROOT));
  }

  @Override
  public String toString() {
    return hex;
  }
}
