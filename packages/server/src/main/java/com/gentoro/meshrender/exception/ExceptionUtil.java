package com.gentoro.meshrender.exception;

import java.time.Instant;
import java.util.function.Function;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logging or API responses. If the
   * throwable is a {@link MeshRenderException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof MeshRenderException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        safeMessage(t.getMessage()),
        MeshRenderErrorCode.UNKNOWN,
        null,
        Instant.now());
  }

  /**
   * Produce a compact, single-line representation of a throwable's stack trace, top frames first.
   *
   * <p>Example output: {@code com.example.Foo.bar (Foo.java:42) > com.example.App.main
   * (App.java:10)}
   *
   * @param t the throwable whose stack should be summarized (null returns empty string)
   * @param maxFrames maximum number of top stack frames to include; if <= 0, includes all frames
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  /** Convenience overload using a default of 10 frames. */
  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }

  /**
   * Extract a user-facing message from a throwable. Walks to the innermost cause that carries a
   * message, since wrappers tend to say less than what they wrap.
   *
   * @return the message, prefixed with the exception's simple name, or a default if none exists
   */
  public static String extractErrorMessage(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }

    Throwable best = t;
    Throwable current = t.getCause();
    while (current != null && current != best) {
      String message = current.getMessage();
      if (message != null && !message.isBlank()) {
        best = current;
      }
      current = current.getCause();
    }

    String message = best.getMessage();
    if (message == null || message.isBlank()) {
      return best.getClass().getSimpleName();
    }
    if (best instanceof MeshRenderException) {
      return message;
    }
    return best.getClass().getSimpleName() + ": " + message;
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }

  public static MeshRenderException rethrowIfUnchecked(
      Throwable t, Function<Throwable, MeshRenderException> supplier) {
    if (t instanceof MeshRenderException) {
      return (MeshRenderException) t;
    } else {
      return supplier.apply(t);
    }
  }
}
