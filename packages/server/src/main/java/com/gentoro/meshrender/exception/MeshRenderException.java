package com.gentoro.meshrender.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base unchecked exception for the service. Carries a {@link MeshRenderErrorCode} and an optional
 * key/value context that ends up in logs and error responses.
 */
public class MeshRenderException extends RuntimeException {
  private final MeshRenderErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public MeshRenderException(MeshRenderErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public MeshRenderException(MeshRenderErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public MeshRenderErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a context value; returns {@code this} for chaining. */
  public MeshRenderException with(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
