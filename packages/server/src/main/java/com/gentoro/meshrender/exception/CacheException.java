package com.gentoro.meshrender.exception;

/** Failures loading or persisting the fingerprint cache. */
public class CacheException extends MeshRenderException {
  public CacheException(String message) {
    super(MeshRenderErrorCode.CACHE_ERROR, message);
  }

  public CacheException(String message, Throwable cause) {
    super(MeshRenderErrorCode.CACHE_ERROR, message, cause);
  }
}
