package com.gentoro.meshrender.exception;

/** Stable error codes attached to {@link MeshRenderException} instances. */
public enum MeshRenderErrorCode {
  UNKNOWN,
  CONFIG_ERROR,
  IO_ERROR,
  CACHE_ERROR,
  RENDER_ERROR,
  NETWORK_ERROR,
  STATE_ERROR
}
