package com.gentoro.meshrender.exception;

/** Invalid or missing configuration values. */
public class ConfigException extends MeshRenderException {
  public ConfigException(String message) {
    super(MeshRenderErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(MeshRenderErrorCode.CONFIG_ERROR, message, cause);
  }
}
