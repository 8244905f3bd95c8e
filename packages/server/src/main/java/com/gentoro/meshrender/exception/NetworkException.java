package com.gentoro.meshrender.exception;

/** Failures binding or running the HTTP listener. */
public class NetworkException extends MeshRenderException {
  public NetworkException(String message) {
    super(MeshRenderErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(MeshRenderErrorCode.NETWORK_ERROR, message, cause);
  }
}
