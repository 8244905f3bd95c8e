package com.gentoro.meshrender.exception;

/** Operations attempted in the wrong lifecycle state. */
public class StateException extends MeshRenderException {
  public StateException(String message) {
    super(MeshRenderErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(MeshRenderErrorCode.STATE_ERROR, message, cause);
  }
}
