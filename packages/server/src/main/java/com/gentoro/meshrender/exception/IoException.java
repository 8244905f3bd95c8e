package com.gentoro.meshrender.exception;

/** File system failures while storing uploads or outputs. */
public class IoException extends MeshRenderException {
  public IoException(String message) {
    super(MeshRenderErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(MeshRenderErrorCode.IO_ERROR, message, cause);
  }
}
