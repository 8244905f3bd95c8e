package com.gentoro.meshrender.exception;

/** Failures while turning a mesh into an image. */
public class RenderException extends MeshRenderException {
  public RenderException(String message) {
    super(MeshRenderErrorCode.RENDER_ERROR, message);
  }

  public RenderException(String message, Throwable cause) {
    super(MeshRenderErrorCode.RENDER_ERROR, message, cause);
  }
}
