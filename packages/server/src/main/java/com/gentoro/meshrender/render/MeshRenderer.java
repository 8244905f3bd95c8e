package com.gentoro.meshrender.render;

import java.nio.file.Path;

/**
 * Turns an uploaded mesh into an image. Implementations need not be thread-safe: the render worker
 * calls them from a single thread, one job at a time.
 */
public interface MeshRenderer {

  /**
   * Render {@code input} and write the image to {@code output}.
   *
   * @return the path actually written, normally {@code output}
   * @throws com.gentoro.meshrender.exception.RenderException if the mesh cannot be read or drawn
   */
  Path render(Path input, Path output);
}
