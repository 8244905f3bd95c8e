package com.gentoro.meshrender.render;

/**
 * Image and camera settings for {@link StlRenderer}.
 *
 * @param width image width in pixels
 * @param height image height in pixels
 * @param fovDegrees vertical field of view
 */
public record RenderOptions(int width, int height, double fovDegrees) {
  public static final RenderOptions DEFAULT = new RenderOptions(1024, 1024, 30);

  public RenderOptions {
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException("Image size must be positive: " + width + "x" + height);
    }
    if (!(fovDegrees > 0 && fovDegrees < 180)) {
      throw new IllegalArgumentException("Field of view out of range: " + fovDegrees);
    }
  }
}
