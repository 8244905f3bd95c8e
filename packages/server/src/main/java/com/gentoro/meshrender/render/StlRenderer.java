package com.gentoro.meshrender.render;

import com.gentoro.meshrender.exception.RenderException;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import javax.imageio.ImageIO;
import org.slf4j.Logger;

/**
 * Software renderer producing a shaded PNG preview of an STL mesh.
 *
 * <p>The mesh is fitted into the bi-unit cube and viewed from (3, 3, 3) towards the origin with +Z
 * up, on a white background. Shading is Phong with a grey material, lit from the (1, 1, 1)
 * direction. Faces are lit on whichever side faces the camera, since STL winding is often
 * inconsistent.
 *
 * <p>Holds no mutable state; each call allocates its own buffers.
 */
public final class StlRenderer implements MeshRenderer {
  private static final Logger log =
      com.gentoro.meshrender.logging.LoggingService.getLogger(StlRenderer.class);

  private static final Vector3 EYE = new Vector3(3, 3, 3);
  private static final Vector3 CENTER = Vector3.ZERO;
  private static final Vector3 UP = new Vector3(0, 0, 1);
  private static final Vector3 LIGHT = new Vector3(1, 1, 1).normalize();
  private static final double NEAR = 1;
  private static final double FAR = 10;

  private static final double OBJECT_COLOR = 0.75;
  private static final double AMBIENT = 0.2;
  private static final double DIFFUSE = 0.8;
  private static final double SPECULAR = 1.0;
  private static final double SPECULAR_POWER = 100;
  private static final int BACKGROUND = 0xFFFFFF;

  private final RenderOptions options;

  public StlRenderer(RenderOptions options) {
    this.options = options;
  }

  @Override
  public Path render(Path input, Path output) {
    Mesh mesh = StlReader.read(input);
    if (mesh.isEmpty()) {
      throw new RenderException("Mesh contains no triangles");
    }
    log.debug("Rendering {} triangles from {}", mesh.size(), input.getFileName());

    BufferedImage image = draw(mesh.fitToBiUnitCube());
    write(image, output);
    return output;
  }

  BufferedImage draw(Mesh mesh) {
    int width = options.width();
    int height = options.height();
    Matrix4 matrix =
        Matrix4.perspective(options.fovDegrees(), (double) width / height, NEAR, FAR)
            .multiply(Matrix4.lookAt(EYE, CENTER, UP));

    BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    int[] pixels = new int[width * height];
    Arrays.fill(pixels, BACKGROUND);
    double[] depth = new double[width * height];
    Arrays.fill(depth, Double.POSITIVE_INFINITY);

    for (Triangle t : mesh.triangles()) {
      rasterize(t, matrix, width, height, pixels, depth);
    }
    image.setRGB(0, 0, width, height, pixels, 0, width);
    return image;
  }

  private void rasterize(
      Triangle t, Matrix4 matrix, int width, int height, int[] pixels, double[] depth) {
    Vector3[] world = {t.a(), t.b(), t.c()};
    double[] sx = new double[3];
    double[] sy = new double[3];
    double[] sz = new double[3];
    double[] invW = new double[3];

    for (int i = 0; i < 3; i++) {
      double[] clip = matrix.transform(world[i]);
      if (clip[3] <= 1e-9) return; // behind the camera
      invW[i] = 1.0 / clip[3];
      sx[i] = (clip[0] * invW[i] + 1) * 0.5 * width;
      sy[i] = (1 - clip[1] * invW[i]) * 0.5 * height;
      sz[i] = clip[2] * invW[i];
    }

    double area = edge(sx[0], sy[0], sx[1], sy[1], sx[2], sy[2]);
    if (Math.abs(area) < 1e-12) return;

    Vector3 normal = t.normal();
    if (normal.equals(Vector3.ZERO)) return;

    int minX = Math.max(0, (int) Math.floor(Math.min(sx[0], Math.min(sx[1], sx[2]))));
    int maxX = Math.min(width - 1, (int) Math.ceil(Math.max(sx[0], Math.max(sx[1], sx[2]))));
    int minY = Math.max(0, (int) Math.floor(Math.min(sy[0], Math.min(sy[1], sy[2]))));
    int maxY = Math.min(height - 1, (int) Math.ceil(Math.max(sy[0], Math.max(sy[1], sy[2]))));

    for (int y = minY; y <= maxY; y++) {
      double py = y + 0.5;
      for (int x = minX; x <= maxX; x++) {
        double px = x + 0.5;
        double w0 = edge(sx[1], sy[1], sx[2], sy[2], px, py) / area;
        double w1 = edge(sx[2], sy[2], sx[0], sy[0], px, py) / area;
        double w2 = 1 - w0 - w1;
        if (w0 < 0 || w1 < 0 || w2 < 0) continue;

        double z = w0 * sz[0] + w1 * sz[1] + w2 * sz[2];
        if (z < -1 || z > 1) continue;
        int idx = y * width + x;
        if (z >= depth[idx]) continue;
        depth[idx] = z;

        // perspective-correct world position for the specular term
        double p0 = w0 * invW[0];
        double p1 = w1 * invW[1];
        double p2 = w2 * invW[2];
        double sum = p0 + p1 + p2;
        Vector3 position =
            world[0].scale(p0 / sum).add(world[1].scale(p1 / sum)).add(world[2].scale(p2 / sum));

        pixels[idx] = shade(position, normal);
      }
    }
  }

  private static int shade(Vector3 position, Vector3 faceNormal) {
    Vector3 toEye = EYE.sub(position).normalize();
    Vector3 n = faceNormal.dot(toEye) < 0 ? faceNormal.scale(-1) : faceNormal;

    double diffuse = Math.max(n.dot(LIGHT), 0);
    double specular = 0;
    if (diffuse > 0) {
      Vector3 reflected = n.scale(2 * n.dot(LIGHT)).sub(LIGHT);
      specular = Math.pow(Math.max(reflected.dot(toEye), 0), SPECULAR_POWER);
    }
    double v = OBJECT_COLOR * (AMBIENT + DIFFUSE * diffuse) + SPECULAR * specular;
    int c = (int) Math.round(Math.min(1, Math.max(0, v)) * 255);
    return (c << 16) | (c << 8) | c;
  }

  private static double edge(double ax, double ay, double bx, double by, double px, double py) {
    return (bx - ax) * (py - ay) - (by - ay) * (px - ax);
  }

  private static void write(BufferedImage image, Path output) {
    Path tmp = output.resolveSibling(output.getFileName() + ".tmp");
    try {
      if (output.getParent() != null) Files.createDirectories(output.getParent());
      if (!ImageIO.write(image, "png", tmp.toFile())) {
        throw new RenderException("No PNG writer available");
      }
      try {
        Files.move(
            tmp, output, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, output, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      throw new RenderException("Failed to save PNG file: " + output.getFileName(), e);
    }
  }
}
