package com.gentoro.meshrender.render;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.meshrender.exception.RenderException;
import java.awt.image.BufferedImage;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StlRendererTest {

  private final StlRenderer renderer = new StlRenderer(new RenderOptions(96, 64, 30));

  @Test
  void rendersPngOfConfiguredSize(@TempDir Path dir) throws Exception {
    Path input = dir.resolve("input.stl");
    Files.write(input, StlFixtures.tetrahedron());
    Path output = dir.resolve("out/output.png");

    Path produced = renderer.render(input, output);

    assertEquals(output, produced);
    assertTrue(Files.isRegularFile(output));
    assertFalse(Files.exists(dir.resolve("out/output.png.tmp")));
    BufferedImage image = ImageIO.read(output.toFile());
    assertEquals(96, image.getWidth());
    assertEquals(64, image.getHeight());
  }

  @Test
  void meshIsDrawnOverWhiteBackground() {
    Mesh mesh = StlReader.parse(StlFixtures.tetrahedron()).fitToBiUnitCube();

    BufferedImage image = renderer.draw(mesh);

    assertEquals(0xFFFFFF, image.getRGB(0, 0) & 0xFFFFFF);
    int shaded = 0;
    for (int y = 0; y < image.getHeight(); y++) {
      for (int x = 0; x < image.getWidth(); x++) {
        int rgb = image.getRGB(x, y) & 0xFFFFFF;
        if (rgb == 0xFFFFFF) continue;
        shaded++;
        // grey material: all channels equal
        assertEquals((rgb >> 16) & 0xFF, rgb & 0xFF);
      }
    }
    assertTrue(shaded > 100, "expected a visible mesh, got " + shaded + " shaded pixels");
  }

  @Test
  void emptyMeshFails(@TempDir Path dir) throws Exception {
    Path input = dir.resolve("empty.stl");
    Files.writeString(input, "solid empty\nendsolid empty\n", StandardCharsets.US_ASCII);

    assertThrows(RenderException.class, () -> renderer.render(input, dir.resolve("o.png")));
    assertFalse(Files.exists(dir.resolve("o.png")));
  }

  @Test
  void invalidOptionsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> new RenderOptions(0, 10, 30));
    assertThrows(IllegalArgumentException.class, () -> new RenderOptions(10, 10, 180));
  }
}
