package com.gentoro.meshrender.render;

import com.gentoro.meshrender.exception.RenderException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads binary and ASCII STL files.
 *
 * <p>Binary layout: 80 byte header, little-endian uint32 triangle count, then 50 bytes per
 * triangle (normal, three vertices, attribute word). A file is treated as binary when its size
 * matches that layout exactly, since some binary exporters also start the header with {@code
 * solid}.
 */
public final class StlReader {
  private static final int HEADER_SIZE = 80;
  private static final int TRIANGLE_SIZE = 50;

  private StlReader() {}

  public static Mesh read(Path file) {
    byte[] data;
    try {
      data = Files.readAllBytes(file);
    } catch (IOException e) {
      throw new RenderException("Failed to read STL file: " + file.getFileName(), e);
    }
    return parse(data);
  }

  public static Mesh parse(byte[] data) {
    if (isBinary(data)) {
      return parseBinary(data);
    }
    String head =
        new String(data, 0, Math.min(data.length, 5), StandardCharsets.US_ASCII)
            .toLowerCase(Locale.ROOT);
    if (head.equals("solid")) {
      return parseAscii(new String(data, StandardCharsets.US_ASCII));
    }
    throw new RenderException("Not an STL file");
  }

  private static boolean isBinary(byte[] data) {
    if (data.length < HEADER_SIZE + 4) return false;
    long count = readCount(data);
    return data.length == HEADER_SIZE + 4 + count * TRIANGLE_SIZE;
  }

  private static long readCount(byte[] data) {
    return Integer.toUnsignedLong(
        ByteBuffer.wrap(data, HEADER_SIZE, 4).order(ByteOrder.LITTLE_ENDIAN).getInt());
  }

  private static Mesh parseBinary(byte[] data) {
    int count = (int) readCount(data);
    ByteBuffer buf = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
    buf.position(HEADER_SIZE + 4);

    List<Triangle> triangles = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      buf.position(buf.position() + 12); // stored normal, recomputed from vertices
      Vector3 a = readVector(buf);
      Vector3 b = readVector(buf);
      Vector3 c = readVector(buf);
      buf.getShort();
      add(triangles, new Triangle(a, b, c), i);
    }
    return new Mesh(triangles);
  }

  private static Vector3 readVector(ByteBuffer buf) {
    return new Vector3(buf.getFloat(), buf.getFloat(), buf.getFloat());
  }

  private static Mesh parseAscii(String text) {
    List<Triangle> triangles = new ArrayList<>();
    List<Vector3> pending = new ArrayList<>(3);

    String[] lines = text.split("\\R");
    for (int lineNo = 0; lineNo < lines.length; lineNo++) {
      String line = lines[lineNo].trim();
      if (!line.regionMatches(true, 0, "vertex", 0, 6)) continue;

      String[] parts = line.split("\\s+");
      if (parts.length != 4) {
        throw new RenderException("Malformed vertex on line " + (lineNo + 1));
      }
      try {
        pending.add(
            new Vector3(
                Double.parseDouble(parts[1]),
                Double.parseDouble(parts[2]),
                Double.parseDouble(parts[3])));
      } catch (NumberFormatException e) {
        throw new RenderException("Malformed vertex on line " + (lineNo + 1), e);
      }
      if (pending.size() == 3) {
        add(triangles, new Triangle(pending.get(0), pending.get(1), pending.get(2)), lineNo + 1);
        pending.clear();
      }
    }
    if (!pending.isEmpty()) {
      throw new RenderException("Truncated facet at end of ASCII STL");
    }
    return new Mesh(triangles);
  }

  private static void add(List<Triangle> triangles, Triangle t, int where) {
    if (!t.a().isFinite() || !t.b().isFinite() || !t.c().isFinite()) {
      throw new RenderException("Non-finite vertex in facet " + where);
    }
    triangles.add(t);
  }
}
