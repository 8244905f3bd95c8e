package com.gentoro.meshrender.render;

import com.gentoro.meshrender.exception.RenderException;
import java.util.List;

/** Immutable triangle soup. */
public final class Mesh {
  private final List<Triangle> triangles;

  public Mesh(List<Triangle> triangles) {
    this.triangles = List.copyOf(triangles);
  }

  public List<Triangle> triangles() {
    return triangles;
  }

  public int size() {
    return triangles.size();
  }

  public boolean isEmpty() {
    return triangles.isEmpty();
  }

  /** Axis-aligned bounds as {@code [min, max]}. */
  public Vector3[] bounds() {
    if (triangles.isEmpty()) {
      throw new RenderException("Mesh contains no triangles");
    }
    Vector3 min = triangles.get(0).a();
    Vector3 max = min;
    for (Triangle t : triangles) {
      min = min.min(t.a()).min(t.b()).min(t.c());
      max = max.max(t.a()).max(t.b()).max(t.c());
    }
    return new Vector3[] {min, max};
  }

  /**
   * Center the mesh on the origin and scale it uniformly so its largest extent spans [-1, 1].
   *
   * @throws RenderException if the mesh is empty or has no extent
   */
  public Mesh fitToBiUnitCube() {
    Vector3[] b = bounds();
    Vector3 size = b[1].sub(b[0]);
    double extent = Math.max(size.x(), Math.max(size.y(), size.z()));
    if (!(extent > 0) || !Double.isFinite(extent)) {
      throw new RenderException("Mesh has no extent");
    }
    Vector3 center = b[0].add(b[1]).scale(0.5);
    double s = 2.0 / extent;
    return new Mesh(triangles.stream().map(t -> t.map(v -> v.sub(center).scale(s))).toList());
  }
}
