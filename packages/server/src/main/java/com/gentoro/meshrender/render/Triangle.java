package com.gentoro.meshrender.render;

import java.util.function.UnaryOperator;

/** Triangle in model space. Winding is not trusted; see {@link StlRenderer}. */
public record Triangle(Vector3 a, Vector3 b, Vector3 c) {

  public Vector3 normal() {
    return b.sub(a).cross(c.sub(a)).normalize();
  }

  public Triangle map(UnaryOperator<Vector3> f) {
    return new Triangle(f.apply(a), f.apply(b), f.apply(c));
  }
}
