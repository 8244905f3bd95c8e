package com.gentoro.meshrender.render;

/** Immutable 3D vector. */
public record Vector3(double x, double y, double z) {
  public static final Vector3 ZERO = new Vector3(0, 0, 0);

  public Vector3 add(Vector3 o) {
    return new Vector3(x + o.x, y + o.y, z + o.z);
  }

  public Vector3 sub(Vector3 o) {
    return new Vector3(x - o.x, y - o.y, z - o.z);
  }

  public Vector3 scale(double s) {
    return new Vector3(x * s, y * s, z * s);
  }

  public double dot(Vector3 o) {
    return x * o.x + y * o.y + z * o.z;
  }

  public Vector3 cross(Vector3 o) {
    return new Vector3(y * o.z - z * o.y, z * o.x - x * o.z, x * o.y - y * o.x);
  }

  public double length() {
    return Math.sqrt(dot(this));
  }

  /** Unit vector in the same direction, or {@link #ZERO} for a zero-length vector. */
  public Vector3 normalize() {
    double len = length();
    return len == 0 ? ZERO : scale(1.0 / len);
  }

  public Vector3 min(Vector3 o) {
    return new Vector3(Math.min(x, o.x), Math.min(y, o.y), Math.min(z, o.z));
  }

  public Vector3 max(Vector3 o) {
    return new Vector3(Math.max(x, o.x), Math.max(y, o.y), Math.max(z, o.z));
  }

  public boolean isFinite() {
    return Double.isFinite(x) && Double.isFinite(y) && Double.isFinite(z);
  }
}
