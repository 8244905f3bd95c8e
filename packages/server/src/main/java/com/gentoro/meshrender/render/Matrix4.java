package com.gentoro.meshrender.render;

/** Row-major 4x4 matrix with the few camera helpers the renderer needs. */
public final class Matrix4 {
  private final double[] m;

  private Matrix4(double[] m) {
    this.m = m;
  }

  public static Matrix4 of(double... values) {
    if (values.length != 16) {
      throw new IllegalArgumentException("Expected 16 values, got " + values.length);
    }
    return new Matrix4(values.clone());
  }

  public static Matrix4 identity() {
    return of(1, 0, 0, 0, 0, 1, 0, 0, 0, 0, 1, 0, 0, 0, 0, 1);
  }

  /** View matrix for a camera at {@code eye} looking at {@code center}. */
  public static Matrix4 lookAt(Vector3 eye, Vector3 center, Vector3 up) {
    Vector3 f = center.sub(eye).normalize();
    Vector3 s = f.cross(up).normalize();
    Vector3 u = s.cross(f);
    return of(
        s.x(), s.y(), s.z(), -s.dot(eye),
        u.x(), u.y(), u.z(), -u.dot(eye),
        -f.x(), -f.y(), -f.z(), f.dot(eye),
        0, 0, 0, 1);
  }

  /** OpenGL-style perspective projection; {@code fovY} in degrees. */
  public static Matrix4 perspective(double fovY, double aspect, double near, double far) {
    double f = 1.0 / Math.tan(Math.toRadians(fovY) / 2);
    return of(
        f / aspect, 0, 0, 0,
        0, f, 0, 0,
        0, 0, (far + near) / (near - far), 2 * far * near / (near - far),
        0, 0, -1, 0);
  }

  public Matrix4 multiply(Matrix4 o) {
    double[] r = new double[16];
    for (int row = 0; row < 4; row++) {
      for (int col = 0; col < 4; col++) {
        double sum = 0;
        for (int k = 0; k < 4; k++) sum += m[row * 4 + k] * o.m[k * 4 + col];
        r[row * 4 + col] = sum;
      }
    }
    return new Matrix4(r);
  }

  /** Transform a point (w = 1) and return homogeneous {@code [x, y, z, w]}. */
  public double[] transform(Vector3 p) {
    double[] r = new double[4];
    for (int row = 0; row < 4; row++) {
      int i = row * 4;
      r[row] = m[i] * p.x() + m[i + 1] * p.y() + m[i + 2] * p.z() + m[i + 3];
    }
    return r;
  }

  public double get(int row, int col) {
    return m[row * 4 + col];
  }
}
