package nl.bytesoflife.deltascad.model.spatial;

import nl.bytesoflife.deltascad.renderer.scad.ScadFormat;

/**
 * An immutable three-dimensional vector, used as a direction or as a point in space.
 *
 * Equality is defined on the two-decimal string form: vectors that agree up to
 * two decimals are equal. This is also the form in which vectors appear in
 * rendered transform calls, e.g. {@code [1.00, 2.00, 3.00]}.
 */
public final class Vector3 {

    private final double x;
    private final double y;
    private final double z;

    public Vector3() {
        this(0, 0, 0);
    }

    public Vector3(double x, double y, double z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getZ() {
        return z;
    }

    public Vector3 negate() {
        return new Vector3(-x, -y, -z);
    }

    public Vector3 copy() {
        return new Vector3(x, y, z);
    }

    public Vector3 add(Vector3 other) {
        return new Vector3(x + other.x, y + other.y, z + other.z);
    }

    public Vector3 subtract(Vector3 other) {
        return new Vector3(x - other.x, y - other.y, z - other.z);
    }

    /**
     * Component-wise product.
     */
    public Vector3 multiply(Vector3 other) {
        return new Vector3(x * other.x, y * other.y, z * other.z);
    }

    /**
     * Component-wise quotient.
     */
    public Vector3 divide(Vector3 other) {
        return new Vector3(x / other.x, y / other.y, z / other.z);
    }

    public Vector3 multiply(double factor) {
        return new Vector3(x * factor, y * factor, z * factor);
    }

    public Vector3 divide(double divisor) {
        return new Vector3(x / divisor, y / divisor, z / divisor);
    }

    public static Vector3 multiply(double factor, Vector3 vector) {
        return new Vector3(factor * vector.x, factor * vector.y, factor * vector.z);
    }

    /**
     * Divides the scalar by each component.
     */
    public static Vector3 divide(double dividend, Vector3 vector) {
        return new Vector3(dividend / vector.x, dividend / vector.y, dividend / vector.z);
    }

    public double dot(Vector3 other) {
        return x * other.x + y * other.y + z * other.z;
    }

    public Vector3 cross(Vector3 other) {
        return new Vector3(
                y * other.z - z * other.y,
                z * other.x - x * other.z,
                x * other.y - y * other.x);
    }

    /**
     * Euclidean length.
     */
    public double length() {
        return Math.sqrt(dot(this));
    }

    /**
     * Divides each component by the sum of the absolute component values
     * (L1 norm, not the Euclidean length). The zero vector is returned as is.
     */
    public Vector3 normalize() {
        if (x == 0 && y == 0 && z == 0) {
            return this;
        }
        double sum = Math.abs(x) + Math.abs(y) + Math.abs(z);
        return new Vector3(x / sum, y / sum, z / sum);
    }

    public static Vector3 min(Vector3 a, Vector3 b) {
        return new Vector3(Math.min(a.x, b.x), Math.min(a.y, b.y), Math.min(a.z, b.z));
    }

    public static Vector3 max(Vector3 a, Vector3 b) {
        return new Vector3(Math.max(a.x, b.x), Math.max(a.y, b.y), Math.max(a.z, b.z));
    }

    /**
     * Average of the given positions; {@code null} when none are given and the
     * position itself when only one is given.
     */
    public static Vector3 average(Vector3... positions) {
        if (positions == null || positions.length == 0) {
            return null;
        }
        if (positions.length == 1) {
            return positions[0];
        }
        double sumX = 0;
        double sumY = 0;
        double sumZ = 0;
        for (Vector3 p : positions) {
            sumX += p.x;
            sumY += p.y;
            sumZ += p.z;
        }
        int n = positions.length;
        return new Vector3(sumX / n, sumY / n, sumZ / n);
    }

    /**
     * Homogeneous column {@code [x, y, z, 1]}.
     */
    public Matrix toMatrix() {
        return new Matrix(new double[]{x, y, z, 1}, 4, 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Vector3 other)) return false;
        return toString().equals(other.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    @Override
    public String toString() {
        return "[" + ScadFormat.fixed2(x) + ", " + ScadFormat.fixed2(y) + ", " + ScadFormat.fixed2(z) + "]";
    }
}
