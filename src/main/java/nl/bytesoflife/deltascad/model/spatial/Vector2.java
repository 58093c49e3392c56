package nl.bytesoflife.deltascad.model.spatial;

import nl.bytesoflife.deltascad.renderer.scad.ScadFormat;

/**
 * An immutable two-dimensional vector, used as a direction or as a point in the plane.
 *
 * Equality is defined on the two-decimal string form: vectors that agree up to
 * two decimals are equal.
 */
public final class Vector2 {

    private final double x;
    private final double y;

    public Vector2() {
        this(0, 0);
    }

    public Vector2(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public Vector2 negate() {
        return new Vector2(-x, -y);
    }

    public Vector2 copy() {
        return new Vector2(x, y);
    }

    public Vector2 add(Vector2 other) {
        return new Vector2(x + other.x, y + other.y);
    }

    public Vector2 subtract(Vector2 other) {
        return new Vector2(x - other.x, y - other.y);
    }

    /**
     * Component-wise product.
     */
    public Vector2 multiply(Vector2 other) {
        return new Vector2(x * other.x, y * other.y);
    }

    /**
     * Component-wise quotient.
     */
    public Vector2 divide(Vector2 other) {
        return new Vector2(x / other.x, y / other.y);
    }

    public Vector2 multiply(double factor) {
        return new Vector2(x * factor, y * factor);
    }

    public Vector2 divide(double divisor) {
        return new Vector2(x / divisor, y / divisor);
    }

    public static Vector2 multiply(double factor, Vector2 vector) {
        return new Vector2(factor * vector.x, factor * vector.y);
    }

    /**
     * Divides the scalar by each component.
     */
    public static Vector2 divide(double dividend, Vector2 vector) {
        return new Vector2(dividend / vector.x, dividend / vector.y);
    }

    public double dot(Vector2 other) {
        return x * other.x + y * other.y;
    }

    /**
     * Divides each component by the sum of the absolute component values.
     * The zero vector is returned as is.
     */
    public Vector2 normalize() {
        if (x == 0 && y == 0) {
            return this;
        }
        double sum = Math.abs(x) + Math.abs(y);
        return new Vector2(x / sum, y / sum);
    }

    /**
     * Average of the given positions; {@code null} when none are given and the
     * position itself when only one is given.
     */
    public static Vector2 average(Vector2... positions) {
        if (positions == null || positions.length == 0) {
            return null;
        }
        if (positions.length == 1) {
            return positions[0];
        }
        double sumX = 0;
        double sumY = 0;
        for (Vector2 p : positions) {
            sumX += p.x;
            sumY += p.y;
        }
        return new Vector2(sumX / positions.length, sumY / positions.length);
    }

    /**
     * Homogeneous column {@code [x, y, 0, 1]}.
     */
    public Matrix toMatrix() {
        return new Matrix(new double[]{x, y, 0, 1}, 4, 1);
    }

    public Vector3 toVector3() {
        return new Vector3(x, y, 0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Vector2 other)) return false;
        return toString().equals(other.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    @Override
    public String toString() {
        return "[" + ScadFormat.fixed2(x) + ", " + ScadFormat.fixed2(y) + "]";
    }
}
