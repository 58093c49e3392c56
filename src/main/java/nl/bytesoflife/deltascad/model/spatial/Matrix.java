package nl.bytesoflife.deltascad.model.spatial;

import java.util.Arrays;

/**
 * A row-major grid of doubles. Used with homogeneous 4x4 transforms and 4x1
 * point columns to compute positions and bounds of transformed objects.
 */
public final class Matrix {

    private final double[] values;
    private final int rows;
    private final int columns;

    public Matrix(double[] values, int rows, int columns) {
        if (rows < 1 || columns < 1) {
            throw new IllegalArgumentException("Matrix must have at least one row and column");
        }
        if (values.length != rows * columns) {
            throw new IllegalArgumentException(String.format(
                    "Expected %d values for a %dx%d matrix, got %d", rows * columns, rows, columns, values.length));
        }
        this.values = values.clone();
        this.rows = rows;
        this.columns = columns;
    }

    public static Matrix identity(int size) {
        double[] values = new double[size * size];
        for (int i = 0; i < size; i++) {
            values[i * size + i] = 1;
        }
        return new Matrix(values, size, size);
    }

    public static Matrix translation(Vector3 offset) {
        return new Matrix(new double[]{
                1, 0, 0, offset.getX(),
                0, 1, 0, offset.getY(),
                0, 0, 1, offset.getZ(),
                0, 0, 0, 1
        }, 4, 4);
    }

    public static Matrix scaling(Vector3 factor) {
        return new Matrix(new double[]{
                factor.getX(), 0, 0, 0,
                0, factor.getY(), 0, 0,
                0, 0, factor.getZ(), 0,
                0, 0, 0, 1
        }, 4, 4);
    }

    public static Matrix rotationX(double degrees) {
        double rad = Math.toRadians(degrees);
        double cos = Math.cos(rad);
        double sin = Math.sin(rad);
        return new Matrix(new double[]{
                1, 0, 0, 0,
                0, cos, -sin, 0,
                0, sin, cos, 0,
                0, 0, 0, 1
        }, 4, 4);
    }

    public static Matrix rotationY(double degrees) {
        double rad = Math.toRadians(degrees);
        double cos = Math.cos(rad);
        double sin = Math.sin(rad);
        return new Matrix(new double[]{
                cos, 0, sin, 0,
                0, 1, 0, 0,
                -sin, 0, cos, 0,
                0, 0, 0, 1
        }, 4, 4);
    }

    public static Matrix rotationZ(double degrees) {
        double rad = Math.toRadians(degrees);
        double cos = Math.cos(rad);
        double sin = Math.sin(rad);
        return new Matrix(new double[]{
                cos, -sin, 0, 0,
                sin, cos, 0, 0,
                0, 0, 1, 0,
                0, 0, 0, 1
        }, 4, 4);
    }

    /**
     * Euler rotation applied about X first, then Y, then Z.
     */
    public static Matrix rotation(Vector3 degrees) {
        return rotationZ(degrees.getZ())
                .multiply(rotationY(degrees.getY()))
                .multiply(rotationX(degrees.getX()));
    }

    /**
     * Reflection through the plane containing the origin with the given normal.
     * A zero normal yields the identity.
     */
    public static Matrix mirror(Vector3 normal) {
        double length = normal.length();
        if (length == 0) {
            return identity(4);
        }
        double a = normal.getX() / length;
        double b = normal.getY() / length;
        double c = normal.getZ() / length;
        return new Matrix(new double[]{
                1 - 2 * a * a, -2 * a * b, -2 * a * c, 0,
                -2 * a * b, 1 - 2 * b * b, -2 * b * c, 0,
                -2 * a * c, -2 * b * c, 1 - 2 * c * c, 0,
                0, 0, 0, 1
        }, 4, 4);
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    public double get(int row, int column) {
        if (row < 0 || row >= rows || column < 0 || column >= columns) {
            throw new IndexOutOfBoundsException("(" + row + ", " + column + ") outside " + rows + "x" + columns);
        }
        return values[row * columns + column];
    }

    public Matrix multiply(Matrix other) {
        if (columns != other.rows) {
            throw new IllegalArgumentException(String.format(
                    "Cannot multiply %dx%d by %dx%d", rows, columns, other.rows, other.columns));
        }
        double[] result = new double[rows * other.columns];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < other.columns; c++) {
                double sum = 0;
                for (int k = 0; k < columns; k++) {
                    sum += values[r * columns + k] * other.values[k * other.columns + c];
                }
                result[r * other.columns + c] = sum;
            }
        }
        return new Matrix(result, rows, other.columns);
    }

    /**
     * Apply this 4x4 transform to a point.
     */
    public Vector3 transform(Vector3 point) {
        return multiply(point.toMatrix()).toVector3();
    }

    /**
     * Read the first three entries of a single-column matrix as a point.
     */
    public Vector3 toVector3() {
        if (columns != 1 || rows < 3) {
            throw new IllegalStateException("Not a point column: " + rows + "x" + columns);
        }
        return new Vector3(values[0], values[1], values[2]);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Matrix other)) return false;
        return rows == other.rows && columns == other.columns && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + columns) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Matrix[" + rows + "x" + columns + "]" + Arrays.toString(values);
    }
}
