package nl.bytesoflife.deltascad.model.spatial;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Axis-aligned box between a minimum and a maximum corner.
 */
public final class BoundingBox {

    private final Vector3 min;
    private final Vector3 max;

    public BoundingBox(Vector3 min, Vector3 max) {
        this.min = min;
        this.max = max;
    }

    /**
     * Box spanning all given points. The points must not be empty.
     */
    public static BoundingBox spanning(Collection<Vector3> points) {
        if (points.isEmpty()) {
            throw new IllegalArgumentException("Cannot span an empty set of points");
        }
        Vector3 lo = null;
        Vector3 hi = null;
        for (Vector3 p : points) {
            lo = lo == null ? p : Vector3.min(lo, p);
            hi = hi == null ? p : Vector3.max(hi, p);
        }
        return new BoundingBox(lo, hi);
    }

    public Vector3 getMin() {
        return min;
    }

    public Vector3 getMax() {
        return max;
    }

    public Vector3 getSize() {
        return max.subtract(min);
    }

    public Vector3 getCenter() {
        return Vector3.average(min, max);
    }

    public BoundingBox union(BoundingBox other) {
        return new BoundingBox(Vector3.min(min, other.min), Vector3.max(max, other.max));
    }

    /**
     * Overlap of both boxes. When they are disjoint on some axis the result
     * has its minimum above its maximum on that axis.
     */
    public BoundingBox intersection(BoundingBox other) {
        return new BoundingBox(Vector3.max(min, other.min), Vector3.min(max, other.max));
    }

    public BoundingBox translate(Vector3 offset) {
        return new BoundingBox(min.add(offset), max.add(offset));
    }

    public List<Vector3> corners() {
        List<Vector3> corners = new ArrayList<>(8);
        for (double x : new double[]{min.getX(), max.getX()}) {
            for (double y : new double[]{min.getY(), max.getY()}) {
                for (double z : new double[]{min.getZ(), max.getZ()}) {
                    corners.add(new Vector3(x, y, z));
                }
            }
        }
        return corners;
    }

    /**
     * Box spanning the eight corners after applying {@code transform}.
     */
    public BoundingBox transform(Matrix transform) {
        List<Vector3> transformed = new ArrayList<>(8);
        for (Vector3 corner : corners()) {
            transformed.add(transform.transform(corner));
        }
        return spanning(transformed);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BoundingBox other)) return false;
        return min.equals(other.min) && max.equals(other.max);
    }

    @Override
    public int hashCode() {
        return 31 * min.hashCode() + max.hashCode();
    }

    @Override
    public String toString() {
        return "BoundingBox[" + min + " - " + max + "]";
    }
}
