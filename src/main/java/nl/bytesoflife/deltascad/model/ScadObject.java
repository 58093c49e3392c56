package nl.bytesoflife.deltascad.model;

import nl.bytesoflife.deltascad.model.block.Difference;
import nl.bytesoflife.deltascad.model.block.Hull;
import nl.bytesoflife.deltascad.model.block.Intersection;
import nl.bytesoflife.deltascad.model.block.Minkowski;
import nl.bytesoflife.deltascad.model.block.Union;
import nl.bytesoflife.deltascad.model.spatial.BoundingBox;
import nl.bytesoflife.deltascad.model.spatial.Vector3;
import nl.bytesoflife.deltascad.model.transform.Coloring;
import nl.bytesoflife.deltascad.model.transform.LinearExtrusion;
import nl.bytesoflife.deltascad.model.transform.Mirroring;
import nl.bytesoflife.deltascad.model.transform.Resizing;
import nl.bytesoflife.deltascad.model.transform.RotateExtrusion;
import nl.bytesoflife.deltascad.model.transform.Rotation;
import nl.bytesoflife.deltascad.model.transform.Scaling;
import nl.bytesoflife.deltascad.model.transform.Translation;
import nl.bytesoflife.deltascad.output.FileInvoker;
import nl.bytesoflife.deltascad.output.ScadFileWriter;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Base class for every node of an OpenSCAD object tree: primitives, transforms
 * and boolean blocks. {@link #toString()} renders the node and its whole
 * subtree as script text.
 *
 * <p>Transform and block methods never modify the receiver; they wrap it in a
 * new node. The exceptions are {@link #add} and {@link #subtract}, which append
 * to an existing {@link Union} or {@link Difference} in place.
 */
public abstract class ScadObject {

    private final int id = Ids.next();
    private String name;
    private ScadObject parent;

    protected final List<ScadObject> children = new ArrayList<>();

    protected ScadObject() {
    }

    protected ScadObject(List<? extends ScadObject> children) {
        for (ScadObject child : children) {
            addChild(child);
        }
    }

    /**
     * Unique id of this object. Ids auto-increment in construction order.
     */
    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /**
     * The node this object was most recently attached to as a child, or
     * {@code null}. An instance reused in several trees reports only its
     * last attachment.
     */
    public ScadObject getParent() {
        return parent;
    }

    protected final void addChild(ScadObject child) {
        Objects.requireNonNull(child, "child");
        children.add(child);
        child.parent = this;
    }

    // --- transforms ---

    /**
     * Applies a color with full opacity.
     */
    public Coloring color(String colorName) {
        return color(colorName, 1.0);
    }

    /**
     * Applies a color and opacity.
     * @param colorName an OpenSCAD color name, e.g. {@code "red"}
     * @param opacity from 0.0 to 1.0
     */
    public Coloring color(String colorName, double opacity) {
        return new Coloring(this, colorName, opacity);
    }

    /**
     * Mirrors the object about the plane through the origin with the given normal.
     */
    public Mirroring mirror(Vector3 normal) {
        return new Mirroring(this, normal);
    }

    public Mirroring mirror(double x, double y, double z) {
        return mirror(new Vector3(x, y, z));
    }

    /**
     * Resizes to the given X/Y/Z dimensions. A zero component keeps that axis.
     */
    public Resizing resize(Vector3 size) {
        return new Resizing(this, size);
    }

    public Resizing resize(double x, double y, double z) {
        return resize(new Vector3(x, y, z));
    }

    /**
     * Rotates by X/Y/Z Euler angles in degrees.
     */
    public Rotation rotate(Vector3 angle) {
        return new Rotation(this, angle);
    }

    public Rotation rotate(double x, double y, double z) {
        return rotate(new Vector3(x, y, z));
    }

    /**
     * Scales by an X/Y/Z factor; {@code (1, 2, 1)} doubles the Y axis.
     */
    public Scaling scale(Vector3 factor) {
        return new Scaling(this, factor);
    }

    public Scaling scale(double x, double y, double z) {
        return scale(new Vector3(x, y, z));
    }

    public Translation translate(Vector3 offset) {
        return new Translation(this, offset);
    }

    public Translation translate(double x, double y, double z) {
        return translate(new Vector3(x, y, z));
    }

    public LinearExtrusion linearExtrude(double height) {
        return linearExtrude(height, null, LinearExtrusion.DEFAULT_RESOLUTION);
    }

    /**
     * Extrudes a 2D object along Z.
     * @param vector optional extrusion direction, may be {@code null}
     * @param resolution number of fragments ({@code $fn})
     */
    public LinearExtrusion linearExtrude(double height, Vector3 vector, int resolution) {
        return new LinearExtrusion(this, height, vector, resolution);
    }

    public RotateExtrusion rotateExtrude(double angle) {
        return rotateExtrude(angle, RotateExtrusion.DEFAULT_RESOLUTION);
    }

    /**
     * Revolves a 2D object around the Z axis.
     * @param angle sweep in degrees
     * @param resolution number of fragments ({@code $fn})
     */
    public RotateExtrusion rotateExtrude(double angle, int resolution) {
        return new RotateExtrusion(this, angle, resolution);
    }

    // --- blocks ---

    /**
     * Union of this object and the given ones (logical or).
     */
    public Union union(ScadObject... objects) {
        return blockStatement("Union", objects, Union::new);
    }

    /**
     * Subtracts all given objects from this one (logical and not).
     */
    public Difference difference(ScadObject... objects) {
        return blockStatement("Difference", objects, Difference::new);
    }

    /**
     * Keeps only the volume shared by this object and all given ones (logical and).
     */
    public Intersection intersection(ScadObject... objects) {
        return blockStatement("Intersection", objects, Intersection::new);
    }

    /**
     * Convex hull of this object and the given ones.
     */
    public Hull hull(ScadObject... objects) {
        return blockStatement("Hull", objects, Hull::new);
    }

    /**
     * Minkowski sum of this object and the given ones.
     */
    public Minkowski minkowski(ScadObject... objects) {
        return blockStatement("Minkowski", objects, Minkowski::new);
    }

    private <T extends ScadObject> T blockStatement(String operation, ScadObject[] objects,
                                                    Function<List<ScadObject>, T> factory) {
        if (objects == null || objects.length < 1) {
            throw new IllegalArgumentException(operation + " requires at least one other object");
        }
        List<ScadObject> blockChildren = new ArrayList<>(objects.length + 1);
        blockChildren.add(this);
        blockChildren.addAll(Arrays.asList(objects));
        return factory.apply(blockChildren);
    }

    // --- operators ---

    /**
     * Unions two objects. When either side already is a {@link Union} the other
     * side is appended to it and that same instance is returned, so chained
     * additions build one flat union instead of nested ones.
     *
     * @throws IllegalArgumentException when appending would make the union
     *         contain itself, e.g. {@code u.plus(u)}
     */
    public static ScadObject add(ScadObject left, ScadObject right) {
        if (left.getClass() == Union.class) {
            left.append(right);
            return left;
        } else if (right.getClass() == Union.class) {
            right.append(left);
            return right;
        }
        return new Union(List.of(left, right));
    }

    /**
     * Differences two objects, appending to an existing {@link Difference} on
     * either side in the same way {@link #add} does for unions.
     *
     * @throws IllegalArgumentException when appending would make the difference
     *         contain itself
     */
    public static ScadObject subtract(ScadObject left, ScadObject right) {
        if (left.getClass() == Difference.class) {
            left.append(right);
            return left;
        } else if (right.getClass() == Difference.class) {
            right.append(left);
            return right;
        }
        return new Difference(List.of(left, right));
    }

    private void append(ScadObject child) {
        if (child == this || child.getChildren().contains(this)) {
            throw new IllegalArgumentException("Cannot append object " + id + " to itself");
        }
        addChild(child);
    }

    public ScadObject plus(ScadObject other) {
        return add(this, other);
    }

    public ScadObject minus(ScadObject other) {
        return subtract(this, other);
    }

    // --- tree ---

    /**
     * All descendants in pre-order, left to right. The object itself is not included.
     * Every overload returns a new mutable list.
     */
    public List<ScadObject> getChildren() {
        return getChildren(true);
    }

    /**
     * @param recursive {@code true} for all descendants, {@code false} for a copy
     *                  of the direct child list
     */
    public List<ScadObject> getChildren(boolean recursive) {
        if (!recursive) {
            return new ArrayList<>(children);
        }

        // Reversed so the first child is popped first
        Deque<ScadObject> toTraverse = new ArrayDeque<>();
        for (int i = children.size() - 1; i >= 0; i--) {
            toTraverse.push(children.get(i));
        }

        List<ScadObject> all = new ArrayList<>();
        while (!toTraverse.isEmpty()) {
            ScadObject child = toTraverse.pop();
            all.add(child);
            for (int i = child.children.size() - 1; i >= 0; i--) {
                toTraverse.push(child.children.get(i));
            }
        }
        return all;
    }

    /**
     * Descendants matching the predicate, in traversal order.
     */
    public List<ScadObject> getChildren(Predicate<ScadObject> predicate) {
        List<ScadObject> matching = getChildren(true);
        matching.removeIf(predicate.negate());
        return matching;
    }

    /**
     * Whether both objects render to exactly the same script.
     *
     * <p>Renders both subtrees on every call, so the cost grows with their size.
     * Do not use it on deeply nested structures or as a substitute for
     * {@code equals}; cache the rendered text when comparing repeatedly.
     */
    public boolean isSameAs(ScadObject other) {
        return toString().equals(other.toString());
    }

    /**
     * Nominal position of this object. For aggregates this is an approximation,
     * typically an average over the children.
     */
    public abstract Vector3 getPosition();

    /**
     * Approximate axis-aligned bounds.
     */
    public abstract BoundingBox getBounds();

    /**
     * Copy of this object and all its children as new instances. Value objects
     * such as vectors and point arrays are shared with the original.
     */
    public abstract ScadObject copy();

    protected <T extends ScadObject> T withNameOf(T copy) {
        copy.setName(name);
        return copy;
    }

    /**
     * Render this object and its subtree as OpenSCAD script.
     */
    @Override
    public abstract String toString();

    /**
     * Write this object to a {@code .scad} file using the default output settings.
     * @see ScadFileWriter
     */
    public FileInvoker toFile(String filePath) throws IOException {
        return new ScadFileWriter().write(this, filePath);
    }
}
