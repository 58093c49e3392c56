package nl.bytesoflife.deltascad.model.block;

import nl.bytesoflife.deltascad.model.ScadObject;
import nl.bytesoflife.deltascad.model.spatial.BoundingBox;
import nl.bytesoflife.deltascad.model.spatial.Vector3;
import nl.bytesoflife.deltascad.renderer.scad.BlockFormatter;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for operations over several children, rendered as a keyword call
 * with a brace-delimited body:
 * <pre>
 * union()
 * {
 *     ...
 * }
 * </pre>
 * The child list of a {@link Union} or {@link Difference} may grow after
 * construction through {@link ScadObject#add} and {@link ScadObject#subtract}.
 */
public abstract class BlockObject extends ScadObject {

    protected BlockObject(List<? extends ScadObject> children) {
        super(requireChildren(children));
    }

    private static List<? extends ScadObject> requireChildren(List<? extends ScadObject> children) {
        if (children == null || children.isEmpty()) {
            throw new IllegalArgumentException("A block requires at least one child");
        }
        return children;
    }

    /**
     * OpenSCAD keyword of this block, e.g. {@code union}.
     */
    protected abstract String getKeyword();

    /**
     * Create a block of the same type over the given (already copied) children.
     */
    protected abstract BlockObject newInstance(List<ScadObject> children);

    /**
     * Average of the children's positions.
     */
    @Override
    public Vector3 getPosition() {
        Vector3[] positions = children.stream()
                .map(ScadObject::getPosition)
                .toArray(Vector3[]::new);
        return Vector3.average(positions);
    }

    /**
     * Union of the children's bounds.
     */
    @Override
    public BoundingBox getBounds() {
        BoundingBox bounds = children.get(0).getBounds();
        for (int i = 1; i < children.size(); i++) {
            bounds = bounds.union(children.get(i).getBounds());
        }
        return bounds;
    }

    @Override
    public ScadObject copy() {
        List<ScadObject> copies = new ArrayList<>(children.size());
        for (ScadObject child : children) {
            copies.add(child.copy());
        }
        return withNameOf(newInstance(copies));
    }

    @Override
    public String toString() {
        StringBuilder body = new StringBuilder();
        for (ScadObject child : children) {
            body.append(child);
        }
        return new BlockFormatter(getKeyword() + "()", body.toString()).toString();
    }
}
