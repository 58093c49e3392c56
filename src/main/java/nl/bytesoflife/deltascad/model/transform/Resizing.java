package nl.bytesoflife.deltascad.model.transform;

import nl.bytesoflife.deltascad.model.ScadObject;
import nl.bytesoflife.deltascad.model.spatial.BoundingBox;
import nl.bytesoflife.deltascad.model.spatial.Matrix;
import nl.bytesoflife.deltascad.model.spatial.Vector3;
import nl.bytesoflife.deltascad.renderer.scad.StatementBuilder;

import java.util.Objects;

/**
 * Resizes the child to absolute X/Y/Z dimensions. An axis with a size of zero
 * keeps the child's dimension.
 */
public class Resizing extends TransformObject {

    private final Vector3 size;

    public Resizing(ScadObject child, Vector3 size) {
        super(child);
        this.size = Objects.requireNonNull(size, "size");
    }

    public Vector3 getSize() {
        return size;
    }

    @Override
    protected String getStatement() {
        return new StatementBuilder().append("resize(").argument("newsize", size.toString()).append(")").toString();
    }

    /**
     * Per-axis factor turning the child's extent into the requested size.
     */
    Vector3 getScaleFactor() {
        Vector3 extent = getChild().getBounds().getSize();
        return new Vector3(
                factor(size.getX(), extent.getX()),
                factor(size.getY(), extent.getY()),
                factor(size.getZ(), extent.getZ()));
    }

    private static double factor(double requested, double current) {
        if (requested > 0 && current > 0) {
            return requested / current;
        }
        return 1;
    }

    @Override
    public Vector3 getPosition() {
        return getChild().getPosition().multiply(getScaleFactor());
    }

    @Override
    public BoundingBox getBounds() {
        return getChild().getBounds().transform(Matrix.scaling(getScaleFactor()));
    }

    @Override
    public ScadObject copy() {
        return withNameOf(new Resizing(getChild().copy(), size));
    }
}
