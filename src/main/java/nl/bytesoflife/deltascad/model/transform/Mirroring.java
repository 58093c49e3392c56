package nl.bytesoflife.deltascad.model.transform;

import nl.bytesoflife.deltascad.model.ScadObject;
import nl.bytesoflife.deltascad.model.spatial.BoundingBox;
import nl.bytesoflife.deltascad.model.spatial.Matrix;
import nl.bytesoflife.deltascad.model.spatial.Vector3;
import nl.bytesoflife.deltascad.renderer.scad.StatementBuilder;

import java.util.Objects;

/**
 * Reflects the child through the plane containing the origin with the given normal.
 */
public class Mirroring extends TransformObject {

    private final Vector3 normal;

    public Mirroring(ScadObject child, Vector3 normal) {
        super(child);
        this.normal = Objects.requireNonNull(normal, "normal");
    }

    public Vector3 getNormal() {
        return normal;
    }

    @Override
    protected String getStatement() {
        return new StatementBuilder().append("mirror(").append(normal.toString()).append(")").toString();
    }

    @Override
    public Vector3 getPosition() {
        return Matrix.mirror(normal).transform(getChild().getPosition());
    }

    @Override
    public BoundingBox getBounds() {
        return getChild().getBounds().transform(Matrix.mirror(normal));
    }

    @Override
    public ScadObject copy() {
        return withNameOf(new Mirroring(getChild().copy(), normal));
    }
}
