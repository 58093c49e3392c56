package nl.bytesoflife.deltascad.model.transform;

import nl.bytesoflife.deltascad.model.ScadObject;
import nl.bytesoflife.deltascad.model.spatial.BoundingBox;
import nl.bytesoflife.deltascad.model.spatial.Matrix;
import nl.bytesoflife.deltascad.model.spatial.Vector3;
import nl.bytesoflife.deltascad.renderer.scad.StatementBuilder;

import java.util.Objects;

/**
 * Rotates the child about the origin by X, Y and Z Euler angles (degrees),
 * applied in that order.
 */
public class Rotation extends TransformObject {

    private final Vector3 angle;

    public Rotation(ScadObject child, Vector3 angle) {
        super(child);
        this.angle = Objects.requireNonNull(angle, "angle");
    }

    public Vector3 getAngle() {
        return angle;
    }

    @Override
    protected String getStatement() {
        return new StatementBuilder().append("rotate(").argument("a", angle.toString()).append(")").toString();
    }

    @Override
    public Vector3 getPosition() {
        return Matrix.rotation(angle).transform(getChild().getPosition());
    }

    @Override
    public BoundingBox getBounds() {
        return getChild().getBounds().transform(Matrix.rotation(angle));
    }

    @Override
    public ScadObject copy() {
        return withNameOf(new Rotation(getChild().copy(), angle));
    }
}
