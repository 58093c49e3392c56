package nl.bytesoflife.deltascad.model.transform;

import nl.bytesoflife.deltascad.model.ScadObject;
import nl.bytesoflife.deltascad.model.spatial.BoundingBox;
import nl.bytesoflife.deltascad.model.spatial.Matrix;
import nl.bytesoflife.deltascad.model.spatial.Vector3;
import nl.bytesoflife.deltascad.renderer.scad.StatementBuilder;

import java.util.Objects;

/**
 * Scales the child about the origin by a per-axis factor.
 */
public class Scaling extends TransformObject {

    private final Vector3 factor;

    public Scaling(ScadObject child, Vector3 factor) {
        super(child);
        this.factor = Objects.requireNonNull(factor, "factor");
    }

    public Vector3 getFactor() {
        return factor;
    }

    @Override
    protected String getStatement() {
        return new StatementBuilder().append("scale(").argument("v", factor.toString()).append(")").toString();
    }

    @Override
    public Vector3 getPosition() {
        return getChild().getPosition().multiply(factor);
    }

    @Override
    public BoundingBox getBounds() {
        // Negative factors flip corners, so span them again
        return getChild().getBounds().transform(Matrix.scaling(factor));
    }

    @Override
    public ScadObject copy() {
        return withNameOf(new Scaling(getChild().copy(), factor));
    }
}
