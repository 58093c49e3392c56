package nl.bytesoflife.deltascad.model.transform;

import nl.bytesoflife.deltascad.model.ScadObject;
import nl.bytesoflife.deltascad.model.spatial.BoundingBox;
import nl.bytesoflife.deltascad.model.spatial.Vector3;
import nl.bytesoflife.deltascad.renderer.scad.ScadFormat;
import nl.bytesoflife.deltascad.renderer.scad.StatementBuilder;

/**
 * Revolves a 2D child around the Z axis. The child's X axis becomes the
 * radius and its Y axis becomes Z.
 */
public class RotateExtrusion extends TransformObject {

    public static final int DEFAULT_RESOLUTION = 10;

    private final double angle;
    private final int resolution;

    public RotateExtrusion(ScadObject child, double angle) {
        this(child, angle, DEFAULT_RESOLUTION);
    }

    public RotateExtrusion(ScadObject child, double angle, int resolution) {
        super(child);
        this.angle = angle;
        this.resolution = resolution;
    }

    public double getAngle() {
        return angle;
    }

    public int getResolution() {
        return resolution;
    }

    @Override
    protected String getStatement() {
        return new StatementBuilder()
                .append("rotate_extrude(")
                .argument("angle", ScadFormat.number(angle))
                .argument("$fn", Integer.toString(resolution))
                .append(")")
                .toString();
    }

    @Override
    public Vector3 getPosition() {
        return new Vector3(0, 0, getChild().getPosition().getY());
    }

    @Override
    public BoundingBox getBounds() {
        BoundingBox profile = getChild().getBounds();
        double r = Math.max(Math.abs(profile.getMin().getX()), Math.abs(profile.getMax().getX()));
        return new BoundingBox(
                new Vector3(-r, -r, profile.getMin().getY()),
                new Vector3(r, r, profile.getMax().getY()));
    }

    @Override
    public ScadObject copy() {
        return withNameOf(new RotateExtrusion(getChild().copy(), angle, resolution));
    }
}
