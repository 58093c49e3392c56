package nl.bytesoflife.deltascad.model.transform;

import nl.bytesoflife.deltascad.model.ScadObject;
import nl.bytesoflife.deltascad.model.spatial.BoundingBox;
import nl.bytesoflife.deltascad.model.spatial.Vector3;
import nl.bytesoflife.deltascad.renderer.scad.ScadFormat;
import nl.bytesoflife.deltascad.renderer.scad.StatementBuilder;

/**
 * Extrudes a 2D child along the Z axis from 0 to {@code height}.
 */
public class LinearExtrusion extends TransformObject {

    public static final int DEFAULT_RESOLUTION = 10;

    private final double height;
    private final Vector3 vector;
    private final int resolution;

    public LinearExtrusion(ScadObject child, double height) {
        this(child, height, null, DEFAULT_RESOLUTION);
    }

    /**
     * @param vector optional extrusion direction, {@code null} to leave it out
     */
    public LinearExtrusion(ScadObject child, double height, Vector3 vector, int resolution) {
        super(child);
        this.height = height;
        this.vector = vector;
        this.resolution = resolution;
    }

    public double getHeight() {
        return height;
    }

    public Vector3 getVector() {
        return vector;
    }

    public int getResolution() {
        return resolution;
    }

    @Override
    protected String getStatement() {
        StatementBuilder sb = new StatementBuilder()
                .append("linear_extrude(")
                .argument("height", ScadFormat.number(height));
        if (vector != null) {
            sb.argument("v", vector.toString());
        }
        return sb.argument("$fn", Integer.toString(resolution)).append(")").toString();
    }

    @Override
    public Vector3 getPosition() {
        Vector3 p = getChild().getPosition();
        return new Vector3(p.getX(), p.getY(), height / 2);
    }

    @Override
    public BoundingBox getBounds() {
        BoundingBox profile = getChild().getBounds();
        return new BoundingBox(
                new Vector3(profile.getMin().getX(), profile.getMin().getY(), Math.min(0, height)),
                new Vector3(profile.getMax().getX(), profile.getMax().getY(), Math.max(0, height)));
    }

    @Override
    public ScadObject copy() {
        return withNameOf(new LinearExtrusion(getChild().copy(), height, vector, resolution));
    }
}
