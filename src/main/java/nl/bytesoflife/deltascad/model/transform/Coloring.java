package nl.bytesoflife.deltascad.model.transform;

import nl.bytesoflife.deltascad.model.ScadObject;
import nl.bytesoflife.deltascad.model.spatial.BoundingBox;
import nl.bytesoflife.deltascad.model.spatial.Vector3;
import nl.bytesoflife.deltascad.renderer.scad.ScadFormat;
import nl.bytesoflife.deltascad.renderer.scad.StatementBuilder;

import java.util.Objects;

/**
 * Applies a named color and an opacity. Geometry is unaffected.
 */
public class Coloring extends TransformObject {

    private final String colorName;
    private final double opacity;

    public Coloring(ScadObject child, String colorName, double opacity) {
        super(child);
        this.colorName = Objects.requireNonNull(colorName, "colorName");
        this.opacity = opacity;
    }

    public String getColorName() {
        return colorName;
    }

    public double getOpacity() {
        return opacity;
    }

    @Override
    protected String getStatement() {
        return new StatementBuilder()
                .append("color(")
                .append(ScadFormat.quote(colorName))
                .append(", ")
                .append(ScadFormat.number(opacity))
                .append(")")
                .toString();
    }

    @Override
    public Vector3 getPosition() {
        return getChild().getPosition();
    }

    @Override
    public BoundingBox getBounds() {
        return getChild().getBounds();
    }

    @Override
    public ScadObject copy() {
        return withNameOf(new Coloring(getChild().copy(), colorName, opacity));
    }
}
