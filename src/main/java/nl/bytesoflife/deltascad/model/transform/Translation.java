package nl.bytesoflife.deltascad.model.transform;

import nl.bytesoflife.deltascad.model.ScadObject;
import nl.bytesoflife.deltascad.model.spatial.BoundingBox;
import nl.bytesoflife.deltascad.model.spatial.Vector3;
import nl.bytesoflife.deltascad.renderer.scad.StatementBuilder;

import java.util.Objects;

/**
 * Moves the child by an offset.
 */
public class Translation extends TransformObject {

    private final Vector3 offset;

    public Translation(ScadObject child, Vector3 offset) {
        super(child);
        this.offset = Objects.requireNonNull(offset, "offset");
    }

    public Vector3 getOffset() {
        return offset;
    }

    @Override
    protected String getStatement() {
        return new StatementBuilder().append("translate(").argument("v", offset.toString()).append(")").toString();
    }

    @Override
    public Vector3 getPosition() {
        return getChild().getPosition().add(offset);
    }

    @Override
    public BoundingBox getBounds() {
        return getChild().getBounds().translate(offset);
    }

    @Override
    public ScadObject copy() {
        return withNameOf(new Translation(getChild().copy(), offset));
    }
}
