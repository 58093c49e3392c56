package nl.bytesoflife.deltascad.model.block;

import nl.bytesoflife.deltascad.model.ScadObject;
import nl.bytesoflife.deltascad.model.spatial.BoundingBox;
import nl.bytesoflife.deltascad.model.spatial.Vector3;

import java.util.List;

/**
 * The first child minus all subsequent children. Child order matters.
 */
public class Difference extends BlockObject {

    public Difference(List<? extends ScadObject> children) {
        super(children);
    }

    @Override
    protected String getKeyword() {
        return "difference";
    }

    @Override
    protected BlockObject newInstance(List<ScadObject> children) {
        return new Difference(children);
    }

    @Override
    public Vector3 getPosition() {
        return children.get(0).getPosition();
    }

    /**
     * Subtraction never grows the first child, so its bounds are used.
     */
    @Override
    public BoundingBox getBounds() {
        return children.get(0).getBounds();
    }
}
