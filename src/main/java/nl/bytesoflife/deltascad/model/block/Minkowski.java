package nl.bytesoflife.deltascad.model.block;

import nl.bytesoflife.deltascad.model.ScadObject;
import nl.bytesoflife.deltascad.model.spatial.BoundingBox;

import java.util.List;

/**
 * Minkowski sum of all children. Evaluated by OpenSCAD, not here.
 */
public class Minkowski extends BlockObject {

    public Minkowski(List<? extends ScadObject> children) {
        super(children);
    }

    @Override
    protected String getKeyword() {
        return "minkowski";
    }

    @Override
    protected BlockObject newInstance(List<ScadObject> children) {
        return new Minkowski(children);
    }

    /**
     * Bounds of a Minkowski sum are the sums of the children's minimum and
     * maximum corners.
     */
    @Override
    public BoundingBox getBounds() {
        BoundingBox bounds = children.get(0).getBounds();
        for (int i = 1; i < children.size(); i++) {
            BoundingBox next = children.get(i).getBounds();
            bounds = new BoundingBox(bounds.getMin().add(next.getMin()), bounds.getMax().add(next.getMax()));
        }
        return bounds;
    }
}
