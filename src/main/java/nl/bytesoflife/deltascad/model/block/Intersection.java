package nl.bytesoflife.deltascad.model.block;

import nl.bytesoflife.deltascad.model.ScadObject;
import nl.bytesoflife.deltascad.model.spatial.BoundingBox;

import java.util.List;

/**
 * The volume shared by all children (logical and).
 */
public class Intersection extends BlockObject {

    public Intersection(List<? extends ScadObject> children) {
        super(children);
    }

    @Override
    protected String getKeyword() {
        return "intersection";
    }

    @Override
    protected BlockObject newInstance(List<ScadObject> children) {
        return new Intersection(children);
    }

    /**
     * Overlap of the children's bounds.
     */
    @Override
    public BoundingBox getBounds() {
        BoundingBox bounds = children.get(0).getBounds();
        for (int i = 1; i < children.size(); i++) {
            bounds = bounds.intersection(children.get(i).getBounds());
        }
        return bounds;
    }
}
