package nl.bytesoflife.deltascad.model.block;

import nl.bytesoflife.deltascad.model.ScadObject;

import java.util.List;

/**
 * Convex hull of all children. Evaluated by OpenSCAD, not here.
 */
public class Hull extends BlockObject {

    public Hull(List<? extends ScadObject> children) {
        super(children);
    }

    @Override
    protected String getKeyword() {
        return "hull";
    }

    @Override
    protected BlockObject newInstance(List<ScadObject> children) {
        return new Hull(children);
    }
}
