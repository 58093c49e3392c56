package nl.bytesoflife.deltascad.model.block;

import nl.bytesoflife.deltascad.model.ScadObject;

import java.util.List;

/**
 * Sum of all children (logical or).
 */
public class Union extends BlockObject {

    public Union(List<? extends ScadObject> children) {
        super(children);
    }

    @Override
    protected String getKeyword() {
        return "union";
    }

    @Override
    protected BlockObject newInstance(List<ScadObject> children) {
        return new Union(children);
    }
}
