package nl.bytesoflife.deltascad.model.transform;

import nl.bytesoflife.deltascad.model.ScadObject;
import nl.bytesoflife.deltascad.renderer.scad.TransformFormatter;

import java.util.List;
import java.util.Objects;

/**
 * Base class for transforms wrapping exactly one child. Renders as the
 * transform call followed by the child's script, indented one level.
 */
public abstract class TransformObject extends ScadObject {

    protected TransformObject(ScadObject child) {
        super(List.of(Objects.requireNonNull(child, "child")));
    }

    public ScadObject getChild() {
        return children.get(0);
    }

    /**
     * The call text without terminator, e.g. {@code translate(v = [1.00, 0.00, 0.00])}.
     */
    protected abstract String getStatement();

    @Override
    public String toString() {
        return new TransformFormatter(getStatement(), getChild().toString()).toString();
    }
}
