package nl.bytesoflife.deltascad.renderer.scad;

/**
 * Formats a transform call applying to the single statement after it:
 * <pre>
 * translate(v = [1.00, 0.00, 0.00])
 *     polygon(...);
 * </pre>
 */
public class TransformFormatter {

    private final String call;
    private final String body;

    public TransformFormatter(String call, String body) {
        this.call = call;
        this.body = body;
    }

    @Override
    public String toString() {
        return call + ScadFormat.NEWLINE + ScadFormat.indent(body);
    }
}
