package nl.bytesoflife.deltascad.renderer.scad;

/**
 * Formats a header followed by a brace-delimited body:
 * <pre>
 * union()
 * {
 *     ...
 * }
 * </pre>
 * The body is indented one level; any deeper indentation it already carries
 * is kept, so nested blocks compound.
 */
public class BlockFormatter {

    private final String header;
    private final String body;

    public BlockFormatter(String header, String body) {
        this.header = header;
        this.body = body;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(header).append(ScadFormat.NEWLINE);
        sb.append('{').append(ScadFormat.NEWLINE);
        String indented = ScadFormat.indent(body);
        sb.append(indented);
        if (!indented.isEmpty() && !indented.endsWith(ScadFormat.NEWLINE)) {
            sb.append(ScadFormat.NEWLINE);
        }
        sb.append('}').append(ScadFormat.NEWLINE);
        return sb.toString();
    }
}
