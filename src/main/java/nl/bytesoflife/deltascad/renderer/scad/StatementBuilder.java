package nl.bytesoflife.deltascad.renderer.scad;

/**
 * Accumulates the text of a single call, e.g. {@code translate(v = [..])}.
 */
public class StatementBuilder {

    private final StringBuilder sb = new StringBuilder();

    public StatementBuilder append(String text) {
        sb.append(text);
        return this;
    }

    public StatementBuilder appendIf(boolean condition, String text) {
        if (condition) {
            sb.append(text);
        }
        return this;
    }

    /**
     * Append a {@code name = value} argument, preceded by a separator when
     * arguments were already written since the last opening parenthesis.
     */
    public StatementBuilder argument(String name, String value) {
        char last = sb.length() == 0 ? '(' : sb.charAt(sb.length() - 1);
        if (last != '(') {
            sb.append(", ");
        }
        sb.append(name).append(" = ").append(value);
        return this;
    }

    /**
     * Close the statement with the terminator and a line break.
     */
    public StatementBuilder terminate() {
        sb.append(ScadFormat.TERMINATOR).append(ScadFormat.NEWLINE);
        return this;
    }

    public boolean isEmpty() {
        return sb.length() == 0;
    }

    @Override
    public String toString() {
        return sb.toString();
    }
}
