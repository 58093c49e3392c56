package nl.bytesoflife.deltascad.renderer.scad;

/**
 * Wraps a rendered body into a named, parameterless module definition,
 * optionally followed by a call to it.
 */
public class ModuleFormatter {

    private final String moduleName;
    private final String body;
    private final boolean invoke;

    public ModuleFormatter(String moduleName, String body) {
        this(moduleName, body, false);
    }

    public ModuleFormatter(String moduleName, String body, boolean invoke) {
        this.moduleName = moduleName;
        this.body = body;
        this.invoke = invoke;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(new BlockFormatter("module " + moduleName + "()", body));
        if (invoke) {
            sb.append(new StatementBuilder().append(moduleName).append("()").terminate());
        }
        return sb.toString();
    }
}
